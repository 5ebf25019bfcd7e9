package com.agentgate.security;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical tool-name form used for every list and capability lookup:
 * snake case, lower case, without the optional {@code tool_} prefix.
 */
public final class ToolNames {

    private static final Pattern ACRONYM_BOUNDARY = Pattern.compile("([A-Z]+)([A-Z][a-z])");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z0-9])([A-Z])");
    private static final String PREFIX = "tool_";

    private ToolNames() {}

    public static String normalize(String name) {
        if (name == null) return "";
        var snake = ACRONYM_BOUNDARY.matcher(name.strip()).replaceAll("$1_$2");
        snake = CAMEL_BOUNDARY.matcher(snake).replaceAll("$1_$2");
        snake = snake.replace('-', '_').toLowerCase(Locale.ROOT);
        return snake.startsWith(PREFIX) ? snake.substring(PREFIX.length()) : snake;
    }

    public static boolean matches(String a, String b) {
        return a != null && b != null && normalize(a).equals(normalize(b));
    }
}
