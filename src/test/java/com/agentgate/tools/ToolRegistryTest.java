package com.agentgate.tools;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolRegistryTest {

    @Test
    void registersAndLooksUpByExactName() {
        var registry = new ToolRegistry();
        ToolBundles.fileTools().forEach(registry::register);

        assertThat(registry.size()).isEqualTo(3);
        assertThat(registry.get("read_file")).isInstanceOf(FileReadTool.class);
        assertThat(registry.all()).extracting(Tool::name)
                .containsExactly("read_file", "list_files", "write_file");
    }

    @Test
    void resolvesNormalizedAliases() {
        var registry = new ToolRegistry();
        registry.register(new ShellTool());

        assertThat(registry.get("tool_run_bash")).isNotNull();
        assertThat(registry.get("runBash")).isNotNull();
        assertThat(registry.get("bash")).isNull();
        assertThat(registry.get(null)).isNull();
    }

    @Test
    void rejectsDuplicates() {
        var registry = new ToolRegistry();
        registry.register(new FileReadTool());

        assertThatThrownBy(() -> registry.register(new FileReadTool()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Duplicate tool: read_file");
    }

    @Test
    void bundles() {
        assertThat(ToolBundles.readOnlyTools()).allMatch(t -> t.annotations().readOnly());
        assertThat(ToolBundles.all()).extracting(Tool::name)
                .isEqualTo(List.of("read_file", "list_files", "write_file", "run_bash"));
    }
}
