package com.agentgate.agent;

import com.agentgate.hooks.HookContext;
import com.agentgate.hooks.HookInput;
import com.agentgate.hooks.HookPipeline;
import com.agentgate.hooks.HookResult;
import com.agentgate.providers.ModelProvider;
import com.agentgate.shared.model.Turn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Replaces older turns with a summary appended to the system prompt. The
 * summary comes from the caller, a PreCompact hook, the model, or, if the
 * model call fails, a plain-text digest of the turns.
 */
public class ConversationCompactor {

    private static final Logger log = LoggerFactory.getLogger(ConversationCompactor.class);

    public static final int DEFAULT_KEEP_LAST = 4;

    private final ModelProvider provider;
    private final HookPipeline hooks;
    private final Path workingDir;
    private int compactions;

    public ConversationCompactor(ModelProvider provider, HookPipeline hooks, Path workingDir) {
        this.provider = provider;
        this.hooks = hooks;
        this.workingDir = workingDir;
    }

    /** Returns true when history was compacted. */
    public boolean compact(int keepLast, String summary) {
        if (keepLast < 0) throw new IllegalArgumentException("keepLast must be >= 0, got " + keepLast);
        var turns = provider.turns();
        if (turns.size() <= keepLast) {
            log.info("Not enough turns to compact (have {}, keepLast = {})", turns.size(), keepLast);
            return false;
        }
        int compactCount = turns.size() - keepLast;
        var toCompact = turns.subList(0, compactCount);
        var toKeep = turns.subList(compactCount, turns.size());

        var context = new HookContext(workingDir, Map.of(
                "total_turns", turns.size(),
                "compact_count", compactCount,
                "compactions", compactions));
        var hookResult = hooks.fire(new HookInput.PreCompact(toCompact, toKeep, context))
                .map(HookResult.PreCompact.class::cast);
        if (hookResult.isPresent() && !hookResult.get().proceed()) {
            log.info("Compaction cancelled by hook");
            return false;
        }

        var text = summary;
        if (text == null && hookResult.isPresent()) text = hookResult.get().summary();
        if (text == null) text = generateSummary(toCompact);

        provider.setSystemPrompt(PromptBuilder.withSummary(provider.systemPrompt(), text));
        provider.setTurns(toKeep);
        compactions++;
        log.info("Compacted {} turns, keeping {}", compactCount, toKeep.size());
        return true;
    }

    public int compactions() {
        return compactions;
    }

    private String generateSummary(List<Turn> turns) {
        try {
            var summary = provider.summarize(PromptBuilder.summarizationPrompt(turns));
            if (summary != null && !summary.isBlank()) return summary.strip();
            log.warn("LLM summarization returned nothing; falling back to text-based summary");
        } catch (RuntimeException e) {
            log.warn("LLM summarization failed; falling back to text-based summary: {}", e.getMessage());
        }
        return PromptBuilder.fallbackSummary(turns);
    }
}
