package ai.sessionkeeper.context;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class ModelLimitsTest {

    @Test
    public void knownFamiliesResolveByPrefix() {
        assertEquals(200_000, ModelLimits.forModel("claude-3-5-sonnet-20241022").contextWindow());
        assertEquals(8_192, ModelLimits.forModel("Claude-Opus-4").reservedOutput());
        assertEquals(128_000, ModelLimits.forModel("gpt-4o-mini").contextWindow());
        assertEquals(16_384, ModelLimits.forModel("gpt-4o").reservedOutput());
        assertEquals(128_000, ModelLimits.forModel("gpt-4-turbo-preview").contextWindow());
        assertEquals(8_192, ModelLimits.forModel("gpt-4-0613").contextWindow());
        assertEquals(16_385, ModelLimits.forModel("gpt-3.5-turbo").contextWindow());
        assertEquals(32_768, ModelLimits.forModel("o3-mini").reservedOutput());
    }

    @Test
    public void unknownModelGetsConservativeDefault() {
        var limits = ModelLimits.forModel("mystery-model");
        assertEquals(ModelLimits.DEFAULT_CONTEXT_WINDOW, limits.contextWindow());
        assertEquals(ModelLimits.DEFAULT_RESERVED_OUTPUT, limits.reservedOutput());
        assertEquals("mystery-model", limits.model());
    }

    @Test
    public void budgetNeverGoesNegative() {
        var budget = new ContextBudget(1000, 200, 500, 400);
        assertEquals(0, budget.available());
        assertEquals(300, budget.withToolOverhead(0).available());
        assertEquals(700, budget.withSystemOverhead(100).withToolOverhead(0).available());
    }
}
