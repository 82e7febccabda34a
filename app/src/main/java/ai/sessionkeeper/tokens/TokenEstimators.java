package ai.sessionkeeper.tokens;

import java.util.Locale;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Picks a token estimator for a model id. */
public final class TokenEstimators {
    private static final Logger logger = LogManager.getLogger(TokenEstimators.class);

    private TokenEstimators() {}

    public static TokenEstimator forModel(String modelId) {
        return forModel(modelId, ApproximateTokenEstimator.DEFAULT_TOKENS_PER_WORD);
    }

    /**
     * Returns a cached estimator for {@code modelId}. Known OpenAI families use their own vocabulary and
     * Claude/Anthropic models use {@code gpt-4o} as a proxy; anything else, or a vocabulary that fails to load,
     * gets the approximate estimator.
     */
    public static TokenEstimator forModel(String modelId, double tokensPerWord) {
        var vocabulary = vocabularyFor(modelId);
        if (vocabulary != null) {
            try {
                var precise = new ModelTokenEstimator(vocabulary);
                precise.count("probe");
                return new CachingTokenEstimator(precise);
            } catch (RuntimeException e) {
                logger.warn(
                        "Tokenizer {} unavailable for model {} ({}); using approximate counts",
                        vocabulary,
                        modelId,
                        e.getMessage());
            }
        } else {
            logger.warn("No tokenizer known for model {}; using approximate counts", modelId);
        }
        return new CachingTokenEstimator(
                new ApproximateTokenEstimator(tokensPerWord, ApproximateTokenEstimator.DEFAULT_TOKENS_PER_CHAR));
    }

    static @Nullable String vocabularyFor(String modelId) {
        var id = modelId == null ? "" : modelId.toLowerCase(Locale.ROOT).strip();
        if (id.startsWith("gpt-4o") || id.startsWith("o1") || id.startsWith("o3") || id.startsWith("o4")) {
            return "gpt-4o";
        }
        if (id.startsWith("gpt-4")) {
            return "gpt-4";
        }
        if (id.startsWith("gpt-3.5")) {
            return "gpt-3.5-turbo";
        }
        if (id.contains("claude") || id.contains("anthropic")) {
            return "gpt-4o";
        }
        return null;
    }
}
