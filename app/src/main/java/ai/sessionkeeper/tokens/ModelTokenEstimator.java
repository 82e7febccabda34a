package ai.sessionkeeper.tokens;

import dev.langchain4j.model.openai.OpenAiTokenCountEstimator;

/** BPE token counts from a model vocabulary, via langchain4j's OpenAI estimator. */
public final class ModelTokenEstimator implements TokenEstimator {
    private final String vocabulary;
    private final OpenAiTokenCountEstimator estimator;

    /**
     * @param vocabulary an OpenAI model name whose vocabulary is used, e.g. {@code gpt-4o}
     * @throws IllegalArgumentException if the vocabulary is unknown
     */
    public ModelTokenEstimator(String vocabulary) {
        this.vocabulary = vocabulary;
        try {
            this.estimator = new OpenAiTokenCountEstimator(vocabulary);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Unknown tokenizer vocabulary: " + vocabulary, e);
        }
    }

    @Override
    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return estimator.estimateTokenCountInText(text);
    }

    public String vocabulary() {
        return vocabulary;
    }

    @Override
    public String toString() {
        return "ModelTokenEstimator[" + vocabulary + "]";
    }
}
