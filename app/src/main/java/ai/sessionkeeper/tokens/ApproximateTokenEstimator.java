package ai.sessionkeeper.tokens;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

/**
 * Vocabulary-free estimate: {@code ceil(words * tokensPerWord + punctuation * tokensPerChar)}.
 *
 * <p>Used for models without a known tokenizer. Tends to overestimate slightly on prose, which keeps budgets safe.
 */
public final class ApproximateTokenEstimator implements TokenEstimator {
    public static final double DEFAULT_TOKENS_PER_WORD = 1.3;
    public static final double DEFAULT_TOKENS_PER_CHAR = 0.25;

    private static final Splitter WORDS = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
    private static final CharMatcher PUNCTUATION = CharMatcher.forPredicate(
                    (Character c) -> Character.isLetterOrDigit(c.charValue()))
            .or(CharMatcher.whitespace())
            .negate();

    private final double tokensPerWord;
    private final double tokensPerChar;

    public ApproximateTokenEstimator() {
        this(DEFAULT_TOKENS_PER_WORD, DEFAULT_TOKENS_PER_CHAR);
    }

    public ApproximateTokenEstimator(double tokensPerWord, double tokensPerChar) {
        if (tokensPerWord <= 0 || tokensPerChar < 0) {
            throw new IllegalArgumentException("tokensPerWord must be > 0 and tokensPerChar >= 0, got %s / %s"
                    .formatted(tokensPerWord, tokensPerChar));
        }
        this.tokensPerWord = tokensPerWord;
        this.tokensPerChar = tokensPerChar;
    }

    @Override
    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        long words = WORDS.splitToStream(text).count();
        int punctuation = PUNCTUATION.countIn(text);
        return (int) Math.ceil(words * tokensPerWord + punctuation * tokensPerChar);
    }

    public double tokensPerWord() {
        return tokensPerWord;
    }

    @Override
    public String toString() {
        return "ApproximateTokenEstimator[" + tokensPerWord + " per word]";
    }
}
