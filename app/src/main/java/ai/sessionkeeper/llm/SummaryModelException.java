package ai.sessionkeeper.llm;

/** The model boundary failed to produce a reply. */
public class SummaryModelException extends Exception {
    public SummaryModelException(String message) {
        super(message);
    }

    public SummaryModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
