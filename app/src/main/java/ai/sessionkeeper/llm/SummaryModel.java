package ai.sessionkeeper.llm;

import ai.sessionkeeper.sessions.Message;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.jetbrains.annotations.Blocking;

/**
 * Opaque request/response boundary to a language model, used for conversation summaries and session titles.
 * Implementations do not retry; callers decide how to degrade.
 */
@FunctionalInterface
public interface SummaryModel {
    /**
     * @param context prior conversation to send ahead of the instruction; may be empty
     * @param instruction the final user turn
     * @return the model's text reply
     */
    @Blocking
    String complete(List<Message> context, String instruction) throws SummaryModelException;

    /**
     * Runs {@link #complete} on {@code executor}. If no reply arrives within {@code timeout} the future fails with a
     * {@link java.util.concurrent.TimeoutException} and the worker is interrupted, so a hung call does not keep
     * holding an executor thread.
     */
    default CompletableFuture<String> completeAsync(
            List<Message> context, String instruction, ExecutorService executor, Duration timeout) {
        var reply = new CompletableFuture<String>();
        Future<?> task;
        try {
            task = executor.submit(() -> {
                try {
                    reply.complete(complete(context, instruction));
                } catch (Throwable t) {
                    reply.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            reply.completeExceptionally(e);
            return reply;
        }
        reply.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS).whenComplete((text, error) -> {
            if (error != null) {
                task.cancel(true);
            }
        });
        return reply;
    }
}
