package tech.compendium.sdk.store;

import org.jboss.logging.Logger;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Registry allowing at most one in-flight poll per job id.
 *
 * <p>The first caller for a job receives a fresh {@link PollToken} and issues the request;
 * callers arriving while it is in flight get the same result future. The token is released
 * when the request completes, successfully or not, before the shared future completes, so a
 * caller reacting to the result may poll again straight away.
 */
public class InFlightPolls<T> {

    private static final Logger LOG = Logger.getLogger(InFlightPolls.class);

    private final Map<String, PollToken<T>> inFlight = new HashMap<>();
    private long sequence;

    /**
     * Run {@code poll} for the job unless a poll is already in flight, in which case its
     * result is returned instead.
     */
    public CompletableFuture<T> acquireOrJoin(String jobId, Supplier<CompletableFuture<T>> poll) {
        PollToken<T> token;
        synchronized (this) {
            PollToken<T> existing = inFlight.get(jobId);
            if (existing != null) {
                LOG.debugf("Poll of job [%s] already in flight, attaching", jobId);
                return existing.result();
            }
            token = new PollToken<>(jobId, ++sequence, new CompletableFuture<>());
            inFlight.put(jobId, token);
        }

        CompletableFuture<T> request;
        try {
            request = poll.get();
        } catch (RuntimeException e) {
            request = CompletableFuture.failedFuture(e);
        }

        request.whenComplete((value, error) -> {
            release(token);
            if (error != null) {
                token.result().completeExceptionally(error);
            } else {
                token.result().complete(value);
            }
        });
        return token.result();
    }

    /**
     * Release a token. A token that has been superseded, e.g. after {@link #clear()}, is ignored.
     */
    public synchronized boolean release(PollToken<T> token) {
        return inFlight.remove(token.jobId(), token);
    }

    public synchronized boolean isInFlight(String jobId) {
        return inFlight.containsKey(jobId);
    }

    public synchronized Set<String> inFlightIds() {
        return Set.copyOf(inFlight.keySet());
    }

    /**
     * Forget every in-flight poll. Requests already issued still complete their callers.
     */
    public synchronized void clear() {
        inFlight.clear();
    }
}
