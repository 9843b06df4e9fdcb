package com.github.yoep.torrent.debrid.polling;

import com.github.yoep.torrent.adapter.UnlockCancelledException;
import com.github.yoep.torrent.adapter.UnlockException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Repeats an action until its outcome is ready or the {@link PollingPolicy} is exhausted.
 * Failures of the action are never retried, they're thrown immediately.
 */
@Slf4j
@RequiredArgsConstructor
public class Poller {
    private final Sleeper sleeper;

    /**
     * Poll the given action.
     *
     * @param name      The name of the polled resource, used for logging.
     * @param policy    The polling budget.
     * @param action    The action to invoke on each attempt.
     * @param isReady   Verifies if the outcome of an attempt is ready.
     * @param onTimeout Creates the exception thrown when all attempts are exhausted.
     * @param <T>       The outcome type of the action.
     * @return Returns the first ready outcome.
     * @throws UnlockCancelledException Is thrown when the thread is interrupted before, during or in between attempts.
     */
    public <T> T poll(String name, PollingPolicy policy, Supplier<T> action, Predicate<T> isReady, Supplier<? extends UnlockException> onTimeout) {
        for (var attempt = 1; attempt <= policy.attempts(); attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new UnlockCancelledException("Polling of " + name + " has been cancelled before attempt " + attempt);
            }

            log.trace("Polling {}, attempt {}/{}", name, attempt, policy.attempts());
            var outcome = action.get();

            if (isReady.test(outcome)) {
                log.debug("Polling of {} completed after {} attempt(s)", name, attempt);
                return outcome;
            }

            if (attempt < policy.attempts()) {
                waitForNextAttempt(name, policy);
            }
        }

        if (Thread.currentThread().isInterrupted()) {
            throw new UnlockCancelledException("Polling of " + name + " has been cancelled during the last attempt");
        }

        throw onTimeout.get();
    }

    private void waitForNextAttempt(String name, PollingPolicy policy) {
        try {
            sleeper.sleep(policy.interval());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new UnlockCancelledException("Polling of " + name + " has been cancelled", ex);
        }
    }
}
