package tech.yump.rotator.rotation;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Cooperative cancellation of one rotation cycle.
 * Executors register a callback that aborts their active call (statement cancel, thread interrupt)
 * for as long as the call is in flight.
 */
@Slf4j
public final class CancellationSignal {

    private final List<Runnable> callbacks = new ArrayList<>();
    private boolean cancelled;

    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    /**
     * Cancels the cycle and runs every registered callback once.
     */
    public void cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
        }
        log.debug("Cancellation requested, notifying {} active call(s)", toRun.size());
        toRun.forEach(CancellationSignal::runCallback);
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    /**
     * Registers a callback for the duration of a call. Runs it immediately if the signal is
     * already cancelled.
     *
     * @return a registration to close once the call returns.
     */
    public Registration onCancel(Runnable callback) {
        boolean runNow;
        synchronized (this) {
            runNow = cancelled;
            if (!runNow) {
                callbacks.add(callback);
            }
        }
        if (runNow) {
            runCallback(callback);
            return () -> { };
        }
        return () -> {
            synchronized (this) {
                callbacks.remove(callback);
            }
        };
    }

    private static void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Handle of a registered callback.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
