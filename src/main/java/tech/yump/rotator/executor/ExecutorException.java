package tech.yump.rotator.executor;

import tech.yump.rotator.rotation.RotationErrorKind;
import tech.yump.rotator.rotation.RotationException;

import java.util.OptionalInt;

/**
 * A remote call failed: non-2xx status, connection or statement failure, timeout or cancellation.
 * Messages are redacted by the executor before construction.
 */
public class ExecutorException extends RotationException {

    private final boolean retryable;
    private final boolean cancelled;
    private final Integer status;

    public ExecutorException(String message, boolean retryable) {
        this(message, null, null, retryable, false);
    }

    public ExecutorException(String message, Throwable cause, boolean retryable) {
        this(message, cause, null, retryable, false);
    }

    public ExecutorException(String message, int status, boolean retryable) {
        this(message, null, status, retryable, false);
    }

    private ExecutorException(String message, Throwable cause, Integer status, boolean retryable, boolean cancelled) {
        super(RotationErrorKind.EXECUTOR, message, cause);
        this.status = status;
        this.retryable = retryable;
        this.cancelled = cancelled;
    }

    public static ExecutorException cancelled(String target) {
        return new ExecutorException("Operation on " + target + " was cancelled", null, null, false, true);
    }

    /**
     * Whether the orchestrator's retry policy may repeat the call.
     */
    public boolean isRetryable() {
        return retryable;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * The remote HTTP status, when the failure was a non-2xx response.
     */
    public OptionalInt status() {
        return status == null ? OptionalInt.empty() : OptionalInt.of(status);
    }
}
