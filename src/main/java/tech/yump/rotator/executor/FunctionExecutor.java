package tech.yump.rotator.executor;

import tech.yump.rotator.rotation.CancellationSignal;
import tech.yump.rotator.rotation.RotationContext;
import tech.yump.rotator.template.Operation;

/**
 * Performs one remote operation of a given variant.
 * Implementations resolve every templated field against the context, issue exactly one call
 * with bounded timeouts, release every resource before returning, and never retry.
 *
 * @param <O> the operation variant handled.
 */
public interface FunctionExecutor<O extends Operation> {

    /**
     * @throws ExecutorException for remote failures, timeouts and cancellation.
     * @throws tech.yump.rotator.expression.ResolutionException if a templated field cannot be resolved.
     */
    ExecutorResult execute(O operation, RotationContext context, CancellationSignal signal);
}
