package tech.yump.rotator.executor;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import tech.yump.rotator.executor.db.DbFunctionExecutor;
import tech.yump.rotator.executor.http.HttpFunctionExecutor;
import tech.yump.rotator.rotation.CancellationSignal;
import tech.yump.rotator.rotation.RotationContext;
import tech.yump.rotator.template.DbOperation;
import tech.yump.rotator.template.HttpOperation;
import tech.yump.rotator.template.Operation;

/**
 * Routes an operation to the executor of its variant.
 */
@Component
@RequiredArgsConstructor
public class OperationDispatcher {

    private final HttpFunctionExecutor httpExecutor;
    private final DbFunctionExecutor dbExecutor;

    public ExecutorResult dispatch(Operation operation, RotationContext context, CancellationSignal signal) {
        return operation.accept(new Operation.Visitor<>() {
            @Override
            public ExecutorResult visitHttp(HttpOperation http) {
                return httpExecutor.execute(http, context, signal);
            }

            @Override
            public ExecutorResult visitDb(DbOperation db) {
                return dbExecutor.execute(db, context, signal);
            }
        });
    }
}
