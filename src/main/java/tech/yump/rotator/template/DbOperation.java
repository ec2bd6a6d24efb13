package tech.yump.rotator.template;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

/**
 * A single SQL statement run over a short-lived connection. Connection fields and the
 * query are templates; values substituted into the query are quoted for their position.
 *
 * @param ssl optional template resolving to {@code true} or {@code false}.
 */
public record DbOperation(
        @NotNull(message = "DB operation needs a client.")
        DbClient client,
        @NotBlank(message = "DB operation needs a host.")
        String host,
        @NotBlank(message = "DB operation needs a port.")
        String port,
        @NotBlank(message = "DB operation needs a database.")
        String database,
        @NotBlank(message = "DB operation needs a username.")
        String username,
        @NotBlank(message = "DB operation needs a password.")
        String password,
        String ssl,
        @NotBlank(message = "DB operation needs a query.")
        String query,
        Map<String, @Valid Assignment> pre,
        Map<String, @Valid Extraction> setter
) implements Operation {

    public DbOperation {
        pre = Operation.orderedCopy(pre);
        setter = Operation.orderedCopy(setter);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitDb(this);
    }
}
