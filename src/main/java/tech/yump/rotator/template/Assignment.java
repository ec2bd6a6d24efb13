package tech.yump.rotator.template;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import tech.yump.rotator.crypto.CharacterSet;

import java.util.List;

/**
 * A {@code pre} step assignment into an {@code internal} field, evaluated before the operation runs.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Assignment.ValueAssignment.class, name = "value"),
        @JsonSubTypes.Type(value = Assignment.RandomAssignment.class, name = "random"),
        @JsonSubTypes.Type(value = Assignment.AlternateAssignment.class, name = "alternate")
})
public sealed interface Assignment {

    /**
     * Assigns a resolved template string.
     */
    record ValueAssignment(
            @NotBlank(message = "Value assignment needs a value template.")
            String value
    ) implements Assignment {
    }

    /**
     * Assigns a fresh secure random string.
     */
    record RandomAssignment(
            @Min(value = 1, message = "Random assignment length must be at least 1.")
            @Max(value = 1024, message = "Random assignment length must not exceed 1024.")
            int length,
            CharacterSet charset
    ) implements Assignment {
        public RandomAssignment {
            if (charset == null) {
                charset = CharacterSet.ALPHANUMERIC;
            }
        }
    }

    /**
     * Assigns the candidate that follows the field's current value, wrapping around;
     * the first candidate when the field has no value or a value matching none of them.
     * Candidates are field references such as {@code inputs.username1}.
     */
    record AlternateAssignment(
            @NotEmpty
            @Size(min = 2, message = "Alternate assignment needs at least two candidates.")
            List<String> candidates
    ) implements Assignment {
        public AlternateAssignment {
            candidates = candidates == null ? List.of() : List.copyOf(candidates);
        }
    }
}
