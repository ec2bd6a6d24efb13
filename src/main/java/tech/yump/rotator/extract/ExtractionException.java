package tech.yump.rotator.extract;

import com.fasterxml.jackson.databind.JsonNode;
import tech.yump.rotator.rotation.RotationErrorKind;
import tech.yump.rotator.rotation.RotationException;
import tech.yump.rotator.template.FieldRef;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A setter path matched nothing, matched more than one node, or matched a value of the wrong shape.
 * Carries the extractions that succeeded before the failure; they are never committed and only
 * serve as hints for rollback.
 */
public class ExtractionException extends RotationException {

    private final transient Map<FieldRef, JsonNode> partial;

    public ExtractionException(String message) {
        this(message, Map.of());
    }

    public ExtractionException(String message, Map<FieldRef, JsonNode> partial) {
        super(RotationErrorKind.EXTRACTION, message);
        this.partial = Collections.unmodifiableMap(new LinkedHashMap<>(partial));
    }

    public ExtractionException(String message, Throwable cause) {
        super(RotationErrorKind.EXTRACTION, message, cause);
        this.partial = Map.of();
    }

    /**
     * Extractions that succeeded before this failure, in setter order.
     */
    public Map<FieldRef, JsonNode> partial() {
        return partial;
    }

    ExtractionException withPartial(Map<FieldRef, JsonNode> extracted) {
        ExtractionException copy = new ExtractionException(getMessage(), extracted);
        copy.initCause(getCause() != null ? getCause() : this);
        return copy;
    }
}
