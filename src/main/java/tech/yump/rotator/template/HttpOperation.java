package tech.yump.rotator.template;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * An HTTP call. Every string field, header value and text leaf of the body is a template.
 */
public record HttpOperation(
        @NotBlank(message = "HTTP operation needs a method.")
        String method,
        @NotBlank(message = "HTTP operation needs a url.")
        String url,
        Map<String, String> header,
        JsonNode body,
        Map<String, @Valid Assignment> pre,
        Map<String, @Valid Extraction> setter
) implements Operation {

    public HttpOperation {
        header = Operation.orderedCopy(header);
        pre = Operation.orderedCopy(pre);
        setter = Operation.orderedCopy(setter);
    }

    public boolean hasBody() {
        return body != null && !body.isNull() && !body.isMissingNode();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitHttp(this);
    }
}
