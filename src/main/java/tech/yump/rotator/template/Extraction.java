package tech.yump.rotator.template;

import jakarta.validation.constraints.NotBlank;

/**
 * One setter rule: a JSON path evaluated against an executor result.
 *
 * @param path   JSON path; the leading {@code $} is optional.
 * @param source document the path applies to, {@link ExtractionSource#BODY} when absent.
 */
public record Extraction(
        @NotBlank(message = "Setter path is required.")
        String path,
        ExtractionSource source
) {
    public Extraction {
        if (source == null) {
            source = ExtractionSource.BODY;
        }
    }

    public static Extraction body(String path) {
        return new Extraction(path, ExtractionSource.BODY);
    }
}
