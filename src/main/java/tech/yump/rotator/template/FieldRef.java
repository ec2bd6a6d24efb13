package tech.yump.rotator.template;

/**
 * Reference to a top-level field of a namespace, written {@code namespace.field}.
 */
public record FieldRef(Namespace namespace, String field) {

    public FieldRef {
        if (namespace == null || field == null || field.isBlank()) {
            throw new IllegalArgumentException("Field reference needs a namespace and a field name");
        }
    }

    /**
     * Parses {@code outputs.api_key}-style references.
     *
     * @throws IllegalArgumentException for an unknown namespace or a nested field.
     */
    public static FieldRef parse(String reference) {
        if (reference == null) {
            throw new IllegalArgumentException("Field reference must not be null");
        }
        int dot = reference.indexOf('.');
        if (dot <= 0 || dot == reference.length() - 1) {
            throw new IllegalArgumentException("Field reference '" + reference + "' must have the form <namespace>.<field>");
        }
        String field = reference.substring(dot + 1);
        if (field.contains(".")) {
            throw new IllegalArgumentException("Field reference '" + reference + "' must name a top-level field");
        }
        Namespace namespace = Namespace.fromKey(reference.substring(0, dot))
                .orElseThrow(() -> new IllegalArgumentException("Unknown namespace in field reference '" + reference + "'"));
        return new FieldRef(namespace, field);
    }

    @Override
    public String toString() {
        return namespace.key() + "." + field;
    }
}
