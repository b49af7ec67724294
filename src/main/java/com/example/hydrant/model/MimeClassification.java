package com.example.hydrant.model;

/**
 * Output of the content-sniffing tool, split into its parts.
 * Charset is null when the tool did not report one.
 */
public record MimeClassification(
        String type,
        String subtype,
        String charset) {

    /**
     * Parses a line shaped like {@code type/subtype; charset=value}.
     * Anything else yields a null charset and a best-effort split on '/'.
     */
    public static MimeClassification parse(String line) {
        if (line == null || line.isBlank()) {
            return new MimeClassification(null, null, null);
        }

        String[] parts = line.trim().split(";\\s*", 2);
        String[] typeAndSubtype = parts[0].trim().split("/", 2);
        String type = typeAndSubtype[0].isBlank() ? null : typeAndSubtype[0];
        String subtype = typeAndSubtype.length > 1 && !typeAndSubtype[1].isBlank() ? typeAndSubtype[1] : null;

        String charset = null;
        if (parts.length > 1) {
            int idx = parts[1].indexOf("charset=");
            if (idx >= 0) {
                String value = parts[1].substring(idx + "charset=".length()).trim();
                charset = value.isEmpty() ? null : value;
            }
        }
        return new MimeClassification(type, subtype, charset);
    }

    public boolean isImage() {
        return "image".equals(type);
    }

    public boolean isText() {
        return "text".equals(type);
    }
}
