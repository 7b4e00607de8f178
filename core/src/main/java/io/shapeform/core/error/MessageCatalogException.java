package io.shapeform.core.error;

/** Thrown when an issue message catalog cannot be read or is malformed. */
public final class MessageCatalogException extends ShapeformException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public MessageCatalogException(String message, String source) {
        super(message, Phase.DEFINITION);
        this.source = source;
    }

    public MessageCatalogException(String message, Throwable cause, String source) {
        super(message, cause, Phase.DEFINITION);
        this.source = source;
    }

    /** The catalog location (file path or classpath resource), or {@code null} if unknown. */
    public String source() {
        return source;
    }
}
