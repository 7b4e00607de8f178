package io.shapeform.core.error;

/**
 * Abstract base for all shapeform exceptions. Never thrown directly; use the concrete subclasses.
 * Definition-phase errors surface while a schema tree is being built or configured;
 * validation-phase errors surface from the parse entry points.
 */
public abstract class ShapeformException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        DEFINITION,
        VALIDATION
    }

    private final Phase phase;

    protected ShapeformException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected ShapeformException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
