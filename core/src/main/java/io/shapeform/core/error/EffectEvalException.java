package io.shapeform.core.error;

import io.shapeform.core.model.ValuePath;

/**
 * Thrown when a user-supplied callback (preprocess, refine, superRefine or transform) throws or its
 * asynchronous result completes exceptionally. This is a defect in the callback, not a validation
 * failure, so the safe entry points propagate it as well. URN: {@code
 * urn:shapeform:error:effect-eval-failed}
 */
public final class EffectEvalException extends ShapeformException {

    private static final long serialVersionUID = 1L;

    public static final String URN = "urn:shapeform:error:effect-eval-failed";

    private final transient ValuePath path;
    private final String effect;

    public EffectEvalException(String effect, ValuePath path, Throwable cause) {
        super(
                String.format(
                        "%s failed at '%s': %s",
                        effect, path.isRoot() ? "<root>" : path.toString(), cause.getMessage()),
                cause,
                Phase.VALIDATION);
        this.effect = effect;
        this.path = path;
    }

    /** The effect kind that failed, e.g. {@code "refine"}. */
    public String effect() {
        return effect;
    }

    /** The value path at which the callback ran. */
    public ValuePath path() {
        return path;
    }
}
