package io.shapeform.core.spi;

import java.time.Duration;
import java.util.Objects;

/**
 * SPI for observability hooks on validation calls.
 *
 * <p>
 * Implementations bridge to whatever metrics or tracing system the host uses; the core has no
 * telemetry dependency. Implementations MUST be thread-safe and non-blocking: asynchronous calls
 * notify from whichever thread completed the last effect. Exceptions thrown by listeners are caught
 * by the engine and logged. They never affect the validation result.
 */
public interface ValidationListener {

    /**
     * Called once per validation call that produced a result. Calls that ended with a callback
     * failure ({@code EffectEvalException}) are not reported here.
     */
    void onValidationCompleted(ValidationEvent event);

    /**
     * Event emitted when a validation call completes.
     *
     * @param mode       sync or async entry point
     * @param success    whether the result was a success
     * @param issueCount number of issues on failure, 0 on success
     * @param duration   wall-clock time from entry to result
     */
    record ValidationEvent(ExecutionMode mode, boolean success, int issueCount, Duration duration) {
        public ValidationEvent {
            Objects.requireNonNull(mode, "mode must not be null");
            Objects.requireNonNull(duration, "duration must not be null");
        }
    }
}
