package io.shapeform.core.spi;

/** Which entry-point family a validation call came through. */
public enum ExecutionMode {
    /** {@code parse}/{@code safeParse}: never suspends; asynchronous effects are refused. */
    SYNC,
    /** {@code parseAsync}/{@code safeParseAsync}: may suspend at asynchronous effects. */
    ASYNC
}
