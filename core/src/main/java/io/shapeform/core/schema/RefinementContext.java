package io.shapeform.core.schema;

import io.shapeform.core.model.IssueCode;
import io.shapeform.core.model.ValuePath;
import java.util.Map;

/**
 * Issue-collector capability handed to {@code superRefine} callbacks. Callbacks may append any
 * number of issues at the refined value's path or below it. Returning (or completing the returned
 * stage) signals that the callback is done emitting.
 *
 * <p>
 * Implementations are safe to call from the thread completing an asynchronous callback.
 */
public interface RefinementContext {

    /** The absolute path of the value being refined. */
    ValuePath path();

    /** Appends a {@link IssueCode#CUSTOM} issue at the refined value's path. */
    void addIssue(String message);

    /** Appends a {@link IssueCode#CUSTOM} issue at a path relative to the refined value. */
    void addIssue(String message, ValuePath relativePath);

    /**
     * Appends an issue of any code at a path relative to the refined value. A {@code null} message
     * resolves through the message catalog using {@code params}.
     */
    void addIssue(IssueCode code, String message, ValuePath relativePath, Map<String, Object> params);
}
