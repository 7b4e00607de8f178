package io.shapeform.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.shapeform.core.message.MessageCatalog;
import io.shapeform.core.model.Issue;
import io.shapeform.core.model.IssueCode;
import io.shapeform.core.model.JsonValues;
import io.shapeform.core.model.ValuePath;
import io.shapeform.core.spi.ExecutionMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State owned by a single validation call: the execution mode, the message catalog and the issues
 * that fail the whole call regardless of where they occur. Never shared across calls.
 */
final class CallContext {

    private final ExecutionMode mode;
    private final MessageCatalog catalog;
    private final List<Issue> fatal = new ArrayList<>();

    CallContext(ExecutionMode mode, MessageCatalog catalog) {
        this.mode = mode;
        this.catalog = catalog;
    }

    ExecutionMode mode() {
        return mode;
    }

    boolean isSync() {
        return mode == ExecutionMode.SYNC;
    }

    MessageCatalog catalog() {
        return catalog;
    }

    synchronized void addFatal(Issue issue) {
        fatal.add(issue);
    }

    synchronized List<Issue> fatalIssues() {
        return List.copyOf(fatal);
    }

    /**
     * Creates an issue. A non-null {@code customMessage} wins over the catalog template.
     *
     * @param params alternating name/value pairs
     */
    Issue issue(IssueCode code, ValuePath path, String qualifier, String customMessage, Object... params) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < params.length; i += 2) {
            map.put((String) params[i], params[i + 1]);
        }
        return issue(code, path, qualifier, customMessage, map);
    }

    Issue issue(IssueCode code, ValuePath path, String qualifier, String customMessage, Map<String, Object> params) {
        String message = customMessage != null ? customMessage : catalog.resolve(code, qualifier, params);
        return new Issue(code, path, message, params);
    }

    /** An {@code invalid_type} issue; absent input reads "Required". */
    Issue invalidType(String expected, JsonNode received, ValuePath path) {
        String receivedType = JsonValues.typeName(received);
        return issue(
                IssueCode.INVALID_TYPE,
                path,
                received.isMissingNode() ? "required" : null,
                null,
                "expected",
                expected,
                "received",
                receivedType);
    }
}
