package io.shapeform.core.engine;

import io.shapeform.core.message.MessageCatalog;
import io.shapeform.core.model.ValuePath;
import io.shapeform.core.spi.ValidationListener;
import java.util.Objects;

/**
 * Per-engine configuration.
 *
 * @param pathPrefix prepended to every issue path, e.g. {@code body} when validating a request body
 * @param catalog    message catalog, or {@code null} for {@link MessageCatalog#defaults()}
 * @param listener   completion listener, or {@code null} for none
 */
public record ValidationOptions(ValuePath pathPrefix, MessageCatalog catalog, ValidationListener listener) {

    public static final ValidationOptions DEFAULT = new ValidationOptions(ValuePath.root(), null, null);

    public ValidationOptions {
        Objects.requireNonNull(pathPrefix, "pathPrefix must not be null");
    }

    public ValidationOptions withPathPrefix(ValuePath prefix) {
        return new ValidationOptions(prefix, catalog, listener);
    }

    public ValidationOptions withCatalog(MessageCatalog messages) {
        return new ValidationOptions(pathPrefix, messages, listener);
    }

    public ValidationOptions withListener(ValidationListener completionListener) {
        return new ValidationOptions(pathPrefix, catalog, completionListener);
    }
}
