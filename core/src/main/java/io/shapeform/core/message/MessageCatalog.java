package io.shapeform.core.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.POJONode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.shapeform.core.error.MessageCatalogException;
import io.shapeform.core.model.IssueCode;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Issue message templates keyed by issue code plus an optional dotted qualifier, e.g.
 * {@code too_small.string.exact}. Lookup falls back one qualifier segment at a time, so
 * {@code too_small.string.exact} falls back to {@code too_small.string} and then {@code too_small}.
 *
 * <p>
 * Templates reference issue params as {@code {name}}. Catalog files are YAML with a single
 * {@code messages} mapping:
 *
 * <pre>
 * messages:
 *   invalid_type: "Expected {expected}, received {received}"
 *   too_small.string: "Too short"
 * </pre>
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class MessageCatalog {

    /** Classpath location of the default catalog. */
    public static final String DEFAULT_RESOURCE = "shapeform/messages.yaml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z][A-Za-z0-9_]*)}");
    private static final String FALLBACK = "Invalid input";

    private static volatile MessageCatalog defaults;

    private final Map<String, String> templates;

    private MessageCatalog(Map<String, String> templates) {
        this.templates = Collections.unmodifiableMap(new LinkedHashMap<>(templates));
    }

    /**
     * Returns the built-in catalog, loaded once from {@value #DEFAULT_RESOURCE}.
     *
     * @throws MessageCatalogException if the resource is missing or malformed
     */
    public static MessageCatalog defaults() {
        MessageCatalog current = defaults;
        if (current == null) {
            synchronized (MessageCatalog.class) {
                current = defaults;
                if (current == null) {
                    current = loadResource(DEFAULT_RESOURCE);
                    defaults = current;
                }
            }
        }
        return current;
    }

    /**
     * Loads a catalog from a YAML file. The result holds only that file's templates; overlay it on
     * {@link #defaults()} with {@link #withOverrides(MessageCatalog)}.
     *
     * @throws MessageCatalogException if the file cannot be read or is malformed
     */
    public static MessageCatalog load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new MessageCatalogException("Failed to read or parse YAML: " + e.getMessage(), e, source);
        }
        return new MessageCatalog(parse(root, source));
    }

    /** Builds a catalog from an in-memory key-to-template map. */
    public static MessageCatalog of(Map<String, String> templates) {
        Objects.requireNonNull(templates, "templates must not be null");
        templates.forEach((key, template) -> {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(template, "template for '" + key + "' must not be null");
        });
        return new MessageCatalog(templates);
    }

    /** A new catalog with {@code overrides} replacing templates of the same key. */
    public MessageCatalog withOverrides(MessageCatalog overrides) {
        Objects.requireNonNull(overrides, "overrides must not be null");
        return withOverrides(overrides.templates);
    }

    public MessageCatalog withOverrides(Map<String, String> overrides) {
        Map<String, String> merged = new LinkedHashMap<>(templates);
        merged.putAll(of(overrides).templates);
        return new MessageCatalog(merged);
    }

    /** Returns the template for an exact key. */
    public Optional<String> template(String key) {
        return Optional.ofNullable(templates.get(key));
    }

    public Map<String, String> templates() {
        return templates;
    }

    /**
     * Renders the message for an issue. Unknown placeholders are left as written.
     *
     * @param code      the issue code
     * @param qualifier dotted qualifier narrowing the template, or {@code null}
     * @param params    issue params substituted into the template
     */
    public String resolve(IssueCode code, String qualifier, Map<String, Object> params) {
        String key = qualifier == null || qualifier.isEmpty() ? code.id() : code.id() + "." + qualifier;
        String template = lookup(key);
        if (template == null) {
            template = code == IssueCode.CUSTOM ? FALLBACK : code.id();
        }
        return render(template, params == null ? Map.of() : params);
    }

    private String lookup(String key) {
        String candidate = key;
        while (true) {
            String template = templates.get(candidate);
            if (template != null) {
                return template;
            }
            int dot = candidate.lastIndexOf('.');
            if (dot < 0) {
                return null;
            }
            candidate = candidate.substring(0, dot);
        }
    }

    static String render(String template, Map<String, Object> params) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String name = m.group(1);
            String replacement = params.containsKey(name) ? format(params.get(name), false) : m.group();
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /** Formats a param value; text inside collections and text nodes are single-quoted. */
    static String format(Object value, boolean quoteText) {
        if (value == null) {
            return "null";
        }
        if (value instanceof BigDecimal d) {
            return d.stripTrailingZeros().toPlainString();
        }
        if (value instanceof JsonNode node) {
            if (node.isTextual()) {
                return "'" + node.textValue() + "'";
            }
            if (node.isBigDecimal()) {
                return format(node.decimalValue(), false);
            }
            if (node.isMissingNode()) {
                return "undefined";
            }
            if (node instanceof POJONode pojo) {
                return String.valueOf(pojo.getPojo());
            }
            return node.toString();
        }
        if (value instanceof Collection<?> items) {
            return items.stream().map(item -> format(item, true)).collect(Collectors.joining(", "));
        }
        if (value instanceof String s) {
            return quoteText ? "'" + s + "'" : s;
        }
        return String.valueOf(value);
    }

    private static MessageCatalog loadResource(String resource) {
        ClassLoader loader = MessageCatalog.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new MessageCatalogException("Message catalog resource not found", resource);
            }
            return new MessageCatalog(parse(YAML_MAPPER.readTree(in), resource));
        } catch (IOException e) {
            throw new MessageCatalogException("Failed to read or parse YAML: " + e.getMessage(), e, resource);
        }
    }

    private static Map<String, String> parse(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw new MessageCatalogException("Message catalog must be a YAML mapping", source);
        }
        JsonNode messages = root.get("messages");
        if (messages == null || !messages.isObject()) {
            throw new MessageCatalogException("Missing or invalid 'messages' mapping", source);
        }
        Map<String, String> templates = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = messages.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (!entry.getValue().isTextual()) {
                throw new MessageCatalogException(
                        "Template for '" + entry.getKey() + "' must be a string, got: "
                                + entry.getValue().getNodeType(),
                        source);
            }
            templates.put(entry.getKey(), entry.getValue().textValue());
        }
        return templates;
    }

    @Override
    public String toString() {
        return "MessageCatalog[" + templates.size() + " templates]";
    }
}
