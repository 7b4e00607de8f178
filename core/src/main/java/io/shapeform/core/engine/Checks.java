package io.shapeform.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.shapeform.core.model.Issue;
import io.shapeform.core.model.IssueCode;
import io.shapeform.core.model.ValuePath;
import io.shapeform.core.schema.DateCheck;
import io.shapeform.core.schema.NumberCheck;
import io.shapeform.core.schema.SizeCheck;
import io.shapeform.core.schema.StringCheck;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Evaluates constraint checks on values that already passed their kind check. Every check runs;
 * each failing check contributes one issue.
 */
final class Checks {

    private static final Pattern EMAIL_PATTERN = Pattern.compile(
            "^(?!\\.)(?!.*\\.\\.)([A-Z0-9_'+\\-.]*)[A-Z0-9_+-]@([A-Z0-9][A-Z0-9\\-]*\\.)+[A-Z]{2,}$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern UUID_PATTERN =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private Checks() {}

    /** Runs string checks in order; normalizing checks rewrite the text seen by later checks. */
    static NodeResult string(CallContext ctx, List<StringCheck> checks, JsonNode value, ValuePath path) {
        String text = value.textValue();
        List<Issue> issues = new ArrayList<>();
        for (StringCheck check : checks) {
            switch (check.kind()) {
                case TRIM -> text = text.strip();
                case TO_LOWER_CASE -> text = text.toLowerCase(Locale.ROOT);
                case TO_UPPER_CASE -> text = text.toUpperCase(Locale.ROOT);
                case MIN_LENGTH -> {
                    if (text.length() < check.length()) {
                        issues.add(tooSmall(ctx, path, "string", check.length(), false, check.message()));
                    }
                }
                case MAX_LENGTH -> {
                    if (text.length() > check.length()) {
                        issues.add(tooBig(ctx, path, "string", check.length(), false, check.message()));
                    }
                }
                case LENGTH -> {
                    if (text.length() < check.length()) {
                        issues.add(tooSmall(ctx, path, "string", check.length(), true, check.message()));
                    } else if (text.length() > check.length()) {
                        issues.add(tooBig(ctx, path, "string", check.length(), true, check.message()));
                    }
                }
                case REGEX -> {
                    if (!check.pattern().matcher(text).find()) {
                        issues.add(format(ctx, path, check, "pattern", check.pattern().pattern()));
                    }
                }
                case EMAIL -> {
                    if (!EMAIL_PATTERN.matcher(text).matches()) {
                        issues.add(format(ctx, path, check));
                    }
                }
                case URL -> {
                    if (!isUrl(text)) {
                        issues.add(format(ctx, path, check));
                    }
                }
                case UUID -> {
                    if (!UUID_PATTERN.matcher(text).matches()) {
                        issues.add(format(ctx, path, check));
                    }
                }
                case STARTS_WITH -> {
                    if (!text.startsWith(check.text())) {
                        issues.add(format(ctx, path, check, "text", check.text()));
                    }
                }
                case ENDS_WITH -> {
                    if (!text.endsWith(check.text())) {
                        issues.add(format(ctx, path, check, "text", check.text()));
                    }
                }
                case INCLUDES -> {
                    if (!text.contains(check.text())) {
                        issues.add(format(ctx, path, check, "text", check.text()));
                    }
                }
            }
        }
        JsonNode out = text.equals(value.textValue()) ? value : TextNode.valueOf(text);
        return NodeResult.of(out, issues);
    }

    /** Runs number checks. {@code value} is numeric and not NaN. */
    static NodeResult number(CallContext ctx, List<NumberCheck> checks, JsonNode value, ValuePath path) {
        double d = value.doubleValue();
        boolean infinite = (value.isDouble() || value.isFloat()) && Double.isInfinite(d);
        BigDecimal decimal = infinite ? null : value.decimalValue();
        List<Issue> issues = new ArrayList<>();
        for (NumberCheck check : checks) {
            switch (check.kind()) {
                case MIN -> {
                    int cmp = infinite ? (d > 0 ? 1 : -1) : decimal.compareTo(check.value());
                    if (check.inclusive() ? cmp < 0 : cmp <= 0) {
                        issues.add(ctx.issue(
                                IssueCode.TOO_SMALL,
                                path,
                                check.inclusive() ? "number" : "number.exclusive",
                                check.message(),
                                "type", "number",
                                "minimum", check.value(),
                                "inclusive", check.inclusive(),
                                "exact", false));
                    }
                }
                case MAX -> {
                    int cmp = infinite ? (d > 0 ? 1 : -1) : decimal.compareTo(check.value());
                    if (check.inclusive() ? cmp > 0 : cmp >= 0) {
                        issues.add(ctx.issue(
                                IssueCode.TOO_BIG,
                                path,
                                check.inclusive() ? "number" : "number.exclusive",
                                check.message(),
                                "type", "number",
                                "maximum", check.value(),
                                "inclusive", check.inclusive(),
                                "exact", false));
                    }
                }
                case INT -> {
                    if (infinite || decimal.stripTrailingZeros().scale() > 0) {
                        issues.add(ctx.issue(
                                IssueCode.INVALID_TYPE,
                                path,
                                null,
                                check.message(),
                                "expected", "integer",
                                "received", "float"));
                    }
                }
                case MULTIPLE_OF -> {
                    if (infinite || decimal.remainder(check.value()).signum() != 0) {
                        issues.add(ctx.issue(
                                IssueCode.NOT_MULTIPLE_OF, path, null, check.message(), "multipleOf", check.value()));
                    }
                }
                case FINITE -> {
                    if (infinite) {
                        issues.add(ctx.issue(IssueCode.NOT_FINITE, path, null, check.message()));
                    }
                }
                case SAFE -> {
                    BigDecimal max = NumberCheck.MAX_SAFE_INTEGER;
                    if (infinite ? d < 0 : decimal.compareTo(max.negate()) < 0) {
                        issues.add(ctx.issue(
                                IssueCode.TOO_SMALL,
                                path,
                                "number",
                                check.message(),
                                "type", "number",
                                "minimum", max.negate(),
                                "inclusive", true,
                                "exact", false));
                    } else if (infinite ? d > 0 : decimal.compareTo(max) > 0) {
                        issues.add(ctx.issue(
                                IssueCode.TOO_BIG,
                                path,
                                "number",
                                check.message(),
                                "type", "number",
                                "maximum", max,
                                "inclusive", true,
                                "exact", false));
                    }
                }
            }
        }
        return NodeResult.of(value, issues);
    }

    static NodeResult date(CallContext ctx, List<DateCheck> checks, JsonNode value, Instant instant, ValuePath path) {
        List<Issue> issues = new ArrayList<>();
        for (DateCheck check : checks) {
            if (check.kind() == DateCheck.Kind.MIN && instant.isBefore(check.value())) {
                issues.add(ctx.issue(
                        IssueCode.TOO_SMALL,
                        path,
                        "date",
                        check.message(),
                        "type", "date",
                        "minimum", check.value(),
                        "inclusive", true,
                        "exact", false));
            } else if (check.kind() == DateCheck.Kind.MAX && instant.isAfter(check.value())) {
                issues.add(ctx.issue(
                        IssueCode.TOO_BIG,
                        path,
                        "date",
                        check.message(),
                        "type", "date",
                        "maximum", check.value(),
                        "inclusive", true,
                        "exact", false));
            }
        }
        return NodeResult.of(value, issues);
    }

    /** Element-count checks for arrays. */
    static List<Issue> size(CallContext ctx, List<SizeCheck> checks, int size, ValuePath path) {
        List<Issue> issues = new ArrayList<>();
        for (SizeCheck check : checks) {
            switch (check.kind()) {
                case MIN -> {
                    if (size < check.value()) {
                        issues.add(tooSmall(ctx, path, "array", check.value(), false, check.message()));
                    }
                }
                case MAX -> {
                    if (size > check.value()) {
                        issues.add(tooBig(ctx, path, "array", check.value(), false, check.message()));
                    }
                }
                case EXACT -> {
                    if (size < check.value()) {
                        issues.add(tooSmall(ctx, path, "array", check.value(), true, check.message()));
                    } else if (size > check.value()) {
                        issues.add(tooBig(ctx, path, "array", check.value(), true, check.message()));
                    }
                }
            }
        }
        return issues;
    }

    static Issue tooSmall(CallContext ctx, ValuePath path, String type, int minimum, boolean exact, String message) {
        return ctx.issue(
                IssueCode.TOO_SMALL,
                path,
                exact ? type + ".exact" : type,
                message,
                "type", type,
                "minimum", minimum,
                "inclusive", true,
                "exact", exact);
    }

    static Issue tooBig(CallContext ctx, ValuePath path, String type, int maximum, boolean exact, String message) {
        return ctx.issue(
                IssueCode.TOO_BIG,
                path,
                exact ? type + ".exact" : type,
                message,
                "type", type,
                "maximum", maximum,
                "inclusive", true,
                "exact", exact);
    }

    private static Issue format(CallContext ctx, ValuePath path, StringCheck check, Object... extra) {
        Object[] params = new Object[2 + extra.length];
        params[0] = "validation";
        params[1] = check.formatName();
        System.arraycopy(extra, 0, params, 2, extra.length);
        return ctx.issue(IssueCode.INVALID_STRING_FORMAT, path, check.formatName(), check.message(), params);
    }

    private static boolean isUrl(String text) {
        try {
            return new URI(text).isAbsolute();
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
