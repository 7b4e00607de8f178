package io.shapeform.core.error;

import static io.shapeform.core.testkit.TestJson.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.shapeform.core.model.Issue;
import io.shapeform.core.model.IssueCode;
import io.shapeform.core.model.ValuePath;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ValidationExceptionTest")
class ValidationExceptionTest {

    private final ValidationException exception = new ValidationException(List.of(
            new Issue(IssueCode.CUSTOM, ValuePath.root(), "Passwords do not match"),
            new Issue(IssueCode.INVALID_TYPE, ValuePath.of("name"), "Required"),
            new Issue(IssueCode.TOO_SMALL, ValuePath.of("address", "street"), "Too short"),
            new Issue(IssueCode.INVALID_TYPE, ValuePath.of("address", "zip"), "Required"),
            new Issue(IssueCode.INVALID_TYPE, ValuePath.of("tags", 0), "Expected string, received number")));

    @Test
    @DisplayName("flatten splits root messages from per-field messages")
    void flatten() {
        ValidationException.FlattenedIssues flat = exception.flatten();

        assertThat(flat.formErrors()).containsExactly("Passwords do not match");
        assertThat(flat.fieldErrors()).containsOnlyKeys("name", "address", "tags");
        assertThat(flat.fieldErrors().get("address")).containsExactly("Too short", "Required");
        assertThat(flat.fieldErrors().keySet()).containsExactly("name", "address", "tags");
    }

    @Test
    @DisplayName("format mirrors the value's shape with _errors at every level")
    void format() {
        assertThat(exception.format()).isEqualTo(json("""
                {
                  _errors: ['Passwords do not match'],
                  name: {_errors: ['Required']},
                  address: {
                    _errors: [],
                    street: {_errors: ['Too short']},
                    zip: {_errors: ['Required']}
                  },
                  tags: {_errors: [], '0': {_errors: ['Expected string, received number']}}
                }
                """));
    }

    @Test
    void requiresIssues() {
        assertThatThrownBy(() -> new ValidationException(List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
