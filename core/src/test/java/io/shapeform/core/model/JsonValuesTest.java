package io.shapeform.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JsonValuesTest")
class JsonValuesTest {

    @Test
    void convertsPlainData() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", "Ada");
        map.put("tags", Arrays.asList("a", null));
        map.put("skip", Optional.empty());
        map.put("age", 36);

        JsonNode node = JsonValues.toNode(map);

        assertThat(node.toString()).isEqualTo("{\"name\":\"Ada\",\"tags\":[\"a\",null],\"age\":36}");
    }

    @Test
    void jsonNodesPassThrough() {
        JsonNode node = TextNode.valueOf("x");

        assertThat(JsonValues.toNode(node)).isSameAs(node);
        assertThat(JsonValues.toNode(null).isNull()).isTrue();
        assertThat(JsonValues.toNode(Optional.empty()).isMissingNode()).isTrue();
    }

    @Test
    void typeNames() {
        assertThat(JsonValues.typeName(JsonValues.absent())).isEqualTo("undefined");
        assertThat(JsonValues.typeName(JsonValues.toNode(null))).isEqualTo("null");
        assertThat(JsonValues.typeName(JsonValues.toNode(Double.NaN))).isEqualTo("nan");
        assertThat(JsonValues.typeName(JsonValues.toNode(LocalDate.of(2024, 1, 1)))).isEqualTo("date");
        assertThat(JsonValues.typeName(JsonValues.toNode(new Object()))).isEqualTo("unknown");
    }

    @Test
    void dates() {
        Instant instant = Instant.parse("2024-01-01T00:00:00Z");

        assertThat(JsonValues.toInstant(JsonValues.toNode(LocalDate.of(2024, 1, 1)))).contains(instant);
        assertThat(JsonValues.toInstant(JsonValues.toNode(LocalTime.NOON))).isEmpty();
        assertThat(JsonValues.isDate(TextNode.valueOf("2024-01-01"))).isFalse();
    }

    @Test
    void sameValueIsNumericAware() {
        assertThat(JsonValues.sameValue(IntNode.valueOf(1), DecimalNode.valueOf(new BigDecimal("1.00")))).isTrue();
        assertThat(JsonValues.sameValue(IntNode.valueOf(1), TextNode.valueOf("1"))).isFalse();
        assertThat(JsonValues.sameValue(
                        JsonValues.toNode(Instant.parse("2024-01-01T00:00:00Z")),
                        JsonValues.toNode(LocalDate.of(2024, 1, 1))))
                .isTrue();
    }
}
