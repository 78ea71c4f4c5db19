package server.core;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class JsonTest {
    @Test
    void testParseObject() {
        final var m = Json.parseObject("{ \"machineId\": \"m-1\", \"input\": \"a\\\"b\", \"maxDepth\": 12, "
                + "\"ratio\": 0.5, \"flags\": [true, false, null], \"nested\": {} }");
        assertThat(m).containsEntry("machineId", "m-1")
                .containsEntry("input", "a\"b")
                .containsEntry("maxDepth", 12)
                .containsEntry("ratio", 0.5)
                .containsEntry("nested", Map.of());
        assertThat(m.get("flags")).isEqualTo(Arrays.asList(true, false, null));
    }

    @Test
    void testBlankBodyIsEmptyObject() {
        assertThat(Json.parseObject("  ")).isEmpty();
        assertThat(Json.parseObject(null)).isEmpty();
    }

    @Test
    void testLongNumbersStayLong() {
        assertThat(Json.parseObject("{\"n\": 9999999999}")).containsEntry("n", 9999999999L);
    }

    @Test
    void testUnicodeEscape() {
        assertThat(Json.parseObject("{\"s\": \"\\u00e9_\"}")).containsEntry("s", "\u00e9_");
    }

    @Test
    void testMalformedInputIsRejected() {
        for (String bad : List.of("{", "{\"a\" 1}", "{\"a\": 1,}", "{\"a\": 1} x", "{\"a\": \"open}", "{a: 1}")) {
            assertThat(catchThrowable(() -> Json.parseObject(bad)))
                    .as(bad)
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageStartingWith("Malformed JSON");
        }
    }

    @Test
    void testRootMustBeObject() {
        assertThat(catchThrowable(() -> Json.parseObject("[1,2]")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(catchThrowable(() -> Json.parseObject("\"x\"")))
                .hasMessage("Expected a JSON object");
    }

    @Test
    void testStringify() {
        final var m = new LinkedHashMap<String, Object>();
        m.put("ok", true);
        m.put("depth", 3);
        m.put("summary", "line1\nline2 \"q\"");
        m.put("levels", List.of(List.of("[, q0, ab]"), Arrays.asList("x", null)));
        assertThat(Json.stringify(m)).isEqualTo(
                "{\"ok\":true,\"depth\":3,\"summary\":\"line1\\nline2 \\\"q\\\"\","
                        + "\"levels\":[[\"[, q0, ab]\"],[\"x\",null]]}");
    }

    @Test
    void testControlCharactersAreEscaped() {
        assertThat(Json.stringify("a\u0001")).isEqualTo("\"a\\u0001\"");
    }

    @Test
    void testEscapesBetweenPlainRuns() {
        assertThat(Json.stringify("a\"b\\c\td")).isEqualTo("\"a\\\"b\\\\c\\td\"");
        assertThat(Json.stringify("\"")).isEqualTo("\"\\\"\"");
        assertThat(Json.stringify("")).isEqualTo("\"\"");
    }

    @Test
    void testOtherValuesAreWrittenAsStrings() {
        assertThat(Json.stringify(Map.of("v", tmengine.Outcome.Verdict.ACCEPTED))).isEqualTo("{\"v\":\"ACCEPTED\"}");
    }
}
