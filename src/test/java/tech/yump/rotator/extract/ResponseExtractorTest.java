package tech.yump.rotator.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.yump.rotator.executor.ExecutorResult;
import tech.yump.rotator.rotation.RotationContext;
import tech.yump.rotator.template.Extraction;
import tech.yump.rotator.template.ExtractionSource;
import tech.yump.rotator.template.FieldRef;
import tech.yump.rotator.template.ProviderTemplate;
import tech.yump.rotator.template.TemplateFixtures;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseExtractorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ResponseExtractor extractor = new ResponseExtractor(objectMapper);

    private static final ProviderTemplate TEMPLATE = TemplateFixtures.parse("""
            {
              "name": "keys",
              "outputs": {
                "api_key": {"type": "string", "sensitive": true},
                "expires": {"type": "number"}
              },
              "internal": {
                "api_key_id": {"type": "string"},
                "scopes": {"type": "array"}
              },
              "functions": {
                "set": {"type": "HTTP", "method": "POST", "url": "https://keys.example.com/v1/keys"}
              }
            }
            """);

    private ExecutorResult result(String body) throws Exception {
        return new ExecutorResult(201, Map.of("X-Request-Id", List.of("req-1", "req-2")), objectMapper.readTree(body));
    }

    @Test
    @DisplayName("extract: Should read a body path with or without the leading $")
    void extract_BodyPath() throws Exception {
        ExecutorResult result = result("{\"data\": {\"key\": \"SG.abc\", \"items\": [{\"id\": 7}]}}");

        assertThat(extractor.extract(result, Extraction.body("data.key")).asText()).isEqualTo("SG.abc");
        assertThat(extractor.extract(result, Extraction.body("$.data.key")).asText()).isEqualTo("SG.abc");
        assertThat(extractor.extract(result, Extraction.body("data.items[0].id")).asInt()).isEqualTo(7);
    }

    @Test
    @DisplayName("extract: Should read headers by lower-cased name, first value")
    void extract_Headers() throws Exception {
        JsonNode value = extractor.extract(result("{}"), new Extraction("x-request-id", ExtractionSource.HEADERS));

        assertThat(value.asText()).isEqualTo("req-1");
    }

    @Test
    @DisplayName("extract: Should read the rotation context when the source is context")
    void extract_Context() throws Exception {
        RotationContext context = RotationContext.of(null, (ObjectNode) objectMapper.readTree("{\"username\": \"app_blue\"}"));

        JsonNode value = extractor.extract(result("{}"), new Extraction("internal.username", ExtractionSource.CONTEXT), context);

        assertThat(value.asText()).isEqualTo("app_blue");
        assertThatThrownBy(() -> extractor.extract(result("{}"), new Extraction("internal.username", ExtractionSource.CONTEXT)))
                .isInstanceOf(ExtractionException.class);
    }

    @Test
    @DisplayName("extract: Should fail when nothing matches or the value is null")
    void extract_NoMatch() throws Exception {
        ExecutorResult result = result("{\"key\": null}");

        assertThatThrownBy(() -> extractor.extract(result, Extraction.body("missing")))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("matched nothing");
        assertThatThrownBy(() -> extractor.extract(result, Extraction.body("key")))
                .isInstanceOf(ExtractionException.class);
    }

    @Test
    @DisplayName("extract: Indefinite paths must match exactly one node")
    void extract_Indefinite() throws Exception {
        ExecutorResult result = result("{\"keys\": [{\"name\": \"a\", \"id\": 1}, {\"name\": \"b\", \"id\": 2}]}");

        assertThat(extractor.extract(result, Extraction.body("keys[?(@.name == 'b')].id")).asInt()).isEqualTo(2);
        assertThatThrownBy(() -> extractor.extract(result, Extraction.body("keys[*].id")))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("matched 2");
        assertThatThrownBy(() -> extractor.extract(result, Extraction.body("keys[?(@.name == 'c')].id")))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("matched 0");
    }

    @Test
    @DisplayName("extract: Should report invalid JSON paths as extraction errors")
    void extract_InvalidPath() throws Exception {
        assertThatThrownBy(() -> extractor.extract(result("{}"), Extraction.body("keys[")))
                .isInstanceOf(ExtractionException.class);
    }

    @Test
    @DisplayName("applyAll: Should extract and coerce every setter entry in order")
    void applyAll_Success() throws Exception {
        Map<String, Extraction> setter = new LinkedHashMap<>();
        setter.put("outputs.api_key", Extraction.body("api_key"));
        setter.put("internal.api_key_id", Extraction.body("api_key_id"));
        setter.put("outputs.expires", Extraction.body("expires"));
        setter.put("internal.scopes", Extraction.body("scopes"));

        SetterResult extracted = extractor.applyAll(setter,
                result("{\"api_key\": \"SG.abc\", \"api_key_id\": 123, \"expires\": \"3600\", \"scopes\": [\"mail.send\"]}"),
                TEMPLATE, RotationContext.empty());

        assertThat(extracted.values()).containsOnlyKeys(
                FieldRef.parse("outputs.api_key"), FieldRef.parse("internal.api_key_id"),
                FieldRef.parse("outputs.expires"), FieldRef.parse("internal.scopes"));
        assertThat(extracted.values().get(FieldRef.parse("internal.api_key_id")).isTextual()).isTrue();
        assertThat(extracted.values().get(FieldRef.parse("internal.api_key_id")).asText()).isEqualTo("123");
        assertThat(extracted.values().get(FieldRef.parse("outputs.expires")).asLong()).isEqualTo(3600L);
    }

    @Test
    @DisplayName("applyAll: Should fail with the extractions made so far when a later entry fails")
    void applyAll_Partial() throws Exception {
        Map<String, Extraction> setter = new LinkedHashMap<>();
        setter.put("internal.api_key_id", Extraction.body("api_key_id"));
        setter.put("outputs.api_key", Extraction.body("api_key"));

        assertThatThrownBy(() -> extractor.applyAll(setter, result("{\"api_key_id\": \"42\"}"), TEMPLATE, RotationContext.empty()))
                .isInstanceOfSatisfying(ExtractionException.class, e -> {
                    assertThat(e.partial()).containsOnlyKeys(FieldRef.parse("internal.api_key_id"));
                    assertThat(e.partial().get(FieldRef.parse("internal.api_key_id")).asText()).isEqualTo("42");
                });
    }

    @Test
    @DisplayName("applyAll: Should reject a container where a scalar is declared")
    void applyAll_ShapeMismatch() throws Exception {
        Map<String, Extraction> setter = Map.of("outputs.api_key", Extraction.body("api_key"));

        assertThatThrownBy(() -> extractor.applyAll(setter, result("{\"api_key\": {\"value\": \"x\"}}"), TEMPLATE, RotationContext.empty()))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("object");
    }
}
