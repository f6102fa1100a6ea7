package com.novoflow.novoflow_backend.executor;

import com.novoflow.novoflow_backend.PipelineFixtures;
import com.novoflow.novoflow_backend.model.domain.PipelineNode;
import com.novoflow.novoflow_backend.model.execution.NodeStatus;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateResolverTest {

    private final TemplateResolver resolver = new TemplateResolver(PipelineFixtures.objectMapper());

    private final PipelineNode node = PipelineNode.builder()
            .id("n1")
            .type("http_request_node")
            .label("Fetch")
            .status(NodeStatus.RUNNING)
            .config(new LinkedHashMap<>(Map.of("url", "https://api.test", "retries", 3)))
            .build();

    @Test
    void singlePlaceholder_returnsRawValueWithItsType() {
        Map<String, Object> input = Map.of("seq", List.of("A", "B"));

        assertThat(resolver.resolve("{{config.retries}}", node, input)).isEqualTo(3);
        assertThat(resolver.resolve("{{input.seq}}", node, input)).isEqualTo(List.of("A", "B"));
    }

    @Test
    void embeddedPlaceholders_areStringified() {
        Object resolved = resolver.resolve("GET {{config.url}}/items?n={{config.retries}}", node, Map.of());

        assertThat(resolved).isEqualTo("GET https://api.test/items?n=3");
    }

    @Test
    void embeddedMap_isWrittenAsJson() {
        Map<String, Object> input = Map.of("body", Map.of("a", 1));

        assertThat(resolver.resolve("payload={{input.body}}", node, input)).isEqualTo("payload={\"a\":1}");
    }

    @Test
    void missingPathOrUnknownRoot_resolvesToEmptyString() {
        assertThat(resolver.resolve("{{input.nothing.here}}", node, Map.of())).isEqualTo("");
        assertThat(resolver.resolve("{{secrets.key}}", node, Map.of())).isEqualTo("");
        assertThat(resolver.resolve("x{{config.absent}}y", node, Map.of())).isEqualTo("xy");
    }

    @Test
    void nodeRoot_exposesIdTypeLabelAndStatus() {
        assertThat(resolver.resolve("{{node.label}} ({{node.type}}) is {{node.status}}", node, Map.of()))
                .isEqualTo("Fetch (http_request_node) is running");
    }

    @Test
    void listIndexes_inBracketAndDotForm() {
        Map<String, Object> input = Map.of("items", List.of(Map.of("id", "first"), Map.of("id", "second")));

        assertThat(resolver.resolve("{{input.items[1].id}}", node, input)).isEqualTo("second");
        assertThat(resolver.resolve("{{input.items.0.id}}", node, input)).isEqualTo("first");
        assertThat(resolver.resolve("{{input.items[5].id}}", node, input)).isEqualTo("");
    }

    @Test
    void mapsAndLists_areResolvedRecursively() {
        Map<String, Object> template = Map.of(
                "endpoint", "{{config.url}}",
                "tags", List.of("{{node.id}}", "static"));

        Object resolved = resolver.resolve(template, node, Map.of());

        assertThat(resolved).isEqualTo(Map.of(
                "endpoint", "https://api.test",
                "tags", List.of("n1", "static")));
    }

    @Test
    void expressionLikeText_isNeverEvaluated() {
        assertThat(resolver.resolve("{{ config.retries + 1 }}", node, Map.of())).isEqualTo("{{ config.retries + 1 }}");
        assertThat(resolver.resolve("{{process.exit()}}", node, Map.of())).isEqualTo("{{process.exit()}}");
    }

    @Test
    void textWithoutPlaceholders_isReturnedUnchanged() {
        assertThat(resolver.resolve("plain {text}", node, Map.of())).isEqualTo("plain {text}");
        assertThat(resolver.resolve("unclosed {{config.url", node, Map.of())).isEqualTo("unclosed {{config.url");
        assertThat(resolver.resolve(42, node, Map.of())).isEqualTo(42);
    }

    @Test
    void flagKeys_areRecognisedAndStripped() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("__send_body__", true);
        values.put("name", "x");
        values.put("__", "not a flag");

        assertThat(TemplateResolver.isFlagKey("__send_body__")).isTrue();
        assertThat(TemplateResolver.isFlagKey("____")).isFalse();
        assertThat(TemplateResolver.stripFlags(values)).containsOnlyKeys("name", "__");
    }
}
