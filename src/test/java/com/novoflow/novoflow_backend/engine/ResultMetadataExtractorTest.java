package com.novoflow.novoflow_backend.engine;

import com.novoflow.novoflow_backend.PipelineFixtures;
import com.novoflow.novoflow_backend.model.domain.PipelineNode;
import com.novoflow.novoflow_backend.model.execution.NodeExecutionResult;
import com.novoflow.novoflow_backend.registry.NodeDefinitionRegistry;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.novoflow.novoflow_backend.PipelineFixtures.node;
import static org.assertj.core.api.Assertions.assertThat;

class ResultMetadataExtractorTest {

    private final NodeDefinitionRegistry registry = PipelineFixtures.registry();
    private final ResultMetadataExtractor extractor = new ResultMetadataExtractor(PipelineFixtures.properties());

    private Map<String, Object> extract(PipelineNode node, Object data) {
        return extractor.extract(node, registry.loadNodeConfig(node.getType()), NodeExecutionResult.of(data));
    }

    @Test
    void fileCheckResult_isExposedAsFileInfo() {
        Map<String, Object> descriptor = Map.of("type", "pdb_file", "filename", "t.pdb", "file_id", "f-1");

        Map<String, Object> metadata = extract(node("in", "input_node", Map.of()), descriptor);

        assertThat(metadata)
                .containsEntry("file_info", descriptor)
                .containsEntry("data", descriptor)
                .containsEntry("filename", "t.pdb")
                .containsEntry("type", "pdb_file")
                .doesNotContainKey("file_url");
    }

    @Test
    void conventionalFields_arePromoted() {
        Map<String, Object> response = Map.of("sequence", "MKV", "data", Map.of("score", 0.9), "elapsed", 12);

        Map<String, Object> metadata = extract(node("mpnn", "proteinmpnn_node", Map.of()), response);

        assertThat(metadata).containsOnlyKeys("sequence", "data");
    }

    @Test
    void filepath_becomesAFileDescriptorOnFileOutputNodes() {
        Map<String, Object> response = Map.of("data", Map.of("filepath", "/jobs/7/design_0.pdb"));

        Map<String, Object> metadata = extract(node("rf", "rfdiffusion_node", Map.of()), response);

        assertThat(metadata.get("output_file")).isEqualTo(Map.of(
                "type", "pdb_file",
                "filename", "design_0.pdb",
                "filepath", "/jobs/7/design_0.pdb",
                "file_url", "https://novoflow.test/jobs/7/design_0.pdb"));
    }

    @Test
    void unrecognisedShape_isKeptWhole() {
        Map<String, Object> response = Map.of("status", "up", "version", "1.2");

        assertThat(extract(node("http", "http_request_node", Map.of()), response)).isEqualTo(response);
    }

    @Test
    void scalarsAndLists_areWrapped() {
        PipelineNode code = node("code", "code_execution_node", Map.of());

        assertThat(extract(code, 42)).isEqualTo(Map.of("value", 42));
        assertThat(extract(code, List.of(1, 2))).isEqualTo(Map.of("value", List.of(1, 2)));
        assertThat(extract(code, null)).isEmpty();
    }

    @Test
    void metadata_isDetachedFromTheRawResult() {
        Map<String, Object> nested = new LinkedHashMap<>(Map.of("id", 1));
        Map<String, Object> response = new LinkedHashMap<>(Map.of("data", nested));

        Map<String, Object> metadata = extract(node("http", "http_request_node", Map.of()), response);
        nested.put("id", 2);

        assertThat(metadata.get("data")).isEqualTo(Map.of("id", 1));
    }
}
