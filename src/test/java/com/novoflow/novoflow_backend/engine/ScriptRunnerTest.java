package com.novoflow.novoflow_backend.engine;

import com.novoflow.novoflow_backend.PipelineFixtures;
import com.novoflow.novoflow_backend.engine.ScriptRunner.ScriptResult;
import com.novoflow.novoflow_backend.engine.ScriptRunner.ScriptScope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/** Runs real scripts; skipped where no node interpreter is installed. */
class ScriptRunnerTest {

    private final ScriptRunner runner = new ScriptRunner(PipelineFixtures.objectMapper(), PipelineFixtures.properties());

    private final ScriptScope scope = new ScriptScope(
            Map.of("a", 5), Map.of("factor", 2), Map.of("id", "code", "type", "code_execution_node"));

    @BeforeEach
    void requireInterpreter() {
        assumeTrue(runner.isAvailable(), "node interpreter not available");
    }

    @Test
    void returnValue_isPassedBack() {
        ScriptResult result = runner.run("javascript", "return {x: input.a + 1, y: config.factor};", scope, null);

        assertThat(result.success()).isTrue();
        assertThat(result.returned()).isTrue();
        assertThat(result.output()).isEqualTo(Map.of("x", 6, "y", 2));
    }

    @Test
    void thrownError_keepsItsMessage() {
        ScriptResult result = runner.run("javascript", "throw new Error('boom');", scope, null);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("boom");
    }

    @Test
    void consoleOutput_isCapturedNotPrinted() {
        ScriptResult result = runner.run("javascript", "console.warn('careful'); return node.id;", scope, null);

        assertThat(result.output()).isEqualTo("code");
        assertThat(result.logs()).anySatisfy(log -> {
            assertThat(log.level()).isEqualTo("warn");
            assertThat(log.message()).isEqualTo("careful");
        });
    }

    @Test
    void hostFacilities_areOutOfReach() {
        ScriptResult result = runner.run("javascript",
                "return [typeof require, typeof process, typeof fetch, typeof setTimeout];", scope, null);

        assertThat(result.success()).isTrue();
        assertThat(result.output()).isEqualTo(List.of("undefined", "undefined", "undefined", "undefined"));
    }

    @Test
    void constructorChains_neverReachTheHostRealm() {
        ScriptResult result = runner.run("javascript", String.join("\n",
                "const attempts = [",
                "  () => Date.constructor('return process')(),",
                "  () => JSON.parse.constructor('return process')(),",
                "  () => input.constructor.constructor('return process')(),",
                "  () => console.log.constructor('return process')(),",
                "  () => this.constructor.constructor('return process')()",
                "];",
                "return attempts.map(attempt => {",
                "  try { const found = attempt(); return found && found.pid ? 'process' : typeof found; }",
                "  catch (e) { return 'blocked'; }",
                "});"), scope, null);

        assertThat(result.success()).isTrue();
        assertThat((List<Object>) result.output()).hasSize(5).containsOnly("blocked");
    }

    @Test
    void contextBuiltins_stillWork() {
        ScriptResult result = runner.run("javascript",
                "console.log({n: input.a}); return [new Date(0).toISOString(), JSON.stringify(config)];", scope, null);

        assertThat(result.success()).isTrue();
        assertThat(result.output()).isEqualTo(List.of("1970-01-01T00:00:00.000Z", "{\"factor\":2}"));
        assertThat(result.logs()).extracting(ScriptRunner.ScriptLog::message).containsExactly("{\"n\":5}");
    }

    @Test
    void unserialisableResult_isReportedAsAnError() {
        ScriptResult result = runner.run("javascript", "const a = {}; a.self = a; return a;", scope, null);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).startsWith("Script result could not be serialised");
    }

    @Test
    void infiniteLoop_timesOut() {
        ScriptResult result = runner.run("javascript", "while (true) {}", scope, 300L);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("timed out");
    }

    @Test
    void otherLanguages_areRefused() {
        ScriptResult result = runner.run("python", "print(1)", scope, null);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).startsWith("Unsupported language");
    }
}
