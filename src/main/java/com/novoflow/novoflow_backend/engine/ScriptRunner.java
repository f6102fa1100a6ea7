package com.novoflow.novoflow_backend.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.novoflow.novoflow_backend.config.EngineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs user-supplied JavaScript in a sandboxed subprocess.
 *
 * How it works:
 *   1. Start `node [--permission] -e <harness>` with an empty environment (PATH only)
 *   2. Write {code, input, config, node, timeoutMs} to the child's stdin as JSON
 *   3. The harness creates an empty vm context and hands it the scope as a JSON string only;
 *      input, config, node and console are built inside the context, so every object the
 *      script can touch belongs to the context's own realm
 *   4. The context serialises {success, returned, output, error, logs}; the harness writes it to stdout
 *   5. Return ScriptResult
 *
 * Where the interpreter supports the permission model it runs with no grants, so file system,
 * child process and worker access fail even outside the vm context.
 * The vm timeout stops runaway synchronous code; the process itself is force-killed
 * shortly after the same deadline.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScriptRunner {

    private static final long KILL_GRACE_MS = 2_000L;

    private static final List<String> PERMISSION_FLAGS = List.of("--permission", "--experimental-permission");

    private static final String HARNESS = """
            const vm = require('vm');

            // Compiled inside the context from its source text, never called in this realm
            function prelude() {
                const stringify = JSON.stringify;
                const data = JSON.parse(globalThis.__scope);
                delete globalThis.__scope;
                const logs = [];
                const format = args => args.map(a => {
                    if (typeof a === 'string') return a;
                    try { return stringify(a); } catch (e) { return String(a); }
                }).join(' ');
                const sink = level => (...args) => { logs.push({ level, message: format(args) }); };
                globalThis.input   = data.input;
                globalThis.config  = data.config;
                globalThis.node    = data.node;
                globalThis.console = { log: sink('info'), info: sink('info'), warn: sink('warn'), error: sink('error'), debug: sink('debug') };
                Object.defineProperty(globalThis, '__report', {
                    value: (success, value) => {
                        try {
                            return stringify(success
                                ? { success: true, returned: value !== undefined, output: value === undefined ? null : value, logs }
                                : { success: false, error: value, logs });
                        } catch (e) {
                            return stringify({ success: false, error: 'Script result could not be serialised: ' + e.message, logs });
                        }
                    }
                });
            }

            function describe(e) {
                try {
                    return String(e && e.message ? e.message : e);
                } catch (inner) {
                    return 'Script threw an unreadable error';
                }
            }

            let raw = '';
            process.stdin.setEncoding('utf8');
            process.stdin.on('data', chunk => raw += chunk);
            process.stdin.on('end', () => {
                const payload = JSON.parse(raw);
                const sandbox = vm.createContext(Object.create(null));
                const options = { timeout: payload.timeoutMs };
                let success = true;
                try {
                    sandbox.__scope = JSON.stringify({ input: payload.input, config: payload.config, node: payload.node });
                    vm.runInContext('(' + prelude.toString() + ')()', sandbox, options);
                    sandbox.__outcome = vm.runInContext('(function () {\n' + payload.code + '\n})()', sandbox, {
                        timeout: payload.timeoutMs,
                        filename: 'node-script.js'
                    });
                } catch (e) {
                    success = false;
                    sandbox.__outcome = describe(e);
                }
                let report;
                try {
                    report = vm.runInContext('__report(' + success + ', globalThis.__outcome)', sandbox, options);
                } catch (e) {
                    report = null;
                }
                process.stdout.write(typeof report === 'string'
                    ? report
                    : JSON.stringify({ success: false, error: 'Script result could not be serialised', logs: [] }));
            });
            """;

    private final ObjectMapper     objectMapper;
    private final EngineProperties properties;

    private volatile List<String> isolationFlags;

    // ── Public API ────────────────────────────────────────────────────────────

    public ScriptResult run(String language, String userCode, ScriptScope scope, Long timeoutOverrideMs) {
        String lang = language == null || language.isBlank() ? "javascript" : language.toLowerCase(Locale.ROOT);
        if (!"javascript".equals(lang) && !"js".equals(lang)) {
            return ScriptResult.error("Unsupported language: " + language + ". Use 'javascript'.");
        }
        long timeoutMs = timeoutOverrideMs != null && timeoutOverrideMs > 0
                ? timeoutOverrideMs
                : properties.getScript().getTimeoutMs();
        return runJavaScript(userCode, scope, timeoutMs);
    }

    /** True when the configured interpreter can be started at all. */
    public boolean isAvailable() {
        return exitsCleanly("--version");
    }

    /** Permission model flag for the interpreter, or nothing when it has none. Detected once. */
    List<String> isolationFlags() {
        List<String> flags = isolationFlags;
        if (flags == null) {
            flags = detectIsolationFlags();
            isolationFlags = flags;
        }
        return flags;
    }

    private List<String> detectIsolationFlags() {
        for (String flag : PERMISSION_FLAGS) {
            if (exitsCleanly(flag, "-e", "0")) {
                log.info("Scripts run under the {} permission model ({})", properties.getScript().getInterpreter(), flag);
                return List.of(flag);
            }
        }
        log.warn("{} has no permission model; scripts are isolated by the vm context only",
                properties.getScript().getInterpreter());
        return List.of();
    }

    private boolean exitsCleanly(String... args) {
        List<String> command = new ArrayList<>();
        command.add(properties.getScript().getInterpreter());
        command.addAll(List.of(args));
        try {
            Process probe = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .start();
            boolean finished = probe.waitFor(5, TimeUnit.SECONDS);
            if (!finished) {
                probe.destroyForcibly();
                return false;
            }
            return probe.exitValue() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ── Core subprocess runner ────────────────────────────────────────────────

    @SuppressWarnings("unchecked")
    private ScriptResult runJavaScript(String userCode, ScriptScope scope, long timeoutMs) {
        Process process = null;
        try {
            List<String> command = new ArrayList<>();
            command.add(properties.getScript().getInterpreter());
            command.addAll(isolationFlags());
            command.add("-e");
            command.add(HARNESS);

            ProcessBuilder builder = new ProcessBuilder(command);
            Map<String, String> env = builder.environment();
            String path = env.get("PATH");
            env.clear();
            if (path != null) env.put("PATH", path);

            process = builder.start();

            CompletableFuture<String> stdout = readAsync(process.getInputStream());
            CompletableFuture<String> stderr = readAsync(process.getErrorStream());

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("code", userCode);
            payload.put("input", scope.input());
            payload.put("config", scope.config());
            payload.put("node", scope.node());
            payload.put("timeoutMs", timeoutMs);

            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(objectMapper.writeValueAsBytes(payload));
            }

            boolean finished = process.waitFor(timeoutMs + KILL_GRACE_MS, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                return ScriptResult.error("Script timed out after " + timeoutMs + " ms. Check for infinite loops.");
            }

            String out = stdout.get(KILL_GRACE_MS, TimeUnit.MILLISECONDS).trim();
            String err = stderr.get(KILL_GRACE_MS, TimeUnit.MILLISECONDS).trim();

            // No stdout means the harness itself never ran to completion
            if (out.isEmpty()) {
                return ScriptResult.error(err.isEmpty() ? "Script produced no output." : err);
            }

            Map<String, Object> parsed = objectMapper.readValue(out, Map.class);
            List<ScriptLog> logs = toLogs(parsed.get("logs"));

            if (Boolean.TRUE.equals(parsed.get("success"))) {
                return new ScriptResult(true, parsed.get("output"), Boolean.TRUE.equals(parsed.get("returned")), null, logs);
            }
            String error = parsed.get("error") != null ? String.valueOf(parsed.get("error")) : "Script returned failure.";
            if (error.startsWith("Script execution timed out")) {
                error = "Script timed out after " + timeoutMs + " ms. Check for infinite loops.";
            }
            return new ScriptResult(false, null, false, error, logs);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ScriptResult.error("Script execution was interrupted.");
        } catch (IOException | ExecutionException | TimeoutException e) {
            log.error("ScriptRunner failed: {}", e.getMessage());
            return ScriptResult.error("Failed to run script: " + e.getMessage());
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private CompletableFuture<String> readAsync(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (stream) {
                return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                return "";
            }
        });
    }

    private List<ScriptLog> toLogs(Object raw) {
        List<ScriptLog> logs = new ArrayList<>();
        if (raw instanceof List<?> entries) {
            for (Object entry : entries) {
                if (entry instanceof Map<?, ?> m) {
                    logs.add(new ScriptLog(String.valueOf(m.get("level")), String.valueOf(m.get("message"))));
                }
            }
        }
        return logs;
    }

    // ── Types ─────────────────────────────────────────────────────────────────

    /** The only names a script can see besides console, Date and JSON. */
    public record ScriptScope(Object input, Object config, Map<String, Object> node) {}

    public record ScriptLog(String level, String message) {}

    public record ScriptResult(boolean success, Object output, boolean returned, String error, List<ScriptLog> logs) {
        public static ScriptResult ok(Object output)     { return new ScriptResult(true,  output, output != null, null, List.of()); }
        public static ScriptResult error(String message) { return new ScriptResult(false, null,   false, message, List.of()); }
    }
}
