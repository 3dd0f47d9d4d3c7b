package work.rospkg.setup;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a {@code setup.py} script in a Python interpreter with {@code setup()} intercepted and reads
 * the captured keyword arguments back as JSON.
 */
public final class PythonSetupOptionsReader implements SetupOptionsReader {
    private static final Logger LOG = LoggerFactory.getLogger(PythonSetupOptionsReader.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};
    static final String MARKER = "__SETUP_OPTIONS__";

    private static final String SCRIPT = String.join("\n",
        "import json, os, runpy, sys, types",
        "setup_py = os.path.abspath(sys.argv[1])",
        "captured = {}",
        "def _setup(**kwargs):",
        "    captured.update(kwargs)",
        "def _find_packages(*args, **kwargs):",
        "    return []",
        "try:",
        "    import setuptools",
        "except ImportError:",
        "    setuptools = types.ModuleType('setuptools')",
        "    setuptools.find_packages = _find_packages",
        "    sys.modules['setuptools'] = setuptools",
        "setuptools.setup = _setup",
        "try:",
        "    import distutils.core",
        "    distutils.core.setup = _setup",
        "except ImportError:",
        "    pass",
        "sys.argv = [setup_py]",
        "sys.path.insert(0, os.path.dirname(setup_py))",
        "runpy.run_path(setup_py, run_name='__main__')",
        "sys.stdout.write('\\n" + MARKER + "' + json.dumps(captured, default=str) + '\\n')",
        "sys.stdout.flush()"
    );

    private final String executable;
    private final Duration timeout;

    public PythonSetupOptionsReader(String executable, Duration timeout) {
        this.executable = Objects.requireNonNull(executable, "executable");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public Map<String, Object> read(Path setupScript, Map<String, String> environment) {
        Path script = setupScript.toAbsolutePath().normalize();
        ProcessBuilder builder = new ProcessBuilder(executable, "-c", SCRIPT, script.toString());
        builder.directory(script.getParent().toFile());
        builder.redirectErrorStream(true);
        builder.environment().clear();
        builder.environment().putAll(environment);

        LOG.debug("Reading setup options of '{}' with {}", script, executable);
        Process process;
        try {
            process = builder.start();
        } catch (IOException ex) {
            throw new SetupOptionsException(
                "Unable to start '" + executable + "' for " + script + ": " + ex.getMessage(), script, ex);
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()));
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw timedOut(process, output, script);
            }
            // children of the script may still hold the output pipe open
            String text;
            try {
                text = output.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (TimeoutException ex) {
                throw timedOut(process, output, script);
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new SetupOptionsException(
                    "Reading setup options of " + script + " failed with exit code " + exitCode, script, exitCode, text);
            }
            return parseOutput(script, text);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new SetupOptionsException("Interrupted while reading setup options of " + script, script, ex);
        } catch (ExecutionException ex) {
            throw new SetupOptionsException("Unable to read the output for " + script, script, ex.getCause());
        }
    }

    private SetupOptionsException timedOut(Process process, CompletableFuture<String> output, Path script) {
        process.destroyForcibly();
        output.cancel(true);
        try {
            process.getInputStream().close();
        } catch (IOException ex) {
            LOG.debug("Unable to close the output of the setup options reader for '{}'", script, ex);
        }
        return new SetupOptionsException(
            "Timed out after " + timeout.toSeconds() + "s reading setup options of " + script, script, -1, "");
    }

    static Map<String, Object> parseOutput(Path script, String text) {
        int marker = text.lastIndexOf(MARKER);
        if (marker < 0) {
            throw new SetupOptionsException("Script " + script + " did not call setup()", script, 0, text);
        }
        int start = marker + MARKER.length();
        int end = text.indexOf('\n', start);
        String json = end < 0 ? text.substring(start) : text.substring(start, end);
        try {
            return new LinkedHashMap<>(JSON.readValue(json, MAP_REF));
        } catch (IOException ex) {
            throw new SetupOptionsException("Invalid setup options reported for " + script, script, ex);
        }
    }

    private static String readFully(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }
}
