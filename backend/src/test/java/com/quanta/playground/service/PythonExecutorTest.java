package com.quanta.playground.service;

import com.quanta.playground.compiler.QuantaCompiler;
import com.quanta.playground.config.QuantaCompilerProperties;
import com.quanta.playground.exception.ExecutionException;
import com.quanta.playground.service.PythonExecutor.ExecutionResult;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class PythonExecutorTest {

    @TempDir
    Path tempDir;

    private PythonExecutor executor;
    private final QuantaCompiler compiler = new QuantaCompiler();

    @BeforeEach
    void setUp() {
        executor = new PythonExecutor(properties("python3", 10_000L, 50_000));
    }

    private QuantaCompilerProperties properties(String pythonPath, long timeoutMs, int maxOutput) {
        return new QuantaCompilerProperties(pythonPath, tempDir.toString(), timeoutMs, 10_000, maxOutput,
                "    ", true);
    }

    @Test
    void repeatRunsItsBodyExactlyCountTimes() throws Exception {
        assumeTrue(PythonAvailability.python3Available(), "python3 not installed");

        ExecutionResult result = executor.execute(compiler.compile("repeat 3 write 1 end"));

        assertThat(result.success()).isTrue();
        assertThat(result.output().lines()).containsExactly("1", "1", "1");
    }

    @Test
    void generatedProgramsAreValidPython() throws Exception {
        assumeTrue(PythonAvailability.python3Available(), "python3 not installed");

        String source = String.join("\n",
                "let n = 4",
                "let unset",
                "if n > 3 write \"big\" elif n > 1 write \"medium\" else write \"small\" end",
                "repeat n - 2",
                "  if n < 0 end",
                "  write n * 10",
                "end",
                "write unset");

        ExecutionResult result = executor.execute(compiler.compile(source));

        assertThat(result.success()).isTrue();
        assertThat(result.output().lines()).containsExactly("big", "40", "40", "None");
    }

    @Test
    void runtimeFailureIsAResultNotAnException() throws Exception {
        assumeTrue(PythonAvailability.python3Available(), "python3 not installed");

        ExecutionResult result = executor.execute(compiler.compile("write missing"));

        assertThat(result.success()).isFalse();
        assertThat(result.timedOut()).isFalse();
        assertThat(result.exitCode()).isNotZero();
        assertThat(result.output()).contains("NameError");
    }

    @Test
    void longRunningProgramTimesOut() throws Exception {
        assumeTrue(PythonAvailability.python3Available(), "python3 not installed");
        executor = new PythonExecutor(properties("python3", 300L, 50_000));

        ExecutionResult result = executor.execute("import time\ntime.sleep(5)");

        assertThat(result.timedOut()).isTrue();
        assertThat(result.success()).isFalse();
    }

    @Test
    void overlongOutputIsTruncated() throws Exception {
        assumeTrue(PythonAvailability.python3Available(), "python3 not installed");
        executor = new PythonExecutor(properties("python3", 10_000L, 10));

        ExecutionResult result = executor.execute(compiler.compile("repeat 20 write 12345 end"));

        assertThat(result.output()).startsWith("12345\n1234").endsWith("(output truncated)");
    }

    @Test
    void boundedReadKeepsLimitAndDrainsTheRest() throws Exception {
        RepeatingInput input = new RepeatingInput("1\n", 20_000_000L);

        PythonExecutor.BoundedOutput output = PythonExecutor.readBounded(input, 16);

        assertThat(output.text()).isEqualTo("1\n1\n1\n1\n1\n1\n1\n1\n");
        assertThat(output.truncated()).isTrue();
        assertThat(input.served).isEqualTo(20_000_000L);
    }

    @Test
    void boundedReadOfShortOutputIsNotTruncated() throws Exception {
        PythonExecutor.BoundedOutput output = PythonExecutor.readBounded(new RepeatingInput("ab", 4), 4);

        assertThat(output.text()).isEqualTo("abab");
        assertThat(output.truncated()).isFalse();
    }

    @Test
    void largeOutputRunIsCappedAtMaxOutputLength() throws Exception {
        assumeTrue(PythonAvailability.python3Available(), "python3 not installed");
        executor = new PythonExecutor(properties("python3", 20_000L, 100));

        ExecutionResult result = executor.execute(compiler.compile("repeat 500000 write 1234567890 end"));

        assertThat(result.success()).isTrue();
        assertThat(result.output()).hasSize(100 + PythonExecutor.TRUNCATION_NOTICE.length());
        assertThat(result.output()).endsWith(PythonExecutor.TRUNCATION_NOTICE);
    }

    @Test
    void multilineStringRunsAsOneLiteral() throws Exception {
        assumeTrue(PythonAvailability.python3Available(), "python3 not installed");

        ExecutionResult result = executor.execute(compiler.compile("write \"a\nb\\c\""));

        assertThat(result.success()).isTrue();
        assertThat(result.output().lines()).containsExactly("a", "b\\c");
    }

    @Test
    void scriptFileIsRemovedAfterRun() throws Exception {
        assumeTrue(PythonAvailability.python3Available(), "python3 not installed");

        executor.execute("print(1)");

        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    void missingInterpreterRaisesExecutionException() {
        executor = new PythonExecutor(properties("quanta-no-such-python", 1_000L, 100));

        assertThatThrownBy(() -> executor.execute("print(1)"))
                .isInstanceOf(ExecutionException.class)
                .hasMessageContaining("quanta-no-such-python");
    }

    private static final class RepeatingInput extends InputStream {
        private final byte[] pattern;
        private final long total;
        long served;

        RepeatingInput(String pattern, long total) {
            this.pattern = pattern.getBytes(java.nio.charset.StandardCharsets.US_ASCII);
            this.total = total;
        }

        @Override
        public int read() {
            if (served >= total) {
                return -1;
            }
            return pattern[(int) (served++ % pattern.length)];
        }

        @Override
        public int read(byte[] b, int off, int len) {
            if (served >= total) {
                return -1;
            }
            int n = (int) Math.min(len, total - served);
            for (int i = 0; i < n; i++) {
                b[off + i] = pattern[(int) (served++ % pattern.length)];
            }
            return n;
        }
    }
}
