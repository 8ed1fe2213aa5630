package com.specdrift.sandbox;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.specdrift.naming.NamingTransformer;
import com.specdrift.sandbox.ExecutionFailureException.Reason;
import com.specdrift.structure.JavaImplementationParser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProcessSandboxExecutorTest {

    private static final String SOURCE = "int twice(int value) { return value * 2; }";
    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private final ObjectMapper mapper = new ObjectMapper();

    private static ProcessSandboxExecutor executor(ProcessSandboxExecutor.ProcessStarter starter) {
        return new ProcessSandboxExecutor("java",
                new SandboxProgramBuilder(new JavaImplementationParser(), new NamingTransformer()),
                starter);
    }

    private JsonNode input() throws IOException {
        return mapper.readTree("{\"value\": 21}");
    }

    @Test
    void shouldLaunchSourceProgramAndParseLastLine() throws Exception {
        List<String> launched = new ArrayList<>();
        List<Path> files = new ArrayList<>();
        ProcessSandboxExecutor executor = executor((workingDirectory, command) -> {
            launched.addAll(List.of(command));
            Path program = Path.of(command[command.length - 2]);
            files.add(program);
            assertTrue(Files.readString(program).contains("class SandboxMain"));
            assertEquals("{\"value\":21}", Files.readString(Path.of(command[command.length - 1])).trim());
            return new FakeProcess(0, true, false, "warming up\n42", "", false);
        });

        JsonNode result = executor.execute(SOURCE, "twice", input(), TIMEOUT);

        assertEquals(42, result.asInt());
        assertEquals("java", launched.get(0));
        assertTrue(launched.contains("-cp"));
        assertTrue(launched.get(launched.size() - 2).endsWith("SandboxMain.java"));
        assertFalse(Files.exists(files.get(0)), "workspace should be removed after the run");
    }

    @Test
    void shouldReportNonZeroExitWithStderr() throws Exception {
        ProcessSandboxExecutor executor = executor((workingDirectory, command) -> new FakeProcess(1, true, false, "", "boom", false));

        ExecutionFailureException failure = assertThrows(ExecutionFailureException.class,
                () -> executor.execute(SOURCE, "twice", input(), TIMEOUT));

        assertEquals(Reason.NON_ZERO_EXIT, failure.reason());
        assertTrue(failure.getMessage().contains("boom"));
    }

    @Test
    void shouldReportMalformedOutput() throws Exception {
        ProcessSandboxExecutor executor = executor((workingDirectory, command) -> new FakeProcess(0, true, false, "not json {", "", false));

        ExecutionFailureException failure = assertThrows(ExecutionFailureException.class,
                () -> executor.execute(SOURCE, "twice", input(), TIMEOUT));

        assertEquals(Reason.MALFORMED_OUTPUT, failure.reason());
    }

    @Test
    void shouldMarkTimedOutAndDestroyProcess() throws Exception {
        FakeProcess process = new FakeProcess(0, false, false, "", "timeout", false);
        ProcessSandboxExecutor executor = executor((workingDirectory, command) -> process);

        ExecutionFailureException failure = assertThrows(ExecutionFailureException.class,
                () -> executor.execute(SOURCE, "twice", input(), Duration.ofMillis(5)));

        assertEquals(Reason.TIMED_OUT, failure.reason());
        assertTrue(process.destroyForciblyCalled);
    }

    @Test
    void shouldMarkInterruptedAndReinterruptThread() {
        ProcessSandboxExecutor executor = executor((workingDirectory, command) -> new FakeProcess(0, true, true, "", "", false));

        ProcessOutcome outcome = executor.run(Path.of("."), TIMEOUT, "java", "Program.java");

        assertTrue(outcome.interrupted());
        assertEquals(130, outcome.exitCode());
        assertTrue(Thread.currentThread().isInterrupted());
        Thread.interrupted();
    }

    @Test
    void shouldReportLaunchFailure() throws Exception {
        ProcessSandboxExecutor executor = executor((workingDirectory, command) -> {
            throw new IOException("no such file");
        });

        ExecutionFailureException failure = assertThrows(ExecutionFailureException.class,
                () -> executor.execute(SOURCE, "twice", input(), TIMEOUT));

        assertEquals(Reason.LAUNCH_FAILED, failure.reason());
    }

    @Test
    void shouldFailPreparationWithoutLaunchingForUnknownMethod() throws Exception {
        List<String> launched = new ArrayList<>();
        ProcessSandboxExecutor executor = executor((workingDirectory, command) -> {
            launched.add(command[0]);
            return new FakeProcess(0, true, false, "1", "", false);
        });

        ExecutionFailureException failure = assertThrows(ExecutionFailureException.class,
                () -> executor.execute(SOURCE, "thrice", input(), TIMEOUT));

        assertEquals(Reason.PREPARATION_FAILED, failure.reason());
        assertTrue(launched.isEmpty());
    }

    private static class FakeProcess extends Process {
        private final int exitCode;
        private final boolean waitFinished;
        private final boolean interruptedWait;
        private final InputStream stdout;
        private final InputStream stderr;
        private final boolean alive;

        private boolean destroyForciblyCalled;

        private FakeProcess(int exitCode,
                boolean waitFinished,
                boolean interruptedWait,
                String stdout,
                String stderr,
                boolean alive) {
            this.exitCode = exitCode;
            this.waitFinished = waitFinished;
            this.interruptedWait = interruptedWait;
            this.stdout = new ByteArrayInputStream(stdout.getBytes(StandardCharsets.UTF_8));
            this.stderr = new ByteArrayInputStream(stderr.getBytes(StandardCharsets.UTF_8));
            this.alive = alive;
        }

        @Override
        public OutputStream getOutputStream() {
            return OutputStream.nullOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return stdout;
        }

        @Override
        public InputStream getErrorStream() {
            return stderr;
        }

        @Override
        public int waitFor() {
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            if (interruptedWait) {
                throw new InterruptedException("interrupted");
            }
            return waitFinished;
        }

        @Override
        public int exitValue() {
            return exitCode;
        }

        @Override
        public void destroy() {
            // no-op
        }

        @Override
        public Process destroyForcibly() {
            destroyForciblyCalled = true;
            return this;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }
    }
}
