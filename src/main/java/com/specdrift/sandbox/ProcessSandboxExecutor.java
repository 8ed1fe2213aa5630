package com.specdrift.sandbox;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.CodeSource;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.specdrift.naming.NamingTransformer;
import com.specdrift.sandbox.ExecutionFailureException.Reason;
import com.specdrift.structure.JavaImplementationParser;

public class ProcessSandboxExecutor implements SandboxExecutor {
    private static final Logger log = LoggerFactory.getLogger(ProcessSandboxExecutor.class);
    private static final int TIMEOUT_EXIT_CODE = 124;
    private static final int INTERRUPTED_EXIT_CODE = 130;
    private static final int LAUNCH_FAILURE_EXIT_CODE = 127;
    private static final int STDERR_TAIL = 2000;

    private final String javaCommand;
    private final SandboxProgramBuilder programBuilder;
    private final ProcessStarter processStarter;
    private final ObjectMapper mapper;
    private final String classPath;

    public ProcessSandboxExecutor() {
        this(defaultJavaCommand());
    }

    public ProcessSandboxExecutor(String javaCommand) {
        this(javaCommand,
                new SandboxProgramBuilder(new JavaImplementationParser(), new NamingTransformer()),
                new DefaultProcessStarter());
    }

    ProcessSandboxExecutor(String javaCommand, SandboxProgramBuilder programBuilder, ProcessStarter processStarter) {
        this.javaCommand = javaCommand == null || javaCommand.isBlank() ? defaultJavaCommand() : javaCommand;
        this.programBuilder = Objects.requireNonNull(programBuilder, "programBuilder");
        this.processStarter = Objects.requireNonNull(processStarter, "processStarter");
        this.mapper = new ObjectMapper();
        this.classPath = jacksonClassPath();
    }

    public static String defaultJavaCommand() {
        return Path.of(System.getProperty("java.home"), "bin", "java").toString();
    }

    @Override
    public JsonNode execute(String source, String functionName, JsonNode input, Duration timeout)
            throws ExecutionFailureException {
        Objects.requireNonNull(timeout, "timeout");
        SandboxProgram program = programBuilder.build(source, functionName, input);

        ProcessOutcome outcome;
        try (SandboxWorkspace workspace = SandboxWorkspace.create()) {
            Path programFile = workspace.write(program.mainClassName() + ".java", program.source());
            Path argumentsFile = workspace.write("arguments.json", mapper.writeValueAsString(program.arguments()));
            List<String> command = new ArrayList<>(List.of(
                    javaCommand,
                    "-XX:TieredStopAtLevel=1",
                    "-XX:+UseSerialGC",
                    "-Xshare:auto"));
            if (!classPath.isEmpty()) {
                command.add("-cp");
                command.add(classPath);
            }
            command.add(programFile.toString());
            command.add(argumentsFile.toString());
            outcome = run(workspace.directory(), timeout, command.toArray(new String[0]));
        } catch (IOException e) {
            throw new ExecutionFailureException(Reason.PREPARATION_FAILED,
                    "Unable to prepare sandbox workspace: " + e.getMessage(), e);
        }
        return interpret(functionName, outcome);
    }

    ProcessOutcome run(Path workingDirectory, Duration timeout, String... command) {
        Process process;
        try {
            process = processStarter.start(workingDirectory, command);
        } catch (IOException e) {
            return new ProcessOutcome(LAUNCH_FAILURE_EXIT_CODE, "", e.getMessage(), false, false, true);
        }

        CompletableFuture<String> stdoutFuture = readStream(process.getInputStream());
        CompletableFuture<String> stderrFuture = readStream(process.getErrorStream());

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                return new ProcessOutcome(TIMEOUT_EXIT_CODE, stdoutFuture.join(), stderrFuture.join(), true, false, false);
            }
            return new ProcessOutcome(process.exitValue(), stdoutFuture.join(), stderrFuture.join(), false, false, false);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return new ProcessOutcome(INTERRUPTED_EXIT_CODE, stdoutFuture.join(), stderrFuture.join(), false, true, false);
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    JsonNode interpret(String functionName, ProcessOutcome outcome) throws ExecutionFailureException {
        if (outcome.launchFailed()) {
            throw new ExecutionFailureException(Reason.LAUNCH_FAILED, "Unable to launch " + javaCommand + ": " + outcome.stderr());
        }
        if (outcome.timedOut()) {
            throw new ExecutionFailureException(Reason.TIMED_OUT, functionName + " did not finish in time");
        }
        if (outcome.interrupted()) {
            throw new ExecutionFailureException(Reason.INTERRUPTED, "Interrupted while running " + functionName);
        }
        if (outcome.exitCode() != 0) {
            throw new ExecutionFailureException(Reason.NON_ZERO_EXIT,
                    functionName + " exited with " + outcome.exitCode() + ": " + tail(outcome.stderr()));
        }

        String[] lines = outcome.stdout().split("\\R");
        String last = lines[lines.length - 1].trim();
        if (last.isEmpty()) {
            throw new ExecutionFailureException(Reason.MALFORMED_OUTPUT, functionName + " produced no output");
        }
        try {
            return mapper.readTree(last);
        } catch (JsonProcessingException e) {
            throw new ExecutionFailureException(Reason.MALFORMED_OUTPUT,
                    functionName + " printed a result that is not JSON: " + last, e);
        }
    }

    private CompletableFuture<String> readStream(InputStream inputStream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = inputStream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
            } catch (IOException e) {
                log.debug("Sandbox stream closed early", e);
                return "";
            }
        });
    }

    private static String tail(String text) {
        return text.length() <= STDERR_TAIL ? text : text.substring(text.length() - STDERR_TAIL);
    }

    private static String jacksonClassPath() {
        Set<String> entries = new LinkedHashSet<>();
        for (Class<?> type : List.of(ObjectMapper.class, JsonFactory.class, JsonAutoDetect.class)) {
            CodeSource codeSource = type.getProtectionDomain().getCodeSource();
            if (codeSource == null || codeSource.getLocation() == null) {
                continue;
            }
            try {
                entries.add(Path.of(codeSource.getLocation().toURI()).toString());
            } catch (URISyntaxException e) {
                throw new IllegalStateException("Unresolvable class path entry " + codeSource.getLocation(), e);
            }
        }
        return String.join(File.pathSeparator, entries);
    }

    interface ProcessStarter {
        Process start(Path workingDirectory, String... command) throws IOException;
    }

    private static final class DefaultProcessStarter implements ProcessStarter {
        @Override
        public Process start(Path workingDirectory, String... command) throws IOException {
            return new ProcessBuilder(command)
                    .directory(workingDirectory == null ? null : workingDirectory.toFile())
                    .start();
        }
    }

    @Override
    public String toString() {
        return "ProcessSandboxExecutor{" +
                "javaCommand=" + javaCommand +
                ", processStarter=" + processStarter.getClass().getSimpleName() +
                '}';
    }
}
