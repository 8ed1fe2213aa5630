package com.specdrift.sandbox;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SandboxWorkspace implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SandboxWorkspace.class);

    private final Path directory;

    private SandboxWorkspace(Path directory) {
        this.directory = directory;
    }

    public static SandboxWorkspace create() throws IOException {
        return new SandboxWorkspace(Files.createTempDirectory("spec-drift-sandbox-"));
    }

    public Path directory() {
        return directory;
    }

    public Path write(String fileName, String content) throws IOException {
        Path target = directory.resolve(fileName);
        Files.writeString(target, content, StandardCharsets.UTF_8);
        return target;
    }

    @Override
    public void close() {
        if (!Files.exists(directory)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(directory)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Unable to list sandbox workspace {} for cleanup", directory, e);
            return;
        }
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                log.warn("Unable to delete sandbox file {}", path, e);
            }
        }
    }
}
