package com.flowgrid.orchestrator.flow.runtime;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/** Reads sub-workflows from {@code flowgrid.flow.library-dir}; paths may not leave that directory. */
@Component
public class FileSystemFlowSourceResolver implements FlowSourceResolver {

    private final Path root;

    public FileSystemFlowSourceResolver(@Value("${flowgrid.flow.library-dir:flows}") String libraryDir) {
        this.root = Path.of(libraryDir).toAbsolutePath().normalize();
    }

    @Override
    public Optional<String> resolve(String path) {
        Path file = root.resolve(path).normalize();
        if (!file.startsWith(root)) {
            throw new IllegalArgumentException("Flow path escapes the library directory: " + path);
        }
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read flow " + file, e);
        }
    }
}
