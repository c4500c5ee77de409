package com.survey.boothsampling.storage;

import com.survey.boothsampling.exception.LayerNotFoundException;
import com.survey.boothsampling.exception.LayerStorageException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Layers on the local disk, laid out as {@code <base>/<state>/<state>.<kind>.geojson}.
 */
@Slf4j
public class LocalLayerStorage implements LayerStorage {

    private static final List<String> EXTENSIONS = List.of(".geojson", ".json");

    private final Path baseDir;

    public LocalLayerStorage(Path baseDir) {
        this.baseDir = baseDir;
    }

    @Override
    public List<String> listStates() {
        if (!Files.isDirectory(baseDir)) {
            log.warn("Layer directory {} does not exist", baseDir.toAbsolutePath());
            return Collections.emptyList();
        }
        try (Stream<Path> children = Files.list(baseDir)) {
            return children
                    .filter(Files::isDirectory)
                    .map(path -> path.getFileName().toString())
                    .filter(name -> !name.startsWith("."))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new LayerStorageException("Failed to list states under " + baseDir.toAbsolutePath(), e);
        }
    }

    @Override
    public InputStream openLayer(String state, LayerKind kind) throws IOException {
        Path stateDir = resolveStateDir(state);
        List<Path> tried = new ArrayList<>();
        for (String extension : EXTENSIONS) {
            Path candidate = stateDir.resolve(state + "." + kind.getFileToken() + extension);
            tried.add(candidate);
            if (Files.isRegularFile(candidate)) {
                log.debug("Opening {} layer for {} from {}", kind, state, candidate);
                return Files.newInputStream(candidate);
            }
        }
        throw new LayerNotFoundException(String.format(
                "No %s layer found for state %s (looked for %s)", kind.getFileToken(), state, tried));
    }

    @Override
    public String describe() {
        return "local:" + baseDir.toAbsolutePath();
    }

    private Path resolveStateDir(String state) {
        Path stateDir = baseDir.resolve(state).normalize();
        // Reject names such as "../x" that would escape the layer directory
        if (!stateDir.startsWith(baseDir.normalize()) || !Files.isDirectory(stateDir)) {
            throw new LayerNotFoundException("No layer folder found for state: " + state);
        }
        return stateDir;
    }
}
