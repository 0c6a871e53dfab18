package me.christianrobert.cpp2py.batch.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the C++ sources of a batch: the input file itself, or every file below the input
 * directory whose suffix is one of the configured extensions, sorted by path.
 */
@ApplicationScoped
public class SourceFileCollector {

    private static final Logger log = LoggerFactory.getLogger(SourceFileCollector.class);

    /**
     * @throws NoSuchFileException if the input does not exist
     */
    public List<Path> collect(Path input, List<String> extensions) throws IOException {
        if (!Files.exists(input)) {
            throw new NoSuchFileException(input.toString());
        }
        if (Files.isRegularFile(input)) {
            return List.of(input);
        }
        try (Stream<Path> paths = Files.walk(input)) {
            List<Path> sources = paths
                    .filter(Files::isRegularFile)
                    .filter(path -> hasExtension(path, extensions))
                    .sorted()
                    .collect(Collectors.toList());
            log.info("Found {} C++ source file(s) under {}", sources.size(), input);
            return sources;
        }
    }

    static boolean hasExtension(Path path, List<String> extensions) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(name::endsWith);
    }
}
