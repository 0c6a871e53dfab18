package me.christianrobert.cpp2py.batch.service;

import jakarta.enterprise.context.ApplicationScoped;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Decides where the Python file for a source goes.
 *
 * <p>{@code src/util/math.cpp} under input root {@code src} and output directory
 * {@code out} becomes {@code out/util/math.py}. Headers get an {@code _h} suffix
 * ({@code math.h} → {@code math_h.py}) so that a header and its implementation file do not
 * collide. Without an output directory the file lands next to its source.</p>
 */
@ApplicationScoped
public class OutputPathResolver {

    private static final Set<String> HEADER_EXTENSIONS = Set.of("h", "hpp", "hh", "hxx");

    public Path resolve(Path source, Path inputRoot, Path outputDirectory) {
        String fileName = source.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = dot > 0 ? fileName.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
        String pythonName = HEADER_EXTENSIONS.contains(extension) ? stem + "_h.py" : stem + ".py";

        if (outputDirectory == null) {
            return source.resolveSibling(pythonName);
        }
        Path root = Files.isDirectory(inputRoot) ? inputRoot : inputRoot.toAbsolutePath().getParent();
        Path relative = root.toAbsolutePath().normalize().relativize(source.toAbsolutePath().normalize());
        Path parent = relative.getParent();
        Path directory = parent == null ? outputDirectory : outputDirectory.resolve(parent);
        return directory.resolve(pythonName);
    }
}
