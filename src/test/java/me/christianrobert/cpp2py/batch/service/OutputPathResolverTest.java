package me.christianrobert.cpp2py.batch.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class OutputPathResolverTest {

    @TempDir
    Path tempDir;

    private OutputPathResolver resolver;
    private Path sources;

    @BeforeEach
    void setUp() throws IOException {
        resolver = new OutputPathResolver();
        sources = Files.createDirectories(tempDir.resolve("src/util"));
    }

    @Test
    void mirrorsDirectoryStructureUnderOutput() {
        Path out = tempDir.resolve("out");

        Path target = resolver.resolve(sources.resolve("math.cpp"), tempDir.resolve("src"), out);

        assertEquals(out.resolve("util/math.py"), target);
    }

    @Test
    void singleFileInputLandsDirectlyInOutput() throws IOException {
        Path source = Files.writeString(sources.resolve("math.cpp"), "");
        Path out = tempDir.resolve("out");

        assertEquals(out.resolve("math.py"), resolver.resolve(source, source, out));
    }

    @Test
    void headersGetSuffixSoTheyDoNotCollide() {
        Path out = tempDir.resolve("out");
        Path root = tempDir.resolve("src");

        assertEquals(out.resolve("util/math_h.py"), resolver.resolve(sources.resolve("math.h"), root, out));
        assertEquals(out.resolve("util/math_h.py"), resolver.resolve(sources.resolve("math.HPP"), root, out));
        assertEquals(out.resolve("util/math.py"), resolver.resolve(sources.resolve("math.cc"), root, out));
    }

    @Test
    void withoutOutputDirectoryWritesNextToSource() {
        Path source = sources.resolve("math.cpp");

        assertEquals(sources.resolve("math.py"), resolver.resolve(source, tempDir.resolve("src"), null));
    }
}
