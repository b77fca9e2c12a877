package com.github.sheeppig;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class LookupPathResolverTest {

    @Test
    public void testRelativePath() {
        var resolver = new LookupPathResolver(List.of("."));
        assertEquals(Path.of("io.sp"), resolver.relativePath(Identifier.of("io")));
        assertEquals(Path.of("a", "b", "c.sp"), resolver.relativePath(Identifier.of("a", "b", "c")));
    }

    @Test
    public void testFirstMatchingEntryWins(@TempDir Path tempDir) throws IOException {
        var first = Files.createDirectories(tempDir.resolve("first/math"));
        var second = Files.createDirectories(tempDir.resolve("second/math"));
        Files.writeString(second.resolve("trig.sp"), "");
        var resolver = new LookupPathResolver(List.of(tempDir.resolve("first").toString(), tempDir.resolve("second").toString()));

        assertEquals(Optional.of(second.resolve("trig.sp")), resolver.resolve(Identifier.of("math", "trig")));

        Files.writeString(first.resolve("trig.sp"), "");
        assertEquals(Optional.of(first.resolve("trig.sp")), resolver.resolve(Identifier.of("math", "trig")));
        assertEquals(Optional.empty(), resolver.resolve(Identifier.of("math", "geometry")));
    }

}
