package com.github.sheeppig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Resolves {@code a.b.c} to {@code a/b/c.sp} below the first lookup path entry that has it.
 */
@RequiredArgsConstructor
@Accessors(fluent = true)
@Getter
public class LookupPathResolver implements ModuleResolver {

    public static final String DEFAULT_EXTENSION = ".sp";

    private final List<String> lookupPath;
    private final String extension;

    public LookupPathResolver(List<String> lookupPath) {
        this(lookupPath, DEFAULT_EXTENSION);
    }

    @Override
    public Optional<Path> resolve(Identifier module) {
        var relative = relativePath(module);
        for (String lookupPathEntry : lookupPath) {
            var path = Path.of(lookupPathEntry).resolve(relative);
            if (Files.isRegularFile(path)) {
                return Optional.of(path);
            }
        }
        return Optional.empty();
    }

    Path relativePath(Identifier module) {
        var segments = module.segments();
        var last = segments.size() - 1;
        var path = Path.of("");
        for (int i = 0; i < last; i++) {
            path = path.resolve(segments.get(i));
        }
        return path.resolve(segments.get(last) + extension);
    }

}
