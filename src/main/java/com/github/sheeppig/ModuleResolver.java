package com.github.sheeppig;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Maps a module name, as written after {@code from} in a {@code using} block, to its source file.
 */
public interface ModuleResolver {

    Optional<Path> resolve(Identifier module);

}
