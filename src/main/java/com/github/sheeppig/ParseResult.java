package com.github.sheeppig;

import com.github.sheeppig.parser.Module;

/**
 * Outcome of {@link FrontEnd#tryParse}: either the module or the first error.
 */
public sealed interface ParseResult {

    boolean isSuccess();

    /**
     * The module, or the failure's exception rethrown.
     */
    Module orElseThrow();

    record Success(Module module) implements ParseResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Module orElseThrow() {
            return module;
        }
    }

    record Failure(ParseException error) implements ParseResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Module orElseThrow() {
            throw error;
        }
    }

}
