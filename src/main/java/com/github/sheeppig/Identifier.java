package com.github.sheeppig;

import java.util.List;

public sealed interface Identifier {

    List<String> segments();

    default String asString() {
        return String.join(".", segments());
    }

    static Identifier of(String... names) {
        if (names.length == 1) {
            return new Simple(names[0]);
        }
        return new Compound(List.of(names));
    }

    record Simple(String name) implements Identifier {
        @Override
        public List<String> segments() {
            return List.of(name);
        }
    }

    /**
     * A dotted name such as {@code math.trig}, fused from its parts by the preprocessor.
     */
    record Compound(List<String> names) implements Identifier {
        public Compound {
            if (names.size() < 2) {
                throw new IllegalArgumentException("compound identifier needs at least two segments: " + names);
            }
            names = List.copyOf(names);
        }

        @Override
        public List<String> segments() {
            return names;
        }
    }

}
