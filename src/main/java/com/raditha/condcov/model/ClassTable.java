package com.raditha.condcov.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * All type declarations found in one source unit, keyed by dotted in-file name.
 */
public record ClassTable(Map<String, ClassInfo> classes) {

    public static final ClassTable EMPTY = new ClassTable(Map.of());

    public ClassTable {
        classes = Collections.unmodifiableMap(new LinkedHashMap<>(classes));
    }

    public Optional<ClassInfo> get(String name) {
        return Optional.ofNullable(classes.get(name));
    }

    public Collection<ClassInfo> all() {
        return classes.values();
    }

    public int size() {
        return classes.size();
    }
}
