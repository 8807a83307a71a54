package com.raditha.condcov.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Line extent of a type declaration together with the extents of the methods
 * and constructors declared directly in it.
 *
 * @param name    dotted in-file name of the type
 * @param range   lines covered by the whole declaration
 * @param methods method signature to line range, in declaration order
 */
public record ClassInfo(String name, LineRange range, Map<String, LineRange> methods) {

    public ClassInfo {
        methods = Collections.unmodifiableMap(new LinkedHashMap<>(methods));
    }
}
