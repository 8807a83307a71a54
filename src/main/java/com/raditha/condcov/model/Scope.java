package com.raditha.condcov.model;

/**
 * The innermost structural container that was open when a condition was found.
 */
public sealed interface Scope permits Scope.ModuleScope, Scope.ClassScope, Scope.MethodScope {

    /**
     * Top level of the compilation unit, outside any type declaration.
     */
    ModuleScope MODULE = new ModuleScope();

    /**
     * Name of the enclosing class, or null at module level.
     */
    String className();

    record ModuleScope() implements Scope {
        @Override
        public String className() {
            return null;
        }
    }

    /**
     * @param className dotted in-file name of the type, e.g. {@code Outer.Inner}
     */
    record ClassScope(String className) implements Scope {
    }

    /**
     * @param className  owning type
     * @param methodName method or constructor signature
     */
    record MethodScope(String className, String methodName) implements Scope {
    }
}
