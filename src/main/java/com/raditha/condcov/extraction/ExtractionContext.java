package com.raditha.condcov.extraction;

import com.raditha.condcov.model.Scope;

/**
 * Immutable traversal argument: the scope that is open at the current node,
 * and the sink that receives findings. Entering a declaration derives a new
 * context, so leaving it needs no restore step.
 *
 * @param anonymousBody true inside the body of an anonymous class or an enum
 *                      constant, whose members belong to no method table
 */
record ExtractionContext(Scope scope, ExtractionSink sink, boolean anonymousBody) {

    static ExtractionContext root(ExtractionSink sink) {
        return new ExtractionContext(Scope.MODULE, sink, false);
    }

    ExtractionContext enterClass(String className) {
        return new ExtractionContext(new Scope.ClassScope(className), sink, false);
    }

    ExtractionContext enterMethod(String signature) {
        return new ExtractionContext(new Scope.MethodScope(scope.className(), signature), sink, false);
    }

    /**
     * Same scope, but methods declared from here on are not recorded.
     */
    ExtractionContext enterAnonymousBody() {
        return new ExtractionContext(scope, sink, true);
    }

    /**
     * Dotted name a type declared here would get.
     */
    String qualify(String simpleName) {
        String outer = scope.className();
        return outer == null ? simpleName : outer + "." + simpleName;
    }

    /**
     * Methods are attributed to a class only when declared directly in its body,
     * not inside a method, an anonymous class or an enum constant body.
     */
    boolean isDirectlyInClass() {
        return !anonymousBody && scope instanceof Scope.ClassScope;
    }
}
