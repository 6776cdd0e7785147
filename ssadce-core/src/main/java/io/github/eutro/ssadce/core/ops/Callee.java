package io.github.eutro.ssadce.core.ops;

import io.github.eutro.ssadce.core.ext.CommonExts;
import io.github.eutro.ssadce.core.ssa.Function;

/**
 * The target of a {@link IrOps#CALL call}.
 */
public final class Callee {
    public final String name;
    public final boolean knownPure;
    public final boolean external;

    public Callee(String name, boolean knownPure, boolean external) {
        this.name = name;
        this.knownPure = knownPure;
        this.external = external;
    }

    /**
     * Create a callee referring to a function, which is known pure if the function is
     * {@link CommonExts#markPure(io.github.eutro.ssadce.core.ext.ExtContainer) marked pure},
     * and external if it is a declaration.
     *
     * @param func The function.
     * @return The callee.
     */
    public static Callee of(Function func) {
        return new Callee(func.name, CommonExts.isPure(func), func.isDeclaration());
    }

    public static Callee external(String name) {
        return new Callee(name, false, true);
    }

    public static Callee unknown(String name) {
        return new Callee(name, false, false);
    }

    public static Callee pure(String name) {
        return new Callee(name, true, false);
    }

    @Override
    public String toString() {
        return (external ? "extern " : "") + (knownPure ? "pure " : "") + name;
    }
}
