package io.github.eutro.ssadce.core.ssa;

/**
 * The type of a {@link Var value}.
 */
public enum ValType {
    I1,
    I8,
    I32,
    I64,
    F32,
    F64,
    PTR,
    VECTOR,
}
