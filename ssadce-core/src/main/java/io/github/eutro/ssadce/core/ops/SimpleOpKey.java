package io.github.eutro.ssadce.core.ops;

/**
 * A key for operations without immediates. Every instruction of such an operation shares the one {@link Op}.
 */
public final class SimpleOpKey extends OpKey {
    private final Op op;

    public SimpleOpKey(String mnemonic, InsnKind kind) {
        super(mnemonic, kind);
        op = new Op(this);
    }

    public Op create() {
        return op;
    }
}
