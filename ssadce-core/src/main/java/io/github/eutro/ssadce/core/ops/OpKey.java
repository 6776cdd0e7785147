package io.github.eutro.ssadce.core.ops;

/**
 * Identifies a type of operation, independent of any immediates.
 * Keys are compared by identity.
 */
public abstract class OpKey {
    public final String mnemonic;
    public final InsnKind kind;

    protected OpKey(String mnemonic, InsnKind kind) {
        this.mnemonic = mnemonic;
        this.kind = kind;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
