package io.github.eutro.ssadce.core.ops;

import io.github.eutro.ssadce.core.ssa.Insn;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * An {@link OpKey} whose ops carry one immediate of type {@code T}, such as the
 * operator of a binary op, the callee of a call or the predecessors of a phi.
 *
 * @param <T> The type of the immediate.
 */
public class UnaryOpKey<T> extends OpKey {
    private final Function<T, String> printer;
    private final UnaryOperator<T> owner;

    /**
     * @param mnemonic The mnemonic.
     * @param kind     The kind of instruction.
     * @param printer  Prints the immediate.
     * @param owner    Applied to every immediate in {@link #create(Object)}, so an op can own
     *                 a private, mutable copy of it.
     */
    public UnaryOpKey(String mnemonic, InsnKind kind, Function<T, String> printer, UnaryOperator<T> owner) {
        super(mnemonic, kind);
        this.printer = printer;
        this.owner = owner;
    }

    public UnaryOpKey(String mnemonic, InsnKind kind, Function<T, String> printer) {
        this(mnemonic, kind, printer, UnaryOperator.identity());
    }

    public UnaryOpKey(String mnemonic, InsnKind kind) {
        this(mnemonic, kind, Objects::toString);
    }

    /**
     * An op of this key, together with its immediate.
     */
    public class UnaryOp extends Op {
        public final T arg;

        private UnaryOp(T arg) {
            super(UnaryOpKey.this);
            this.arg = arg;
        }

        @Override
        public String toString() {
            return key + " " + printer.apply(arg);
        }
    }

    public UnaryOp create(T arg) {
        return new UnaryOp(owner.apply(Objects.requireNonNull(arg, () -> "immediate of " + mnemonic)));
    }

    /**
     * Check whether an instruction's op has this key.
     *
     * @param insn The instruction.
     * @return Whether it does.
     */
    public boolean matches(Insn insn) {
        return insn.op.key == this;
    }

    /**
     * Cast an op of this key to its concrete type.
     *
     * @param op The op.
     * @return The same op.
     * @throws ClassCastException If the op has a different key.
     */
    @SuppressWarnings("unchecked")
    public UnaryOp cast(Op op) {
        if (op.key != this) {
            throw new ClassCastException(op + " is not a " + mnemonic + " op");
        }
        return (UnaryOp) op;
    }

    public T immediate(Insn insn) {
        return cast(insn.op).arg;
    }
}
