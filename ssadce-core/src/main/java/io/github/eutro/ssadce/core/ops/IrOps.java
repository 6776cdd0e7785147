package io.github.eutro.ssadce.core.ops;

import io.github.eutro.ssadce.core.ssa.BasicBlock;
import io.github.eutro.ssadce.core.ssa.Control;
import io.github.eutro.ssadce.core.ssa.Insn;
import io.github.eutro.ssadce.core.ssa.ValType;
import io.github.eutro.ssadce.core.ssa.Var;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The ops of the IR beyond the {@link CommonOps common ones}.
 */
public class IrOps {
    /**
     * Effect: allocates a stack slot of the given type, returning its address.
     */
    public static final UnaryOpKey<ValType> ALLOCA = new UnaryOpKey<>("alloca", InsnKind.ALLOCA);
    /**
     * Effect: {@code load ptr}
     */
    public static final Op LOAD = new SimpleOpKey("load", InsnKind.LOAD).create();
    /**
     * Effect: {@code store value ptr}, returns nothing.
     */
    public static final Op STORE = new SimpleOpKey("store", InsnKind.STORE).create();
    public static final UnaryOpKey<BinOp> BINARY = new UnaryOpKey<>("binop", InsnKind.BINARY);
    public static final UnaryOpKey<UnOp> UNARY = new UnaryOpKey<>("unop", InsnKind.UNARY);
    public static final UnaryOpKey<CastKind> CAST = new UnaryOpKey<>("cast", InsnKind.CAST);
    /**
     * Effect: {@code gep base index}, address arithmetic.
     */
    public static final Op GEP = new SimpleOpKey("gep", InsnKind.GEP).create();
    public static final UnaryOpKey<Callee> CALL = new UnaryOpKey<>("call", InsnKind.CALL);
    public static final UnaryOpKey<VectorOp> VECTOR = new UnaryOpKey<>("vec", InsnKind.VECTOR);

    // break convention is that the last target is the fallback, while the first targets are taken conditionally
    /**
     * Control: {@code cond_br cond -> then else}
     */
    public static final Op COND_BR = new SimpleOpKey("cond_br", InsnKind.COND_BR).create();
    /**
     * Control: {@code switch value -> cases... default}, the immediate holds the case keys.
     */
    public static final UnaryOpKey<List<Long>> SWITCH = new UnaryOpKey<>("switch", InsnKind.SWITCH);
    /**
     * Control: jumps to the address, which must be one of the targets.
     */
    public static final Op INDIRECT_BR = new SimpleOpKey("indirect_br", InsnKind.INDIRECT_BR).create();
    public static final Op UNREACHABLE = new SimpleOpKey("unreachable", InsnKind.UNREACHABLE).create();

    public enum BinOp {
        ADD, SUB, MUL, DIV, REM,
        AND, OR, XOR, SHL, SHR,
        EQ, NE, LT, LE, GT, GE,
        ;

        @Override
        public String toString() {
            return name().toLowerCase();
        }
    }

    public enum UnOp {
        NEG, NOT,
        ;

        @Override
        public String toString() {
            return name().toLowerCase();
        }
    }

    public enum CastKind {
        TRUNC, ZEXT, SEXT, BITCAST, PTR_TO_INT, INT_TO_PTR, INT_TO_FLOAT, FLOAT_TO_INT,
        ;

        @Override
        public String toString() {
            return name().toLowerCase();
        }
    }

    public enum VectorOp {
        SPLAT, EXTRACT, INSERT, SHUFFLE,
        ;

        @Override
        public String toString() {
            return name().toLowerCase();
        }
    }

    public static Insn binary(BinOp op, Var lhs, Var rhs) {
        return BINARY.create(op).insn(lhs, rhs);
    }

    public static Insn unary(UnOp op, Var arg) {
        return UNARY.create(op).insn(arg);
    }

    public static Insn cast(CastKind kind, Var arg) {
        return CAST.create(kind).insn(arg);
    }

    public static Insn alloca(ValType type) {
        return ALLOCA.create(type).insn();
    }

    public static Insn load(Var ptr) {
        return LOAD.insn(ptr);
    }

    public static Insn store(Var value, Var ptr) {
        return STORE.insn(value, ptr);
    }

    public static Insn gep(Var base, Var index) {
        return GEP.insn(base, index);
    }

    public static Insn call(Callee callee, Var... args) {
        return CALL.create(callee).insn(args);
    }

    public static Insn vector(VectorOp op, Var... args) {
        return VECTOR.create(op).insn(args);
    }

    public static Control condBr(Var cond, BasicBlock thenB, BasicBlock elseB) {
        return COND_BR.insn(cond).jumpsTo(thenB, elseB);
    }

    /**
     * Construct a switch.
     *
     * @param value   The value switched on.
     * @param keys    The case keys, aligned with {@code cases}.
     * @param cases   The case targets.
     * @param dflt    The default target.
     * @return The switch.
     */
    public static Control switchOn(Var value, List<Long> keys, List<BasicBlock> cases, BasicBlock dflt) {
        if (keys.size() != cases.size()) {
            throw new IllegalArgumentException("Got " + keys.size() + " keys for " + cases.size() + " cases");
        }
        List<BasicBlock> targets = new ArrayList<>(cases);
        targets.add(dflt);
        return SWITCH.create(new ArrayList<>(keys)).insn(value).jumpsTo(targets);
    }

    public static Control indirectBr(Var address, BasicBlock... possible) {
        return INDIRECT_BR.insn(address).jumpsTo(Arrays.asList(possible));
    }

    public static Control unreachable() {
        return UNREACHABLE.insn().jumpsTo();
    }
}
