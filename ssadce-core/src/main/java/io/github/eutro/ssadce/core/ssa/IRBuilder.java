package io.github.eutro.ssadce.core.ssa;

import io.github.eutro.ssadce.core.ext.CommonExts;
import io.github.eutro.ssadce.core.ext.ExtContainer;
import io.github.eutro.ssadce.core.ops.IrOps;
import org.jetbrains.annotations.Nullable;

/**
 * Appends instructions to the end of a block of a function.
 * <p>
 * The builder can be moved between blocks with {@link #setBlock(BasicBlock)}, and
 * tags everything it appends with the {@link #setSpan(SourceSpan) current source span}, if any.
 */
public class IRBuilder {
    public final Function func;
    private BasicBlock bb;
    @Nullable
    private SourceSpan span;

    public IRBuilder(Function func, BasicBlock bb) {
        this.func = func;
        this.bb = bb;
    }

    public BasicBlock getBlock() {
        return bb;
    }

    public void setBlock(BasicBlock bb) {
        this.bb = bb;
    }

    /**
     * @param span The span to attach to everything appended from now on, or null for none.
     */
    public void setSpan(@Nullable SourceSpan span) {
        this.span = span;
    }

    private <T extends ExtContainer> T spanned(T t) {
        if (span != null) t.attachExt(CommonExts.SOURCE_SPAN, span);
        return t;
    }

    public void insert(Effect effect) {
        bb.addEffect(spanned(effect));
    }

    /**
     * Append an instruction that defines nothing, such as a store or a call whose result is unused.
     *
     * @param insn The instruction.
     */
    public void insert(Insn insn) {
        insert(insn.assignTo());
    }

    public Var insert(Insn insn, Var result) {
        insert(insn.assignTo(result));
        return result;
    }

    /**
     * Append an instruction defining a fresh value.
     *
     * @param insn The instruction.
     * @param name A name hint for the value, made unique within the function.
     * @return The value.
     */
    public Var insert(Insn insn, String name) {
        return insert(insn, func.newVar(name));
    }

    public Var insert(Insn insn, String name, ValType type) {
        return insert(insn, func.newVar(name, type));
    }

    /**
     * Append a stack allocation.
     *
     * @param name A name hint for the address.
     * @param type The type of the allocated slot.
     * @return The address, which has type {@link ValType#PTR}.
     */
    public Var alloca(String name, ValType type) {
        return insert(IrOps.alloca(type), name, ValType.PTR);
    }

    public Var constant(long k) {
        return func.constant(k, ValType.I64);
    }

    /**
     * Set the terminator of the current block, replacing any previous one.
     *
     * @param ctrl The terminator.
     */
    public void insertCtrl(Control ctrl) {
        bb.setControl(spanned(ctrl));
    }
}
