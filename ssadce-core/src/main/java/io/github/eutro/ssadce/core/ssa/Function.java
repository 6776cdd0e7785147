package io.github.eutro.ssadce.core.ssa;

import io.github.eutro.ssadce.core.ext.*;
import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * A function: a named control flow graph of {@link BasicBlock}s with a designated entry,
 * or a bodiless declaration.
 */
public final class Function extends ExtHolder {
    private static final Ext<?>[] SLOTS = {CommonExts.METADATA_STATE, CommonExts.OWNING_MODULE};

    public final String name;
    private final boolean declaration;

    /**
     * The blocks of this function, in creation order unless edited.
     * Adding or removing a block keeps its {@link CommonExts#OWNING_FUNCTION owner} up to date.
     */
    public final List<BasicBlock> blocks = new OwnedList<>(this, CommonExts.OWNING_FUNCTION);

    private final Map<String, Integer> varNames = new HashMap<>();
    private int nextBlockIndex = 0;
    @Nullable
    private BasicBlock entry;

    public Function(String name, boolean declaration) {
        super(SLOTS);
        attachExt(CommonExts.METADATA_STATE, new MetadataState());
        this.name = name;
        this.declaration = declaration;
    }

    public Function(String name) {
        this(name, false);
    }

    public boolean isDeclaration() {
        return declaration;
    }

    /**
     * Get the entry block of this function.
     * <p>
     * This is the first block created, unless {@link #setEntry(BasicBlock) set} explicitly.
     *
     * @return The entry, or null if there is none.
     */
    @Nullable
    public BasicBlock getEntry() {
        return entry;
    }

    public void setEntry(@Nullable BasicBlock entry) {
        this.entry = entry;
    }

    /**
     * Create a new value, with a name that is unique within this function.
     *
     * @param name The base name of the value.
     * @param type The type of the value.
     * @return The new value.
     */
    public Var newVar(String name, ValType type) {
        Integer seen = varNames.get(name);
        int index = seen == null ? 0 : seen;
        varNames.put(name, index + 1);
        return new Var(name, index, type);
    }

    public Var newVar(String name) {
        return newVar(name, ValType.I64);
    }

    /**
     * Create an immediate operand.
     *
     * @param k    The value of the constant.
     * @param type Its type.
     * @return The immediate.
     */
    public Var constant(Object k, ValType type) {
        Var var = new Var("k", 0, type);
        var.attachExt(CommonExts.CONSTANT_VALUE, Objects.requireNonNull(k, "constant"));
        return var;
    }

    public BasicBlock newBb(String label) {
        BasicBlock bb = new BasicBlock(nextBlockIndex++, label);
        blocks.add(bb);
        if (entry == null) entry = bb;
        return bb;
    }

    public BasicBlock newBb() {
        return newBb("bb" + nextBlockIndex);
    }

    /**
     * Get the number of block indices handed out so far, an upper bound on the index of any block.
     *
     * @return The bound.
     */
    public int blockIndexBound() {
        return nextBlockIndex;
    }

    @Override
    public String toString() {
        if (declaration) return "declare " + name + "()";
        StringBuilder sb = new StringBuilder();
        sb.append("fn ").append(name).append("() {\n");
        for (BasicBlock block : blocks) {
            sb.append(block).append('\n');
        }
        sb.append("}");
        return sb.toString();
    }
}
