package io.github.eutro.ssadce.core.ssa;

import io.github.eutro.ssadce.core.ext.CommonExts;
import io.github.eutro.ssadce.core.ext.Ext;
import io.github.eutro.ssadce.core.ext.ExtHolder;

/**
 * A value in the IR.
 * <p>
 * A var is either an SSA value, which is {@link CommonExts#ASSIGNED_AT assigned at}
 * exactly one {@link Effect}, or an immediate, which has a
 * {@link CommonExts#CONSTANT_VALUE constant value} and is never assigned.
 */
public final class Var extends ExtHolder {
    private static final Ext<?>[] SLOTS = {CommonExts.ASSIGNED_AT, CommonExts.CONSTANT_VALUE};

    public final String name;
    public final int index;
    public final ValType type;

    Var(String name, int index, ValType type) {
        super(SLOTS);
        this.name = name;
        this.index = index;
        this.type = type;
    }

    /**
     * Check whether this is an immediate operand.
     *
     * @return Whether this var has a constant value.
     */
    public boolean isConstant() {
        return hasExt(CommonExts.CONSTANT_VALUE);
    }

    @Override
    public String toString() {
        Object k = getNullable(CommonExts.CONSTANT_VALUE);
        if (k != null) return String.valueOf(k);
        return '%' + name + (index == 0 ? "" : "." + index);
    }
}
