package io.github.eutro.ssadce.core.ext;

import io.github.eutro.ssadce.core.ssa.Module;
import io.github.eutro.ssadce.core.ssa.*;

import java.util.List;

/**
 * The exts shared by the IR and the passes that operate on it.
 */
public class CommonExts {
    /**
     * Which derived metadata of a {@link Function} is currently up to date.
     */
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    /**
     * The distinct predecessors of a block, in first-seen order. Computed by
     * {@link io.github.eutro.ssadce.core.passes.meta.ComputePreds}.
     */
    public static final Ext<List<BasicBlock>> PREDS = Ext.create(List.class, "PREDS");

    /**
     * Present (and true) on a function that is known to be free of side effects,
     * and on the callees created from it.
     */
    public static final Ext<Boolean> IS_PURE = Ext.create(Boolean.class, "IS_PURE");

    /**
     * The value of an immediate operand. Immediates have no defining effect.
     */
    public static final Ext<Object> CONSTANT_VALUE = Ext.create(Object.class, "CONSTANT_VALUE");

    /**
     * The effect that defines a value.
     */
    public static final Ext<Effect> ASSIGNED_AT = Ext.create(Effect.class, "ASSIGNED_AT");

    /**
     * Where in the source an effect or control instruction came from.
     */
    public static final Ext<SourceSpan> SOURCE_SPAN = Ext.create(SourceSpan.class, "SOURCE_SPAN");

    public static final Ext<Module> OWNING_MODULE = Ext.create(Module.class, "OWNING_MODULE");
    public static final Ext<Function> OWNING_FUNCTION = Ext.create(Function.class, "OWNING_FUNCTION");
    public static final Ext<BasicBlock> OWNING_BLOCK = Ext.create(BasicBlock.class, "OWNING_BLOCK");
    public static final Ext<Control> OWNING_CONTROL = Ext.create(Control.class, "OWNING_CONTROL");
    public static final Ext<Effect> OWNING_EFFECT = Ext.create(Effect.class, "OWNING_EFFECT");

    /**
     * Mark something as {@link #IS_PURE pure}.
     *
     * @param t   The thing to mark.
     * @param <T> Its type.
     * @return {@code t}
     */
    public static <T extends ExtContainer> T markPure(T t) {
        t.attachExt(IS_PURE, true);
        return t;
    }

    /**
     * Check whether something has been {@link #markPure(ExtContainer) marked pure}.
     *
     * @param ec The container.
     * @return Whether it is marked pure.
     */
    public static boolean isPure(ExtContainer ec) {
        return ec.getExt(IS_PURE).orElse(false);
    }
}
