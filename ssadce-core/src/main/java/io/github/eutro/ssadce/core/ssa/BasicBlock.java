package io.github.eutro.ssadce.core.ssa;

import io.github.eutro.ssadce.core.ext.*;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * A basic block: a list of {@link Effect effects} followed by exactly one {@link Control terminator}.
 * <p>
 * Blocks are identified by an index which is unique within their function
 * and never reused, even once the block is removed.
 */
public final class BasicBlock extends ExtHolder {
    private static final Ext<?>[] SLOTS = {CommonExts.OWNING_FUNCTION, CommonExts.PREDS};

    private final int index;
    private final String label;
    private final OwnedList<BasicBlock, Effect> effects = new OwnedList<>(this, CommonExts.OWNING_BLOCK);
    private Control control;

    BasicBlock(int index, String label) {
        super(SLOTS);
        this.index = index;
        this.label = label;
    }

    public int getIndex() {
        return index;
    }

    public String getLabel() {
        return label;
    }

    public String toTargetString() {
        return "@" + label;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString()).append("\n{\n");
        for (Effect effect : getEffects()) {
            sb.append(' ').append(effect).append('\n');
        }
        sb.append(' ').append(getControl());
        sb.append("\n}");
        return sb.toString();
    }

    /**
     * Get the effects of this block. The list may be modified, and keeps
     * the {@link CommonExts#OWNING_BLOCK owner} of its elements up to date.
     *
     * @return The effects.
     */
    public List<Effect> getEffects() {
        return effects;
    }

    public void addEffect(Effect effect) {
        effects.add(effect);
    }

    @Nullable
    public Control getControl() {
        return control;
    }

    public void setControl(@Nullable Control control) {
        if (this.control != null) {
            this.control.removeExt(CommonExts.OWNING_BLOCK);
        }
        if (control != null) {
            control.attachExt(CommonExts.OWNING_BLOCK, this);
        }
        this.control = control;
    }

    /**
     * Get the jump targets of this block's terminator.
     *
     * @return The targets, possibly with duplicates, or an empty list if the block has no terminator.
     */
    public List<BasicBlock> getSuccessors() {
        return control == null ? Collections.emptyList() : control.targets;
    }
}
