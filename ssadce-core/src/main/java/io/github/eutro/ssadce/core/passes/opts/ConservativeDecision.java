package io.github.eutro.ssadce.core.passes.opts;

import java.util.Objects;

/**
 * A record of an instruction that was kept even though it looked removable.
 */
public final class ConservativeDecision {
    /**
     * The instruction, as printed.
     */
    public final String instruction;
    public final String blockLabel;
    public final ConservativeReason reason;

    public ConservativeDecision(String instruction, String blockLabel, ConservativeReason reason) {
        this.instruction = instruction;
        this.blockLabel = blockLabel;
        this.reason = reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConservativeDecision that = (ConservativeDecision) o;
        return instruction.equals(that.instruction)
                && blockLabel.equals(that.blockLabel)
                && reason == that.reason;
    }

    @Override
    public int hashCode() {
        return Objects.hash(instruction, blockLabel, reason);
    }

    @Override
    public String toString() {
        return "kept '" + instruction + "' in block '" + blockLabel + "' (reason: " + reason.getExplanation() + ")";
    }
}
