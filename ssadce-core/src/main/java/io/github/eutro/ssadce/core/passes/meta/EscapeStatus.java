package io.github.eutro.ssadce.core.passes.meta;

/**
 * How far the address of an allocation may have travelled, from least to most conservative.
 */
public enum EscapeStatus {
    /**
     * Only ever used directly as the address of loads and stores.
     */
    LOCAL,
    /**
     * Used in address arithmetic, so other pointers may alias it.
     */
    ADDRESS_TAKEN,
    /**
     * Observable outside the function, or otherwise untracked.
     */
    ESCAPED,
    ;

    /**
     * Combine two statuses, keeping the more conservative one.
     *
     * @param other The other status.
     * @return The more conservative of the two.
     */
    public EscapeStatus join(EscapeStatus other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
