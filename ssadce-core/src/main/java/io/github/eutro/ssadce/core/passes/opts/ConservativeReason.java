package io.github.eutro.ssadce.core.passes.opts;

/**
 * Why an instruction that looked removable was kept.
 */
public enum ConservativeReason {
    MAY_ALIAS("instruction may alias with other memory locations"),
    UNKNOWN_CALL_PURITY("function call has unknown purity (may have side effects)"),
    ESCAPED_POINTER("pointer operand escapes the current function"),
    POTENTIAL_SIDE_EFFECT("instruction may have other observable side effects"),
    ;

    private final String explanation;

    ConservativeReason(String explanation) {
        this.explanation = explanation;
    }

    public String getExplanation() {
        return explanation;
    }
}
