package io.github.eutro.ssadce.core.passes.meta;

import io.github.eutro.ssadce.core.ssa.Var;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Map;

/**
 * The result of {@link EscapeAnalysis}: an {@link EscapeStatus} per allocation.
 * <p>
 * Anything that is not a tracked allocation is {@link EscapeStatus#ESCAPED}.
 */
public final class EscapeTable {
    private final Map<Var, EscapeStatus> statuses;
    private final Map<Var, Var> roots;

    EscapeTable(Map<Var, EscapeStatus> statuses, Map<Var, Var> roots) {
        this.statuses = statuses;
        this.roots = roots;
    }

    /**
     * Get the status of an allocation.
     *
     * @param alloc The address returned by the allocation.
     * @return Its status, or {@link EscapeStatus#ESCAPED} if it is not an allocation.
     */
    public EscapeStatus status(Var alloc) {
        return statuses.getOrDefault(alloc, EscapeStatus.ESCAPED);
    }

    /**
     * Get the allocation a pointer was derived from by address arithmetic, if any.
     *
     * @param ptr The pointer.
     * @return The allocation, which is {@code ptr} itself for an allocation, or null if unknown.
     */
    @Nullable
    public Var rootOf(Var ptr) {
        return roots.get(ptr);
    }

    /**
     * Get the status of the memory written through a pointer.
     * <p>
     * A pointer derived from an allocation by address arithmetic is at least
     * {@link EscapeStatus#ADDRESS_TAKEN}, and a pointer of unknown origin is escaped.
     *
     * @param ptr The pointer.
     * @return The status.
     */
    public EscapeStatus targetStatus(Var ptr) {
        Var root = roots.get(ptr);
        if (root == null) return EscapeStatus.ESCAPED;
        EscapeStatus status = status(root);
        return root == ptr ? status : status.join(EscapeStatus.ADDRESS_TAKEN);
    }

    public Map<Var, EscapeStatus> asMap() {
        return Collections.unmodifiableMap(statuses);
    }

    @Override
    public String toString() {
        return statuses.toString();
    }
}
