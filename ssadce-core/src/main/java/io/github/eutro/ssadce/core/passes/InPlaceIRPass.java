package io.github.eutro.ssadce.core.passes;

/**
 * A pass that edits its input where it stands, and hands the same object on.
 * <p>
 * Analyses never are; transformations of a function or module usually are.
 *
 * @param <T> The type of the IR this pass edits.
 */
@FunctionalInterface
public interface InPlaceIRPass<T> extends IRPass<T, T> {
    /**
     * Edit the input.
     *
     * @param t The IR to edit.
     */
    void runInPlace(T t);

    @Override
    default T run(T t) {
        runInPlace(t);
        return t;
    }

    @Override
    default boolean isInPlace() {
        return true;
    }

    /**
     * Get a pass that leaves its input alone, the start of a chain built up one pass at a time.
     *
     * @param <T> The type of the IR.
     * @return The pass.
     */
    static <T> InPlaceIRPass<T> identity() {
        return t -> {
        };
    }
}
