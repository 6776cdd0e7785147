package io.github.eutro.ssadce.core.passes;

/**
 * A step in processing IR, taking an {@code A} to a {@code B}.
 * <p>
 * Analyses usually take a function and return a result object, while
 * {@link InPlaceIRPass in-place passes} edit the function they are given.
 *
 * @param <A> What the pass consumes.
 * @param <B> What the pass produces.
 */
public interface IRPass<A, B> {
    B run(A a);

    /**
     * In-place passes mutate and return their argument, so they can be rerun by
     * {@link io.github.eutro.ssadce.core.ext.MetadataState} to refresh metadata.
     *
     * @return Whether this pass works in place.
     */
    default boolean isInPlace() {
        return false;
    }

    /**
     * @param next The pass that receives this pass' output.
     * @param <C>  The output of {@code next}.
     * @return A pass running this, then {@code next}.
     * @see ChainedPass
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
