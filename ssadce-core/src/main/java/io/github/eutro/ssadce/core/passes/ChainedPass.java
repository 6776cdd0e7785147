package io.github.eutro.ssadce.core.passes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Two passes run back to back, the second receiving the output of the first.
 * <p>
 * Chains of chains are flattened when built, so running a long chain is a simple loop,
 * and a failure can name the stage it happened in.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final List<IRPass<?, ?>> stages;
    private final boolean isInPlace;

    public ChainedPass(IRPass<A, B> firstPass, IRPass<B, C> nextPass) {
        List<IRPass<?, ?>> stages = new ArrayList<>();
        addStages(stages, firstPass);
        addStages(stages, nextPass);
        this.stages = Collections.unmodifiableList(stages);
        isInPlace = firstPass.isInPlace() && nextPass.isInPlace();
    }

    private static void addStages(List<IRPass<?, ?>> stages, IRPass<?, ?> pass) {
        if (pass instanceof ChainedPass) {
            stages.addAll(((ChainedPass<?, ?, ?>) pass).stages);
        } else {
            stages.add(pass);
        }
    }

    /**
     * Get the passes this chain runs, first to last, with nested chains flattened.
     *
     * @return The passes.
     */
    public List<IRPass<?, ?>> listPasses() {
        return stages;
    }

    @Override
    public boolean isInPlace() {
        return isInPlace;
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        Object acc = a;
        for (int i = 0; i < stages.size(); i++) {
            IRPass<Object, Object> stage = (IRPass<Object, Object>) stages.get(i);
            try {
                acc = stage.run(acc);
            } catch (RuntimeException | Error e) {
                e.addSuppressed(new RuntimeException("in pass " + i + " (" + stage.getClass().getSimpleName() + ") of chain"));
                throw e;
            }
        }
        return (C) acc;
    }
}
