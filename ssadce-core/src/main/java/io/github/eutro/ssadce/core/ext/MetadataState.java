package io.github.eutro.ssadce.core.ext;

import io.github.eutro.ssadce.core.passes.IRPass;
import io.github.eutro.ssadce.core.passes.meta.ComputePreds;
import io.github.eutro.ssadce.core.ssa.Function;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Tracks which kinds of metadata attached to a function are still valid.
 * <p>
 * Passes that edit the graph call {@link #graphChanged()}, and passes that
 * read metadata call {@link #ensureValid(Object, ComputableMetaKind[])}, which
 * recomputes whatever has been invalidated since.
 */
public class MetadataState {
    private static final List<MetaKind> KINDS = Collections.synchronizedList(new ArrayList<>());

    /**
     * A kind of metadata whose validity can be tracked. Kinds are compared by identity.
     */
    public static class MetaKind {
        private final int index;
        private final String name;

        MetaKind(String name) {
            this.name = name;
            synchronized (KINDS) {
                index = KINDS.size();
                KINDS.add(this);
            }
        }

        public String getName() {
            return name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A kind of metadata that can be recomputed by running in-place passes, in order.
     *
     * @param <T> The type of object the metadata is computed for.
     */
    public static class ComputableMetaKind<T> extends MetaKind {
        private final List<IRPass<T, T>> computers;

        @SafeVarargs
        ComputableMetaKind(String name, IRPass<T, T>... computers) {
            super(name);
            for (IRPass<T, T> computer : computers) {
                if (!computer.isInPlace()) {
                    throw new IllegalArgumentException(name + " can only be computed by in-place passes");
                }
            }
            this.computers = Arrays.asList(computers);
        }

        void computeFor(T t) {
            computers.forEach(computer -> computer.run(t));
        }
    }

    /**
     * {@link CommonExts#PREDS} on every block.
     */
    public static final ComputableMetaKind<Function>
            PREDS = new ComputableMetaKind<>("PREDS", ComputePreds.INSTANCE);

    private boolean[] valid = new boolean[0];

    public boolean isValid(MetaKind kind) {
        return kind.index < valid.length && valid[kind.index];
    }

    @SafeVarargs
    public final <T> void ensureValid(T t, ComputableMetaKind<T>... kinds) {
        for (ComputableMetaKind<T> kind : kinds) {
            if (isValid(kind)) continue;
            kind.computeFor(t);
            validate(kind);
        }
    }

    public void validate(MetaKind... kinds) {
        mark(true, kinds);
    }

    public void invalidate(MetaKind... kinds) {
        mark(false, kinds);
    }

    private void mark(boolean to, MetaKind[] kinds) {
        for (MetaKind kind : kinds) {
            if (kind.index >= valid.length) {
                if (!to) continue;
                valid = Arrays.copyOf(valid, KINDS.size());
            }
            valid[kind.index] = to;
        }
    }

    /**
     * Invalidate everything derived from the shape of the control flow graph.
     */
    public void graphChanged() {
        invalidate(PREDS);
    }
}
