package io.github.eutro.ssadce.core.util;

import io.github.eutro.ssadce.core.ssa.BasicBlock;
import io.github.eutro.ssadce.core.ssa.Function;

import java.util.*;

/**
 * Depth-first traversals of a graph, from a single root.
 * <p>
 * Successors are explored in the order the successor function yields them, and each
 * node is visited once, however many edges lead to it. Nodes are compared by identity.
 *
 * @param <T> The type of a node in the graph.
 */
public class GraphWalker<T> {
    /**
     * The successor function of a graph.
     *
     * @param <T> The type of a node.
     */
    @FunctionalInterface
    public interface Successors<T> {
        Iterable<? extends T> of(T node);
    }

    private final T root;
    private final Successors<T> successors;

    public GraphWalker(T root, Successors<T> successors) {
        this.root = root;
        this.successors = successors;
    }

    /**
     * Walk the control flow graph from a block, following jump targets.
     *
     * @param root The root block.
     * @return The graph walker.
     */
    public static GraphWalker<BasicBlock> blockWalker(BasicBlock root) {
        return new GraphWalker<>(root, BasicBlock::getSuccessors);
    }

    /**
     * Walk the control flow graph of a function, from its entry.
     *
     * @param func The function.
     * @return The graph walker.
     * @throws IllegalStateException If the function has no entry.
     */
    public static GraphWalker<BasicBlock> blockWalker(Function func) {
        BasicBlock entry = func.getEntry();
        if (entry == null) throw new IllegalStateException("Function " + func.name + " has no entry block");
        return blockWalker(entry);
    }

    /**
     * An order over the nodes reachable from the root.
     *
     * @param <T> The type of each node.
     */
    public interface Order<T> extends Iterable<T> {
        default List<T> toList() {
            List<T> ls = new ArrayList<>();
            for (T t : this) {
                ls.add(t);
            }
            return ls;
        }
    }

    /**
     * Get the order in which nodes are first reached.
     *
     * @return The pre-order.
     */
    public Order<T> preOrder() {
        return () -> new Walk(true);
    }

    /**
     * Get the order in which nodes are finished, every node after all the nodes it reaches
     * that were not already on the path to it.
     *
     * @return The post-order.
     */
    public Order<T> postOrder() {
        return () -> new Walk(false);
    }

    /**
     * Get the reverse of the {@link #postOrder() post-order}, in which every node
     * comes before its successors, back edges aside.
     *
     * @return The reverse post-order.
     */
    public Order<T> reversePostOrder() {
        return () -> {
            List<T> post = postOrder().toList();
            Collections.reverse(post);
            return post.iterator();
        };
    }

    private final class Frame {
        final T node;
        final Iterator<? extends T> pending;

        Frame(T node) {
            this.node = node;
            this.pending = successors.of(node).iterator();
        }
    }

    private final class Walk implements Iterator<T> {
        private final boolean pre;
        private final Deque<Frame> path = new ArrayDeque<>();
        private final Set<T> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        private T next;

        Walk(boolean pre) {
            this.pre = pre;
            seen.add(root);
            path.push(new Frame(root));
            next = pre ? root : advance();
        }

        /**
         * Step the walk until the next node in this order, or null once it is exhausted.
         */
        private T advance() {
            while (!path.isEmpty()) {
                Frame top = path.peek();
                if (top.pending.hasNext()) {
                    T succ = top.pending.next();
                    if (seen.add(succ)) {
                        path.push(new Frame(succ));
                        if (pre) return succ;
                    }
                } else {
                    path.pop();
                    if (!pre) return top.node;
                }
            }
            return null;
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public T next() {
            if (next == null) throw new NoSuchElementException();
            T ret = next;
            next = advance();
            return ret;
        }
    }
}
