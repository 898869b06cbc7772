package io.github.eutro.tacgraph.core.util;

import java.util.*;
import java.util.function.Function;

/**
 * Depth-first traversal of the nodes reachable from a root, each visited once.
 * <p>
 * The traversal keeps an explicit stack, so graphs of any depth can be walked.
 *
 * @param <T> The node type.
 */
public class GraphWalker<T> {
    private final T root;
    private final Function<? super T, ? extends Iterable<? extends T>> successors;

    /**
     * @param root       The node to start from.
     * @param successors The successors of each node. Successors listed later are visited first.
     */
    public GraphWalker(T root, Function<? super T, ? extends Iterable<? extends T>> successors) {
        this.root = root;
        this.successors = successors;
    }

    /**
     * A traversal order, which can be iterated any number of times.
     *
     * @param <T> The node type.
     */
    public interface Order<T> extends Iterable<T> {
        default List<T> toList() {
            List<T> out = new ArrayList<>();
            forEach(out::add);
            return out;
        }
    }

    /**
     * Each node before any of the nodes first discovered from it.
     *
     * @return The order.
     */
    public Order<T> preOrder() {
        return () -> new Iterator<T>() {
            private final Deque<T> pending = new ArrayDeque<>(Collections.singleton(root));
            private final Set<T> discovered = new HashSet<>(Collections.singleton(root));

            @Override
            public boolean hasNext() {
                return !pending.isEmpty();
            }

            @Override
            public T next() {
                T node = pending.pollLast();
                if (node == null) throw new NoSuchElementException();
                for (T succ : successors.apply(node)) {
                    if (discovered.add(succ)) pending.addLast(succ);
                }
                return node;
            }
        };
    }

    /**
     * Each node after every node first discovered from it, the root last.
     *
     * @return The order.
     */
    public Order<T> postOrder() {
        return () -> {
            // frames of (node, its successors not yet looked at)
            Deque<Pair<T, Iterator<? extends T>>> frames = new ArrayDeque<>();
            Set<T> discovered = new HashSet<>();
            List<T> finished = new ArrayList<>();
            discovered.add(root);
            frames.push(Pair.of(root, successors.apply(root).iterator()));
            while (!frames.isEmpty()) {
                Pair<T, Iterator<? extends T>> top = frames.peek();
                if (top.right.hasNext()) {
                    T succ = top.right.next();
                    if (discovered.add(succ)) {
                        frames.push(Pair.of(succ, successors.apply(succ).iterator()));
                    }
                } else {
                    frames.pop();
                    finished.add(top.left);
                }
            }
            return finished.iterator();
        };
    }
}
