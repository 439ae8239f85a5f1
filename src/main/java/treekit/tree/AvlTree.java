/*
 * The MIT License
 *
 * Copyright (c) 2026 The TreeKit Authors
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package treekit.tree;

import htsjdk.utils.ValidationUtils;
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.function.BinaryOperator;

/**
 * An ordered map backed by an AVL tree: for every node the heights of the two subtrees differ by at
 * most one, so lookups, insertions and removals take O(log n) steps.  Each structural change is
 * followed by a walk from the point of change up to the root that rebalances every ancestor in turn.
 *
 * Keys are unique.  Neither keys nor values may be null.  Not thread-safe; any mutation invalidates
 * outstanding cursors and iterators.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class AvlTree<K, V> extends AbstractSearchTree<K, V, AvlNode<K, V>> {

    private AvlNode<K, V> root;

    /**
     * Creates an empty tree ordered by the natural ordering of its keys, which must implement
     * {@link Comparable}.
     */
    public AvlTree() {
        this(AbstractSearchTree.<K>naturalOrder());
    }

    /**
     * Creates an empty tree ordered by the given comparator.
     */
    public AvlTree(final Comparator<? super K> comparator) {
        super(comparator);
    }

    /**
     * Builds a tree from the given pairs in natural key order.  Pairs are inserted in sequence, so the
     * last value given for a repeated key is the one kept.
     */
    public static <K extends Comparable<? super K>, V> AvlTree<K, V> fromPairs(final Iterable<? extends Pair<? extends K, ? extends V>> pairs) {
        return fromPairs(pairs, (existing, value) -> value);
    }

    /**
     * Builds a tree from the given pairs in natural key order, resolving repeated keys with the combiner.
     * @param combiner called with the value already in the tree and the new value; returns the value to keep
     */
    public static <K extends Comparable<? super K>, V> AvlTree<K, V> fromPairs(final Iterable<? extends Pair<? extends K, ? extends V>> pairs,
                                                                              final BinaryOperator<V> combiner) {
        final AvlTree<K, V> tree = new AvlTree<>(Comparator.<K>naturalOrder());
        tree.putPairs(pairs, combiner);
        return tree;
    }

    @Override
    public AvlNode<K, V> getRoot() {
        return root;
    }

    @Override
    public V put(final K key, final V value) {
        ValidationUtils.nonNull(key, "key must not be null");
        ValidationUtils.nonNull(value, "value must not be null");

        if (root == null) {
            root = new AvlNode<>(key, value);
            return null;
        }

        AvlNode<K, V> parent = null;
        AvlNode<K, V> node = root;
        int cmpVal = 0;
        while (node != null) {
            parent = node;
            cmpVal = comparator.compare(key, node.getKey());
            if (cmpVal == 0) {
                return node.setValue(value);
            }
            node = cmpVal < 0 ? node.getLeft() : node.getRight();
        }

        final AvlNode<K, V> leaf = new AvlNode<>(key, value, parent);
        if (cmpVal < 0) {
            parent.setLeft(leaf);
        } else {
            parent.setRight(leaf);
        }
        rebalanceFrom(parent);
        return null;
    }

    @Override
    public V remove(final K key) {
        final AvlNode<K, V> node = findNode(key);
        if (node == null) {
            return null;
        }

        final V result = node.getValue();
        AvlNode<K, V> removed = node;
        if (node.getLeft() != null && node.getRight() != null) {
            // keep the node in place and take over its successor's entry instead
            final AvlNode<K, V> successor = TreeNodes.leftMost(node.getRight());
            node.setKey(successor.getKey());
            node.setValue(successor.getValue());
            removed = successor;
        }

        final AvlNode<K, V> parent = removed.getParent();
        spliceOut(removed);
        if (parent != null) {
            rebalanceFrom(parent);
        }
        return result;
    }

    @Override
    public void clear() {
        root = null;
    }

    /**
     * The height is cached on the root, so unlike {@link #size()} this is O(1).
     */
    @Override
    public int height() {
        return AvlNode.height(root);
    }

    /**
     * This method is only for debugging.
     * It verifies the cached heights, the balance bound, the parent links and the key order.
     * @throws IllegalStateException If an inconsistency is detected.
     */
    public void checkInvariants() {
        if (root == null) return;
        if (root.getParent() != null) {
            throw new IllegalStateException("Root has a parent: " + root);
        }

        final Deque<AvlNode<K, V>> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            final AvlNode<K, V> node = stack.pop();
            final int expectedHeight = Math.max(AvlNode.height(node.getLeft()), AvlNode.height(node.getRight())) + 1;
            if (node.getHeight() != expectedHeight) {
                throw new IllegalStateException("Height mismatch " + node.getHeight() + " vs " + expectedHeight + ": " + node);
            }
            if (Math.abs(node.getBalance()) > 1) {
                throw new IllegalStateException("Node out of balance by " + node.getBalance() + ": " + node);
            }
            checkChild(stack, node, node.getLeft());
            checkChild(stack, node, node.getRight());
        }

        final InOrderCursor<AvlNode<K, V>> cursor = cursor();
        AvlNode<K, V> previous = cursor.advance();
        while (!cursor.isExhausted()) {
            final AvlNode<K, V> node = cursor.advance();
            if (comparator.compare(previous.getKey(), node.getKey()) >= 0) {
                throw new IllegalStateException("Keys out of order: " + previous + " before " + node);
            }
            previous = node;
        }
    }

    private static <K, V> void checkChild(final Deque<AvlNode<K, V>> stack, final AvlNode<K, V> node, final AvlNode<K, V> child) {
        if (child == null) return;
        if (child.getParent() != node) {
            throw new IllegalStateException("Broken parent link below " + node + ": " + child);
        }
        stack.push(child);
    }

    /**
     * Walks from the given node up to the root, rebalancing each node and storing the result back into
     * its parent's child slot.  Storing always happens, even without a rotation, because assigning a
     * child is what brings the parent's cached height back in line.
     */
    private void rebalanceFrom(final AvlNode<K, V> start) {
        AvlNode<K, V> node = start;
        while (node != null) {
            final AvlNode<K, V> parent = node.getParent();
            replaceChild(parent, node, AvlBalancer.rebalance(node));
            node = parent;
        }
    }

    /** Unlinks a node with at most one child, moving that child up into its place. */
    private void spliceOut(final AvlNode<K, V> node) {
        final AvlNode<K, V> child = node.getLeft() != null ? node.getLeft() : node.getRight();
        final AvlNode<K, V> parent = node.getParent();
        if (child != null) {
            child.setParent(parent);
        }
        replaceChild(parent, node, child);
        node.setParent(null);
    }

    private void replaceChild(final AvlNode<K, V> parent, final AvlNode<K, V> oldChild, final AvlNode<K, V> newChild) {
        if (parent == null) {
            root = newChild;
        } else if (parent.isLeftChild(oldChild)) {
            parent.setLeft(newChild);
        } else {
            parent.setRight(newChild);
        }
    }
}
