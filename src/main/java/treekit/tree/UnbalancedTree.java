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

import java.util.Comparator;
import java.util.function.BinaryOperator;

/**
 * A plain binary search tree with no balancing.  Its shape depends entirely on insertion order, so
 * inserting keys in sorted order degenerates it into a list; it is mostly useful as a baseline for
 * {@link AvlTree}.
 *
 * Keys are unique.  Neither keys nor values may be null.  Not thread-safe.
 */
public class UnbalancedTree<K, V> extends AbstractSearchTree<K, V, UnbalancedNode<K, V>> {

    private UnbalancedNode<K, V> root;

    /**
     * Creates an empty tree ordered by the natural ordering of its keys, which must implement
     * {@link Comparable}.
     */
    public UnbalancedTree() {
        this(AbstractSearchTree.<K>naturalOrder());
    }

    public UnbalancedTree(final Comparator<? super K> comparator) {
        super(comparator);
    }

    /**
     * Builds a tree from the given pairs in natural key order, keeping the last value of a repeated key.
     */
    public static <K extends Comparable<? super K>, V> UnbalancedTree<K, V> fromPairs(final Iterable<? extends Pair<? extends K, ? extends V>> pairs) {
        return fromPairs(pairs, (existing, value) -> value);
    }

    /**
     * Builds a tree from the given pairs in natural key order, resolving repeated keys with the combiner.
     * @param combiner called with the value already in the tree and the new value; returns the value to keep
     */
    public static <K extends Comparable<? super K>, V> UnbalancedTree<K, V> fromPairs(final Iterable<? extends Pair<? extends K, ? extends V>> pairs,
                                                                                     final BinaryOperator<V> combiner) {
        final UnbalancedTree<K, V> tree = new UnbalancedTree<>(Comparator.<K>naturalOrder());
        tree.putPairs(pairs, combiner);
        return tree;
    }

    @Override
    public UnbalancedNode<K, V> getRoot() {
        return root;
    }

    @Override
    public V put(final K key, final V value) {
        ValidationUtils.nonNull(key, "key must not be null");
        ValidationUtils.nonNull(value, "value must not be null");

        if (root == null) {
            root = new UnbalancedNode<>(key, value);
            return null;
        }

        UnbalancedNode<K, V> node = root;
        while (true) {
            final int cmpVal = comparator.compare(key, node.getKey());
            if (cmpVal == 0) {
                return node.setValue(value);
            } else if (cmpVal < 0) {
                if (node.left == null) {
                    node.left = new UnbalancedNode<>(key, value);
                    return null;
                }
                node = node.left;
            } else {
                if (node.right == null) {
                    node.right = new UnbalancedNode<>(key, value);
                    return null;
                }
                node = node.right;
            }
        }
    }

    @Override
    public V remove(final K key) {
        ValidationUtils.nonNull(key, "key must not be null");

        UnbalancedNode<K, V> parent = null;
        UnbalancedNode<K, V> node = root;
        while (node != null) {
            final int cmpVal = comparator.compare(key, node.getKey());
            if (cmpVal == 0) {
                break;
            }
            parent = node;
            node = cmpVal < 0 ? node.left : node.right;
        }
        if (node == null) {
            return null;
        }

        final V result = node.getValue();
        if (node.left != null && node.right != null) {
            // take over the successor's entry, then unlink the successor, which has no left child
            UnbalancedNode<K, V> successorParent = node;
            UnbalancedNode<K, V> successor = node.right;
            while (successor.left != null) {
                successorParent = successor;
                successor = successor.left;
            }
            node.setKey(successor.getKey());
            node.setValue(successor.getValue());
            replaceChild(successorParent, successor, successor.right);
        } else {
            replaceChild(parent, node, node.left != null ? node.left : node.right);
        }
        return result;
    }

    @Override
    public void clear() {
        root = null;
    }

    private void replaceChild(final UnbalancedNode<K, V> parent, final UnbalancedNode<K, V> oldChild, final UnbalancedNode<K, V> newChild) {
        if (parent == null) {
            root = newChild;
        } else if (parent.left == oldChild) {
            parent.left = newChild;
        } else {
            parent.right = newChild;
        }
    }
}
