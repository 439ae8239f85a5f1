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
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.BinaryOperator;

/**
 * Behaviour shared by the keyed binary search trees: lookup, ordered iteration, counting,
 * rendering and equality.  Subclasses own the root and implement the structural mutations.
 *
 * The comparator must impose a strict total order on the keys; if it does not, the ordering
 * invariant of the tree is undefined.  This is a precondition and is not checked.
 *
 * @param <K> key type
 * @param <V> value type
 * @param <N> node type
 */
public abstract class AbstractSearchTree<K, V, N extends SearchTreeNode<K, V, N>> implements Iterable<Pair<K, V>> {

    protected final Comparator<? super K> comparator;

    protected AbstractSearchTree(final Comparator<? super K> comparator) {
        this.comparator = ValidationUtils.nonNull(comparator, "comparator must not be null");
    }

    /** @return the root node, or null if the tree is empty. */
    public abstract N getRoot();

    /**
     * Associates the value with the key, replacing any previous value.
     * @return the previous value, or null if the key was not in the tree
     */
    public abstract V put(K key, V value);

    /**
     * Removes the key and its value.
     * @return the removed value, or null if the key was not in the tree
     */
    public abstract V remove(K key);

    /** Remove all entries. */
    public abstract void clear();

    public Comparator<? super K> comparator() {
        return comparator;
    }

    /**
     * @return the value associated with the key, or null if there is none
     */
    public V get(final K key) {
        final N node = findNode(key);
        return node == null ? null : node.getValue();
    }

    public boolean containsKey(final K key) {
        return findNode(key) != null;
    }

    public boolean isEmpty() {
        return getRoot() == null;
    }

    /**
     * Return the number of entries in the tree.  The count is not cached: this walks the whole tree.
     */
    public int size() {
        return TreeNodes.count(getRoot());
    }

    /**
     * @return the number of nodes on the longest root-to-leaf path, 0 for an empty tree
     */
    public int height() {
        return TreeNodes.height(getRoot());
    }

    /**
     * @return a cursor positioned at the smallest key, exhausted if the tree is empty
     */
    public InOrderCursor<N> cursor() {
        return InOrderCursor.start(getRoot());
    }

    /**
     * Return an iterator over the entries of the tree in ascending key order.  The iterator must not
     * be used after the tree has been modified.
     */
    @Override
    public Iterator<Pair<K, V>> iterator() {
        final InOrderCursor<N> cursor = cursor();
        return new Iterator<Pair<K, V>>() {
            @Override
            public boolean hasNext() {
                return !cursor.isExhausted();
            }

            @Override
            public Pair<K, V> next() {
                final N node = cursor.advance();
                if (node == null) {
                    throw new NoSuchElementException("No next element.");
                }
                return Pair.of(node.getKey(), node.getValue());
            }
        };
    }

    /**
     * Inserts the pairs in sequence, passing the value already in the tree and the new value to the
     * combiner whenever a key repeats.
     */
    protected void putPairs(final Iterable<? extends Pair<? extends K, ? extends V>> pairs, final BinaryOperator<V> combiner) {
        for (final Pair<? extends K, ? extends V> pair : pairs) {
            final V existing = get(pair.getKey());
            put(pair.getKey(), existing == null ? pair.getValue() : combiner.apply(existing, pair.getValue()));
        }
    }

    /** @return a comparator over the natural ordering of keys that implement {@link Comparable}. */
    @SuppressWarnings("unchecked")
    protected static <K> Comparator<K> naturalOrder() {
        return (a, b) -> ((Comparable<? super K>) a).compareTo(b);
    }

    /**
     * Finds the node holding the given key.
     * @return the node, or null if the key is not in the tree
     */
    protected N findNode(final K key) {
        ValidationUtils.nonNull(key, "key must not be null");
        N node = getRoot();
        while (node != null) {
            final int cmpVal = comparator.compare(key, node.getKey());
            if (cmpVal == 0) {
                break;
            }
            node = cmpVal < 0 ? node.getLeft() : node.getRight();
        }
        return node;
    }

    /**
     * Trees are equal when they hold the same entries in the same order, regardless of their shape
     * or balancing strategy.
     */
    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof AbstractSearchTree)) return false;

        final Iterator<?> mine = iterator();
        final Iterator<?> theirs = ((AbstractSearchTree<?, ?, ?>) o).iterator();
        while (mine.hasNext()) {
            if (!theirs.hasNext() || !mine.next().equals(theirs.next())) {
                return false;
            }
        }
        return !theirs.hasNext();
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (final Pair<K, V> entry : this) {
            result = 31 * result + entry.hashCode();
        }
        return result;
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "[:]";
        }
        final StringBuilder sb = new StringBuilder("[");
        for (final Pair<K, V> entry : this) {
            if (sb.length() > 1) sb.append(',');
            sb.append(entry.getKey()).append(": ").append(entry.getValue());
        }
        return sb.append(']').toString();
    }
}
