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

import java.util.Arrays;
import java.util.Comparator;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * An ordered set of elements kept in a plain (unbalanced) binary search tree. Elements are their own keys;
 * two elements the comparator finds equal occupy a single slot.
 *
 * Iteration is ascending. Not thread safe; mutating the set invalidates outstanding iterators and cursors.
 *
 * @param <T> the element type
 */
public class SearchTreeSet<T> implements Iterable<T> {
    private final Comparator<? super T> comparator;
    private SearchTreeSetNode<T> root;

    public SearchTreeSet() {
        this(AbstractSearchTree.<T>naturalOrder());
    }

    public SearchTreeSet(final Comparator<? super T> comparator) {
        this.comparator = ValidationUtils.nonNull(comparator, "comparator must not be null");
    }

    /** Builds a naturally ordered set holding the given elements; later duplicates replace earlier ones. */
    public static <T extends Comparable<? super T>> SearchTreeSet<T> fromIterable(final Iterable<? extends T> elements) {
        final SearchTreeSet<T> set = new SearchTreeSet<>(Comparator.<T>naturalOrder());
        for (final T element : elements) {
            set.update(element);
        }
        return set;
    }

    @SafeVarargs
    public static <T extends Comparable<? super T>> SearchTreeSet<T> of(final T... elements) {
        return fromIterable(Arrays.asList(elements));
    }

    public SearchTreeSetNode<T> getRoot() {
        return root;
    }

    /**
     * Adds the element unless an equal one is already present.
     * @return whether the element was added, paired with the element the set holds afterwards
     */
    public Pair<Boolean, T> insert(final T element) {
        final SearchTreeSetNode<T> existing = findNode(element);
        if (existing != null) {
            return Pair.of(false, existing.getElement());
        }
        update(element);
        return Pair.of(true, element);
    }

    /**
     * Adds the element, replacing an equal one if present.
     * @return the replaced element, or null if none was present
     */
    public T update(final T element) {
        ValidationUtils.nonNull(element, "element must not be null");
        if (root == null) {
            root = new SearchTreeSetNode<>(element);
            return null;
        }

        SearchTreeSetNode<T> node = root;
        while (true) {
            final int cmpVal = comparator.compare(element, node.getElement());
            if (cmpVal == 0) {
                return node.setElement(element);
            } else if (cmpVal < 0) {
                if (node.left == null) {
                    node.left = new SearchTreeSetNode<>(element);
                    return null;
                }
                node = node.left;
            } else {
                if (node.right == null) {
                    node.right = new SearchTreeSetNode<>(element);
                    return null;
                }
                node = node.right;
            }
        }
    }

    /**
     * @return the removed element, or null if no equal element was present
     */
    public T remove(final T element) {
        ValidationUtils.nonNull(element, "element must not be null");

        SearchTreeSetNode<T> parent = null;
        SearchTreeSetNode<T> node = root;
        while (node != null) {
            final int cmpVal = comparator.compare(element, node.getElement());
            if (cmpVal == 0) {
                break;
            }
            parent = node;
            node = cmpVal < 0 ? node.left : node.right;
        }
        if (node == null) {
            return null;
        }

        final T result = node.getElement();
        if (node.left != null && node.right != null) {
            // the successor has no left child
            SearchTreeSetNode<T> successorParent = node;
            SearchTreeSetNode<T> successor = node.right;
            while (successor.left != null) {
                successorParent = successor;
                successor = successor.left;
            }
            node.setElement(successor.getElement());
            replaceChild(successorParent, successor, successor.right);
        } else {
            replaceChild(parent, node, node.left != null ? node.left : node.right);
        }
        return result;
    }

    public boolean contains(final T element) {
        return findNode(element) != null;
    }

    public boolean isEmpty() {
        return root == null;
    }

    public int size() {
        return TreeNodes.count(root);
    }

    public int height() {
        return TreeNodes.height(root);
    }

    public void clear() {
        root = null;
    }

    public InOrderCursor<SearchTreeSetNode<T>> cursor() {
        return InOrderCursor.start(root);
    }

    @Override
    public Iterator<T> iterator() {
        final InOrderCursor<SearchTreeSetNode<T>> cursor = cursor();
        return new Iterator<T>() {
            @Override
            public boolean hasNext() {
                return !cursor.isExhausted();
            }

            @Override
            public T next() {
                final SearchTreeSetNode<T> node = cursor.advance();
                if (node == null) {
                    throw new NoSuchElementException("No next element.");
                }
                return node.getElement();
            }
        };
    }

    private SearchTreeSetNode<T> findNode(final T element) {
        ValidationUtils.nonNull(element, "element must not be null");
        SearchTreeSetNode<T> node = root;
        while (node != null) {
            final int cmpVal = comparator.compare(element, node.getElement());
            if (cmpVal == 0) {
                break;
            }
            node = cmpVal < 0 ? node.left : node.right;
        }
        return node;
    }

    private void replaceChild(final SearchTreeSetNode<T> parent, final SearchTreeSetNode<T> oldChild, final SearchTreeSetNode<T> newChild) {
        if (parent == null) {
            root = newChild;
        } else if (parent.left == oldChild) {
            parent.left = newChild;
        } else {
            parent.right = newChild;
        }
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof SearchTreeSet)) return false;

        final Iterator<?> mine = iterator();
        final Iterator<?> theirs = ((SearchTreeSet<?>) o).iterator();
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
        for (final T element : this) {
            result = 31 * result + element.hashCode();
        }
        return result;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("[");
        for (final T element : this) {
            if (sb.length() > 1) sb.append(',');
            sb.append(element);
        }
        return sb.append(']').toString();
    }
}
