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

/**
 * Rotations and the rebalancing decision for {@link AvlNode}s.  The methods only relink the nodes
 * they are given and return the new local subtree root; storing that root in the slot of the
 * former subtree root's parent is left to the caller.
 */
final class AvlBalancer {

    private AvlBalancer() {
    }

    /**
     * Restores the AVL bound at the given node, assuming both of its subtrees already satisfy it.
     * Handles the four classic cases (left-left, left-right, right-right, right-left) with one or two
     * rotations.
     * @return the root of the rebalanced subtree, which is the given node when no rotation was needed
     */
    static <K, V> AvlNode<K, V> rebalance(final AvlNode<K, V> node) {
        final int balance = node.getBalance();
        if (balance > 1) {
            if (node.getLeft().getBalance() < 0) {
                node.setLeft(rotateLeft(node.getLeft()));
            }
            return rotateRight(node);
        } else if (balance < -1) {
            if (node.getRight().getBalance() > 0) {
                node.setRight(rotateRight(node.getRight()));
            }
            return rotateLeft(node);
        }
        return node;
    }

    /**
     * Makes the right child of the given node the root of the subtree.
     * @param a subtree root; must have a right child
     * @return the former right child, now the subtree root
     */
    static <K, V> AvlNode<K, V> rotateLeft(final AvlNode<K, V> a) {
        final AvlNode<K, V> b = a.getRight();

        b.setParent(a.getParent());
        a.setRight(b.getLeft());
        if (a.getRight() != null) {
            a.getRight().setParent(a);
        }
        b.setLeft(a);
        a.setParent(b);

        return b;
    }

    /**
     * Makes the left child of the given node the root of the subtree.
     * @param a subtree root; must have a left child
     * @return the former left child, now the subtree root
     */
    static <K, V> AvlNode<K, V> rotateRight(final AvlNode<K, V> a) {
        final AvlNode<K, V> b = a.getLeft();

        b.setParent(a.getParent());
        a.setLeft(b.getRight());
        if (a.getLeft() != null) {
            a.getLeft().setParent(a);
        }
        b.setRight(a);
        a.setParent(b);

        return b;
    }
}
