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
 * A node of an {@link AvlTree}.  Caches the height of the subtree it roots; assigning either child
 * recomputes that height and raises (but never lowers) the parent's cached height.  Heights that
 * became too large on the side that shrank are corrected by the tree's rebalancing walk, which
 * passes through every ancestor of a mutation.
 *
 * The parent link is a plain back-reference: the tree owns nodes through the child links only.
 */
public final class AvlNode<K, V> implements SearchTreeNode<K, V, AvlNode<K, V>> {
    private K key;
    private V value;
    private AvlNode<K, V> parent;
    private AvlNode<K, V> left;
    private AvlNode<K, V> right;
    private int height = 1;

    AvlNode(final K key, final V value) {
        this(key, value, null);
    }

    AvlNode(final K key, final V value, final AvlNode<K, V> parent) {
        this.key = key;
        this.value = value;
        this.parent = parent;
    }

    @Override
    public K getKey() {
        return key;
    }

    @Override
    public V getValue() {
        return value;
    }

    @Override
    public AvlNode<K, V> getLeft() {
        return left;
    }

    @Override
    public AvlNode<K, V> getRight() {
        return right;
    }

    public AvlNode<K, V> getParent() {
        return parent;
    }

    /** @return the cached height of the subtree rooted here; 1 for a leaf. */
    public int getHeight() {
        return height;
    }

    /** @return height of the left subtree minus height of the right subtree. */
    public int getBalance() {
        return height(left) - height(right);
    }

    void setKey(final K key) {
        this.key = key;
    }

    V setValue(final V value) {
        final V result = this.value;
        this.value = value;
        return result;
    }

    void setParent(final AvlNode<K, V> parent) {
        this.parent = parent;
    }

    void setLeft(final AvlNode<K, V> left) {
        this.left = left;
        childChanged();
    }

    void setRight(final AvlNode<K, V> right) {
        this.right = right;
        childChanged();
    }

    /** @return true if the given node is this node's left child. */
    boolean isLeftChild(final AvlNode<K, V> child) {
        return left == child;
    }

    static int height(final AvlNode<?, ?> node) {
        return node == null ? 0 : node.height;
    }

    private void childChanged() {
        height = Math.max(height(left), height(right)) + 1;
        if (parent != null) {
            parent.height = Math.max(parent.height, height + 1);
        }
    }

    @Override
    public String toString() {
        return "AvlNode(" + key + "," + value + "," + height + ")";
    }
}
