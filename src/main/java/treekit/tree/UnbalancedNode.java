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
 * A node of an {@link UnbalancedTree}: key, value and two children, nothing else.
 */
public final class UnbalancedNode<K, V> implements SearchTreeNode<K, V, UnbalancedNode<K, V>> {
    private K key;
    private V value;
    UnbalancedNode<K, V> left;
    UnbalancedNode<K, V> right;

    UnbalancedNode(final K key, final V value) {
        this.key = key;
        this.value = value;
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
    public UnbalancedNode<K, V> getLeft() {
        return left;
    }

    @Override
    public UnbalancedNode<K, V> getRight() {
        return right;
    }

    void setKey(final K key) {
        this.key = key;
    }

    V setValue(final V value) {
        final V result = this.value;
        this.value = value;
        return result;
    }

    @Override
    public String toString() {
        return "UnbalancedNode(" + key + "," + value + ")";
    }
}
