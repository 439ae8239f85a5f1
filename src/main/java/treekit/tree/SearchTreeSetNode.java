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
 * Node of a {@link SearchTreeSet}: an element with two child links.
 */
public final class SearchTreeSetNode<T> implements BinaryTreeNode<SearchTreeSetNode<T>> {
    private T element;
    SearchTreeSetNode<T> left;
    SearchTreeSetNode<T> right;

    SearchTreeSetNode(final T element) {
        this.element = element;
    }

    public T getElement() {
        return element;
    }

    T setElement(final T element) {
        final T result = this.element;
        this.element = element;
        return result;
    }

    @Override
    public SearchTreeSetNode<T> getLeft() {
        return left;
    }

    @Override
    public SearchTreeSetNode<T> getRight() {
        return right;
    }

    @Override
    public String toString() {
        return "SearchTreeSetNode(" + element + ")";
    }
}
