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

import java.util.ArrayList;
import java.util.List;

/**
 * A position in the in-order (left, node, right) traversal of a binary tree, kept as an explicit
 * stack of frames holding the path from the root down to the current node.  Each frame remembers
 * whether the right subtree of its node is still to be visited; frames whose right subtree has
 * already been entered stay on the stack as ancestors and are discarded on the way back up.
 *
 * An empty stack is the exhausted position.  The cursor only reads child links and must not be used
 * once the tree it was created from has been modified.
 *
 * Not thread-safe.
 */
public final class InOrderCursor<N extends BinaryTreeNode<N>> {

    private static final class Frame<N> {
        final N node;
        boolean followRight;

        Frame(final N node, final boolean followRight) {
            this.node = node;
            this.followRight = followRight;
        }
    }

    private final List<Frame<N>> stack;

    private InOrderCursor(final List<Frame<N>> stack) {
        this.stack = stack;
    }

    /**
     * @param root root of the tree to traverse, may be null
     * @return a cursor positioned at the leftmost node of the tree, exhausted if the tree is empty
     */
    public static <N extends BinaryTreeNode<N>> InOrderCursor<N> start(final N root) {
        final InOrderCursor<N> cursor = new InOrderCursor<>(new ArrayList<>());
        if (root != null) {
            cursor.pushLeftSpine(root);
        }
        return cursor;
    }

    /** @return an exhausted cursor, usable as the end position of any traversal. */
    public static <N extends BinaryTreeNode<N>> InOrderCursor<N> end() {
        return new InOrderCursor<>(new ArrayList<>());
    }

    public boolean isExhausted() {
        return stack.isEmpty();
    }

    /** @return the node at this position, or null if the cursor is exhausted. */
    public N current() {
        return stack.isEmpty() ? null : top().node;
    }

    /**
     * Moves one step forward in the traversal.  Advancing an exhausted cursor does nothing.
     * @return the node the cursor rested on before this step, or null if it was already exhausted
     */
    public N advance() {
        if (stack.isEmpty()) return null;

        final Frame<N> frame = top();
        final N right = frame.node.getRight();
        if (frame.followRight && right != null) {
            frame.followRight = false;
            pushLeftSpine(right);
        } else {
            stack.remove(stack.size() - 1);
            while (!stack.isEmpty() && !top().followRight) {
                stack.remove(stack.size() - 1);
            }
        }
        return frame.node;
    }

    /** @return the depth of the current position, 0 when exhausted. */
    public int depth() {
        return stack.size();
    }

    /** @return an independent cursor at the same position. */
    public InOrderCursor<N> copy() {
        final List<Frame<N>> frames = new ArrayList<>(stack.size());
        for (final Frame<N> frame : stack) {
            frames.add(new Frame<>(frame.node, frame.followRight));
        }
        return new InOrderCursor<>(frames);
    }

    private Frame<N> top() {
        return stack.get(stack.size() - 1);
    }

    private void pushLeftSpine(final N node) {
        N next = node;
        while (next != null) {
            stack.add(new Frame<>(next, true));
            next = next.getLeft();
        }
    }

    /**
     * Two cursors over the same tree are equal when both are exhausted or both rest on the same node.
     * Comparing cursors over different trees is meaningless.
     */
    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof InOrderCursor)) return false;

        final InOrderCursor<?> that = (InOrderCursor<?>) o;
        if (isExhausted() || that.isExhausted()) {
            return isExhausted() && that.isExhausted();
        }
        return current() == that.current();
    }

    @Override
    public int hashCode() {
        return isExhausted() ? 0 : System.identityHashCode(current());
    }

    @Override
    public String toString() {
        return isExhausted() ? "InOrderCursor(end)" : "InOrderCursor(" + current() + ")";
    }
}
