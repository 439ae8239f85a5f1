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

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Static helpers that only rely on a node exposing its children.  None of them recurse, so they
 * are safe on arbitrarily deep (unbalanced) trees.
 */
public final class TreeNodes {

    private TreeNodes() {
    }

    /**
     * Counts the nodes of the subtree rooted at the given node.
     * @param root subtree root, may be null
     * @return the number of nodes, 0 for a null root
     */
    public static <N extends BinaryTreeNode<N>> int count(final N root) {
        if (root == null) return 0;

        int result = 0;
        final Deque<N> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            final N node = stack.pop();
            ++result;
            if (node.getLeft() != null) stack.push(node.getLeft());
            if (node.getRight() != null) stack.push(node.getRight());
        }
        return result;
    }

    /**
     * Measures the height of the subtree rooted at the given node, a lone node having height 1.
     * @param root subtree root, may be null
     * @return the number of nodes on the longest root-to-leaf path, 0 for a null root
     */
    public static <N extends BinaryTreeNode<N>> int height(final N root) {
        if (root == null) return 0;

        int result = 0;
        final Deque<N> nodes = new ArrayDeque<>();
        final Deque<Integer> depths = new ArrayDeque<>();
        nodes.push(root);
        depths.push(1);
        while (!nodes.isEmpty()) {
            final N node = nodes.pop();
            final int depth = depths.pop();
            result = Math.max(result, depth);
            if (node.getLeft() != null) {
                nodes.push(node.getLeft());
                depths.push(depth + 1);
            }
            if (node.getRight() != null) {
                nodes.push(node.getRight());
                depths.push(depth + 1);
            }
        }
        return result;
    }

    /** @return the leftmost descendant of the given node (the node itself if it has no left child). */
    public static <N extends BinaryTreeNode<N>> N leftMost(final N node) {
        N result = node;
        while (result.getLeft() != null) {
            result = result.getLeft();
        }
        return result;
    }

    /** @return the rightmost descendant of the given node (the node itself if it has no right child). */
    public static <N extends BinaryTreeNode<N>> N rightMost(final N node) {
        N result = node;
        while (result.getRight() != null) {
            result = result.getRight();
        }
        return result;
    }
}
