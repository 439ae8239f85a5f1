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

import org.testng.Assert;
import org.testng.annotations.Test;

public class TreeNodesTest {

    @Test
    public void testNullRoot() {
        Assert.assertEquals(TreeNodes.count((AvlNode<Integer, Integer>) null), 0);
        Assert.assertEquals(TreeNodes.height((AvlNode<Integer, Integer>) null), 0);
    }

    @Test
    public void testCountAndHeight() {
        final UnbalancedTree<Integer, Integer> tree = new UnbalancedTree<>();
        for (final int key : new int[]{50, 20, 80, 10, 30, 25, 27}) {
            tree.put(key, key);
        }
        Assert.assertEquals(TreeNodes.count(tree.getRoot()), 7);
        // 50 -> 20 -> 30 -> 25 -> 27
        Assert.assertEquals(TreeNodes.height(tree.getRoot()), 5);
        Assert.assertEquals(TreeNodes.leftMost(tree.getRoot()).getKey(), Integer.valueOf(10));
        Assert.assertEquals(TreeNodes.rightMost(tree.getRoot()).getKey(), Integer.valueOf(80));
        Assert.assertEquals(TreeNodes.leftMost(tree.getRoot().getRight()).getKey(), Integer.valueOf(80));
    }

    @Test
    public void testHeightMatchesCachedAvlHeight() {
        final AvlTree<Integer, Integer> tree = new AvlTree<>();
        for (int i = 0; i < 100; i++) {
            tree.put((i * 37) % 101, i);
            Assert.assertEquals(TreeNodes.height(tree.getRoot()), tree.getRoot().getHeight());
        }
        Assert.assertEquals(TreeNodes.count(tree.getRoot()), 100);
    }
}
