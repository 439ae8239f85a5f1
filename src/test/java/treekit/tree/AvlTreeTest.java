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

import org.apache.commons.lang3.tuple.Pair;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.TreeMap;

public class AvlTreeTest {

    private static AvlTree<Integer, String> treeOf(final int... keys) {
        final AvlTree<Integer, String> tree = new AvlTree<>();
        for (final int key : keys) {
            tree.put(key, "v" + key);
        }
        return tree;
    }

    private static List<Integer> keys(final AbstractSearchTree<Integer, ?, ?> tree) {
        final List<Integer> keys = new ArrayList<>();
        for (final Pair<Integer, ?> entry : tree) {
            keys.add(entry.getKey());
        }
        return keys;
    }

    @Test
    public void testEmptyTree() {
        final AvlTree<Integer, String> tree = new AvlTree<>();
        Assert.assertTrue(tree.isEmpty());
        Assert.assertEquals(tree.size(), 0);
        Assert.assertEquals(tree.height(), 0);
        Assert.assertNull(tree.getRoot());
        Assert.assertNull(tree.get(1));
        Assert.assertFalse(tree.containsKey(1));
        Assert.assertNull(tree.remove(1));
        Assert.assertFalse(tree.iterator().hasNext());
        Assert.assertTrue(tree.cursor().isExhausted());
        Assert.assertEquals(tree.toString(), "[:]");
        tree.checkInvariants();
    }

    @Test
    public void testPutThenGet() {
        final AvlTree<Integer, String> tree = new AvlTree<>();
        Assert.assertNull(tree.put(1, "a"));
        Assert.assertEquals(tree.get(1), "a");
        Assert.assertTrue(tree.containsKey(1));
        Assert.assertEquals(tree.size(), 1);
        Assert.assertEquals(tree.height(), 1);
    }

    @Test
    public void testOverwriteKeepsSize() {
        final AvlTree<Integer, String> tree = treeOf(5, 3, 8);
        Assert.assertEquals(tree.put(3, "x"), "v3");
        Assert.assertEquals(tree.get(3), "x");
        Assert.assertEquals(tree.size(), 3);
        tree.checkInvariants();
    }

    @Test
    public void testMixedInsertOrder() {
        final AvlTree<Integer, String> tree = treeOf(5, 3, 8, 1, 4, 7, 9);
        Assert.assertEquals(keys(tree), Arrays.asList(1, 3, 4, 5, 7, 8, 9));
        Assert.assertTrue(tree.height() <= 4);
        Assert.assertEquals(tree.getRoot().getKey(), Integer.valueOf(5));
        tree.checkInvariants();
    }

    @Test
    public void testAscendingInsertStaysBalanced() {
        final AvlTree<Integer, String> tree = treeOf(1, 2, 3, 4, 5, 6, 7);
        Assert.assertEquals(tree.height(), 3);
        Assert.assertEquals(tree.getRoot().getKey(), Integer.valueOf(4));
        Assert.assertEquals(keys(tree), Arrays.asList(1, 2, 3, 4, 5, 6, 7));
        tree.checkInvariants();

        final UnbalancedTree<Integer, String> unbalanced = new UnbalancedTree<>();
        for (int i = 1; i <= 7; i++) {
            unbalanced.put(i, "v" + i);
        }
        Assert.assertEquals(unbalanced.height(), 7);
        Assert.assertEquals(unbalanced, tree);
    }

    @Test
    public void testRemoveAbsentKeyLeavesTreeUnchanged() {
        final AvlTree<Integer, String> tree = treeOf(5, 3, 8, 1, 4, 7, 9);
        final String before = tree.toString();
        final int height = tree.height();
        Assert.assertNull(tree.remove(6));
        Assert.assertNull(tree.remove(100));
        Assert.assertEquals(tree.toString(), before);
        Assert.assertEquals(tree.height(), height);
        tree.checkInvariants();
    }

    @Test
    public void testRemoveLeaf() {
        final AvlTree<Integer, String> tree = treeOf(2, 1, 3);
        Assert.assertEquals(tree.remove(3), "v3");
        Assert.assertEquals(keys(tree), Arrays.asList(1, 2));
        Assert.assertEquals(tree.height(), 2);
        tree.checkInvariants();
    }

    @Test
    public void testRemoveRootOfTwoNodeTree() {
        final AvlTree<Integer, String> tree = treeOf(1, 2);
        Assert.assertEquals(tree.getRoot().getKey(), Integer.valueOf(1));
        Assert.assertEquals(tree.remove(1), "v1");

        final AvlNode<Integer, String> root = tree.getRoot();
        Assert.assertEquals(root.getKey(), Integer.valueOf(2));
        Assert.assertNull(root.getLeft());
        Assert.assertNull(root.getRight());
        Assert.assertNull(root.getParent());
        Assert.assertEquals(root.getHeight(), 1);
        tree.checkInvariants();
    }

    @Test
    public void testRemoveNodeWithTwoChildren() {
        final AvlTree<Integer, String> tree = treeOf(5, 3, 8, 1, 4, 7, 9);
        Assert.assertEquals(tree.remove(5), "v5");
        Assert.assertEquals(tree.getRoot().getKey(), Integer.valueOf(7));
        Assert.assertEquals(tree.get(7), "v7");
        Assert.assertNull(tree.get(5));
        Assert.assertEquals(keys(tree), Arrays.asList(1, 3, 4, 7, 8, 9));
        tree.checkInvariants();

        // successor is the right child itself
        Assert.assertEquals(tree.remove(3), "v3");
        Assert.assertEquals(keys(tree), Arrays.asList(1, 4, 7, 8, 9));
        tree.checkInvariants();
    }

    @Test
    public void testRemoveTriggersRotation() {
        final AvlTree<Integer, String> tree = treeOf(2, 1, 3, 4);
        Assert.assertEquals(tree.remove(1), "v1");
        Assert.assertEquals(tree.getRoot().getKey(), Integer.valueOf(3));
        Assert.assertEquals(tree.height(), 2);
        tree.checkInvariants();
    }

    @DataProvider(name = "seeds")
    public Object[][] seeds() {
        return new Object[][]{{1L, 10}, {7L, 100}, {42L, 1000}, {2024L, 257}};
    }

    @Test(dataProvider = "seeds")
    public void testRandomPermutationsInsertedAndRemoved(final long seed, final int n) {
        final Random random = new Random(seed);
        final List<Integer> insertOrder = new ArrayList<>();
        for (int i = 1; i <= n; i++) {
            insertOrder.add(i);
        }
        Collections.shuffle(insertOrder, random);

        final AvlTree<Integer, Integer> tree = new AvlTree<>();
        final TreeMap<Integer, Integer> expected = new TreeMap<>();
        for (final Integer key : insertOrder) {
            tree.put(key, key * 2);
            expected.put(key, key * 2);
            tree.checkInvariants();
        }
        Assert.assertEquals(tree.size(), n);
        Assert.assertEquals(keys(tree), new ArrayList<>(expected.keySet()));
        // 1.44 * log2(n + 2) bounds the height of any AVL tree of n nodes
        Assert.assertTrue(tree.height() <= 1.45 * Math.log(n + 2) / Math.log(2), "height " + tree.height());

        final List<Integer> removeOrder = new ArrayList<>(insertOrder);
        Collections.shuffle(removeOrder, random);
        for (final Integer key : removeOrder) {
            Assert.assertEquals(tree.remove(key), expected.remove(key));
            Assert.assertNull(tree.get(key));
            tree.checkInvariants();
        }
        Assert.assertTrue(tree.isEmpty());
        Assert.assertEquals(tree.height(), 0);
    }

    @Test
    public void testAllPermutationsOfSmallTrees() {
        final List<List<Integer>> permutations = new ArrayList<>();
        permute(new ArrayList<>(Arrays.asList(1, 2, 3, 4, 5)), 0, permutations);
        Assert.assertEquals(permutations.size(), 120);

        for (final List<Integer> insertOrder : permutations) {
            final AvlTree<Integer, Integer> tree = new AvlTree<>();
            insertOrder.forEach(k -> tree.put(k, k));
            tree.checkInvariants();
            Assert.assertEquals(tree.height(), 3, insertOrder.toString());
            for (final Integer key : insertOrder) {
                tree.remove(key);
                tree.checkInvariants();
            }
            Assert.assertTrue(tree.isEmpty());
        }
    }

    private static void permute(final List<Integer> items, final int start, final List<List<Integer>> result) {
        if (start == items.size()) {
            result.add(new ArrayList<>(items));
            return;
        }
        for (int i = start; i < items.size(); i++) {
            Collections.swap(items, start, i);
            permute(items, start + 1, result);
            Collections.swap(items, start, i);
        }
    }

    @Test
    public void testFromPairsLastWins() {
        final AvlTree<Integer, String> tree = AvlTree.fromPairs(Arrays.asList(Pair.of(2, "b"), Pair.of(1, "a"), Pair.of(2, "c")));
        Assert.assertEquals(tree.size(), 2);
        Assert.assertEquals(tree.get(2), "c");
        Assert.assertEquals(tree.toString(), "[1: a,2: c]");
    }

    @Test
    public void testFromPairsWithCombiner() {
        final AvlTree<Integer, String> tree = AvlTree.fromPairs(Arrays.asList(Pair.of(1, "a"), Pair.of(1, "b")), String::concat);
        Assert.assertEquals(tree.get(1), "ab");
        Assert.assertEquals(tree.size(), 1);
    }

    @Test
    public void testCustomComparator() {
        final Comparator<String> descending = Comparator.reverseOrder();
        final AvlTree<String, Integer> tree = new AvlTree<>(descending);
        Assert.assertSame(tree.comparator(), descending);
        for (final String key : Arrays.asList("b", "a", "d", "c")) {
            tree.put(key, key.charAt(0) - 'a');
        }
        Assert.assertEquals(tree.toString(), "[d: 3,c: 2,b: 1,a: 0]");
        tree.checkInvariants();
    }

    @Test
    public void testEqualsAndHashCode() {
        final AvlTree<Integer, String> first = treeOf(1, 2, 3);
        final AvlTree<Integer, String> second = treeOf(3, 2, 1);
        Assert.assertEquals(first, second);
        Assert.assertEquals(first.hashCode(), second.hashCode());

        second.put(3, "other");
        Assert.assertNotEquals(first, second);
        second.remove(3);
        Assert.assertNotEquals(first, second);
        Assert.assertNotEquals(first, "[1: v1,2: v2,3: v3]");
        Assert.assertEquals(new AvlTree<Integer, String>(), new UnbalancedTree<Integer, String>());
    }

    @Test
    public void testIteratorPastEnd() {
        final Iterator<Pair<Integer, String>> iterator = treeOf(1).iterator();
        Assert.assertEquals(iterator.next(), Pair.of(1, "v1"));
        Assert.assertFalse(iterator.hasNext());
        Assert.assertThrows(NoSuchElementException.class, iterator::next);
    }

    @Test
    public void testClear() {
        final AvlTree<Integer, String> tree = treeOf(1, 2, 3);
        tree.clear();
        Assert.assertTrue(tree.isEmpty());
        Assert.assertNull(tree.get(2));
        tree.put(4, "v4");
        Assert.assertEquals(tree.toString(), "[4: v4]");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNullKeyRejected() {
        new AvlTree<Integer, String>().put(null, "a");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNullValueRejected() {
        new AvlTree<Integer, String>().put(1, null);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNullLookupRejected() {
        treeOf(1).get(null);
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testCheckInvariantsDetectsBrokenParentLink() {
        final AvlTree<Integer, String> tree = treeOf(2, 1, 3);
        tree.getRoot().getLeft().setParent(null);
        tree.checkInvariants();
    }
}
