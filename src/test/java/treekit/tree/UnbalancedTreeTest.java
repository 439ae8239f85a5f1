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
import java.util.List;
import java.util.Random;
import java.util.TreeMap;

public class UnbalancedTreeTest {

    @Test
    public void testAscendingInsertDegenerates() {
        final UnbalancedTree<Integer, Integer> tree = new UnbalancedTree<>();
        for (int i = 1; i <= 7; i++) {
            Assert.assertNull(tree.put(i, i));
        }
        Assert.assertEquals(tree.height(), 7);
        Assert.assertEquals(tree.size(), 7);
        Assert.assertEquals(tree.getRoot().getKey(), Integer.valueOf(1));
        Assert.assertEquals(TreeNodes.rightMost(tree.getRoot()).getKey(), Integer.valueOf(7));
    }

    @Test
    public void testPutGetOverwrite() {
        final UnbalancedTree<String, String> tree = new UnbalancedTree<>();
        tree.put("m", "1");
        tree.put("c", "2");
        tree.put("x", "3");
        Assert.assertEquals(tree.put("c", "4"), "2");
        Assert.assertEquals(tree.get("c"), "4");
        Assert.assertNull(tree.get("d"));
        Assert.assertEquals(tree.toString(), "[c: 4,m: 1,x: 3]");
    }

    @DataProvider(name = "removals")
    public Object[][] removals() {
        return new Object[][]{
                // leaf, one child, two children, root, absent
                {3, Arrays.asList(1, 4, 5, 7, 8, 9)},
                {1, Arrays.asList(3, 4, 5, 7, 8, 9)},
                {8, Arrays.asList(1, 3, 4, 5, 7, 9)},
                {5, Arrays.asList(1, 3, 4, 7, 8, 9)},
                {6, Arrays.asList(1, 3, 4, 5, 7, 8, 9)},
        };
    }

    @Test(dataProvider = "removals")
    public void testRemove(final int key, final List<Integer> expectedKeys) {
        final UnbalancedTree<Integer, String> tree = UnbalancedTree.fromPairs(Arrays.asList(
                Pair.of(5, "e"), Pair.of(3, "c"), Pair.of(8, "h"), Pair.of(1, "a"), Pair.of(4, "d"),
                Pair.of(7, "g"), Pair.of(9, "i")));
        tree.remove(3);
        tree.put(3, "c");
        final boolean present = tree.containsKey(key);
        Assert.assertEquals(tree.remove(key) != null, present);
        final List<Integer> keys = new ArrayList<>();
        tree.forEach(entry -> keys.add(entry.getKey()));
        Assert.assertEquals(keys, expectedKeys);
    }

    @Test
    public void testRemoveRoot() {
        final UnbalancedTree<Integer, String> tree = UnbalancedTree.fromPairs(Arrays.asList(Pair.of(1, "a"), Pair.of(2, "b")));
        Assert.assertEquals(tree.remove(1), "a");
        Assert.assertEquals(tree.getRoot().getKey(), Integer.valueOf(2));
        Assert.assertNull(tree.getRoot().getLeft());
        Assert.assertEquals(tree.remove(2), "b");
        Assert.assertTrue(tree.isEmpty());
    }

    @Test
    public void testRandomAgainstTreeMap() {
        final Random random = new Random(17);
        final UnbalancedTree<Integer, Integer> tree = new UnbalancedTree<>();
        final TreeMap<Integer, Integer> expected = new TreeMap<>();
        for (int i = 0; i < 2000; i++) {
            final int key = random.nextInt(200);
            if (random.nextBoolean()) {
                Assert.assertEquals(tree.put(key, i), expected.put(key, i));
            } else {
                Assert.assertEquals(tree.remove(key), expected.remove(key));
            }
        }
        final List<Integer> keys = new ArrayList<>();
        tree.forEach(entry -> keys.add(entry.getKey()));
        Assert.assertEquals(keys, new ArrayList<>(expected.keySet()));
        Assert.assertEquals(tree.size(), expected.size());
    }

    @Test
    public void testFromPairsWithCombiner() {
        final List<Pair<String, Integer>> pairs = new ArrayList<>();
        for (final String word : Arrays.asList("b", "a", "b", "c", "b")) {
            pairs.add(Pair.of(word, 1));
        }
        final UnbalancedTree<String, Integer> counts = UnbalancedTree.fromPairs(pairs, Integer::sum);
        Assert.assertEquals(counts.toString(), "[a: 1,b: 3,c: 1]");
    }
}
