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

import htsjdk.samtools.metrics.MetricBase;

/**
 * Counts gathered by {@link SortKeyValueFile} while loading records into a search tree.
 */
public class SearchTreeMetrics extends MetricBase {
    /** Number of key-value records read from the input, excluding blank and comment lines */
    public long RECORDS_READ;

    /** Number of records whose key was already present in the tree */
    public long DUPLICATE_KEYS;

    /** Number of REMOVE keys that were present and removed */
    public long REMOVED_KEYS;

    /** Number of REMOVE keys that were not present */
    public long MISSING_KEYS;

    /** Number of entries written to the output */
    public long ENTRIES;

    /** Height of the tree after loading and removal */
    public int TREE_HEIGHT;
}
