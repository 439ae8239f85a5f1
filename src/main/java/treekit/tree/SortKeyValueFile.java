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

import htsjdk.samtools.metrics.MetricsFile;
import htsjdk.samtools.util.IOUtil;
import htsjdk.samtools.util.Log;
import htsjdk.samtools.util.RuntimeIOException;
import org.apache.commons.lang3.tuple.Pair;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineParser;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import treekit.TreeKitException;
import treekit.cmdline.CommandLineProgram;
import treekit.cmdline.StandardOptionDefinitions;
import treekit.cmdline.programgroups.SortedCollectionsProgramGroup;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Loads a tab-delimited key-value file into an {@link AvlTree} and writes the entries back out in key order.
 *
 * <h3>Input</h3>
 * One record per line, {@code key<TAB>value}. The value is everything after the first tab and may be empty.
 * Blank lines and lines starting with '#' are skipped.
 *
 * <h3>Usage example</h3>
 * <pre>
 * java -jar treekit.jar SortKeyValueFile \
 *      -I input.tsv \
 *      -O sorted.tsv \
 *      --KEY_ORDER NUMERIC \
 *      --DUPLICATE_POLICY CONCATENATE \
 *      --SEPARATOR ,
 * </pre>
 */
@CommandLineProgramProperties(
        summary = SortKeyValueFile.USAGE_SUMMARY + SortKeyValueFile.USAGE_DETAILS,
        oneLineSummary = SortKeyValueFile.USAGE_SUMMARY,
        programGroup = SortedCollectionsProgramGroup.class
)
public class SortKeyValueFile extends CommandLineProgram {
    static final String USAGE_SUMMARY = "Sorts a tab-delimited key-value file by key.";
    static final String USAGE_DETAILS = "  Records are loaded into a height-balanced search tree, duplicate keys are resolved " +
            "according to DUPLICATE_POLICY, the keys named by REMOVE are deleted, and the remaining entries are written " +
            "to OUTPUT in ascending key order.";

    private static final Log log = Log.getInstance(SortKeyValueFile.class);

    private static final char DELIMITER = '\t';
    private static final String COMMENT_PREFIX = "#";

    public enum KeyOrder implements CommandLineParser.ClpEnum {
        LEXICOGRAPHIC("Keys are compared as strings.", Comparator.naturalOrder()),
        NUMERIC("Keys are parsed as integers and compared numerically.", Comparator.comparingLong(Long::parseLong));

        private final String description;
        private final Comparator<String> comparator;

        KeyOrder(final String description, final Comparator<String> comparator) {
            this.description = description;
            this.comparator = comparator;
        }

        public Comparator<String> getComparator() {
            return comparator;
        }

        /** Returns true if the key can be ordered under this key order. */
        public boolean accepts(final String key) {
            if (this == LEXICOGRAPHIC) {
                return true;
            }
            try {
                Long.parseLong(key);
                return true;
            } catch (final NumberFormatException e) {
                return false;
            }
        }

        @Override
        public String getHelpDoc() {
            return description;
        }
    }

    public enum DuplicatePolicy implements CommandLineParser.ClpEnum {
        LAST_WINS("The value of the last record with a given key is kept."),
        FIRST_WINS("The value of the first record with a given key is kept."),
        CONCATENATE("Values of records with the same key are joined with SEPARATOR, in input order."),
        FAIL("A repeated key is an error.");

        private final String description;

        DuplicatePolicy(final String description) {
            this.description = description;
        }

        @Override
        public String getHelpDoc() {
            return description;
        }
    }

    @Argument(shortName = StandardOptionDefinitions.INPUT_SHORT_NAME, doc = "Tab-delimited key-value file to sort.")
    public File INPUT;

    @Argument(shortName = StandardOptionDefinitions.OUTPUT_SHORT_NAME, doc = "Output file of key-value records in ascending key order.")
    public File OUTPUT;

    @Argument(doc = "How keys are compared.")
    public KeyOrder KEY_ORDER = KeyOrder.LEXICOGRAPHIC;

    @Argument(doc = "What to do when a key appears more than once in INPUT.")
    public DuplicatePolicy DUPLICATE_POLICY = DuplicatePolicy.LAST_WINS;

    @Argument(doc = "Placed between joined values when DUPLICATE_POLICY is CONCATENATE.")
    public String SEPARATOR = "";

    @Argument(doc = "Key to remove after loading. May be specified more than once. Keys that are not present are counted, not reported as errors.",
            optional = true)
    public List<String> REMOVE = new ArrayList<>();

    @Argument(shortName = StandardOptionDefinitions.METRICS_FILE_SHORT_NAME, doc = "Optional file to write a SearchTreeMetrics row to.",
            optional = true)
    public File METRICS_FILE;

    @Override
    protected String[] customCommandLineValidation() {
        final List<String> errors = new ArrayList<>();
        for (final String key : REMOVE) {
            if (!KEY_ORDER.accepts(key)) {
                errors.add("REMOVE key '" + key + "' cannot be ordered with KEY_ORDER " + KEY_ORDER);
            }
        }
        return errors.isEmpty() ? null : errors.toArray(new String[0]);
    }

    @Override
    protected int doWork() {
        IOUtil.assertFileIsReadable(INPUT);
        IOUtil.assertFileIsWritable(OUTPUT);
        if (METRICS_FILE != null) {
            IOUtil.assertFileIsWritable(METRICS_FILE);
        }

        final SearchTreeMetrics metrics = new SearchTreeMetrics();
        final AvlTree<String, String> tree = load(metrics);

        for (final String key : REMOVE) {
            if (tree.remove(key) != null) {
                metrics.REMOVED_KEYS++;
            } else {
                metrics.MISSING_KEYS++;
            }
        }
        log.info("Removed " + metrics.REMOVED_KEYS + " keys; " + metrics.MISSING_KEYS + " requested keys were not present.");

        try (final BufferedWriter out = IOUtil.openFileForBufferedWriting(OUTPUT)) {
            for (final Pair<String, String> entry : tree) {
                out.write(entry.getKey());
                out.write(DELIMITER);
                out.write(entry.getValue());
                out.newLine();
                metrics.ENTRIES++;
            }
        } catch (final IOException e) {
            throw new RuntimeIOException("Error writing " + OUTPUT.getAbsolutePath(), e);
        }
        metrics.TREE_HEIGHT = tree.height();
        log.info("Wrote " + metrics.ENTRIES + " entries; tree height " + metrics.TREE_HEIGHT + ".");

        if (METRICS_FILE != null) {
            final MetricsFile<SearchTreeMetrics, Integer> metricsFile = getMetricsFile();
            metricsFile.addMetric(metrics);
            metricsFile.write(METRICS_FILE);
        }
        return 0;
    }

    private AvlTree<String, String> load(final SearchTreeMetrics metrics) {
        final AvlTree<String, String> tree = new AvlTree<>(KEY_ORDER.getComparator());
        try (final BufferedReader in = IOUtil.openFileForBufferedReading(INPUT)) {
            int lineNumber = 0;
            String line;
            while ((line = in.readLine()) != null) {
                lineNumber++;
                if (line.isEmpty() || line.startsWith(COMMENT_PREFIX)) {
                    continue;
                }
                final int tab = line.indexOf(DELIMITER);
                if (tab <= 0) {
                    throw new TreeKitException(String.format("Malformed record at %s:%d, expected key<TAB>value: %s",
                            INPUT.getName(), lineNumber, line));
                }
                final String key = line.substring(0, tab);
                final String value = line.substring(tab + 1);
                if (!KEY_ORDER.accepts(key)) {
                    throw new TreeKitException(String.format("Key '%s' at %s:%d cannot be ordered with KEY_ORDER %s",
                            key, INPUT.getName(), lineNumber, KEY_ORDER));
                }
                metrics.RECORDS_READ++;
                addRecord(tree, key, value, lineNumber, metrics);
            }
        } catch (final IOException e) {
            throw new RuntimeIOException("Error reading " + INPUT.getAbsolutePath(), e);
        }
        log.info("Read " + metrics.RECORDS_READ + " records with " + metrics.DUPLICATE_KEYS + " duplicate keys from " + INPUT.getName() + ".");
        return tree;
    }

    private void addRecord(final AvlTree<String, String> tree, final String key, final String value,
                           final int lineNumber, final SearchTreeMetrics metrics) {
        final String existing = tree.get(key);
        if (existing == null) {
            tree.put(key, value);
            return;
        }
        metrics.DUPLICATE_KEYS++;
        switch (DUPLICATE_POLICY) {
            case LAST_WINS:
                tree.put(key, value);
                break;
            case FIRST_WINS:
                break;
            case CONCATENATE:
                tree.put(key, existing + SEPARATOR + value);
                break;
            case FAIL:
                throw new TreeKitException(String.format("Duplicate key '%s' at %s:%d", key, INPUT.getName(), lineNumber));
            default:
                throw new IllegalStateException("Unknown duplicate policy " + DUPLICATE_POLICY);
        }
    }
}
