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
package treekit.cmdline;

import org.testng.Assert;
import org.testng.annotations.Test;
import treekit.tree.SortKeyValueFile;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class TreeKitCommandLineTest {

    @Test
    public void testNoArgumentsPrintsUsage() {
        final String stderr = captureStderr(() -> Assert.assertEquals(new TreeKitCommandLine().instanceMain(new String[0]), 1));
        Assert.assertTrue(stderr.contains("USAGE: TreeKitCommandLine"), stderr);
        Assert.assertTrue(stderr.contains("SortKeyValueFile"), stderr);
    }

    @Test
    public void testListCommands() {
        final PrintStream stdout = System.out;
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        System.setOut(new PrintStream(bytes, true));
        try {
            Assert.assertEquals(new TreeKitCommandLine().instanceMain(new String[]{"--list-commands"}), 1);
        } finally {
            System.setOut(stdout);
        }
        Assert.assertTrue(bytes.toString().contains(SortKeyValueFile.class.getSimpleName()));
    }

    @Test
    public void testUnknownCommandSuggestsCloseMatch() {
        final String stderr = captureStderr(() -> Assert.assertEquals(new TreeKitCommandLine().instanceMain(new String[]{"SortKeyValueFiles"}), 1));
        Assert.assertTrue(stderr.contains("'SortKeyValueFiles' is not a valid command."), stderr);
        Assert.assertTrue(stderr.contains("Did you mean this?"), stderr);
    }

    @Test
    public void testAllProgramsAreAnnotated() {
        final List<String> programs = new ArrayList<>();
        TreeKitCommandLine.processAllCommandLinePrograms(TreeKitCommandLine.getPackageList(), (clazz, properties) -> {
            Assert.assertNotNull(properties, clazz.getSimpleName());
            programs.add(clazz.getSimpleName());
        });
        Assert.assertTrue(programs.contains(SortKeyValueFile.class.getSimpleName()), programs.toString());
    }

    private static String captureStderr(final Runnable runnable) {
        final PrintStream stderr = System.err;
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        System.setErr(new PrintStream(bytes, true));
        try {
            runnable.run();
        } finally {
            System.setErr(stderr);
        }
        return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
    }
}
