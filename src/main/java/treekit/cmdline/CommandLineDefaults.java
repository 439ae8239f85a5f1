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

/**
 * Command line defaults, read from system properties prefixed with "treekit.cmdline.".
 */
public class CommandLineDefaults {

    /**
     * Decides if we want to write colors to the terminal.
     */
    public static final boolean COLOR_STATUS;

    static {
        COLOR_STATUS = getBooleanProperty("color_status", true);
    }

    private CommandLineDefaults() {}

    /** Gets a boolean system property, prefixed with "treekit.cmdline." using the default if the property does not exist. */
    private static boolean getBooleanProperty(final String name, final boolean def) {
        return Boolean.parseBoolean(System.getProperty("treekit.cmdline." + name, Boolean.toString(def)));
    }
}
