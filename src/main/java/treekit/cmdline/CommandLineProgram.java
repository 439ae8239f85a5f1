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

import htsjdk.samtools.metrics.Header;
import htsjdk.samtools.metrics.MetricBase;
import htsjdk.samtools.metrics.MetricsFile;
import htsjdk.samtools.metrics.StringHeader;
import htsjdk.samtools.util.Log;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.ArgumentCollection;
import org.broadinstitute.barclay.argparser.CommandLineArgumentParser;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineParser;
import org.broadinstitute.barclay.argparser.CommandLineParserOptions;
import org.broadinstitute.barclay.argparser.LegacyCommandLineArgumentParser;
import org.broadinstitute.barclay.argparser.SpecialArgumentsCollection;
import treekit.util.PropertyUtils;

import java.text.DecimalFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.EnumSet;
import java.util.List;
import java.util.Properties;

/**
 * Base class for TreeKit command line programs.
 *
 * A program extends this class, carries a {@code @CommandLineProgramProperties} annotation and declares its
 * options as public fields annotated with {@code @Argument}. {@link #instanceMain(String[])} parses the
 * arguments into those fields, runs {@link #customCommandLineValidation()}, and then calls {@link #doWork()},
 * whose return value is the exit status. Unchecked exceptions thrown by {@code doWork()} reach the caller.
 */
public abstract class CommandLineProgram {
    static final String TREEKIT_CMDLINE_PROPERTIES_FILE = "treekit/treekitCmdLine.properties";
    static final String PROPERTY_USE_LEGACY_PARSER = "treekit.useLegacyParser";

    // resolved once per JVM
    private static Boolean useLegacyParser;

    @Argument(doc = "Control verbosity of logging.", common = true)
    public Log.LogLevel VERBOSITY = Log.LogLevel.INFO;

    @Argument(doc = "Whether to suppress job-summary info on System.err.", common = true)
    public Boolean QUIET = false;

    // --help, --version and --arguments_file; the legacy parser handles these itself
    @ArgumentCollection(doc = "Special arguments that have meaning to the argument parsing system.")
    public Object specialArgumentsCollection = useLegacyParser(getClass()) ? new Object() : new SpecialArgumentsCollection();

    private CommandLineParser commandLineParser;

    private final List<Header> defaultHeaders = new ArrayList<>();

    private String commandLine;

    /**
     * Does the work once the arguments have been parsed and validated.
     * @return program exit status.
     */
    protected abstract int doWork();

    /**
     * Parses {@code argv}, runs the program and returns its exit status, or 1 when the arguments are invalid.
     */
    public int instanceMain(final String[] argv) {
        if (!parseArgs(argv)) {
            return 1;
        }

        final Date startDate = new Date();
        defaultHeaders.add(new StringHeader(commandLine));
        defaultHeaders.add(new StringHeader("Started on: " + startDate));
        Log.setGlobalLogLevel(VERBOSITY);

        if (!QUIET) {
            printStartBanner(startDate);
        }
        try {
            return doWork();
        } finally {
            if (!QUIET) {
                printElapsedTime(startDate);
            }
        }
    }

    private void printStartBanner(final Date startDate) {
        System.err.println("[" + startDate + "] " + commandLine);
        System.err.println(String.format("[%s] Executing as %s on %s %s %s; %s %s; TreeKit version: %s",
                startDate, System.getProperty("user.name"),
                System.getProperty("os.name"), System.getProperty("os.version"), System.getProperty("os.arch"),
                System.getProperty("java.vm.name"), System.getProperty("java.runtime.version"),
                getVersion()));
    }

    private void printElapsedTime(final Date startDate) {
        final Date endDate = new Date();
        final double elapsedMinutes = (endDate.getTime() - startDate.getTime()) / (1000d * 60d);
        System.err.println("[" + endDate + "] " + getClass().getName() + " done. Elapsed time: " +
                new DecimalFormat("#,##0.00").format(elapsedMinutes) + " minutes.");
    }

    /**
     * Override to check option combinations the parser cannot express. Called after the fields have been set.
     * @return null when the command line is valid, otherwise the messages to report.
     */
    protected String[] customCommandLineValidation() {
        return null;
    }

    /**
     * Parses the arguments into this program's fields, printing usage and the problem to System.err on failure.
     * @return true if the command line is valid
     */
    protected boolean parseArgs(final String[] argv) {
        final CommandLineParser parser = getCommandLineParser();

        boolean parsed;
        try {
            parsed = parser.parseArguments(System.err, argv);
        } catch (final CommandLineException e) {
            System.err.println(parser.usage(false, false));
            System.err.println(e.getMessage());
            parsed = false;
        }
        commandLine = parser.getCommandLine();
        if (!parsed) {
            return false;
        }

        final String[] errors = customCommandLineValidation();
        if (errors == null) {
            return true;
        }
        System.err.print(parser.usage(false, false));
        for (final String error : errors) {
            System.err.println(error);
        }
        return false;
    }

    /** Returns an empty MetricsFile carrying this run's command line and start time as headers. */
    protected <A extends MetricBase, B extends Comparable<?>> MetricsFile<A, B> getMetricsFile() {
        final MetricsFile<A, B> file = new MetricsFile<>();
        defaultHeaders.forEach(file::addHeader);
        return file;
    }

    public CommandLineParser getCommandLineParser() {
        if (commandLineParser == null) {
            commandLineParser = useLegacyParser(getClass())
                    ? new LegacyCommandLineArgumentParser(this)
                    : new CommandLineArgumentParser(this, Collections.emptyList(),
                            EnumSet.of(CommandLineParserOptions.APPEND_TO_COLLECTIONS));
        }
        return commandLineParser;
    }

    /**
     * Whether to parse NAME=value style arguments instead of --NAME value.
     *
     * Read from the "treekit.useLegacyParser" system property, falling back to the same key in the
     * treekitCmdLine.properties resource. Defaults to false.
     */
    public static boolean useLegacyParser(final Class<?> clazz) {
        if (useLegacyParser == null) {
            String value = System.getProperty(PROPERTY_USE_LEGACY_PARSER);
            if (value == null) {
                final Properties props = PropertyUtils.loadPropertiesFile(TREEKIT_CMDLINE_PROPERTIES_FILE, clazz);
                if (props != null) {
                    value = props.getProperty(PROPERTY_USE_LEGACY_PARSER);
                }
            }
            useLegacyParser = Boolean.parseBoolean(value);
        }
        return useLegacyParser;
    }

    /** @return the version from the jar manifest */
    public String getVersion() {
        return getCommandLineParser().getVersion();
    }

    public String getCommandLine() {
        return commandLine;
    }
}
