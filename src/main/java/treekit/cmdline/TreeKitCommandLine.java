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

import htsjdk.samtools.util.StringUtil;
import org.broadinstitute.barclay.argparser.ClassFinder;
import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import treekit.TreeKitException;

import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.BiConsumer;
import java.util.stream.Collectors;

/**
 * Entry point for running the individual TreeKit command line programs.
 *
 * The first argument names the program (by simple class name); the remaining arguments are handed to that
 * program's own parser. Programs are discovered by scanning the packages in {@link #getPackageList()} for
 * concrete subclasses of {@link CommandLineProgram}.
 */
public class TreeKitCommandLine {
    private static String initializeColor(final String color) {
        return CommandLineDefaults.COLOR_STATUS ? color : "";
    }

    /** ANSI colors for terminal output. */
    private static final String KNRM = initializeColor("\u001B[0m");
    private static final String KRED = initializeColor("\u001B[31m");
    private static final String KGRN = initializeColor("\u001B[32m");
    private static final String KCYN = initializeColor("\u001B[36m");
    private static final String KWHT = initializeColor("\u001B[37m");
    private static final String KBLDRED = initializeColor("\u001B[1m\u001B[31m");

    private static final String COMMAND_LINE_NAME = TreeKitCommandLine.class.getSimpleName();
    private static final String RULE = "--------------------------------------------------------------------------------------\n";

    /** similarity floor for matching in printUnknown */
    private static final int HELP_SIMILARITY_FLOOR = 7;
    private static final int MINIMUM_SUBSTRING_LENGTH = 5;

    protected static List<String> getPackageList() {
        return Collections.singletonList("treekit");
    }

    public static void main(final String[] args) {
        System.exit(new TreeKitCommandLine().instanceMain(args));
    }

    protected int instanceMain(final String[] args, final List<String> packageList, final String commandLineName) {
        final CommandLineProgram program = extractCommandLineProgram(args, packageList, commandLineName);
        if (program == null) {
            return 1;
        }
        return program.instanceMain(Arrays.copyOfRange(args, 1, args.length));
    }

    /** For testing */
    protected int instanceMain(final String[] args) {
        return instanceMain(args, getPackageList(), COMMAND_LINE_NAME);
    }

    /** Returns the command line program named by the first argument, or prints usage and returns null. */
    private static CommandLineProgram extractCommandLineProgram(final String[] args, final List<String> packageList,
                                                                final String commandLineName) {
        final Map<String, Class<? extends CommandLineProgram>> programsByName = new HashMap<>();
        final List<String> missingAnnotationClasses = new ArrayList<>();
        processAllCommandLinePrograms(packageList, (clazz, properties) -> {
            if (properties == null) {
                missingAnnotationClasses.add(clazz.getSimpleName());
            } else if (!properties.omitFromCommandLine()) {
                if (programsByName.put(clazz.getSimpleName(), clazz) != null) {
                    throw new TreeKitException("Simple class name collision: " + clazz.getSimpleName());
                }
            }
        });
        if (!missingAnnotationClasses.isEmpty()) {
            throw new TreeKitException("The following classes are missing the required CommandLineProgramProperties annotation: " +
                    String.join(", ", missingAnnotationClasses));
        }

        if (args.length < 1 || args[0].equals("-h")) {
            printUsage(programsByName.values(), commandLineName, false);
        } else if (args[0].equals("--list-commands")) {
            printUsage(programsByName.values(), commandLineName, true);
        } else {
            final Class<? extends CommandLineProgram> clazz = programsByName.get(args[0]);
            if (clazz != null) {
                try {
                    return clazz.getDeclaredConstructor().newInstance();
                } catch (final ReflectiveOperationException e) {
                    throw new TreeKitException("Could not instantiate " + clazz.getSimpleName(), e);
                }
            }
            printUsage(programsByName.values(), commandLineName, false);
            printUnknown(programsByName.values(), args[0], commandLineName);
        }
        return null;
    }

    /**
     * Process each concrete {@code CommandLineProgram} class found in the given packages.
     * The {@code CommandLineProgramProperties} handed to the processor may be null.
     */
    @SuppressWarnings("unchecked")
    public static void processAllCommandLinePrograms(
            final List<String> packageList,
            final BiConsumer<Class<? extends CommandLineProgram>, CommandLineProgramProperties> clpClassProcessor) {
        final ClassFinder classFinder = new ClassFinder();
        packageList.forEach(pkg -> classFinder.find(pkg, CommandLineProgram.class));

        for (final Class<?> clazz : classFinder.getClasses()) {
            if (!clazz.isInterface() && !clazz.isSynthetic() && !clazz.isPrimitive() && !clazz.isLocalClass()
                    && !clazz.isAnonymousClass() && !Modifier.isAbstract(clazz.getModifiers())) {
                clpClassProcessor.accept((Class<? extends CommandLineProgram>) clazz,
                        clazz.getAnnotation(CommandLineProgramProperties.class));
            }
        }
    }

    private static void printUsage(final Iterable<Class<? extends CommandLineProgram>> classes,
                                   final String commandLineName, final boolean commandListOnly) {
        final StringBuilder builder = new StringBuilder();
        if (!commandListOnly) {
            builder.append(KBLDRED).append("USAGE: ").append(commandLineName).append(' ')
                    .append(KGRN).append("<program name>").append(KBLDRED).append(" [-h]\n\n").append(KNRM);
            builder.append(KBLDRED).append("Available Programs:\n").append(KNRM);
        }

        // Group programs by program group; one group instance per group class
        final Map<Class<? extends CommandLineProgramGroup>, CommandLineProgramGroup> groupInstances = new LinkedHashMap<>();
        final Map<CommandLineProgramGroup, List<Class<? extends CommandLineProgram>>> programsByGroup =
                new TreeMap<>(CommandLineProgramGroup.comparator);
        for (final Class<? extends CommandLineProgram> clazz : classes) {
            final CommandLineProgramProperties property = clazz.getAnnotation(CommandLineProgramProperties.class);
            final CommandLineProgramGroup group = groupInstances.computeIfAbsent(property.programGroup(), groupClass -> {
                try {
                    return groupClass.getDeclaredConstructor().newInstance();
                } catch (final ReflectiveOperationException e) {
                    throw new TreeKitException("Could not instantiate program group " + groupClass.getSimpleName(), e);
                }
            });
            programsByGroup.computeIfAbsent(group, g -> new ArrayList<>()).add(clazz);
        }

        for (final Map.Entry<CommandLineProgramGroup, List<Class<? extends CommandLineProgram>>> entry : programsByGroup.entrySet()) {
            final CommandLineProgramGroup group = entry.getKey();
            if (!commandListOnly) {
                builder.append(KWHT).append(RULE).append(KNRM);
                builder.append(String.format("%s%-48s %-45s%s\n", KRED, group.getName() + ":", group.getDescription(), KNRM));
            }
            final List<Class<? extends CommandLineProgram>> sorted = entry.getValue().stream()
                    .sorted(Comparator.comparing(Class::getSimpleName))
                    .collect(Collectors.toList());
            for (final Class<? extends CommandLineProgram> clazz : sorted) {
                if (commandListOnly) {
                    builder.append(clazz.getSimpleName()).append('\n');
                } else {
                    final CommandLineProgramProperties property = clazz.getAnnotation(CommandLineProgramProperties.class);
                    builder.append(String.format("%s    %-45s%s%s\n", KGRN, clazz.getSimpleName(), KCYN + property.oneLineSummary(), KNRM));
                }
            }
            if (!commandListOnly) {
                builder.append('\n');
            }
        }
        if (commandListOnly) {
            System.out.print(builder);
        } else {
            builder.append(KWHT).append(RULE).append('\n').append(KNRM);
            System.err.print(builder);
        }
    }

    /** When a command does not match any known command, searches for similar commands the way git does. */
    static void printUnknown(final Iterable<Class<? extends CommandLineProgram>> classes, final String command,
                             final String commandLineName) {
        final Map<String, Integer> distances = new TreeMap<>();
        int bestDistance = Integer.MAX_VALUE;
        int bestN = 0;

        for (final Class<?> clazz : classes) {
            final String name = clazz.getSimpleName();
            final int distance;
            if (name.startsWith(command) || (MINIMUM_SUBSTRING_LENGTH <= command.length() && name.contains(command))) {
                distance = 0;
            } else {
                distance = StringUtil.levenshteinDistance(command, name, 0, 2, 1, 4);
            }
            distances.put(name, distance);

            if (distance < bestDistance) {
                bestDistance = distance;
                bestN = 1;
            } else if (distance == bestDistance) {
                bestN++;
            }
        }

        // Everything matching is as good as nothing matching
        if (bestDistance == 0 && bestN == distances.size()) {
            bestDistance = HELP_SIMILARITY_FLOOR + 1;
        }

        System.err.println(String.format("'%s' is not a valid command. See %s -h for more information.", command, commandLineName));
        if (bestDistance < HELP_SIMILARITY_FLOOR) {
            System.err.println(String.format("Did you mean %s?", (bestN < 2) ? "this" : "one of these"));
            for (final Map.Entry<String, Integer> entry : distances.entrySet()) {
                if (entry.getValue() == bestDistance) {
                    System.err.println("        " + entry.getKey());
                }
            }
        }
    }
}
