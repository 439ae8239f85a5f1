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
package treekit.util;

import htsjdk.samtools.util.RuntimeIOException;
import org.broadinstitute.barclay.utils.Utils;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Utility for loading properties files from resources.
 */
public final class PropertyUtils {

    private PropertyUtils() {}

    /**
     * Attempt to load a Properties object from an on-disk properties file.
     * @param propertyFilePath name of the properties file to load. Must have a .properties extension
     * @param clazz class used to obtain a class loader to use to locate the properties file
     * @return null if the file doesn't exist, otherwise a Properties object
     */
    public static Properties loadPropertiesFile(final String propertyFilePath, final Class<?> clazz) {
        Utils.nonNull(propertyFilePath);
        Utils.nonNull(clazz);

        try (final InputStream inputStream = clazz.getClassLoader().getResourceAsStream(propertyFilePath)) {
            if (inputStream == null) {
                return null;
            }
            final Properties properties = new Properties();
            properties.load(inputStream);
            return properties;
        } catch (final IOException ex) {
            throw new RuntimeIOException(String.format("IOException loading properties file %s", propertyFilePath), ex);
        }
    }
}
