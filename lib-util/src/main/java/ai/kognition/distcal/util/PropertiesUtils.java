/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.distcal.util;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Enumeration;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Helpers for reading sectioned {@link Properties}. A section is every key sharing
 * a dotted prefix, for example {@code grid.pitch} and {@code grid.offset.x} are in
 * the {@code grid} section.
 */
public class PropertiesUtils {
    private static final Logger LOGGER = LoggerFactory.getLogger(PropertiesUtils.class);

    public static final String separator = ".";

    public static Properties getSection(final Properties props, final String sectionName, final boolean removeSectionName) {
        final Properties ret = new Properties();

        for(final Enumeration<?> e = props.propertyNames(); e.hasMoreElements();) {
            final String key = (String)(e.nextElement());
            if(key.startsWith(sectionName + separator)) {
                final String newkey = removeSectionName ? key.substring(sectionName.length() + 1) : key;

                ret.setProperty(newkey, props.getProperty(key));
            } else if(key.equals(sectionName) && !removeSectionName) {
                ret.setProperty(key, props.getProperty(key));
            }
        }

        return ret;
    }

    /**
     * Load the properties file at {@code fname} on top of whatever is already in {@code p}.
     */
    public static Properties loadProps(final Properties p, final String fname) throws IOException {
        try(InputStream is = new FileInputStream(fname);) {
            p.load(is);
        }
        LOGGER.debug("Loaded {} properties from \"{}\"", p.size(), fname);
        return p;
    }

    /**
     * Load a properties resource from the classpath.
     *
     * @throws FileNotFoundException if the resource isn't on the classpath.
     */
    public static Properties loadResource(final String resource) throws IOException {
        final Properties ret = new Properties();
        try(InputStream is = PropertiesUtils.class.getClassLoader().getResourceAsStream(resource);) {
            if(is == null)
                throw new FileNotFoundException("Couldn't find the properties resource \"" + resource + "\" on the classpath.");
            ret.load(is);
        }
        return ret;
    }

    /**
     * Returns a new {@link Properties} containing {@code defaults} with every entry
     * in {@code overrides} layered on top. Neither argument is modified.
     */
    public static Properties overlay(final Properties defaults, final Properties overrides) {
        final Properties ret = new Properties();
        for(final String key: defaults.stringPropertyNames())
            ret.setProperty(key, defaults.getProperty(key));
        for(final String key: overrides.stringPropertyNames())
            ret.setProperty(key, overrides.getProperty(key));
        return ret;
    }

    public static String getRequired(final Properties props, final String key) {
        final String val = props.getProperty(key);
        if(val == null || val.trim().length() == 0)
            throw new IllegalArgumentException("Missing required property \"" + key + "\"");
        return val.trim();
    }

    public static double getDouble(final Properties props, final String key) {
        final String val = getRequired(props, key);
        try {
            return Double.parseDouble(val);
        } catch(final NumberFormatException nfe) {
            throw new IllegalArgumentException("The property \"" + key + "\" must be a number but was \"" + val + "\"", nfe);
        }
    }

    public static int getInt(final Properties props, final String key) {
        final String val = getRequired(props, key);
        try {
            return Integer.parseInt(val);
        } catch(final NumberFormatException nfe) {
            throw new IllegalArgumentException("The property \"" + key + "\" must be an integer but was \"" + val + "\"", nfe);
        }
    }
}
