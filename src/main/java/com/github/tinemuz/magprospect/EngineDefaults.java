/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.magprospect;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Engine-wide default settings.
 *
 * <p>Defaults are read once from the classpath resource
 * <code>magprospect-defaults.properties</code> and are used to seed the
 * builders of the settings objects ({@code EulerSettings}, {@code InversionConfig},
 * {@code CombinerSettings}). Callers may override any value on the builders;
 * nothing here is mutable after the first load.</p>
 */
public final class EngineDefaults {
    private static final Logger log = LoggerFactory.getLogger(EngineDefaults.class);
    static final String RESOURCE = "magprospect-defaults.properties";

    private static volatile boolean loaded = false;
    private static Properties values;

    private EngineDefaults() {}

    /**
     * Numeric default for {@code key}.
     *
     * @throws IllegalStateException if the resource cannot be loaded or the key
     *     is missing or not a number
     */
    public static double getDouble(String key) {
        String raw = raw(key);
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            log.error("Default '{}' is not a number: '{}'", key, raw);
            throw new IllegalStateException("Default '" + key + "' is not a number: " + raw, e);
        }
    }

    /** Integer default for {@code key}. */
    public static int getInt(String key) {
        String raw = raw(key);
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            log.error("Default '{}' is not an integer: '{}'", key, raw);
            throw new IllegalStateException("Default '" + key + "' is not an integer: " + raw, e);
        }
    }

    /** Long default for {@code key}. */
    public static long getLong(String key) {
        String raw = raw(key);
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            log.error("Default '{}' is not an integer: '{}'", key, raw);
            throw new IllegalStateException("Default '" + key + "' is not an integer: " + raw, e);
        }
    }

    /**
     * Load the defaults now. Useful at startup to surface a missing or broken
     * resource early instead of on the first computation.
     */
    public static void preload() {
        ensureLoaded();
    }

    private static String raw(String key) {
        ensureLoaded();
        String raw = values.getProperty(key);
        if (raw == null) {
            log.error("Default '{}' missing from {}", key, RESOURCE);
            throw new IllegalStateException("Default '" + key + "' missing from " + RESOURCE);
        }
        return raw.trim();
    }

    private static synchronized void ensureLoaded() {
        if (loaded) return;
        values = loadFromResource();
        loaded = true;
    }

    private static Properties loadFromResource() {
        InputStream in = EngineDefaults.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            log.error("Defaults file '{}' not found on classpath", RESOURCE);
            throw new IllegalStateException("Defaults file '" + RESOURCE + "' not found on classpath");
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            Properties props = new Properties();
            props.load(reader);
            log.debug("Loaded {} engine defaults from {}", props.size(), RESOURCE);
            return props;
        } catch (IOException e) {
            log.error("Failed to read defaults file", e);
            throw new IllegalStateException("Failed to read defaults file " + RESOURCE, e);
        } catch (IllegalArgumentException e) {
            log.error("Failed to parse defaults file", e);
            throw new IllegalStateException("Failed to parse defaults file " + RESOURCE, e);
        }
    }
}
