package org.opensase.upo.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Environment lookups with defaulting and clamping. Every method takes the environment as
 * a map so tests can pass their own instead of {@link System#getenv()}.
 */
public final class EnvVars {

    private static final Logger log = LoggerFactory.getLogger(EnvVars.class);

    private EnvVars() {
    }

    public static String getOrDefault(Map<String, String> env, String name, String defaultValue) {
        String v = env.get(name);
        return (v == null || v.isBlank()) ? defaultValue : v.trim();
    }

    public static boolean getBoolean(Map<String, String> env, String name, boolean defaultValue) {
        String v = env.get(name);
        if (v == null || v.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(v.trim());
    }

    public static int getIntClamped(Map<String, String> env, String name, int defaultValue, int min, int max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            if (parsed < min) return min;
            return Math.min(parsed, max);
        } catch (NumberFormatException e) {
            log.warn("{}='{}' is not an integer, using {}", name, raw, defaultValue);
            return defaultValue;
        }
    }

    /** Comma-separated list with blanks dropped; empty when unset. */
    public static List<String> getList(Map<String, String> env, String name) {
        String raw = env.get(name);
        List<String> out = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return out;
        }
        for (String part : raw.split(",")) {
            if (!part.isBlank()) {
                out.add(part.trim());
            }
        }
        return out;
    }
}
