package dev.dimitra.reviewbot.config;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Reads settings from environment variables. The lookup is swappable so tests can pass a plain map.
 */
public final class EnvConfig {
    private final Function<String, String> lookup;

    public EnvConfig(Function<String, String> lookup) {
        this.lookup = Objects.requireNonNull(lookup, "lookup");
    }

    public static EnvConfig system() {
        return new EnvConfig(System::getenv);
    }

    public static EnvConfig of(Map<String, String> values) {
        return new EnvConfig(values::get);
    }

    /** Value of {@code key}, or {@code def} when missing or blank. */
    public String env(String key, String def) {
        String v = lookup.apply(key);
        if (v == null || v.isBlank()) return def;
        return v.trim();
    }

    /** Value of {@code key}, or null when missing or blank. */
    public String optional(String key) {
        return env(key, null);
    }

    public int intEnv(String key, int def) {
        String v = optional(key);
        if (v == null) return def;
        try { return Integer.parseInt(v); }
        catch (NumberFormatException e) { return def; }
    }

    public double doubleEnv(String key, double def) {
        String v = optional(key);
        if (v == null) return def;
        try { return Double.parseDouble(v); }
        catch (NumberFormatException e) { return def; }
    }

    public boolean boolEnv(String key, boolean def) {
        String v = optional(key);
        if (v == null) return def;
        return v.equalsIgnoreCase("true") || v.equalsIgnoreCase("1") || v.equalsIgnoreCase("yes");
    }
}
