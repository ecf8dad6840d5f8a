package io.github.hide212131.rayskillkit.infra.config;

import io.github.cdimascio.dotenv.Dotenv;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 環境変数を優先し、未設定の場合のみ .env をフォールバックしてランタイム設定を解決する。
 */
public final class RuntimeConfigLoader {

    public static final String ENV_SKILLS_DEFINITION = "RAYSKILLKIT_SKILLS_DEFINITION";
    public static final String ENV_TELEMETRY_DIR = "RAYSKILLKIT_TELEMETRY_DIR";
    public static final String ENV_TELEMETRY_SAMPLING = "RAYSKILLKIT_TELEMETRY_SAMPLING";
    public static final String ENV_TELEMETRY_DEFAULT_RATE = "RAYSKILLKIT_TELEMETRY_DEFAULT_RATE";
    public static final String ENV_IDLE = "RAYSKILLKIT_IDLE";
    public static final String ENV_RELEASE_PUBLIC_KEY = "RAYSKILLKIT_RELEASE_PUBLIC_KEY";
    public static final String ENV_OTLP_ENDPOINT = "RAYSKILLKIT_OTLP_ENDPOINT";

    private final Map<String, String> environment;
    private final Dotenv dotenv;

    public RuntimeConfigLoader() {
        this(System.getenv(), Dotenv.configure().ignoreIfMalformed().ignoreIfMissing().load());
    }

    RuntimeConfigLoader(Map<String, String> environment, Dotenv dotenv) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
        this.dotenv = Objects.requireNonNull(dotenv, "dotenv");
    }

    public RuntimeConfig load() {
        String definition = resolve(ENV_SKILLS_DEFINITION);
        String telemetryDir = resolve(ENV_TELEMETRY_DIR);
        return new RuntimeConfig(
                definition == null ? null : toPath(ENV_SKILLS_DEFINITION, definition),
                telemetryDir == null ? defaultTelemetryDirectory() : toPath(ENV_TELEMETRY_DIR, telemetryDir),
                parseSamplingRules(resolve(ENV_TELEMETRY_SAMPLING)),
                parseRate(ENV_TELEMETRY_DEFAULT_RATE, resolve(ENV_TELEMETRY_DEFAULT_RATE), 1.0),
                parseBoolean(ENV_IDLE, resolve(ENV_IDLE)),
                resolve(ENV_RELEASE_PUBLIC_KEY),
                resolve(ENV_OTLP_ENDPOINT));
    }

    static Path defaultTelemetryDirectory() {
        return Path.of(System.getProperty("java.io.tmpdir"), "rayskillkit-telemetry");
    }

    /** {@code "share_in=1.0, router=0.25"} */
    static Map<String, Double> parseSamplingRules(String value) {
        Map<String, Double> rules = new LinkedHashMap<>();
        if (value == null) {
            return rules;
        }
        for (String entry : value.split(",")) {
            if (entry.isBlank()) {
                continue;
            }
            int separator = entry.indexOf('=');
            if (separator <= 0) {
                throw new IllegalStateException(
                        ENV_TELEMETRY_SAMPLING + " の形式が不正です (prefix=rate): " + entry.trim());
            }
            String prefix = entry.substring(0, separator).trim();
            rules.put(prefix, parseRate(ENV_TELEMETRY_SAMPLING, entry.substring(separator + 1).trim(), 1.0));
        }
        return rules;
    }

    private static double parseRate(String key, String value, double defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        double rate;
        try {
            rate = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " は数値である必要があります: " + value, e);
        }
        if (Double.isNaN(rate) || rate < 0.0 || rate > 1.0) {
            throw new IllegalStateException(key + " は 0 から 1 の範囲で指定してください: " + value);
        }
        return rate;
    }

    private static boolean parseBoolean(String key, String value) {
        if (value == null) {
            return false;
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> throw new IllegalStateException(key + " は true/false で指定してください: " + value);
        };
    }

    private static Path toPath(String key, String value) {
        try {
            return Path.of(value);
        } catch (InvalidPathException e) {
            throw new IllegalStateException(key + " のパスが不正です: " + value, e);
        }
    }

    private String resolve(String key) {
        String value = environment.containsKey(key) ? environment.get(key) : dotenv.get(key);
        return trimToNull(value);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
