package dev.onboarding.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads {@link AnalysisSettings} from environment variables layered over an optional {@code .env} file.
 * Keys are case-insensitive; environment variables win over file entries.
 */
public final class SettingsLoader {

    public static final String API_KEY = "OPENAI_API_KEY";
    public static final String MODEL = "OPENAI_MODEL";
    public static final String BASE_URL = "OPENAI_BASE_URL";
    public static final String TEMPERATURE = "OPENAI_TEMPERATURE";
    public static final String REQUEST_TIMEOUT = "REQUEST_TIMEOUT_SECONDS";
    public static final String DEBUG = "DEBUG";

    public static final Path DEFAULT_ENV_FILE = Path.of(".env");

    private SettingsLoader() {}

    /**
     * Load settings from the process environment and {@code ./.env}.
     */
    public static AnalysisSettings load() throws ConfigurationException {
        return load(System.getenv(), DEFAULT_ENV_FILE);
    }

    /**
     * Load settings from the given environment, falling back to entries of {@code envFile} if it exists.
     *
     * @param environment variables, typically {@link System#getenv()}
     * @param envFile     dotenv file; ignored when null or absent
     */
    public static AnalysisSettings load(Map<String, String> environment, Path envFile) throws ConfigurationException {
        var values = new LinkedHashMap<String, String>();
        if (envFile != null && Files.isRegularFile(envFile)) {
            values.putAll(readEnvFile(envFile));
        }
        environment.forEach((key, value) -> values.put(key.toUpperCase(Locale.ROOT), value));
        return fromValues(values);
    }

    static AnalysisSettings fromValues(Map<String, String> values) throws ConfigurationException {
        String apiKey = values.get(API_KEY);
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException(API_KEY + " is not set");
        }

        String model = valueOrDefault(values, MODEL, AnalysisSettings.DEFAULT_MODEL);
        String baseUrl = valueOrDefault(values, BASE_URL, AnalysisSettings.DEFAULT_BASE_URL);

        double temperature = AnalysisSettings.DEFAULT_TEMPERATURE;
        if (hasValue(values, TEMPERATURE)) {
            temperature = parseDouble(TEMPERATURE, values.get(TEMPERATURE));
        }

        Duration timeout = AnalysisSettings.DEFAULT_REQUEST_TIMEOUT;
        if (hasValue(values, REQUEST_TIMEOUT)) {
            long seconds = parseLong(REQUEST_TIMEOUT, values.get(REQUEST_TIMEOUT));
            if (seconds <= 0) {
                throw new ConfigurationException(REQUEST_TIMEOUT + " must be positive, got " + seconds);
            }
            timeout = Duration.ofSeconds(seconds);
        }

        boolean debug = parseBoolean(DEBUG, values.getOrDefault(DEBUG, "false"));

        return new AnalysisSettings(apiKey.trim(), model, baseUrl, temperature, timeout, debug);
    }

    /**
     * Parse a dotenv file: {@code KEY=VALUE} lines, {@code #} comments, optional {@code export} prefix
     * and optional surrounding quotes.
     */
    static Map<String, String> readEnvFile(Path envFile) throws ConfigurationException {
        List<String> lines;
        try {
            lines = Files.readAllLines(envFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + envFile + ": " + e.getMessage(), e);
        }

        var values = new LinkedHashMap<String, String>();
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            if (line.startsWith("export ")) {
                line = line.substring(7).trim();
            }
            int eq = line.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = line.substring(0, eq).trim().toUpperCase(Locale.ROOT);
            values.put(key, unquote(line.substring(eq + 1).trim()));
        }
        return values;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    private static boolean hasValue(Map<String, String> values, String key) {
        String value = values.get(key);
        return value != null && !value.isBlank();
    }

    private static String valueOrDefault(Map<String, String> values, String key, String fallback) {
        return hasValue(values, key) ? values.get(key).trim() : fallback;
    }

    private static double parseDouble(String key, String value) throws ConfigurationException {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("%s must be a number, got '%s'".formatted(key, value), e);
        }
    }

    private static long parseLong(String key, String value) throws ConfigurationException {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("%s must be an integer, got '%s'".formatted(key, value), e);
        }
    }

    private static boolean parseBoolean(String key, String value) throws ConfigurationException {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off", "" -> false;
            default -> throw new ConfigurationException(
                "%s must be a boolean, got '%s'".formatted(key, value));
        };
    }
}
