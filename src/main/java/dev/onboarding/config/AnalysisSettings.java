package dev.onboarding.config;

import java.time.Duration;

/**
 * Resolved runtime settings for one process.
 */
public record AnalysisSettings(
    String apiKey,
    String model,
    String baseUrl,
    double temperature,
    Duration requestTimeout,
    boolean debug
) {
    public static final String APP_NAME = "Ember Date Onboarding Analysis";
    public static final String APP_VERSION = "1.0.0";

    public static final String DEFAULT_MODEL = "gpt-4o-mini";
    public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);

    public AnalysisSettings withModel(String model) {
        return new AnalysisSettings(apiKey, model, baseUrl, temperature, requestTimeout, debug);
    }

    public AnalysisSettings withBaseUrl(String baseUrl) {
        return new AnalysisSettings(apiKey, model, baseUrl, temperature, requestTimeout, debug);
    }

    public AnalysisSettings withRequestTimeout(Duration requestTimeout) {
        return new AnalysisSettings(apiKey, model, baseUrl, temperature, requestTimeout, debug);
    }

    public AnalysisSettings withDebug(boolean debug) {
        return new AnalysisSettings(apiKey, model, baseUrl, temperature, requestTimeout, debug);
    }

    @Override
    public String toString() {
        // keep the key out of logs
        return "AnalysisSettings[model=%s, baseUrl=%s, temperature=%s, requestTimeout=%s, debug=%s]"
            .formatted(model, baseUrl, temperature, requestTimeout, debug);
    }
}
