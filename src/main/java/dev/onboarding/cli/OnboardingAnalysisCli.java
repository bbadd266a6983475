package dev.onboarding.cli;

import ch.qos.logback.classic.Level;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import dev.onboarding.backend.OpenAiChatBackend;
import dev.onboarding.backend.TextBackend;
import dev.onboarding.config.AnalysisSettings;
import dev.onboarding.config.ConfigurationException;
import dev.onboarding.config.SettingsLoader;
import dev.onboarding.engine.AnalysisException;
import dev.onboarding.engine.AnalysisService;
import dev.onboarding.engine.IncompleteResultException;
import dev.onboarding.engine.TaskGraphExecutor;
import dev.onboarding.model.AnalysisInput;
import dev.onboarding.model.AnalysisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

/**
 * CLI entry point: reads one JSON request from a file or stdin and prints the analysis as JSON.
 */
@Command(
    name = "onboarding-analysis",
    mixinStandardHelpOptions = true,
    version = AnalysisSettings.APP_NAME + " " + AnalysisSettings.APP_VERSION,
    description = "Analyze an onboarding question/answer pair with parallel insight and trait agents."
)
public class OnboardingAnalysisCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(OnboardingAnalysisCli.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1",
        description = "JSON file with user_id, question and answer (default: read stdin)")
    private Path inputFile;

    @Option(names = "--model", description = "Override OPENAI_MODEL")
    private String model;

    @Option(names = "--base-url", description = "Override OPENAI_BASE_URL")
    private String baseUrl;

    @Option(names = "--timeout", description = "Per-request backend timeout in seconds")
    private Long timeoutSeconds;

    @Option(names = "--env-file", defaultValue = ".env", description = "Dotenv file to read settings from")
    private Path envFile;

    @Option(names = "--verbose", description = "Log task dispatch and backend calls")
    private boolean verbose;

    private final Map<String, String> environment;
    private final Function<AnalysisSettings, TextBackend> backendFactory;
    private final InputStream stdin;

    public OnboardingAnalysisCli() {
        this(System.getenv(), OpenAiChatBackend::fromSettings, System.in);
    }

    OnboardingAnalysisCli(Map<String, String> environment,
                          Function<AnalysisSettings, TextBackend> backendFactory,
                          InputStream stdin) {
        this.environment = environment;
        this.backendFactory = backendFactory;
        this.stdin = stdin;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        AnalysisSettings settings;
        try {
            settings = resolveSettings();
        } catch (ConfigurationException e) {
            err.println("Error: Configuration error - " + e.getMessage());
            return 1;
        }
        if (settings.debug()) {
            enableDebugLogging();
        }
        log.debug("Using {}", settings);

        AnalysisInput input;
        try {
            input = RequestCodec.readRequest(readRequestJson());
        } catch (NoSuchFileException e) {
            err.println("Error: File not found: " + inputFile);
            return 1;
        } catch (JsonProcessingException e) {
            err.println((inputFile != null ? "Error: Invalid JSON in file: " : "Error: Invalid JSON input: ")
                + e.getOriginalMessage());
            return 1;
        } catch (IOException e) {
            err.println("Error: Cannot read input: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        ExecutorService pool = TaskGraphExecutor.newDefaultPool(TaskGraphExecutor.DEFAULT_POOL_SIZE);
        try {
            AnalysisService service = AnalysisService.create(backendFactory.apply(settings), pool);
            AnalysisResult result = service.analyze(input.subjectId(), input.promptText(), input.responseText());
            out.println(RequestCodec.writeResult(result));
            out.flush();
            return 0;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (AnalysisException | IncompleteResultException e) {
            err.println("Error: Analysis failed: " + e.getMessage());
            return 1;
        } catch (JsonProcessingException e) {
            err.println("Error: Cannot render result: " + e.getOriginalMessage());
            return 1;
        } finally {
            pool.shutdownNow();
        }
    }

    private AnalysisSettings resolveSettings() throws ConfigurationException {
        AnalysisSettings settings = SettingsLoader.load(environment, envFile);
        if (model != null) {
            settings = settings.withModel(model);
        }
        if (baseUrl != null) {
            settings = settings.withBaseUrl(baseUrl);
        }
        if (timeoutSeconds != null) {
            if (timeoutSeconds <= 0) {
                throw new ConfigurationException("--timeout must be positive, got " + timeoutSeconds);
            }
            settings = settings.withRequestTimeout(Duration.ofSeconds(timeoutSeconds));
        }
        if (verbose) {
            settings = settings.withDebug(true);
        }
        return settings;
    }

    private JsonNode readRequestJson() throws IOException {
        if (inputFile != null) {
            try (InputStream in = Files.newInputStream(inputFile)) {
                return RequestCodec.MAPPER.readTree(in);
            }
        }
        return RequestCodec.MAPPER.readTree(stdin);
    }

    private static void enableDebugLogging() {
        if (LoggerFactory.getLogger("dev.onboarding") instanceof ch.qos.logback.classic.Logger logger) {
            logger.setLevel(Level.DEBUG);
        }
    }
}
