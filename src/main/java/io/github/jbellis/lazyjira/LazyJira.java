package io.github.jbellis.lazyjira;

import io.github.jbellis.lazyjira.api.ConnectionValidator;
import io.github.jbellis.lazyjira.api.JiraApiClient;
import io.github.jbellis.lazyjira.app.AppController;
import io.github.jbellis.lazyjira.app.AppState;
import io.github.jbellis.lazyjira.config.ConfigLoader;
import io.github.jbellis.lazyjira.config.LazyJiraConfig;
import io.github.jbellis.lazyjira.exception.LazyJiraException;
import io.github.jbellis.lazyjira.ui.BrowserLauncher;
import io.github.jbellis.lazyjira.ui.TerminalSession;
import io.github.jbellis.lazyjira.ui.TerminalUi;
import io.github.jbellis.lazyjira.util.GlobalExceptionHandler;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "lazyjira",
        mixinStandardHelpOptions = true,
        version = "lazyjira 0.1.0",
        description = "Keyboard-driven terminal client for browsing and transitioning Jira issues.")
public final class LazyJira implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(LazyJira.class);

    @CommandLine.Option(names = "--instance", description = "Jira Cloud host, e.g. example.atlassian.net.")
    @Nullable
    private String instance;

    @CommandLine.Option(names = "--user", description = "Account email used for authentication.")
    @Nullable
    private String username;

    @CommandLine.Option(names = "--jql", description = "JQL query for the ticket list.")
    @Nullable
    private String jql;

    @CommandLine.Option(names = "--legacy-search", description = "Use the older paginated search endpoint.")
    private boolean legacySearch = false;

    @CommandLine.Option(names = "--config", description = "Path to a jira-cli style YAML config file.")
    @Nullable
    private Path configFile;

    public static void main(String[] args) {
        logger.info("Starting LazyJira...");
        int exitCode = new CommandLine(new LazyJira()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        Thread.setDefaultUncaughtExceptionHandler(new GlobalExceptionHandler());

        LazyJiraConfig config;
        try {
            config = new ConfigLoader()
                    .load(new ConfigLoader.Overrides(instance, username, jql, legacySearch, configFile));
            ConfigLoader.validate(config);
        } catch (LazyJiraException e) {
            logger.error("Configuration error", e);
            System.err.println(e.getMessage());
            return 1;
        }

        try (var client = JiraApiClient.create(config)) {
            var status = ConnectionValidator.testConnection(client);
            if (!status.isConnected()) {
                var message = status.errorMessage().orElse("Unable to connect to Jira");
                logger.error("Connection check failed: {}", message);
                System.err.println(message);
                return 1;
            }
            logger.info("Connected to {}", config.instance());

            try (var session = TerminalSession.open()) {
                var ui = new TerminalUi(session.terminal());
                var state = new AppState(config.instance());
                var controller = new AppController(
                        client,
                        state,
                        config.defaultJql(),
                        config.pageSize(),
                        new BrowserLauncher(),
                        ui::onStateChanged);
                try (controller) {
                    ui.run(controller);
                }
            }
        } catch (LazyJiraException e) {
            logger.error("Failed to start", e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
        logger.info("LazyJira exited normally");
        return 0;
    }
}
