package ai.agentdeck.config;

import ai.agentdeck.terminal.AttentionPatterns;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Resolves per-user AgentDeck locations and tunables.
 *
 * Default config directory resolution is platform-aware:
 * - Linux: $XDG_CONFIG_HOME/agentdeck or $HOME/.config/agentdeck
 * - macOS: $HOME/Library/Application Support/AgentDeck
 * - Windows: %APPDATA%\\AgentDeck
 *
 * Every value can be overridden by a system property or an environment variable
 * (system property wins). For tests use {@link #builder(Path)}.
 */
public final class AgentDeckConfig {
    public static final String CONFIG_DIR_PROPERTY = "agentdeck.configDir";
    public static final String CONFIG_DIR_ENV = "AGENTDECK_CONFIG_DIR";
    public static final String CLAUDE_HOME_PROPERTY = "agentdeck.claudeHome";
    public static final String CLAUDE_HOME_ENV = "AGENTDECK_CLAUDE_HOME";
    public static final String CLI_PROPERTY = "agentdeck.cli";
    public static final String CLI_ENV = "AGENTDECK_CLI";
    public static final String NOTIFICATIONS_PROPERTY = "agentdeck.notifications";
    public static final String NOTIFICATIONS_ENV = "AGENTDECK_NOTIFICATIONS";
    public static final String BRIDGE_SCRIPT_PROPERTY = "agentdeck.bridgeScript";
    public static final String BRIDGE_SCRIPT_ENV = "AGENTDECK_BRIDGE_SCRIPT";

    public static final String DEFAULT_CLI = "claude";
    public static final String DEFAULT_TITLE_MODEL = "claude-haiku-4-5-20251001";
    public static final Duration DEFAULT_STOP_GRACE = Duration.ofSeconds(5);
    public static final Duration DEFAULT_TERMINAL_SILENCE = Duration.ofMillis(3000);

    private final Path configDir;
    private final Path claudeHome;
    private final String cliExecutable;
    private final boolean notificationsEnabled;
    private final @Nullable Path bridgeScript;
    private final @Nullable String defaultModel;
    private final String titleModel;
    private final Duration stopGracePeriod;
    private final Duration terminalSilence;
    private final List<String> attentionPatterns;

    private AgentDeckConfig(Builder builder) {
        this.configDir = Objects.requireNonNull(builder.configDir);
        this.claudeHome = Objects.requireNonNull(builder.claudeHome);
        this.cliExecutable = Objects.requireNonNull(builder.cliExecutable);
        this.notificationsEnabled = builder.notificationsEnabled;
        this.bridgeScript = builder.bridgeScript;
        this.defaultModel = builder.defaultModel;
        this.titleModel = Objects.requireNonNull(builder.titleModel);
        this.stopGracePeriod = Objects.requireNonNull(builder.stopGracePeriod);
        this.terminalSilence = Objects.requireNonNull(builder.terminalSilence);
        this.attentionPatterns = List.copyOf(builder.attentionPatterns);
    }

    /**
     * Compute configuration from system properties, environment variables and platform defaults.
     */
    public static AgentDeckConfig load() {
        var configDirOverride = getConfigValue(CONFIG_DIR_PROPERTY, CONFIG_DIR_ENV);
        var builder = builder(configDirOverride != null ? Paths.get(configDirOverride) : defaultConfigDir());

        var claudeHome = getConfigValue(CLAUDE_HOME_PROPERTY, CLAUDE_HOME_ENV);
        if (claudeHome != null) {
            builder.claudeHome(Paths.get(claudeHome));
        }
        var cli = getConfigValue(CLI_PROPERTY, CLI_ENV);
        if (cli != null) {
            builder.cliExecutable(cli);
        }
        var notifications = getConfigValue(NOTIFICATIONS_PROPERTY, NOTIFICATIONS_ENV);
        if (notifications != null) {
            builder.notificationsEnabled(Boolean.parseBoolean(notifications));
        }
        var bridgeScript = getConfigValue(BRIDGE_SCRIPT_PROPERTY, BRIDGE_SCRIPT_ENV);
        if (bridgeScript != null) {
            builder.bridgeScript(Paths.get(bridgeScript));
        }
        return builder.build();
    }

    /**
     * Start from defaults anchored at the given config directory. Useful for tests.
     */
    public static Builder builder(Path configDir) {
        return new Builder(configDir);
    }

    static Path defaultConfigDir() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        Path home = Paths.get(System.getProperty("user.home"));

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData != null && !appData.isBlank()) {
                return Paths.get(appData).resolve("AgentDeck");
            }
            return home.resolve("AppData").resolve("Roaming").resolve("AgentDeck");
        }

        if (os.contains("mac") || os.contains("darwin")) {
            return home.resolve("Library").resolve("Application Support").resolve("AgentDeck");
        }

        String xdg = System.getenv("XDG_CONFIG_HOME");
        if (xdg != null && !xdg.isBlank()) {
            return Paths.get(xdg).resolve("agentdeck");
        }
        return home.resolve(".config").resolve("agentdeck");
    }

    @Nullable
    private static String getConfigValue(String propertyKey, String envVarName) {
        var value = System.getProperty(propertyKey);
        if (value != null && !value.isBlank()) {
            return value;
        }
        value = System.getenv(envVarName);
        if (value != null && !value.isBlank()) {
            return value;
        }
        return null;
    }

    /** Base per-user AgentDeck directory. */
    public Path configDir() {
        return configDir;
    }

    /** Root under which session worktrees are created, one directory per project hash. */
    public Path worktreesDir() {
        return configDir.resolve("worktrees");
    }

    public Path worktreeRegistryFile() {
        return configDir.resolve("worktree-registry.json");
    }

    /** The agent CLI's home, normally ~/.claude. */
    public Path claudeHome() {
        return claudeHome;
    }

    /** Directory holding one transcript directory per encoded project path. */
    public Path claudeProjectsDir() {
        return claudeHome.resolve("projects");
    }

    public String cliExecutable() {
        return cliExecutable;
    }

    public boolean notificationsEnabled() {
        return notificationsEnabled;
    }

    @Nullable
    public Path bridgeScript() {
        return bridgeScript;
    }

    @Nullable
    public String defaultModel() {
        return defaultModel;
    }

    public String titleModel() {
        return titleModel;
    }

    public Duration stopGracePeriod() {
        return stopGracePeriod;
    }

    public Duration terminalSilence() {
        return terminalSilence;
    }

    public List<String> attentionPatterns() {
        return attentionPatterns;
    }

    @Override
    public String toString() {
        return "AgentDeckConfig{configDir=" + configDir + ", claudeHome=" + claudeHome + ", cli=" + cliExecutable
                + ", notifications=" + notificationsEnabled + ", bridgeScript=" + bridgeScript + "}";
    }

    public static final class Builder {
        private final Path configDir;
        private Path claudeHome = Paths.get(System.getProperty("user.home")).resolve(".claude");
        private String cliExecutable = DEFAULT_CLI;
        private boolean notificationsEnabled = true;
        private @Nullable Path bridgeScript;
        private @Nullable String defaultModel;
        private String titleModel = DEFAULT_TITLE_MODEL;
        private Duration stopGracePeriod = DEFAULT_STOP_GRACE;
        private Duration terminalSilence = DEFAULT_TERMINAL_SILENCE;
        private List<String> attentionPatterns = AttentionPatterns.DEFAULT_SOURCES;

        private Builder(Path configDir) {
            this.configDir = Objects.requireNonNull(configDir);
        }

        public Builder claudeHome(Path claudeHome) {
            this.claudeHome = claudeHome;
            return this;
        }

        public Builder cliExecutable(String cliExecutable) {
            if (cliExecutable.isBlank()) {
                throw new IllegalArgumentException("cliExecutable must not be blank");
            }
            this.cliExecutable = cliExecutable;
            return this;
        }

        public Builder notificationsEnabled(boolean notificationsEnabled) {
            this.notificationsEnabled = notificationsEnabled;
            return this;
        }

        public Builder bridgeScript(@Nullable Path bridgeScript) {
            this.bridgeScript = bridgeScript;
            return this;
        }

        public Builder defaultModel(@Nullable String defaultModel) {
            this.defaultModel = defaultModel;
            return this;
        }

        public Builder titleModel(String titleModel) {
            this.titleModel = titleModel;
            return this;
        }

        public Builder stopGracePeriod(Duration stopGracePeriod) {
            if (stopGracePeriod.isNegative()) {
                throw new IllegalArgumentException("stopGracePeriod must not be negative");
            }
            this.stopGracePeriod = stopGracePeriod;
            return this;
        }

        public Builder terminalSilence(Duration terminalSilence) {
            if (terminalSilence.isNegative() || terminalSilence.isZero()) {
                throw new IllegalArgumentException("terminalSilence must be positive");
            }
            this.terminalSilence = terminalSilence;
            return this;
        }

        public Builder attentionPatterns(List<String> attentionPatterns) {
            this.attentionPatterns = attentionPatterns;
            return this;
        }

        public AgentDeckConfig build() {
            return new AgentDeckConfig(this);
        }
    }
}
