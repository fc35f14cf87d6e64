package de.mirkosertic.mcp.docnav.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for the documentation navigator.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.docnav/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_PROJECT_ROOT = "DOCNAV_PROJECT_ROOT";
    private static final String ENV_STATE_DIR = "DOCNAV_STATE_DIR";
    private static final String PROP_PROJECT_ROOT = "docnav.project.root";
    private static final String PROP_PROFILES_ACTIVE = "spring.profiles.active";
    private static final String CONFIG_DIR = ".docnav";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Collection settings
    private String projectRoot;
    private String docsDirectory = "docs";
    private String stateDirectory = ".docnav";
    private String snapshotFile = "index.json";
    private List<String> includeExtensions = List.of(
            ".md", ".txt", ".rst", ".py", ".js", ".ts", ".json"
    );
    private List<String> structuredExtensions = List.of(
            ".md", ".txt", ".rst"
    );
    private List<String> excludePathFragments = List.of(
            "node_modules", ".git", "__pycache__", "archive"
    );

    // Engine and presentation settings
    private int codePreviewChars = 2000;
    private int resultPreviewChars = 300;
    private int defaultResultLimit = 5;
    private int maxResultLimit = 50;
    private int filePreviewLines = 40;
    private int chunkLines = 200;
    private int topTerms = 20;

    private boolean deployedMode = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        config.loadFromClasspath();
        config.loadFromUserConfig();
        config.applyEnvironmentOverrides();
        config.determineProfile();

        logger.info("Configuration loaded: projectRoot={}, stateDirectory={}, deployedMode={}",
                config.projectRoot, config.stateDirectory, config.deployedMode);

        return config;
    }

    /**
     * Defaults only, rooted at the given project directory. No files or environment are consulted.
     */
    public static ApplicationConfig defaults(final Path projectRoot) {
        final ApplicationConfig config = new ApplicationConfig();
        config.projectRoot = projectRoot.toString();
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Map<String, Object> config = new Yaml().load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    /**
     * Apply a parsed YAML document. Only the {@code docnav} section is read.
     */
    @SuppressWarnings("unchecked")
    void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> navConfig = (Map<String, Object>) config.get("docnav");
        if (navConfig == null) {
            return;
        }

        if (navConfig.get("project-root") != null) {
            this.projectRoot = resolveVariables(navConfig.get("project-root").toString());
        }
        if (navConfig.get("docs-directory") != null) {
            this.docsDirectory = navConfig.get("docs-directory").toString();
        }
        if (navConfig.get("state-directory") != null) {
            this.stateDirectory = resolveVariables(navConfig.get("state-directory").toString());
        }
        if (navConfig.get("snapshot-file") != null) {
            this.snapshotFile = navConfig.get("snapshot-file").toString();
        }
        if (navConfig.get("include-extensions") instanceof List) {
            this.includeExtensions = new ArrayList<>((List<String>) navConfig.get("include-extensions"));
        }
        if (navConfig.get("structured-extensions") instanceof List) {
            this.structuredExtensions = new ArrayList<>((List<String>) navConfig.get("structured-extensions"));
        }
        if (navConfig.get("exclude-path-fragments") instanceof List) {
            this.excludePathFragments = new ArrayList<>((List<String>) navConfig.get("exclude-path-fragments"));
        }
        if (navConfig.containsKey("code-preview-chars")) {
            this.codePreviewChars = ((Number) navConfig.get("code-preview-chars")).intValue();
        }
        if (navConfig.containsKey("result-preview-chars")) {
            this.resultPreviewChars = ((Number) navConfig.get("result-preview-chars")).intValue();
        }
        if (navConfig.containsKey("default-result-limit")) {
            this.defaultResultLimit = ((Number) navConfig.get("default-result-limit")).intValue();
        }
        if (navConfig.containsKey("max-result-limit")) {
            this.maxResultLimit = ((Number) navConfig.get("max-result-limit")).intValue();
        }
        if (navConfig.containsKey("file-preview-lines")) {
            this.filePreviewLines = ((Number) navConfig.get("file-preview-lines")).intValue();
        }
        if (navConfig.containsKey("chunk-lines")) {
            this.chunkLines = ((Number) navConfig.get("chunk-lines")).intValue();
        }
        if (navConfig.containsKey("top-terms")) {
            this.topTerms = ((Number) navConfig.get("top-terms")).intValue();
        }
    }

    private void applyEnvironmentOverrides() {
        final String envProjectRoot = System.getenv(ENV_PROJECT_ROOT);
        if (envProjectRoot != null && !envProjectRoot.trim().isEmpty()) {
            this.projectRoot = envProjectRoot.trim();
            logger.info("Project root from environment: {}", this.projectRoot);
        }

        final String envStateDir = System.getenv(ENV_STATE_DIR);
        if (envStateDir != null && !envStateDir.trim().isEmpty()) {
            this.stateDirectory = envStateDir.trim();
            logger.info("State directory from environment: {}", this.stateDirectory);
        }

        final String propProjectRoot = System.getProperty(PROP_PROJECT_ROOT);
        if (propProjectRoot != null && !propProjectRoot.isEmpty()) {
            this.projectRoot = propProjectRoot;
        }

        // Default to the working directory the server was launched from
        if (this.projectRoot == null || this.projectRoot.isEmpty()) {
            this.projectRoot = System.getProperty("user.dir");
        }
    }

    private void determineProfile() {
        final String profile = System.getProperty(PROP_PROFILES_ACTIVE,
                System.getProperty("profile", "default"));
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String[] parts = result.substring(start + 2, end).split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }
            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public Path getProjectRootPath() {
        return Paths.get(projectRoot).toAbsolutePath().normalize();
    }

    public Path getDocsDirectoryPath() {
        return getProjectRootPath().resolve(docsDirectory);
    }

    /**
     * The working-state directory. Relative values are resolved against the project root.
     */
    public Path getStateDirectoryPath() {
        return getProjectRootPath().resolve(stateDirectory).normalize();
    }

    public Path getSnapshotPath() {
        return getStateDirectoryPath().resolve(snapshotFile);
    }

    // Getters
    public List<String> getIncludeExtensions() {
        return includeExtensions;
    }

    public List<String> getStructuredExtensions() {
        return structuredExtensions;
    }

    public List<String> getExcludePathFragments() {
        return excludePathFragments;
    }

    public int getCodePreviewChars() {
        return codePreviewChars;
    }

    public int getResultPreviewChars() {
        return resultPreviewChars;
    }

    public int getDefaultResultLimit() {
        return defaultResultLimit;
    }

    public int getMaxResultLimit() {
        return maxResultLimit;
    }

    public int getFilePreviewLines() {
        return filePreviewLines;
    }

    public int getChunkLines() {
        return chunkLines;
    }

    public int getTopTerms() {
        return topTerms;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
