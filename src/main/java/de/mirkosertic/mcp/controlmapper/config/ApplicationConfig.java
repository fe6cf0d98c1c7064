package de.mirkosertic.mcp.controlmapper.config;

import de.mirkosertic.mcp.controlmapper.analysis.TokenizerSettings;
import de.mirkosertic.mcp.controlmapper.index.Bm25Parameters;
import de.mirkosertic.mcp.controlmapper.mapping.ConfidenceThresholds;
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
 * Central configuration for the control mapper.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.controlmapper/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_CATALOG_PATH = "CONTROLMAPPER_CATALOG";
    private static final String PROP_CATALOG_PATH = "controlmapper.catalog.path";
    private static final String PROP_PROFILES_ACTIVE = "controlmapper.profile";
    private static final String CONFIG_DIR = ".controlmapper";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Catalog settings
    private String catalogPath;
    private String idColumn = "id";
    private String descriptionColumn = "description";

    // Analysis and ranking
    private int minTokenLength = TokenizerSettings.DEFAULT_MIN_TOKEN_LENGTH;
    private String stemmingLanguage;
    private double k1 = Bm25Parameters.DEFAULT_K1;
    private double b = Bm25Parameters.DEFAULT_B;
    private double highThreshold = ConfidenceThresholds.DEFAULT_HIGH;
    private double mediumThreshold = ConfidenceThresholds.DEFAULT_MEDIUM;

    // Extraction and query composition
    private List<String> securityPatterns = new ArrayList<>();
    private int fallbackMaxChars = 40000;
    private int maxDocumentChars = 5000;

    // Output and enhancement
    private int topN = 10;
    private int enhancementTopN = 5;
    private int enhancementExcerptChars = 2000;

    // Profile settings
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

        logger.info("Configuration loaded: catalogPath={}, patterns={}, k1={}, b={}, thresholds={}/{}, deployedMode={}",
                config.catalogPath, config.securityPatterns.size(), config.k1, config.b,
                config.highThreshold, config.mediumThreshold, config.deployedMode);

        return config;
    }

    /**
     * Load only the classpath defaults, ignoring user config and environment.
     * Used by tests and by callers that want reproducible settings.
     */
    public static ApplicationConfig defaults() {
        final ApplicationConfig config = new ApplicationConfig();
        config.loadFromClasspath();
        return config;
    }

    /**
     * Load configuration from a YAML stream on top of the classpath defaults.
     */
    public static ApplicationConfig fromYaml(final InputStream yamlStream) {
        final ApplicationConfig config = defaults();
        final Map<String, Object> yaml = new Yaml().load(yamlStream);
        if (yaml != null) {
            config.applyYamlConfig(yaml);
        }
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
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
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> root = (Map<String, Object>) config.get("controlmapper");
        if (root == null) {
            return;
        }

        final Map<String, Object> catalogConfig = (Map<String, Object>) root.get("catalog");
        if (catalogConfig != null) {
            final Object path = catalogConfig.get("path");
            if (path != null) {
                this.catalogPath = resolveVariables(path.toString());
            }
            if (catalogConfig.containsKey("id-column")) {
                this.idColumn = catalogConfig.get("id-column").toString();
            }
            if (catalogConfig.containsKey("description-column")) {
                this.descriptionColumn = catalogConfig.get("description-column").toString();
            }
        }

        final Map<String, Object> tokenizerConfig = (Map<String, Object>) root.get("tokenizer");
        if (tokenizerConfig != null) {
            if (tokenizerConfig.containsKey("min-token-length")) {
                this.minTokenLength = ((Number) tokenizerConfig.get("min-token-length")).intValue();
            }
            if (tokenizerConfig.containsKey("stemming-language")) {
                final Object language = tokenizerConfig.get("stemming-language");
                this.stemmingLanguage = language == null ? null : language.toString();
            }
        }

        final Map<String, Object> bm25Config = (Map<String, Object>) root.get("bm25");
        if (bm25Config != null) {
            if (bm25Config.containsKey("k1")) {
                this.k1 = ((Number) bm25Config.get("k1")).doubleValue();
            }
            if (bm25Config.containsKey("b")) {
                this.b = ((Number) bm25Config.get("b")).doubleValue();
            }
        }

        final Map<String, Object> classifierConfig = (Map<String, Object>) root.get("classifier");
        if (classifierConfig != null) {
            if (classifierConfig.containsKey("high-threshold")) {
                this.highThreshold = ((Number) classifierConfig.get("high-threshold")).doubleValue();
            }
            if (classifierConfig.containsKey("medium-threshold")) {
                this.mediumThreshold = ((Number) classifierConfig.get("medium-threshold")).doubleValue();
            }
        }

        final Map<String, Object> extractorConfig = (Map<String, Object>) root.get("extractor");
        if (extractorConfig != null) {
            if (extractorConfig.containsKey("patterns")) {
                final Object patterns = extractorConfig.get("patterns");
                if (patterns instanceof List) {
                    this.securityPatterns = new ArrayList<>();
                    for (final Object pattern : (List<Object>) patterns) {
                        this.securityPatterns.add(pattern.toString());
                    }
                }
            }
            if (extractorConfig.containsKey("fallback-max-chars")) {
                this.fallbackMaxChars = ((Number) extractorConfig.get("fallback-max-chars")).intValue();
            }
        }

        final Map<String, Object> queryConfig = (Map<String, Object>) root.get("query");
        if (queryConfig != null) {
            if (queryConfig.containsKey("max-document-chars")) {
                this.maxDocumentChars = ((Number) queryConfig.get("max-document-chars")).intValue();
            }
            if (queryConfig.containsKey("top-n")) {
                this.topN = ((Number) queryConfig.get("top-n")).intValue();
            }
        }

        final Map<String, Object> enhancementConfig = (Map<String, Object>) root.get("enhancement");
        if (enhancementConfig != null) {
            if (enhancementConfig.containsKey("top-n")) {
                this.enhancementTopN = ((Number) enhancementConfig.get("top-n")).intValue();
            }
            if (enhancementConfig.containsKey("excerpt-chars")) {
                this.enhancementExcerptChars = ((Number) enhancementConfig.get("excerpt-chars")).intValue();
            }
        }
    }

    private void applyEnvironmentOverrides() {
        final String envCatalogPath = System.getenv(ENV_CATALOG_PATH);
        if (envCatalogPath != null && !envCatalogPath.trim().isEmpty()) {
            this.catalogPath = envCatalogPath.trim();
            logger.info("Catalog path from environment: {}", this.catalogPath);
        }

        final String propCatalogPath = System.getProperty(PROP_CATALOG_PATH);
        if (propCatalogPath != null && !propCatalogPath.isEmpty()) {
            this.catalogPath = propCatalogPath;
        }

        if (this.catalogPath != null && this.catalogPath.isEmpty()) {
            this.catalogPath = null;
        }
    }

    private void determineProfile() {
        final String profile = System.getProperty(PROP_PROFILES_ACTIVE, System.getProperty("profile", "default"));
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
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

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
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

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    // Typed views

    public TokenizerSettings getTokenizerSettings() {
        return new TokenizerSettings(minTokenLength, stemmingLanguage);
    }

    public Bm25Parameters getBm25Parameters() {
        return new Bm25Parameters(k1, b);
    }

    public ConfidenceThresholds getConfidenceThresholds() {
        return new ConfidenceThresholds(highThreshold, mediumThreshold);
    }

    // Getters

    public String getCatalogPath() {
        return catalogPath;
    }

    public void setCatalogPath(final String catalogPath) {
        this.catalogPath = catalogPath;
    }

    public String getIdColumn() {
        return idColumn;
    }

    public String getDescriptionColumn() {
        return descriptionColumn;
    }

    public List<String> getSecurityPatterns() {
        return List.copyOf(securityPatterns);
    }

    public int getFallbackMaxChars() {
        return fallbackMaxChars;
    }

    public int getMaxDocumentChars() {
        return maxDocumentChars;
    }

    public int getTopN() {
        return topN;
    }

    public int getEnhancementTopN() {
        return enhancementTopN;
    }

    public int getEnhancementExcerptChars() {
        return enhancementExcerptChars;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
