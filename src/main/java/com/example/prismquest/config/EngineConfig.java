package com.example.prismquest.config;

import com.example.prismquest.catalog.CatalogLoader;
import com.example.prismquest.util.Dice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Engine settings, read from environment variables first and system properties second.
 *
 * <ul>
 *   <li>{@code PRISMQUEST_CATALOG_ROOT} / {@code prismquest.catalog.root}: classpath
 *       directory holding the catalog (default {@code /data})</li>
 *   <li>{@code PRISMQUEST_RANDOM_SEED} / {@code prismquest.random.seed}: fixed seed for
 *       reproducible sessions (default unseeded)</li>
 * </ul>
 */
public final class EngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    public static final String CATALOG_ROOT_ENV = "PRISMQUEST_CATALOG_ROOT";
    public static final String CATALOG_ROOT_PROPERTY = "prismquest.catalog.root";
    public static final String RANDOM_SEED_ENV = "PRISMQUEST_RANDOM_SEED";
    public static final String RANDOM_SEED_PROPERTY = "prismquest.random.seed";

    private final String catalogRoot;
    private final Long randomSeed;

    public EngineConfig(String catalogRoot, Long randomSeed) {
        this.catalogRoot = catalogRoot != null && !catalogRoot.isBlank() ? catalogRoot : CatalogLoader.DEFAULT_ROOT;
        this.randomSeed = randomSeed;
    }

    /**
     * Read the settings of the running process.
     */
    public static EngineConfig load() {
        return load(System::getenv, System::getProperty);
    }

    static EngineConfig load(Function<String, String> env, Function<String, String> properties) {
        String root = lookup(env, properties, CATALOG_ROOT_ENV, CATALOG_ROOT_PROPERTY);
        String seedText = lookup(env, properties, RANDOM_SEED_ENV, RANDOM_SEED_PROPERTY);
        Long seed = null;
        if (seedText != null) {
            try {
                seed = Long.parseLong(seedText.trim());
            } catch (NumberFormatException e) {
                logger.warn("Ignoring invalid random seed '{}'", seedText);
            }
        }
        return new EngineConfig(root, seed);
    }

    private static String lookup(Function<String, String> env, Function<String, String> properties,
                                 String envName, String propertyName) {
        String value = env.apply(envName);
        if (value != null && !value.isEmpty()) return value;
        value = properties.apply(propertyName);
        if (value != null && !value.isEmpty()) return value;
        return null;
    }

    public String getCatalogRoot() {
        return catalogRoot;
    }

    /** The configured seed, or null when unseeded. */
    public Long getRandomSeed() {
        return randomSeed;
    }

    public Dice createDice() {
        return randomSeed != null ? Dice.seeded(randomSeed) : new Dice();
    }

    public CatalogLoader createCatalogLoader() {
        return new CatalogLoader(catalogRoot);
    }

    @Override
    public String toString() {
        return "EngineConfig[catalogRoot=" + catalogRoot + ", seed=" + randomSeed + "]";
    }
}
