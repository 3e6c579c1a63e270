package com.example.prismquest.catalog;

import com.example.prismquest.model.EnemyDefinition;
import com.example.prismquest.model.ItemDefinition;
import com.example.prismquest.model.Scene;
import com.example.prismquest.util.Documents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the game catalog from YAML resources on the classpath. Files live under a
 * root directory (default {@code /data}):
 * <ul>
 *   <li>{@code chapters.yaml}: {@code chapters: [prologue, ...]}</li>
 *   <li>{@code chapters/<id>.yaml}: {@code scenes: id -> scene}</li>
 *   <li>{@code enemies.yaml}: {@code id -> enemy}</li>
 *   <li>{@code items.yaml}: {@code category -> id -> item}</li>
 * </ul>
 * YAML is a superset of JSON, so the same files may be written as JSON.
 */
public class CatalogLoader {

    private static final Logger logger = LoggerFactory.getLogger(CatalogLoader.class);

    public static final String DEFAULT_ROOT = "/data";

    private final String root;

    public CatalogLoader() {
        this(DEFAULT_ROOT);
    }

    public CatalogLoader(String root) {
        String r = root == null || root.isBlank() ? DEFAULT_ROOT : root.trim();
        if (!r.startsWith("/")) r = "/" + r;
        if (r.length() > 1 && r.endsWith("/")) r = r.substring(0, r.length() - 1);
        this.root = r;
    }

    public String getRoot() {
        return root;
    }

    /**
     * Load the full catalog.
     *
     * @throws CatalogException if a required file is missing or malformed
     */
    public GameCatalog load() {
        Map<String, Object> index = readRequired(root + "/chapters.yaml");
        List<String> chapterIds = Documents.getStringList(index, "chapters");
        if (chapterIds == null || chapterIds.isEmpty()) {
            throw new CatalogException(root + "/chapters.yaml lists no chapters");
        }

        Map<String, Map<String, Scene>> chapters = new LinkedHashMap<>();
        for (String chapterId : chapterIds) {
            Map<String, Object> chapterDoc = readRequired(root + "/chapters/" + chapterId + ".yaml");
            chapters.put(chapterId, CatalogParser.parseScenes(chapterDoc));
        }

        Map<String, EnemyDefinition> enemies = CatalogParser.parseEnemies(readOptional(root + "/enemies.yaml"));
        Map<String, ItemDefinition> items = CatalogParser.parseItems(readOptional(root + "/items.yaml"));

        GameCatalog catalog = new GameCatalog(chapters, enemies, items);
        logger.info("Loaded {} from {}", catalog, root);
        return catalog;
    }

    /**
     * Build a catalog from documents the host has already parsed.
     *
     * @param chapterDocs chapter id to chapter document ({@code scenes:} map)
     * @param enemyDoc enemy document, may be null
     * @param itemDoc categorized item document, may be null
     */
    public static GameCatalog fromDocuments(Map<String, Map<String, Object>> chapterDocs,
                                            Map<String, Object> enemyDoc,
                                            Map<String, Object> itemDoc) {
        Map<String, Map<String, Scene>> chapters = new LinkedHashMap<>();
        if (chapterDocs != null) {
            for (Map.Entry<String, Map<String, Object>> e : chapterDocs.entrySet()) {
                chapters.put(e.getKey(), CatalogParser.parseScenes(e.getValue()));
            }
        }
        return new GameCatalog(chapters, CatalogParser.parseEnemies(enemyDoc), CatalogParser.parseItems(itemDoc));
    }

    private Map<String, Object> readRequired(String resourcePath) {
        Map<String, Object> doc = readOptional(resourcePath);
        if (doc == null) {
            throw new CatalogException("Missing catalog resource " + resourcePath);
        }
        return doc;
    }

    private Map<String, Object> readOptional(String resourcePath) {
        try (InputStream in = CatalogLoader.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                logger.debug("Catalog resource {} not found", resourcePath);
                return null;
            }
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                Object parsed = new Yaml().load(reader);
                if (parsed == null) return new LinkedHashMap<>();
                Map<String, Object> doc = Documents.asMap(parsed);
                if (doc == null) {
                    throw new CatalogException(resourcePath + " must contain a mapping at the top level");
                }
                return doc;
            }
        } catch (YAMLException e) {
            throw new CatalogException("Failed to parse " + resourcePath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new CatalogException("Failed to read " + resourcePath, e);
        }
    }
}
