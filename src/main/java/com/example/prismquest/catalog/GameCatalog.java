package com.example.prismquest.catalog;

import com.example.prismquest.model.EnemyDefinition;
import com.example.prismquest.model.ItemDefinition;
import com.example.prismquest.model.Scene;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable scene/enemy/item catalog.
 *
 * Built once by the host (see {@link CatalogLoader}) and shared by every request;
 * nothing here changes after construction, so concurrent readers need no locking.
 */
public final class GameCatalog {

    private final Map<String, Map<String, Scene>> chapters;
    private final Map<String, EnemyDefinition> enemies;
    private final Map<String, ItemDefinition> items;

    public GameCatalog(Map<String, Map<String, Scene>> chapters,
                       Map<String, EnemyDefinition> enemies,
                       Map<String, ItemDefinition> items) {
        Map<String, Map<String, Scene>> chapterCopy = new LinkedHashMap<>();
        if (chapters != null) {
            for (Map.Entry<String, Map<String, Scene>> e : chapters.entrySet()) {
                chapterCopy.put(e.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(e.getValue())));
            }
        }
        this.chapters = Collections.unmodifiableMap(chapterCopy);
        this.enemies = enemies == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(enemies));
        this.items = items == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(items));
    }

    public static GameCatalog empty() {
        return new GameCatalog(null, null, null);
    }

    /**
     * Resolve a scene. Unknown chapters or scene ids yield {@link Scene#EMPTY}.
     */
    public Scene getScene(String chapter, String sceneId) {
        if (chapter == null || sceneId == null) return Scene.EMPTY;
        Map<String, Scene> scenes = chapters.get(chapter);
        if (scenes == null) return Scene.EMPTY;
        Scene scene = scenes.get(sceneId);
        return scene != null ? scene : Scene.EMPTY;
    }

    public boolean hasChapter(String chapter) {
        return chapters.containsKey(chapter);
    }

    public Collection<String> getChapterIds() {
        return chapters.keySet();
    }

    /** Enemy by id, or null. */
    public EnemyDefinition getEnemy(String enemyId) {
        if (enemyId == null) return null;
        return enemies.get(enemyId);
    }

    /** Item by id, or null. */
    public ItemDefinition getItem(String itemId) {
        if (itemId == null) return null;
        return items.get(itemId);
    }

    /** Display name of an item, falling back to the id itself. */
    public String getItemName(String itemId) {
        ItemDefinition item = getItem(itemId);
        return item != null ? item.getName() : itemId;
    }

    public Map<String, EnemyDefinition> getEnemies() { return enemies; }
    public Map<String, ItemDefinition> getItems() { return items; }

    @Override
    public String toString() {
        int sceneCount = 0;
        for (Map<String, Scene> s : chapters.values()) sceneCount += s.size();
        return String.format("GameCatalog[chapters=%d scenes=%d enemies=%d items=%d]",
            chapters.size(), sceneCount, enemies.size(), items.size());
    }
}
