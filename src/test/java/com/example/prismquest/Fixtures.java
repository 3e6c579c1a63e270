package com.example.prismquest;

import com.example.prismquest.catalog.CatalogLoader;
import com.example.prismquest.catalog.GameCatalog;
import com.example.prismquest.model.Background;
import com.example.prismquest.model.GameState;
import com.example.prismquest.model.Player;
import com.example.prismquest.model.Stats;

/**
 * Shared test data: the bundled catalog and a standard character.
 */
final class Fixtures {

    private static GameCatalog catalog;

    private Fixtures() {
    }

    static synchronized GameCatalog catalog() {
        if (catalog == null) catalog = new CatalogLoader().load();
        return catalog;
    }

    /**
     * A warrior: strength 3, dexterity 2, intelligence 2, perception 3.
     * 26 hp, 14 mp, 50 gold, two red potions.
     */
    static Player warrior() {
        return Player.create("艾琳", Background.WARRIOR, new Stats(2, 2, 2, 3));
    }

    static GameState at(String chapter, String scene, Player player) {
        return GameState.newGame(player).withScene(chapter, scene);
    }

    static GameState at(String scene) {
        return at(GameState.FIRST_CHAPTER, scene, warrior());
    }
}
