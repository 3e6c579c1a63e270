package com.example.prismquest.combat;

import com.example.prismquest.util.Documents;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted state of one in-progress encounter.
 *
 * The snapshot is embedded in the game state between requests. The engine works on
 * a {@link #copy()} of it and reports the result in its delta; it is cleared on
 * victory or when the player leaves the scene.
 */
public class CombatSnapshot {

    private final String enemyId;
    private final String enemyName;
    private int enemyHp;
    private final int enemyMaxHp;
    private final int enemyEvasion;
    private final int enemyArmor;
    private int turn;
    private boolean active;
    private int playerHp;
    private final int playerMaxHp;

    public CombatSnapshot(String enemyId, String enemyName, int enemyHp, int enemyMaxHp,
                          int enemyEvasion, int enemyArmor, int turn, boolean active,
                          int playerHp, int playerMaxHp) {
        this.enemyId = enemyId;
        this.enemyName = enemyName != null ? enemyName : enemyId;
        this.enemyMaxHp = enemyMaxHp;
        this.enemyHp = Math.max(0, Math.min(enemyHp, enemyMaxHp));
        this.enemyEvasion = enemyEvasion;
        this.enemyArmor = enemyArmor;
        this.turn = turn;
        this.active = active;
        this.playerMaxHp = playerMaxHp;
        this.playerHp = Math.max(0, Math.min(playerHp, playerMaxHp));
    }

    public CombatSnapshot copy() {
        return new CombatSnapshot(enemyId, enemyName, enemyHp, enemyMaxHp, enemyEvasion, enemyArmor,
            turn, active, playerHp, playerMaxHp);
    }

    public String getEnemyId() { return enemyId; }
    public String getEnemyName() { return enemyName; }
    public int getEnemyHp() { return enemyHp; }
    public int getEnemyMaxHp() { return enemyMaxHp; }
    public int getEnemyEvasion() { return enemyEvasion; }
    public int getEnemyArmor() { return enemyArmor; }
    public int getTurn() { return turn; }
    public boolean isActive() { return active; }
    public int getPlayerHp() { return playerHp; }
    public int getPlayerMaxHp() { return playerMaxHp; }

    /** Reduce enemy hp, never below 0. Returns the new hp. */
    public int damageEnemy(int amount) {
        enemyHp = Math.max(0, enemyHp - Math.max(0, amount));
        return enemyHp;
    }

    /** Reduce the player hp mirror, never below 0. Returns the new hp. */
    public int damagePlayer(int amount) {
        playerHp = Math.max(0, playerHp - Math.max(0, amount));
        return playerHp;
    }

    /** Set the player hp mirror, clamped to {@code [0, playerMaxHp]}. */
    public void setPlayerHp(int hp) {
        this.playerHp = Math.max(0, Math.min(hp, playerMaxHp));
    }

    public void nextTurn() {
        turn++;
    }

    public void end() {
        active = false;
    }

    public boolean isEnemyDefeated() {
        return enemyHp <= 0;
    }

    public boolean isPlayerDefeated() {
        return playerHp <= 0;
    }

    public Map<String, Object> toDocument() {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("enemy_id", enemyId);
        doc.put("enemy_name", enemyName);
        doc.put("enemy_hp", enemyHp);
        doc.put("enemy_max_hp", enemyMaxHp);
        doc.put("enemy_evasion", enemyEvasion);
        doc.put("enemy_armor", enemyArmor);
        doc.put("turn", turn);
        doc.put("is_active", active);
        doc.put("player_hp", playerHp);
        doc.put("player_max_hp", playerMaxHp);
        return doc;
    }

    /**
     * Restore a snapshot from its document form. Returns null when the document is
     * absent or names no enemy.
     */
    public static CombatSnapshot fromDocument(Map<String, Object> doc) {
        if (doc == null) return null;
        String enemyId = Documents.getString(doc, "enemy_id", null);
        if (enemyId == null || enemyId.isBlank()) return null;
        int enemyMaxHp = Documents.getInt(doc, "enemy_max_hp", 0);
        int enemyHp = Documents.getInt(doc, "enemy_hp", enemyMaxHp);
        int playerMaxHp = Documents.getInt(doc, "player_max_hp", 20);
        return new CombatSnapshot(
            enemyId,
            Documents.getString(doc, "enemy_name", enemyId),
            enemyHp,
            Math.max(enemyMaxHp, enemyHp),
            Documents.getInt(doc, "enemy_evasion", 0),
            Documents.getInt(doc, "enemy_armor", 0),
            Documents.getInt(doc, "turn", 1),
            Documents.getBoolean(doc, "is_active", true),
            Documents.getInt(doc, "player_hp", playerMaxHp),
            playerMaxHp);
    }

    @Override
    public String toString() {
        return String.format("CombatSnapshot[%s hp=%d/%d turn=%d player=%d/%d%s]",
            enemyId, enemyHp, enemyMaxHp, turn, playerHp, playerMaxHp, active ? "" : " ended");
    }
}
