package com.example.prismquest.model;

/**
 * Effect carried by a usable item. The {@link Type} tag selects which of the
 * parameters are meaningful:
 * <ul>
 *   <li>HEAL_HP / HEAL_MP / DAMAGE_AOE: {@code value}</li>
 *   <li>REGEN_HP: {@code value} per tick for {@code duration} ticks</li>
 *   <li>CURE_STATUS: {@code status}</li>
 *   <li>BUFF: {@code buffId}</li>
 *   <li>CURE_ALL_STATUS: none</li>
 * </ul>
 */
public final class ItemEffect {

    public enum Type {
        HEAL_HP("heal_hp"),
        HEAL_MP("heal_mp"),
        REGEN_HP("regen_hp"),
        CURE_STATUS("cure_status"),
        CURE_ALL_STATUS("cure_all_status"),
        BUFF("buff"),
        DAMAGE_AOE("damage_aoe");

        public final String key;

        Type(String key) {
            this.key = key;
        }

        public static Type fromKey(String key) {
            if (key == null) return null;
            String k = key.trim().toLowerCase();
            for (Type t : values()) if (t.key.equals(k)) return t;
            return null;
        }
    }

    /** Regen lasts this many ticks when the catalog omits a duration. */
    public static final int DEFAULT_REGEN_DURATION = 3;

    private final Type type;
    private final int value;
    private final int duration;
    private final String status;
    private final String buffId;

    public ItemEffect(Type type, int value, int duration, String status, String buffId) {
        this.type = type;
        this.value = value;
        this.duration = duration;
        this.status = status != null ? status : "";
        this.buffId = buffId != null ? buffId : "";
    }

    public static ItemEffect healHp(int value) {
        return new ItemEffect(Type.HEAL_HP, value, 0, null, null);
    }

    public static ItemEffect healMp(int value) {
        return new ItemEffect(Type.HEAL_MP, value, 0, null, null);
    }

    public static ItemEffect regenHp(int value, int duration) {
        return new ItemEffect(Type.REGEN_HP, value, duration, null, null);
    }

    public static ItemEffect cureStatus(String status) {
        return new ItemEffect(Type.CURE_STATUS, 0, 0, status, null);
    }

    public static ItemEffect cureAllStatus() {
        return new ItemEffect(Type.CURE_ALL_STATUS, 0, 0, null, null);
    }

    public static ItemEffect buff(String buffId) {
        return new ItemEffect(Type.BUFF, 0, 0, null, buffId);
    }

    public static ItemEffect damageAoe(int value) {
        return new ItemEffect(Type.DAMAGE_AOE, value, 0, null, null);
    }

    public Type getType() { return type; }
    public int getValue() { return value; }
    public int getDuration() { return duration; }
    public String getStatus() { return status; }
    public String getBuffId() { return buffId; }

    @Override
    public String toString() {
        return "ItemEffect[" + type + ", value=" + value + "]";
    }
}
