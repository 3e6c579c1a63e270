package com.example.prismquest.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The four equipment slots of a player, each holding an optional item id.
 */
public final class Equipment {

    private final Map<EquipmentSlot, String> slots;

    public Equipment(Map<EquipmentSlot, String> slots) {
        EnumMap<EquipmentSlot, String> copy = new EnumMap<>(EquipmentSlot.class);
        if (slots != null) {
            for (Map.Entry<EquipmentSlot, String> e : slots.entrySet()) {
                if (e.getKey() != null && e.getValue() != null && !e.getValue().isBlank()) {
                    copy.put(e.getKey(), e.getValue());
                }
            }
        }
        this.slots = Collections.unmodifiableMap(copy);
    }

    public static Equipment empty() {
        return new Equipment(null);
    }

    /** Item id in the slot, or null when the slot is empty. */
    public String get(EquipmentSlot slot) {
        return slots.get(slot);
    }

    public String getWeapon() {
        return slots.get(EquipmentSlot.WEAPON);
    }

    public Equipment with(EquipmentSlot slot, String itemId) {
        EnumMap<EquipmentSlot, String> copy = new EnumMap<>(EquipmentSlot.class);
        copy.putAll(slots);
        if (itemId == null) copy.remove(slot); else copy.put(slot, itemId);
        return new Equipment(copy);
    }

    public Map<String, Object> toDocument() {
        Map<String, Object> doc = new LinkedHashMap<>();
        for (EquipmentSlot s : EquipmentSlot.values()) {
            doc.put(s.key, slots.get(s));
        }
        return doc;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Equipment other)) return false;
        return slots.equals(other.slots);
    }

    @Override
    public int hashCode() {
        return slots.hashCode();
    }
}
