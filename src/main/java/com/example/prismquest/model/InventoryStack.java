package com.example.prismquest.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One inventory entry: an item id with a quantity of at least 1.
 */
public final class InventoryStack {

    private final String id;
    private final String name;
    private final ItemType type;
    private final int quantity;

    public InventoryStack(String id, String name, ItemType type, int quantity) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Inventory stack requires an item id");
        }
        if (quantity < 1) {
            throw new IllegalArgumentException("Inventory stack quantity must be >= 1, got " + quantity);
        }
        this.id = id;
        this.name = name != null ? name : id;
        this.type = type != null ? type : ItemType.MISC;
        this.quantity = quantity;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public ItemType getType() { return type; }
    public int getQuantity() { return quantity; }

    public InventoryStack withQuantity(int newQuantity) {
        return new InventoryStack(id, name, type, newQuantity);
    }

    public Map<String, Object> toDocument() {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("id", id);
        doc.put("name", name);
        doc.put("type", type.key);
        doc.put("quantity", quantity);
        return doc;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InventoryStack other)) return false;
        return quantity == other.quantity && id.equals(other.id)
            && name.equals(other.name) && type == other.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, type, quantity);
    }

    @Override
    public String toString() {
        return id + " x" + quantity;
    }
}
