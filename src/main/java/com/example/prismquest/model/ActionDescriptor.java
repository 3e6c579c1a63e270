package com.example.prismquest.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One action offered to the player: a button label plus the request it sends back.
 */
public final class ActionDescriptor {

    private final String id;
    private final String type;
    private final String label;
    private final Map<String, Object> data;

    public ActionDescriptor(String id, String type, String label, Map<String, Object> data) {
        this.id = id;
        this.type = type;
        this.label = label != null ? label : "";
        this.data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static ActionDescriptor of(String id, String type, String label) {
        return new ActionDescriptor(id, type, label, null);
    }

    public String getId() { return id; }
    public String getType() { return type; }
    public String getLabel() { return label; }
    public Map<String, Object> getData() { return data; }

    public Map<String, Object> toDocument() {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("id", id);
        doc.put("type", type);
        doc.put("label", label);
        if (!data.isEmpty()) doc.put("data", new LinkedHashMap<>(data));
        return doc;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ActionDescriptor other)) return false;
        return Objects.equals(id, other.id) && Objects.equals(type, other.type)
            && label.equals(other.label) && data.equals(other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, label, data);
    }

    @Override
    public String toString() {
        return "Action[" + id + ":" + type + " '" + label + "']";
    }
}
