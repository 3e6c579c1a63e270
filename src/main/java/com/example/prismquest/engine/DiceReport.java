package com.example.prismquest.engine;

import com.example.prismquest.model.Attribute;
import com.example.prismquest.util.CheckOutcome;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The roll behind a result, for display.
 */
public record DiceReport(int roll, int threshold, CheckOutcome outcome, Attribute attribute, int attributeValue) {

    public Map<String, Object> toDocument() {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("roll", roll);
        doc.put("threshold", threshold);
        doc.put("outcome", outcome.key);
        doc.put("attribute", attribute.key);
        doc.put("attribute_value", attributeValue);
        return doc;
    }
}
