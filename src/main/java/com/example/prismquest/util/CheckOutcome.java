package com.example.prismquest.util;

/**
 * Graded result of a d100 skill check.
 */
public enum CheckOutcome {
    CRITICAL_SUCCESS("critical_success", "大成功！"),
    SUCCESS("success", "成功"),
    FAILURE("failure", "失敗"),
    CRITICAL_FAILURE("critical_failure", "大失敗...");

    public final String key;
    public final String displayName;

    CheckOutcome(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String getKey() { return key; }
    public String getDisplayName() { return displayName; }

    public boolean isSuccess() {
        return this == CRITICAL_SUCCESS || this == SUCCESS;
    }

    public boolean isCritical() {
        return this == CRITICAL_SUCCESS || this == CRITICAL_FAILURE;
    }
}
