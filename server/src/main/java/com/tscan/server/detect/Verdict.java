package com.tscan.server.detect;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Verdict {
    UNKNOWN("unknown"),
    REAL("real"),
    BOGUS("bogus");

    private final String wireName;

    Verdict(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Verdict fromWireName(String value) {
        if (value == null) {
            return null;
        }
        for (Verdict v : values()) {
            if (v.wireName.equalsIgnoreCase(value)) {
                return v;
            }
        }
        return UNKNOWN;
    }
}
