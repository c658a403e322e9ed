package com.jasmin.requestguard.models;

import com.fasterxml.jackson.annotation.JsonValue;

/** Attack families, in the order the scanner evaluates them. */
public enum AttackType {
    XSS("xss"),
    SQLI("sqli"),
    CMD_INJECTION("cmd_injection"),
    PATH_TRAVERSAL("path_traversal"),
    SENSITIVE_DATA("sensitive_data");

    private final String tag;

    AttackType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }
}
