package com.flowlayout.flowlayout_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Connector anchor on one side of a node. Names match the handle ids the
 * renderer registers on every component ("right-source", "left-target", ...).
 */
public enum Handle {
    TOP_SOURCE("top-source"),
    BOTTOM_SOURCE("bottom-source"),
    LEFT_SOURCE("left-source"),
    RIGHT_SOURCE("right-source"),
    TOP_TARGET("top-target"),
    BOTTOM_TARGET("bottom-target"),
    LEFT_TARGET("left-target"),
    RIGHT_TARGET("right-target");

    private final String wireName;

    Handle(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
