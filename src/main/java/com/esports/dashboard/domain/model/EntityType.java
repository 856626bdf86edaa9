package com.esports.dashboard.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EntityType {
    PLAYER,
    TEAM;

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase();
    }
}
