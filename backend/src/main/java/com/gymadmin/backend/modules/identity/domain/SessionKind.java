package com.gymadmin.backend.modules.identity.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionKind {

    PLATFORM_TOKEN("platform_token"),
    BRANCH_SESSION("branch_session");

    private final String wireValue;

    SessionKind(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
