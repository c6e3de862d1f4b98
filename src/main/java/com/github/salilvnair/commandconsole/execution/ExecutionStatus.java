package com.github.salilvnair.commandconsole.execution;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExecutionStatus {
    EXECUTED("executed"),
    ROLLED_BACK("rolled_back");

    private final String code;

    ExecutionStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
