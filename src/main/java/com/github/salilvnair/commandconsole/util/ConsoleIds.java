package com.github.salilvnair.commandconsole.util;

import lombok.experimental.UtilityClass;

import java.util.UUID;

@UtilityClass
public final class ConsoleIds {

    public static String planId() {
        return "ops_" + hex(12);
    }

    public static String executionId() {
        return "exec_" + hex(12);
    }

    public static String auditEventId() {
        return "audit_" + hex(16);
    }

    private static String hex(int length) {
        return UUID.randomUUID().toString().replace("-", "").substring(0, length);
    }
}
