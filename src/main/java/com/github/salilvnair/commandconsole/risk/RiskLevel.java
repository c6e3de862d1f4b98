package com.github.salilvnair.commandconsole.risk;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH
}
