package com.github.salilvnair.commandconsole.approval;

public enum ApprovalDecisionType {
    APPROVE,
    REJECT
}
