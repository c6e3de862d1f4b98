package com.github.salilvnair.commandconsole.audit;

import com.github.salilvnair.commandconsole.entity.CcAuditEvent;

/**
 * Write side of the audit trail. Append is the only operation.
 */
public interface AuditLog {

    CcAuditEvent append(AuditEntry entry);
}
