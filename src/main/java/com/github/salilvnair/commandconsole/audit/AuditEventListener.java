package com.github.salilvnair.commandconsole.audit;

import com.github.salilvnair.commandconsole.entity.CcAuditEvent;

public interface AuditEventListener {

    void onAudit(CcAuditEvent event);
}
