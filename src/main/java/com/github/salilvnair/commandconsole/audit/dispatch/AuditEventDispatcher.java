package com.github.salilvnair.commandconsole.audit.dispatch;

import com.github.salilvnair.commandconsole.audit.AuditEventListener;
import com.github.salilvnair.commandconsole.entity.CcAuditEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

@Component
@RequiredArgsConstructor
@Slf4j
public class AuditEventDispatcher {

    private final List<AuditEventListener> listeners;

    private final AtomicLong listenerFailures = new AtomicLong();

    public void dispatch(CcAuditEvent event) {
        if (listeners == null || listeners.isEmpty() || event == null) {
            return;
        }
        for (AuditEventListener listener : listeners) {
            try {
                listener.onAudit(event);
            }
            catch (Exception e) {
                listenerFailures.incrementAndGet();
                log.warn(
                        "Audit listener failed listener={} planId={} stage={} msg={}",
                        listener.getClass().getSimpleName(),
                        event.getPlanId(),
                        event.getStage(),
                        e.getMessage()
                );
            }
        }
    }

    public long listenerFailureCount() {
        return listenerFailures.get();
    }
}
