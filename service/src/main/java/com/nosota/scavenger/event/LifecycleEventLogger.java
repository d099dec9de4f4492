package com.nosota.scavenger.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Writes committed lifecycle events to the application log.
 * Events of a rolled-back call are never delivered here.
 */
@Component
@Slf4j
public class LifecycleEventLogger {

    @TransactionalEventListener(fallbackExecution = true)
    public void onLifecycleEvent(LifecycleEvent event) {
        log.info("[{}] record={} actor={} {}", event.type(), event.recordId(), event.actor(), event.detail());
    }
}
