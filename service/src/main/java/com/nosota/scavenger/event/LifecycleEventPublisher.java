package com.nosota.scavenger.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Publishes lifecycle events through Spring's internal event system.
 *
 * <p>Events are observations only; nothing in the engine reads them back.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LifecycleEventPublisher {

    private final ApplicationEventPublisher springEventPublisher;

    public void publish(EventType type, Long recordId, String actor, String detail) {
        LifecycleEvent event = new LifecycleEvent(type, recordId, actor, detail, LocalDateTime.now());
        springEventPublisher.publishEvent(event);
        log.debug("Published lifecycle event: {}", event);
    }
}
