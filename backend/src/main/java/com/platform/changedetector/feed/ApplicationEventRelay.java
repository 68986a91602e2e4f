package com.platform.changedetector.feed;

import com.platform.changedetector.model.ChangeEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Republishes change events as Spring application events, so any
 * {@code @EventListener} method taking a {@link ChangeEvent} receives them.
 */
@Slf4j
@Component
public class ApplicationEventRelay implements ChangeEventHandler {
    
    private final ApplicationEventPublisher eventPublisher;
    
    public ApplicationEventRelay(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }
    
    @Override
    public void onChange(ChangeEvent event) {
        log.trace("Relaying {} for {}", event.type(), event.uid());
        eventPublisher.publishEvent(event);
    }
}
