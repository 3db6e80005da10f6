package com.graphmend.communication;

import java.util.List;

import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class EventListenerRegistrar {

    private final RepairEventBus eventBus;
    private final List<RepairEventListener> listeners;

    public EventListenerRegistrar(
            RepairEventBus eventBus,
            List<RepairEventListener> listeners) {
        this.eventBus = eventBus;
        this.listeners = listeners;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void registerListeners() {
        for (RepairEventListener listener : listeners) {
            eventBus.subscribe(listener);
        }
    }
}
