package com.graphmend.communication;

import com.graphmend.core.event.RepairEvent;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@Component
public class InMemoryRepairEventBus implements RepairEventBus {

    private final List<RepairEventListener> listeners =
            new CopyOnWriteArrayList<>();

    @Override
    public void publish(RepairEvent event) {
        for (RepairEventListener listener : listeners) {
            listener.onEvent(event);
        }
    }

    @Override
    public void subscribe(RepairEventListener listener) {
        listeners.add(listener);
    }
}
