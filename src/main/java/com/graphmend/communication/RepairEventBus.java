package com.graphmend.communication;

import com.graphmend.core.event.RepairEvent;

public interface RepairEventBus {

    void publish(RepairEvent event);

    void subscribe(RepairEventListener listener);
}
