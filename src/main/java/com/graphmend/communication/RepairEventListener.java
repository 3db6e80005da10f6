package com.graphmend.communication;

import com.graphmend.core.event.RepairEvent;

public interface RepairEventListener {

    void onEvent(RepairEvent event);
}
