package com.graphmend.core.event;

import java.time.Instant;
import java.util.UUID;

public class RepairEvent {

    private final String eventId;
    private final RepairEventType type;
    private final String source;
    private final Object payload;

    // payload depends on type: StageSummary, FieldDeletionEvent, PipelineReport or the rejection message

    private final Instant timestamp;

    public RepairEvent(RepairEventType type, String source, Object payload) {
        this.eventId = UUID.randomUUID().toString();
        this.type = type;
        this.source = source;
        this.payload = payload;
        this.timestamp = Instant.now();
    }

    public String getEventId() {
        return eventId;
    }

    public RepairEventType getType() {
        return type;
    }

    public String getSource() {
        return source;
    }

    public Object getPayload() {
        return payload;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "RepairEvent{" + type + " from " + source + "}";
    }
}
