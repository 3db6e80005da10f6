package com.graphmend.communication;

import com.graphmend.core.event.RepairEvent;
import com.graphmend.core.event.RepairEventType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes repair events to the log. Field deletions go out at info so they
 * are visible without debug logging; everything else at debug.
 */
@Component
public class LoggingRepairEventListener implements RepairEventListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingRepairEventListener.class);

    @Override
    public void onEvent(RepairEvent event) {
        if (event.getType() == RepairEventType.FIELD_DELETED) {
            log.info("[Audit] {} from {}: {}", event.getType(), event.getSource(), event.getPayload());
        } else {
            log.debug("[Audit] {} from {}: {}", event.getType(), event.getSource(), event.getPayload());
        }
    }
}
