package com.healthsentinel.core.events;

import com.healthsentinel.core.model.DeliveryRecord;

import java.time.Instant;

public record AlertDelivered(Instant timestamp, DeliveryRecord record) implements Event {
    @Override
    public String type() {
        return "AlertDelivered";
    }
}
