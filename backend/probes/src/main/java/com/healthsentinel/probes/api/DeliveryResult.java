package com.healthsentinel.probes.api;

public record DeliveryResult(boolean success, String reason) {
    public static DeliveryResult delivered() {
        return new DeliveryResult(true, null);
    }

    public static DeliveryResult failed(String reason) {
        return new DeliveryResult(false, reason);
    }
}
