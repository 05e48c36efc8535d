package com.crewlife.booking.service;

/**
 * Outcome of handing a message to the mail collaborator. A failure never rolls back the
 * row that was already written.
 */
public record DeliveryResult(boolean sent, String error) {

    public static DeliveryResult delivered() {
        return new DeliveryResult(true, null);
    }

    public static DeliveryResult failed(String error) {
        return new DeliveryResult(false, error);
    }
}
