package com.crewlife.booking.service;

/**
 * What a successful consume releases: the booking destination, revealed exactly once.
 */
public record ConsumedAccess(String bookingUrl, String brand, String textForEmail, String rowId) {
}
