package com.clapgrow.bridge.api.delivery;

/**
 * Body encoding for tenant webhook deliveries.
 */
public enum DeliveryMode {
    /** {@code application/json}, signed over the raw JSON bytes. */
    JSON,
    /** {@code application/x-www-form-urlencoded}, keys sorted, signed over the encoded string. */
    FORM
}
