package com.xbleey.pricewatch.client;

import com.xbleey.pricewatch.enums.DeliveryResult;

/**
 * Delivers a text message to an owner. Implementations never throw; failures are returned.
 */
@FunctionalInterface
public interface MessageSender {

    DeliveryResult send(String ownerId, String message);
}
