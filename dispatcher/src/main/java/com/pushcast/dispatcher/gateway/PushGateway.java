package com.pushcast.dispatcher.gateway;

import com.pushcast.dispatcher.model.PushMessage;

/**
 * Sends one message to one device token.
 */
public interface PushGateway {

    /**
     * @return the gateway's message id
     * @throws TransientDeliveryException on timeouts, throttling and server errors
     * @throws PermanentDeliveryException when the gateway rejects the message or token
     */
    String send(String token, PushMessage message);
}
