package com.sproutsocial.rmq;

/**
 * Receives messages pushed by the broker for a subscription.
 * Called on the broker client's dispatch thread, one delivery at a time per channel.
 */
public interface DeliveryHandler {

    void accept(RetrievedMessage message);

    /**
     * The broker ended the subscription on its own, e.g. the queue was deleted.
     */
    void cancelledByBroker(String consumerTag);

}
