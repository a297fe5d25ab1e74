package com.sproutsocial.rmq;

import java.io.Closeable;
import java.io.IOException;

/**
 * The broker operations the retrieval pipeline needs, on a single channel.
 * Closing the channel returns every delivery that was not acknowledged to its queue.
 */
public interface BrokerChannel extends Closeable {

    /**
     * Passive declare.
     * @throws QueueNotFoundException if the queue does not exist
     */
    QueueInfo checkQueue(String queue) throws IOException;

    /**
     * Pull one message with manual acknowledgment.
     * @return the message, or null when the queue has nothing to deliver
     */
    RetrievedMessage fetch(String queue) throws IOException;

    /**
     * Register a push consumer with manual acknowledgment.
     * @return the consumer tag, needed to cancel
     */
    String subscribe(String queue, DeliveryHandler handler) throws IOException;

    void cancelSubscription(String consumerTag) throws IOException;

    void ack(long deliveryTag) throws IOException;

    void reject(long deliveryTag, boolean requeue) throws IOException;

    void setPrefetchCount(int prefetchCount) throws IOException;

    boolean isOpen();

}
