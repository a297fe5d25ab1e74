package com.sproutsocial.rmq;

import java.io.IOException;

/**
 * Pulls messages off a queue and hands them to the receive queue.
 * <p>
 * Every implementation counts each message it hands over, stops once {@code messageCount} messages were handed over
 * ({@code messageCount <= 0} means no limit), stops on cancellation, and closes the receive queue when it stops.
 */
public interface RetrievalStrategy {

    /**
     * Starts retrieving. May return before retrieval is over, completion is signalled by the receive queue closing.
     */
    void retrieveMessages(BrokerChannel channel,
                          String queue,
                          HandoffQueue<RetrievedMessage> receiveQueue,
                          long messageCount,
                          ReceivedMessageCounter counter,
                          CancellationSignal cancellation) throws IOException;

    /**
     * e.g. "polling", "subscribe"
     */
    String getName();

}
