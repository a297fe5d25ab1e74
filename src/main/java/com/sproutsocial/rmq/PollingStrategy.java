package com.sproutsocial.rmq;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * One basic.get per message, on the calling thread. An empty answer from the broker is the normal end of data.
 */
public class PollingStrategy implements RetrievalStrategy {

    private static final Logger logger = LoggerFactory.getLogger(PollingStrategy.class);

    @Override
    public void retrieveMessages(BrokerChannel channel,
                                 String queue,
                                 HandoffQueue<RetrievedMessage> receiveQueue,
                                 long messageCount,
                                 ReceivedMessageCounter counter,
                                 CancellationSignal cancellation) throws IOException {
        try {
            while (!cancellation.isCancelled()) {
                if (messageCount > 0 && counter.getValue() >= messageCount) {
                    break;
                }
                RetrievedMessage message = channel.fetch(queue);
                if (message == null) {
                    logger.debug("no more messages available in queue:{}", queue);
                    break;
                }
                logger.trace("fetched message #{}", message.getDeliveryTag());
                if (!receiveQueue.put(message)) {
                    //nobody will ack it, the broker takes it back when the channel closes
                    logger.debug("receive queue closed, leaving message #{} unacknowledged", message.getDeliveryTag());
                    break;
                }
                counter.increment();
            }
        }
        finally {
            receiveQueue.close();
            logger.debug("receive queue closed after fetching {} messages", counter.getValue());
        }
    }

    @Override
    public String getName() {
        return "polling";
    }

}
