package com.sproutsocial.rmq;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Push consumer. The broker calls back for every delivery, this returns as soon as the consumer is registered.
 * <p>
 * Reaching the message count raises an internal limit signal. The user's cancellation and the limit signal
 * together stop the subscription: new deliveries are dropped, the broker consumer is cancelled
 * and the receive queue is closed. Dropped deliveries are never acknowledged, so the broker requeues them
 * when the channel closes.
 */
public class SubscriptionStrategy implements RetrievalStrategy {

    private final Executor executor;

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionStrategy.class);

    /**
     * @param executor runs the broker consumer cancel, off the thread that fired the cancellation
     */
    public SubscriptionStrategy(Executor executor) {
        this.executor = checkNotNull(executor);
    }

    @Override
    public void retrieveMessages(final BrokerChannel channel,
                                 final String queue,
                                 final HandoffQueue<RetrievedMessage> receiveQueue,
                                 final long messageCount,
                                 final ReceivedMessageCounter counter,
                                 final CancellationSignal cancellation) throws IOException {
        final CancellationSignal limitReached = new CancellationSignal("message-limit:" + queue);
        final CancellationSignal combined = CancellationSignal.anyOf("subscription:" + queue, cancellation, limitReached);
        //a delivery past the drop check always lands before the receive queue closes
        final Object deliveryLock = new Object();

        DeliveryHandler handler = new DeliveryHandler() {
            @Override
            public void accept(RetrievedMessage message) {
                long received;
                synchronized (deliveryLock) {
                    if (combined.isCancelled() || !receiveQueue.put(message)) {
                        logger.trace("dropped message #{} after cancellation", message.getDeliveryTag());
                        return;
                    }
                    received = counter.increment();
                }
                logger.trace("received message #{}", message.getDeliveryTag());
                if (received == messageCount) {
                    logger.debug("message limit {} reached, stopping subscription", messageCount);
                    limitReached.cancel();
                }
            }

            @Override
            public void cancelledByBroker(String consumerTag) {
                synchronized (deliveryLock) {
                    receiveQueue.close();
                }
            }
        };

        final String consumerTag;
        try {
            consumerTag = channel.subscribe(queue, handler);
        }
        catch (IOException | RuntimeException e) {
            receiveQueue.close();
            throw e;
        }
        logger.debug("subscribed to queue:{} consumer:{}", queue, consumerTag);

        combined.onCancel(new Runnable() {
            public void run() {
                logger.debug("cancellation requested - stopping consumer:{} reason:{}", consumerTag,
                        cancellation.isCancelled() ? "user cancellation" : "message count limit reached");
                cancelConsumer(channel, consumerTag);
                synchronized (deliveryLock) {
                    receiveQueue.close();
                }
                logger.debug("receive queue closed after receiving {} messages", counter.getValue());
            }
        });
    }

    /**
     * Fire and forget. A failed cancel is not fatal, the channel closes shortly after anyway.
     */
    private void cancelConsumer(final BrokerChannel channel, final String consumerTag) {
        Runnable cancelTask = new Runnable() {
            public void run() {
                try {
                    channel.cancelSubscription(consumerTag);
                    logger.debug("consumer:{} cancelled", consumerTag);
                }
                catch (Exception e) {
                    logger.warn("failed to cancel consumer:{}", consumerTag, e);
                }
            }
        };
        try {
            executor.execute(cancelTask);
        }
        catch (RejectedExecutionException e) {
            logger.warn("could not schedule cancel of consumer:{}", consumerTag, e);
        }
    }

    @Override
    public String getName() {
        return "subscribe";
    }

}
