package com.sproutsocial.rmq;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Turns ack intents into broker acknowledgments, in the order the intents were queued.
 * In forced requeue mode every intent becomes a requeue and no positive acknowledgment is ever sent.
 */
public class AckDispatcher {

    private final boolean forceRequeue;

    //written only by the dispatching thread
    private volatile long ackedCount = 0;
    private volatile long rejectedCount = 0;
    private volatile long requeuedCount = 0;
    private volatile long failedCount = 0;

    private static final Logger logger = LoggerFactory.getLogger(AckDispatcher.class);

    public AckDispatcher(boolean forceRequeue) {
        this.forceRequeue = forceRequeue;
    }

    public AckDispatcher() {
        this(false);
    }

    /**
     * Returns once the ack queue is closed and drained.
     */
    public void dispatchAcknowledgments(HandoffQueue<AckIntent> ackQueue, BrokerChannel channel) throws InterruptedException {
        logger.debug("starting acknowledgment dispatcher (forceRequeue:{})", forceRequeue);
        AckIntent intent;
        while ((intent = ackQueue.take()) != null) {
            AckMode outcome = forceRequeue ? AckMode.REQUEUE : intent.getOutcome();
            try {
                dispatch(channel, intent.getDeliveryTag(), outcome);
            }
            catch (IOException | RuntimeException e) {
                //keep draining, the broker takes the message back when the channel closes
                failedCount++;
                logger.error("{} failed for message #{}. {}", outcome, intent.getDeliveryTag(), stateDesc(), e);
            }
        }
        logger.debug("acknowledgment dispatcher finished. {}", stateDesc());
    }

    private void dispatch(BrokerChannel channel, long deliveryTag, AckMode outcome) throws IOException {
        switch (outcome) {
            case ACK:
                logger.trace("acknowledging message #{}", deliveryTag);
                channel.ack(deliveryTag);
                ackedCount++;
                break;
            case REJECT:
                logger.trace("rejecting message #{} without requeue", deliveryTag);
                channel.reject(deliveryTag, false);
                rejectedCount++;
                break;
            case REQUEUE:
                logger.trace("requeuing message #{}", deliveryTag);
                channel.reject(deliveryTag, true);
                requeuedCount++;
                break;
            default:
                throw new IllegalStateException("unknown ack mode " + outcome);
        }
    }

    public boolean isForceRequeue() {
        return forceRequeue;
    }

    public long getAckedCount() {
        return ackedCount;
    }

    public long getRejectedCount() {
        return rejectedCount;
    }

    public long getRequeuedCount() {
        return requeuedCount;
    }

    public long getFailedCount() {
        return failedCount;
    }

    public String stateDesc() {
        return String.format("ack:%d reject:%d requeue:%d failed:%d", ackedCount, rejectedCount, requeuedCount, failedCount);
    }

}
