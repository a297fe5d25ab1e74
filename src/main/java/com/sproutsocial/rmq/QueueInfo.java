package com.sproutsocial.rmq;

/**
 * Result of the passive queue check.
 */
public final class QueueInfo {

    private final String queue;
    private final long messageCount;
    private final long consumerCount;

    public QueueInfo(String queue, long messageCount, long consumerCount) {
        this.queue = queue;
        this.messageCount = messageCount;
        this.consumerCount = consumerCount;
    }

    public String getQueue() {
        return queue;
    }

    public long getMessageCount() {
        return messageCount;
    }

    public long getConsumerCount() {
        return consumerCount;
    }

    @Override
    public String toString() {
        return String.format("QueueInfo:%s messages:%d consumers:%d", queue, messageCount, consumerCount);
    }

}
