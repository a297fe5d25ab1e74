package com.sproutsocial.rmq;

/**
 * What to retrieve and how to acknowledge it.
 */
public class RetrievalOptions {

    private String queue;
    private AckMode ackMode = AckMode.REQUEUE;
    private long messageCount = -1;
    private int prefetchCount = 0;

    public RetrievalOptions() {
    }

    public RetrievalOptions(String queue, AckMode ackMode, long messageCount) {
        this.queue = queue;
        this.ackMode = ackMode;
        this.messageCount = messageCount;
    }

    public boolean isUnlimited() {
        return messageCount <= 0;
    }

    //region accessors
    public String getQueue() {
        return queue;
    }

    public void setQueue(String queue) {
        this.queue = queue;
    }

    public AckMode getAckMode() {
        return ackMode;
    }

    public void setAckMode(AckMode ackMode) {
        this.ackMode = ackMode;
    }

    /**
     * @return the target number of messages, zero or less for no limit
     */
    public long getMessageCount() {
        return messageCount;
    }

    public void setMessageCount(long messageCount) {
        this.messageCount = messageCount;
    }

    /**
     * @return the broker prefetch for subscriptions, 0 leaves the broker default
     */
    public int getPrefetchCount() {
        return prefetchCount;
    }

    public void setPrefetchCount(int prefetchCount) {
        this.prefetchCount = prefetchCount;
    }
    //endregion

    @Override
    public String toString() {
        return "RetrievalOptions{" +
                "queue='" + queue + '\'' +
                ", ackMode=" + ackMode +
                ", messageCount=" + messageCount +
                ", prefetchCount=" + prefetchCount +
                '}';
    }

}
