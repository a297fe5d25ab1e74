package com.sproutsocial.rmq;

/**
 * What the output stage did with the messages it took from the receive queue.
 * Every message it took is either processed or skipped.
 */
public class MessageOutputResult {

    private final long processedCount;
    private final long skippedCount;
    private final long totalBytes;
    private final Throwable failure;

    public MessageOutputResult(long processedCount, long skippedCount, long totalBytes, Throwable failure) {
        this.processedCount = processedCount;
        this.skippedCount = skippedCount;
        this.totalBytes = totalBytes;
        this.failure = failure;
    }

    public long getProcessedCount() {
        return processedCount;
    }

    public long getSkippedCount() {
        return skippedCount;
    }

    public long getTotalBytes() {
        return totalBytes;
    }

    /**
     * @return the error that stopped the output, null if it ran to the end of the receive queue
     */
    public Throwable getFailure() {
        return failure;
    }

    public boolean isFailed() {
        return failure != null;
    }

    @Override
    public String toString() {
        return String.format("MessageOutputResult processed:%d skipped:%d bytes:%d failed:%s",
                processedCount, skippedCount, totalBytes, isFailed());
    }

}
