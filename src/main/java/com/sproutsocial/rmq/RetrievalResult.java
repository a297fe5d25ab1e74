package com.sproutsocial.rmq;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Outcome of one retrieval run. Serialized with the client's mapper, so properties come out snake_case.
 */
@JsonPropertyOrder({"status", "timestamp", "queue", "retrievalMode", "ackMode", "messagesReceived",
        "messagesProcessed", "messagesSkipped", "durationMs", "duration", "cancellationReason",
        "messagesPerSecond", "totalSizeBytes", "totalSize", "outputDestination", "outputFormat", "error"})
public class RetrievalResult {

    public static final String USER_CANCELLATION = "User cancellation (Ctrl+C)";
    public static final String OUTPUT_FAILURE = "Output failure";

    private String status = "success";
    private String timestamp;
    private String queue;
    private String retrievalMode;
    private String ackMode;
    private long messagesReceived;
    private long messagesProcessed;
    private long durationMs;
    private String cancellationReason;
    private long totalSizeBytes;
    private String outputDestination;
    private String outputFormat;
    private ErrorInfo error;

    public static RetrievalResult failed(String queue, ErrorInfo error) {
        RetrievalResult result = new RetrievalResult();
        result.setStatus("error");
        result.setQueue(queue);
        result.setError(error);
        return result;
    }

    public long getMessagesSkipped() {
        return messagesReceived - messagesProcessed;
    }

    public String getDuration() {
        return Util.elapsedTimeString(durationMs);
    }

    public double getMessagesPerSecond() {
        if (durationMs <= 0) {
            return 0;
        }
        return BigDecimal.valueOf(messagesProcessed * 1000.0 / durationMs).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    public String getTotalSize() {
        return Util.toSizeString(totalSizeBytes);
    }

    @JsonIgnore
    public boolean isCancelled() {
        return USER_CANCELLATION.equals(cancellationReason);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return "success".equals(status);
    }

    @JsonIgnore
    public int getExitCode() {
        return isSuccess() ? 0 : 1;
    }

    //region accessors
    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(String timestamp) {
        this.timestamp = timestamp;
    }

    public String getQueue() {
        return queue;
    }

    public void setQueue(String queue) {
        this.queue = queue;
    }

    public String getRetrievalMode() {
        return retrievalMode;
    }

    public void setRetrievalMode(String retrievalMode) {
        this.retrievalMode = retrievalMode;
    }

    public String getAckMode() {
        return ackMode;
    }

    public void setAckMode(String ackMode) {
        this.ackMode = ackMode;
    }

    public long getMessagesReceived() {
        return messagesReceived;
    }

    public void setMessagesReceived(long messagesReceived) {
        this.messagesReceived = messagesReceived;
    }

    public long getMessagesProcessed() {
        return messagesProcessed;
    }

    public void setMessagesProcessed(long messagesProcessed) {
        this.messagesProcessed = messagesProcessed;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }

    public String getCancellationReason() {
        return cancellationReason;
    }

    public void setCancellationReason(String cancellationReason) {
        this.cancellationReason = cancellationReason;
    }

    public long getTotalSizeBytes() {
        return totalSizeBytes;
    }

    public void setTotalSizeBytes(long totalSizeBytes) {
        this.totalSizeBytes = totalSizeBytes;
    }

    public String getOutputDestination() {
        return outputDestination;
    }

    public void setOutputDestination(String outputDestination) {
        this.outputDestination = outputDestination;
    }

    public String getOutputFormat() {
        return outputFormat;
    }

    public void setOutputFormat(String outputFormat) {
        this.outputFormat = outputFormat;
    }

    public ErrorInfo getError() {
        return error;
    }

    public void setError(ErrorInfo error) {
        this.error = error;
    }
    //endregion

    @Override
    public String toString() {
        return String.format("RetrievalResult %s queue:%s received:%d processed:%d skipped:%d reason:%s",
                status, queue, messagesReceived, messagesProcessed, getMessagesSkipped(), cancellationReason);
    }

}
