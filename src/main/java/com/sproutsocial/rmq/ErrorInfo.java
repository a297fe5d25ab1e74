package com.sproutsocial.rmq;

/**
 * A user facing error: what failed, what kind of failure it is and what to try.
 */
public class ErrorInfo {

    private final String code;
    private final String error;
    private final String category;
    private final String suggestion;

    public ErrorInfo(String code, String error, String category, String suggestion) {
        this.code = code;
        this.error = error;
        this.category = category;
        this.suggestion = suggestion;
    }

    public static ErrorInfo queueNotFound(String queue) {
        return new ErrorInfo("QUEUE_NOT_FOUND", "Queue '" + queue + "' not found", "routing",
                "Check if the queue exists and is correctly configured");
    }

    public static ErrorInfo connectionFailed(BrokerConfig config, Throwable cause) {
        return new ErrorInfo("CONNECTION_FAILED",
                "Could not connect to " + config.getHost() + ":" + config.getPort() + " (" + cause.getMessage() + ")",
                "connection", "Check that the broker is running and the connection settings are correct");
    }

    public static ErrorInfo retrievalFailed(Throwable cause) {
        return new ErrorInfo("RETRIEVAL_FAILED", String.valueOf(cause.getMessage()), "internal", null);
    }

    public String getCode() {
        return code;
    }

    public String getError() {
        return error;
    }

    public String getCategory() {
        return category;
    }

    public String getSuggestion() {
        return suggestion;
    }

    @Override
    public String toString() {
        return String.format("ErrorInfo %s: %s", code, error);
    }

}
