package com.sproutsocial.rmq;

/**
 * The standard AMQP basic properties of a message. Every property is independently present or null.
 * Timestamp is Unix seconds.
 */
public final class MessageProperties {

    public static final MessageProperties EMPTY = new Builder().build();

    private final String appId;
    private final String clusterId;
    private final String contentType;
    private final String contentEncoding;
    private final String correlationId;
    private final Integer deliveryMode;
    private final String expiration;
    private final String messageId;
    private final Integer priority;
    private final String replyTo;
    private final Long timestamp;
    private final String type;
    private final String userId;

    private MessageProperties(Builder builder) {
        this.appId = builder.appId;
        this.clusterId = builder.clusterId;
        this.contentType = builder.contentType;
        this.contentEncoding = builder.contentEncoding;
        this.correlationId = builder.correlationId;
        this.deliveryMode = builder.deliveryMode;
        this.expiration = builder.expiration;
        this.messageId = builder.messageId;
        this.priority = builder.priority;
        this.replyTo = builder.replyTo;
        this.timestamp = builder.timestamp;
        this.type = builder.type;
        this.userId = builder.userId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasAnyProperty() {
        return type != null || messageId != null || appId != null || clusterId != null
                || contentType != null || contentEncoding != null || correlationId != null
                || deliveryMode != null || expiration != null || priority != null
                || replyTo != null || timestamp != null || userId != null;
    }

    //region accessors
    public String getAppId() {
        return appId;
    }

    public String getClusterId() {
        return clusterId;
    }

    public String getContentType() {
        return contentType;
    }

    public String getContentEncoding() {
        return contentEncoding;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public Integer getDeliveryMode() {
        return deliveryMode;
    }

    public String getExpiration() {
        return expiration;
    }

    public String getMessageId() {
        return messageId;
    }

    public Integer getPriority() {
        return priority;
    }

    public String getReplyTo() {
        return replyTo;
    }

    public Long getTimestamp() {
        return timestamp;
    }

    public String getType() {
        return type;
    }

    public String getUserId() {
        return userId;
    }
    //endregion

    @Override
    public String toString() {
        return "MessageProperties{" +
                "appId='" + appId + '\'' +
                ", clusterId='" + clusterId + '\'' +
                ", contentType='" + contentType + '\'' +
                ", contentEncoding='" + contentEncoding + '\'' +
                ", correlationId='" + correlationId + '\'' +
                ", deliveryMode=" + deliveryMode +
                ", expiration='" + expiration + '\'' +
                ", messageId='" + messageId + '\'' +
                ", priority=" + priority +
                ", replyTo='" + replyTo + '\'' +
                ", timestamp=" + timestamp +
                ", type='" + type + '\'' +
                ", userId='" + userId + '\'' +
                '}';
    }

    public static final class Builder {
        private String appId;
        private String clusterId;
        private String contentType;
        private String contentEncoding;
        private String correlationId;
        private Integer deliveryMode;
        private String expiration;
        private String messageId;
        private Integer priority;
        private String replyTo;
        private Long timestamp;
        private String type;
        private String userId;

        private Builder() {
        }

        public Builder appId(String appId) {
            this.appId = appId;
            return this;
        }

        public Builder clusterId(String clusterId) {
            this.clusterId = clusterId;
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder contentEncoding(String contentEncoding) {
            this.contentEncoding = contentEncoding;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder deliveryMode(Integer deliveryMode) {
            this.deliveryMode = deliveryMode;
            return this;
        }

        public Builder expiration(String expiration) {
            this.expiration = expiration;
            return this;
        }

        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder priority(Integer priority) {
            this.priority = priority;
            return this;
        }

        public Builder replyTo(String replyTo) {
            this.replyTo = replyTo;
            return this;
        }

        public Builder timestamp(Long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public MessageProperties build() {
            return new MessageProperties(this);
        }
    }

}
