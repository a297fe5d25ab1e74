package com.sproutsocial.rmq;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One message taken off a queue, immutable once built.
 * <p>
 * The delivery tag is only meaningful on the channel that produced it and only until that channel closes.
 * Header values are String, Number, Boolean, nested {@code Map<String, Object>}, {@code List<Object>},
 * or a {@code "<binary data: N bytes>"} marker string.
 */
public final class RetrievedMessage {

    private final byte[] body;
    private final long deliveryTag;
    private final boolean redelivered;
    private final String exchange;
    private final String routingKey;
    private final String queue;
    private final MessageProperties properties;
    private final Map<String, Object> headers;

    private RetrievedMessage(Builder builder) {
        this.body = builder.body;
        this.deliveryTag = builder.deliveryTag;
        this.redelivered = builder.redelivered;
        this.exchange = builder.exchange;
        this.routingKey = builder.routingKey;
        this.queue = builder.queue;
        this.properties = builder.properties;
        this.headers = builder.headers == null || builder.headers.isEmpty()
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<String, Object>(builder.headers));
    }

    public static Builder builder() {
        return new Builder();
    }

    public byte[] getBody() {
        return body.clone();
    }

    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public long getBodySizeBytes() {
        return body.length;
    }

    public String getBodySize() {
        return Util.toSizeString(body.length);
    }

    public long getDeliveryTag() {
        return deliveryTag;
    }

    public boolean isRedelivered() {
        return redelivered;
    }

    public String getExchange() {
        return exchange;
    }

    public String getRoutingKey() {
        return routingKey;
    }

    public String getQueue() {
        return queue;
    }

    /**
     * Never null, {@link MessageProperties#EMPTY} when the message had none.
     */
    public MessageProperties getProperties() {
        return properties;
    }

    /**
     * Custom headers, null when the message had none.
     */
    public Map<String, Object> getHeaders() {
        return headers;
    }

    @Override
    public String toString() {
        return String.format("RetrievedMessage:%s queue:%s exchange:%s routingKey:%s size:%d",
                deliveryTag, queue, exchange, routingKey, body.length);
    }

    public static final class Builder {
        private byte[] body = new byte[0];
        private long deliveryTag;
        private boolean redelivered;
        private String exchange = "";
        private String routingKey = "";
        private String queue = "";
        private MessageProperties properties = MessageProperties.EMPTY;
        private Map<String, Object> headers;

        private Builder() {
        }

        public Builder body(byte[] body) {
            checkNotNull(body);
            this.body = body.clone();
            return this;
        }

        public Builder body(String body) {
            checkNotNull(body);
            this.body = body.getBytes(StandardCharsets.UTF_8);
            return this;
        }

        public Builder deliveryTag(long deliveryTag) {
            this.deliveryTag = deliveryTag;
            return this;
        }

        public Builder redelivered(boolean redelivered) {
            this.redelivered = redelivered;
            return this;
        }

        public Builder exchange(String exchange) {
            this.exchange = exchange == null ? "" : exchange;
            return this;
        }

        public Builder routingKey(String routingKey) {
            this.routingKey = routingKey == null ? "" : routingKey;
            return this;
        }

        public Builder queue(String queue) {
            this.queue = queue == null ? "" : queue;
            return this;
        }

        public Builder properties(MessageProperties properties) {
            this.properties = properties == null ? MessageProperties.EMPTY : properties;
            return this;
        }

        public Builder headers(Map<String, Object> headers) {
            this.headers = headers;
            return this;
        }

        public RetrievedMessage build() {
            return new RetrievedMessage(this);
        }
    }

}
