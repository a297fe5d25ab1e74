package com.sproutsocial.rmq.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sproutsocial.rmq.MessageProperties;
import com.sproutsocial.rmq.RetrievedMessage;
import com.sproutsocial.rmq.RmqException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One JSON object per message, on a single line. A body that is itself a JSON object or array is embedded
 * as JSON, any other body is a string.
 */
public class JsonMessageFormatter implements MessageFormatter {

    private final ObjectMapper mapper;

    public JsonMessageFormatter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public JsonMessageFormatter() {
        this(new ObjectMapper());
    }

    @Override
    public String format(RetrievedMessage message, boolean compact) {
        Map<String, Object> json = new LinkedHashMap<String, Object>();
        json.put("exchange", message.getExchange());
        json.put("routingKey", message.getRoutingKey());
        json.put("queue", message.getQueue());
        json.put("deliveryTag", message.getDeliveryTag());
        json.put("redelivered", message.isRedelivered());
        json.put("body", bodyValue(message.getBodyAsString()));
        json.put("bodySizeBytes", message.getBodySizeBytes());
        json.put("bodySize", message.getBodySize());
        Map<String, Object> props = properties(message.getProperties());
        if (!props.isEmpty()) {
            json.put("properties", props);
        }
        if (message.getHeaders() != null) {
            json.put("headers", message.getHeaders());
        }
        try {
            return mapper.writeValueAsString(json);
        }
        catch (JsonProcessingException e) {
            throw new RmqException("could not serialize message #" + message.getDeliveryTag(), e);
        }
    }

    Object bodyValue(String body) {
        String trimmed = body.trim();
        boolean looksLikeJson = (trimmed.startsWith("{") && trimmed.endsWith("}"))
                || (trimmed.startsWith("[") && trimmed.endsWith("]"));
        if (!looksLikeJson) {
            return body;
        }
        try {
            JsonNode node = mapper.readTree(trimmed);
            return node.isContainerNode() ? node : body;
        }
        catch (JsonProcessingException e) {
            return body;
        }
    }

    private static Map<String, Object> properties(MessageProperties p) {
        Map<String, Object> props = new LinkedHashMap<String, Object>();
        putIfPresent(props, "type", p.getType());
        putIfPresent(props, "messageId", p.getMessageId());
        putIfPresent(props, "appId", p.getAppId());
        putIfPresent(props, "clusterId", p.getClusterId());
        putIfPresent(props, "contentType", p.getContentType());
        putIfPresent(props, "contentEncoding", p.getContentEncoding());
        putIfPresent(props, "correlationId", p.getCorrelationId());
        putIfPresent(props, "deliveryMode", p.getDeliveryMode());
        putIfPresent(props, "expiration", p.getExpiration());
        putIfPresent(props, "priority", p.getPriority());
        putIfPresent(props, "replyTo", p.getReplyTo());
        putIfPresent(props, "timestamp", p.getTimestamp());
        putIfPresent(props, "userId", p.getUserId());
        return props;
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }

}
