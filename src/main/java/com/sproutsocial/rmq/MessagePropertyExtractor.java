package com.sproutsocial.rmq;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.LongString;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts AMQP basic properties and header tables into the client's own types.
 */
class MessagePropertyExtractor {

    private MessagePropertyExtractor() {
    }

    static MessageProperties extractProperties(AMQP.BasicProperties props) {
        if (props == null) {
            return MessageProperties.EMPTY;
        }
        return MessageProperties.builder()
                .type(props.getType())
                .messageId(props.getMessageId())
                .appId(props.getAppId())
                .clusterId(props.getClusterId())
                .contentType(props.getContentType())
                .contentEncoding(props.getContentEncoding())
                .correlationId(props.getCorrelationId())
                .deliveryMode(props.getDeliveryMode())
                .expiration(props.getExpiration())
                .priority(props.getPriority())
                .replyTo(props.getReplyTo())
                .userId(props.getUserId())
                .timestamp(props.getTimestamp() != null ? unixSeconds(props.getTimestamp()) : null)
                .build();
    }

    /**
     * @return converted headers without null values, or null when nothing is left
     */
    static Map<String, Object> extractHeaders(AMQP.BasicProperties props) {
        if (props == null || props.getHeaders() == null) {
            return null;
        }
        Map<String, Object> converted = new LinkedHashMap<String, Object>();
        for (Map.Entry<String, Object> header : props.getHeaders().entrySet()) {
            if (header.getValue() != null) {
                converted.put(header.getKey(), convertValue(header.getValue()));
            }
        }
        return converted.isEmpty() ? null : converted;
    }

    @SuppressWarnings("unchecked")
    static Object convertValue(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof LongString) {
            return convertBytes(((LongString) value).getBytes());
        }
        if (value instanceof byte[]) {
            return convertBytes((byte[]) value);
        }
        if (value instanceof Date) {
            return unixSeconds((Date) value);
        }
        if (value instanceof Map) {
            Map<String, Object> map = new LinkedHashMap<String, Object>();
            for (Map.Entry<String, Object> entry : ((Map<String, Object>) value).entrySet()) {
                map.put(entry.getKey(), convertValue(entry.getValue()));
            }
            return map;
        }
        if (value instanceof List) {
            List<Object> list = new ArrayList<Object>();
            for (Object item : (List<Object>) value) {
                list.add(convertValue(item));
            }
            return list;
        }
        if (value instanceof Object[]) {
            List<Object> list = new ArrayList<Object>();
            for (Object item : (Object[]) value) {
                list.add(convertValue(item));
            }
            return list;
        }
        return value;
    }

    /**
     * Text when the bytes are valid UTF-8 without control characters (CR, LF and TAB allowed),
     * a binary marker otherwise.
     */
    static Object convertBytes(byte[] bytes) {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        }
        catch (CharacterCodingException e) {
            return binaryMarker(bytes.length);
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isISOControl(c) && c != '\r' && c != '\n' && c != '\t') {
                return binaryMarker(bytes.length);
            }
        }
        return text;
    }

    static String binaryMarker(int length) {
        return "<binary data: " + length + " bytes>";
    }

    private static long unixSeconds(Date date) {
        return date.getTime() / 1000;
    }

}
