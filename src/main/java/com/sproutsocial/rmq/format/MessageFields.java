package com.sproutsocial.rmq.format;

import com.sproutsocial.rmq.MessageProperties;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Labels and display values shared by the text and table formats.
 */
final class MessageFields {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private MessageFields() {
    }

    /**
     * Property label to display value, in display order. Compact leaves out absent properties,
     * otherwise they show as "-".
     */
    static Map<String, String> propertyRows(MessageProperties props, boolean compact) {
        Map<String, String> rows = new LinkedHashMap<String, String>();
        addRow(rows, "Type", props.getType(), compact);
        addRow(rows, "Message ID", props.getMessageId(), compact);
        addRow(rows, "App ID", props.getAppId(), compact);
        addRow(rows, "Cluster ID", props.getClusterId(), compact);
        addRow(rows, "Content Type", props.getContentType(), compact);
        addRow(rows, "Content Encoding", props.getContentEncoding(), compact);
        addRow(rows, "Correlation ID", props.getCorrelationId(), compact);
        addRow(rows, "Delivery Mode", formatDeliveryMode(props.getDeliveryMode()), compact);
        addRow(rows, "Expiration", props.getExpiration(), compact);
        addRow(rows, "Priority", props.getPriority() == null ? null : props.getPriority().toString(), compact);
        addRow(rows, "Reply To", props.getReplyTo(), compact);
        addRow(rows, "Timestamp", formatTimestamp(props.getTimestamp()), compact);
        addRow(rows, "User ID", props.getUserId(), compact);
        return rows;
    }

    private static void addRow(Map<String, String> rows, String label, String value, boolean compact) {
        if (value != null) {
            rows.put(label, value);
        }
        else if (!compact) {
            rows.put(label, "-");
        }
    }

    static String formatTimestamp(Long epochSeconds) {
        if (epochSeconds == null) {
            return null;
        }
        return TIMESTAMP_FORMAT.format(Instant.ofEpochSecond(epochSeconds)) + " UTC";
    }

    static String formatDeliveryMode(Integer mode) {
        if (mode == null) {
            return null;
        }
        switch (mode) {
            case 1:
                return "Non-persistent (1)";
            case 2:
                return "Persistent (2)";
            default:
                return String.valueOf(mode);
        }
    }

    static String orDash(String s) {
        return s == null || s.isEmpty() ? "-" : s;
    }

    static String yesNo(boolean b) {
        return b ? "Yes" : "No";
    }

}
