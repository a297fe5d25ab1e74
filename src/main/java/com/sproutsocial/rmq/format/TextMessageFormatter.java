package com.sproutsocial.rmq.format;

import com.sproutsocial.rmq.RetrievedMessage;

import java.util.Map;

/**
 * Sectioned plain text: envelope, properties, custom headers and body.
 */
public class TextMessageFormatter implements MessageFormatter {

    @Override
    public String format(RetrievedMessage message, boolean compact) {
        StringBuilder sb = new StringBuilder();
        sb.append("== Message #").append(message.getDeliveryTag()).append(" ==\n");
        sb.append("Queue: ").append(message.getQueue()).append('\n');
        sb.append("Routing Key: ").append(message.getRoutingKey()).append('\n');
        sb.append("Exchange: ").append(MessageFields.orDash(message.getExchange())).append('\n');
        sb.append("Redelivered: ").append(MessageFields.yesNo(message.isRedelivered())).append('\n');

        Map<String, String> props = MessageFields.propertyRows(message.getProperties(), compact);
        if (!props.isEmpty()) {
            sb.append('\n').append("== Properties ==\n");
            for (Map.Entry<String, String> row : props.entrySet()) {
                sb.append(row.getKey()).append(": ").append(row.getValue()).append('\n');
            }
        }

        Map<String, Object> headers = message.getHeaders();
        if (headers != null) {
            sb.append('\n').append("== Custom Headers ==\n");
            for (Map.Entry<String, Object> header : headers.entrySet()) {
                sb.append(header.getKey()).append(": ").append(HeaderValueFormatter.formatValue(header.getValue())).append('\n');
            }
        }

        sb.append('\n').append("== Body (").append(message.getBodySize()).append(") ==\n");
        sb.append(message.getBodyAsString());
        return sb.toString();
    }

}
