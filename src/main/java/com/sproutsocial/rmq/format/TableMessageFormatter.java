package com.sproutsocial.rmq.format;

import com.google.common.base.Strings;
import com.sproutsocial.rmq.RetrievedMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A boxed panel per message with a fixed width label column.
 */
public class TableMessageFormatter implements MessageFormatter {

    static final int LABEL_WIDTH = 17;

    @Override
    public String format(RetrievedMessage message, boolean compact) {
        List<String> lines = new ArrayList<String>();
        row(lines, "Queue", message.getQueue());
        row(lines, "Routing Key", message.getRoutingKey());
        row(lines, "Exchange", MessageFields.orDash(message.getExchange()));
        row(lines, "Redelivered", MessageFields.yesNo(message.isRedelivered()));

        Map<String, String> props = MessageFields.propertyRows(message.getProperties(), compact);
        if (!props.isEmpty()) {
            lines.add(null);
            lines.add("Properties");
            for (Map.Entry<String, String> e : props.entrySet()) {
                row(lines, e.getKey(), e.getValue());
            }
        }

        if (message.getHeaders() != null) {
            lines.add(null);
            lines.add("Custom Headers");
            for (Map.Entry<String, Object> e : message.getHeaders().entrySet()) {
                row(lines, e.getKey(), HeaderValueFormatter.formatValue(e.getValue(), LABEL_WIDTH));
            }
        }

        lines.add(null);
        lines.add("Body (" + message.getBodySize() + ")");
        for (String bodyLine : message.getBodyAsString().split("\r?\n", -1)) {
            lines.add(bodyLine);
        }
        return panel("Message #" + message.getDeliveryTag(), lines);
    }

    private static void row(List<String> lines, String label, String value) {
        String[] valueLines = value.split("\n", -1);
        String first = Strings.padEnd(label, LABEL_WIDTH, ' ') + valueLines[0];
        lines.add(first.replaceAll("\\s+$", ""));
        for (int i = 1; i < valueLines.length; i++) {
            //nested values already carry their own indentation
            lines.add(valueLines[i]);
        }
    }

    /**
     * Null entries are section separators, the entry after a separator is the section title.
     */
    static String panel(String title, List<String> lines) {
        int width = title.length() + 4;
        for (String line : lines) {
            if (line != null) {
                width = Math.max(width, line.length());
            }
        }
        StringBuilder sb = new StringBuilder();
        sb.append("╭─ ").append(title).append(' ')
                .append(Strings.repeat("─", width - title.length() - 1)).append("╮\n");
        boolean titleNext = false;
        for (String line : lines) {
            if (line == null) {
                titleNext = true;
                continue;
            }
            if (titleNext) {
                titleNext = false;
                sb.append("│ ── ").append(line).append(' ')
                        .append(Strings.repeat("─", Math.max(0, width - line.length() - 4))).append(" │\n");
                continue;
            }
            sb.append("│ ").append(Strings.padEnd(line, width, ' ')).append(" │\n");
        }
        sb.append('╰').append(Strings.repeat("─", width + 2)).append('╯');
        return sb.toString();
    }

}
