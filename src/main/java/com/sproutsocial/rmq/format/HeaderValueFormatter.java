package com.sproutsocial.rmq.format;

import com.google.common.base.Strings;

import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map;

/**
 * Renders header values for the human readable formats. Small flat maps and lists stay on one line,
 * anything larger or nested is spread over indented lines.
 */
public final class HeaderValueFormatter {

    static final int MAX_INLINE_MAP_ENTRIES = 3;
    static final int MAX_INLINE_LIST_ITEMS = 5;
    private static final int INDENT = 2;

    private HeaderValueFormatter() {
    }

    public static String formatValue(Object value) {
        return formatValue(value, 0);
    }

    /**
     * @param indent the indentation of the line the value starts on, used for continuation lines
     */
    public static String formatValue(Object value, int indent) {
        if (value == null) {
            return "-";
        }
        if (value instanceof byte[]) {
            return "<binary data: " + ((byte[]) value).length + " bytes>";
        }
        if (value instanceof String) {
            String s = (String) value;
            return s.startsWith("<binary data:") ? s : escape(s);
        }
        if (value instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) value;
            return map.isEmpty() ? "{}" : formatMap(map, indent);
        }
        if (value instanceof Object[]) {
            value = Arrays.asList((Object[]) value);
        }
        if (value instanceof Collection) {
            Collection<?> list = (Collection<?>) value;
            return list.isEmpty() ? "[]" : formatList(list, indent);
        }
        return value.toString();
    }

    private static String formatMap(Map<?, ?> map, int indent) {
        boolean nested = false;
        for (Object v : map.values()) {
            if (v instanceof Map || (v instanceof Collection && !((Collection<?>) v).isEmpty())) {
                nested = true;
                break;
            }
        }
        if (!nested && map.size() <= MAX_INLINE_MAP_ENTRIES) {
            StringBuilder sb = new StringBuilder("{");
            Iterator<? extends Map.Entry<?, ?>> it = map.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<?, ?> e = it.next();
                sb.append(e.getKey()).append(": ").append(formatValue(e.getValue(), indent));
                if (it.hasNext()) {
                    sb.append(", ");
                }
            }
            return sb.append('}').toString();
        }
        String pad = Strings.repeat(" ", indent + INDENT);
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            sb.append('\n').append(pad).append(e.getKey()).append(": ")
                    .append(formatValue(e.getValue(), indent + INDENT));
        }
        return sb.toString();
    }

    private static String formatList(Collection<?> list, int indent) {
        boolean complex = false;
        for (Object item : list) {
            if (item instanceof Map) {
                complex = true;
                break;
            }
        }
        if (!complex && list.size() <= MAX_INLINE_LIST_ITEMS) {
            StringBuilder sb = new StringBuilder("[");
            Iterator<?> it = list.iterator();
            while (it.hasNext()) {
                sb.append(formatValue(it.next(), indent));
                if (it.hasNext()) {
                    sb.append(", ");
                }
            }
            return sb.append(']').toString();
        }
        String pad = Strings.repeat(" ", indent + INDENT);
        StringBuilder sb = new StringBuilder();
        for (Object item : list) {
            sb.append('\n').append(pad).append("- ").append(formatValue(item, indent + INDENT));
        }
        return sb.toString();
    }

    static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\n", "\\n").replace("\r", "\\r").replace("\t", "\\t");
    }

}
