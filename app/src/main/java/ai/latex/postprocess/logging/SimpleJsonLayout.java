package ai.latex.postprocess.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.LayoutBase;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.TreeMap;

/**
 * Single-line JSON layout so batch runs can be shipped to a log collector.
 */
public class SimpleJsonLayout extends LayoutBase<ILoggingEvent> {

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    @Override
    public String doLayout(ILoggingEvent event) {
        StringBuilder builder = new StringBuilder(256).append('{');
        field(builder, "timestamp", ISO_FORMATTER.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)));
        field(builder.append(','), "level", String.valueOf(event.getLevel()));
        field(builder.append(','), "logger", event.getLoggerName());
        field(builder.append(','), "message", event.getFormattedMessage());

        Map<String, String> mdc = safeMdc(event);
        if (!mdc.isEmpty()) {
            builder.append(",\"mdc\":{");
            boolean first = true;
            for (Map.Entry<String, String> entry : new TreeMap<>(mdc).entrySet()) {
                if (!first) {
                    builder.append(',');
                }
                field(builder, entry.getKey(), entry.getValue());
                first = false;
            }
            builder.append('}');
        }

        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            field(builder.append(','), "exception", throwable.getClassName());
            field(builder.append(','), "exceptionMessage", throwable.getMessage());
        }

        return builder.append('}').append(System.lineSeparator()).toString();
    }

    // Events built outside a logger context have no MDC adapter to consult.
    private static Map<String, String> safeMdc(ILoggingEvent event) {
        try {
            Map<String, String> map = event.getMDCPropertyMap();
            return map == null ? Map.of() : map;
        } catch (RuntimeException ex) {
            return Map.of();
        }
    }

    private static void field(StringBuilder builder, String name, String value) {
        quote(builder, name);
        builder.append(':');
        quote(builder, value);
    }

    private static void quote(StringBuilder builder, String value) {
        if (value == null) {
            builder.append("null");
            return;
        }
        builder.append('"');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '\\' -> builder.append("\\\\");
                case '"' -> builder.append("\\\"");
                case '\n' -> builder.append("\\n");
                case '\r' -> builder.append("\\r");
                case '\t' -> builder.append("\\t");
                default -> {
                    if (ch < 0x20) {
                        builder.append(String.format("\\u%04x", (int) ch));
                    } else {
                        builder.append(ch);
                    }
                }
            }
        }
        builder.append('"');
    }
}
