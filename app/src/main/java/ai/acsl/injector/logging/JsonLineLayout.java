package ai.acsl.injector.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.LayoutBase;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders each event as one JSON object per line for {@code --log-format json}. Batch workers tag their
 * events with the job id, which lands under {@code "mdc"}.
 */
public class JsonLineLayout extends LayoutBase<ILoggingEvent> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public String doLayout(ILoggingEvent event) {
        ObjectNode line = MAPPER.createObjectNode();
        line.put("timestamp", Instant.ofEpochMilli(event.getTimeStamp()).toString());
        line.put("level", String.valueOf(event.getLevel()));
        line.put("logger", event.getLoggerName());
        line.put("thread", event.getThreadName());
        line.put("message", event.getFormattedMessage());

        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            line.put("exception", throwable.getClassName() + ": " + throwable.getMessage());
        }
        Map<String, String> mdc = mdcOf(event);
        if (!mdc.isEmpty()) {
            ObjectNode context = line.putObject("mdc");
            new TreeMap<>(mdc).forEach(context::put);
        }

        try {
            return MAPPER.writeValueAsString(line) + System.lineSeparator();
        } catch (JsonProcessingException ex) {
            addError("Failed to render log event as JSON", ex);
            return event.getFormattedMessage() + System.lineSeparator();
        }
    }

    // Events built outside a logger context have no MDC adapter.
    private static Map<String, String> mdcOf(ILoggingEvent event) {
        try {
            Map<String, String> map = event.getMDCPropertyMap();
            return map == null ? Map.of() : map;
        } catch (RuntimeException ex) {
            return Map.of();
        }
    }
}
