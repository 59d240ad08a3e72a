package ai.acsl.injector.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonLineLayoutTest {

    private static final LoggerContext CONTEXT = new LoggerContext();
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void writesOneJsonObjectPerLine() throws Exception {
        String line = layout().doLayout(event("spliced 3 fragments into \"clamp\"\n\tdone"));

        assertThat(line).endsWith(System.lineSeparator());
        assertThat(line.strip()).doesNotContain("\n");
        JsonNode json = MAPPER.readTree(line);
        assertThat(json.get("timestamp").asText()).isEqualTo("1970-01-01T00:00:00Z");
        assertThat(json.get("level").asText()).isEqualTo("INFO");
        assertThat(json.get("logger").asText()).isEqualTo("ai.acsl.injector.pipeline");
        assertThat(json.get("thread").asText()).isEqualTo("main");
        assertThat(json.get("message").asText()).isEqualTo("spliced 3 fragments into \"clamp\"\n\tdone");
        assertThat(json.has("mdc")).isFalse();
        assertThat(json.has("exception")).isFalse();
    }

    @Test
    void rendersJobFromMdcAndException() throws Exception {
        LoggingEvent event = event("job failed");
        event.setMDCPropertyMap(Map.of("job", "clamp", "attempt", "1"));
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("boom")));

        String line = layout().doLayout(event);

        assertThat(line).contains("\"mdc\":{\"attempt\":\"1\",\"job\":\"clamp\"}");
        assertThat(MAPPER.readTree(line).get("exception").asText()).isEqualTo("java.lang.IllegalStateException: boom");
    }

    private static JsonLineLayout layout() {
        CONTEXT.start();
        JsonLineLayout layout = new JsonLineLayout();
        layout.setContext(CONTEXT);
        layout.start();
        return layout;
    }

    private static LoggingEvent event(String message) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("ai.acsl.injector.pipeline");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(CONTEXT);
        return event;
    }
}
