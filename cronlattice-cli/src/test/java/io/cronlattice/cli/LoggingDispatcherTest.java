package io.cronlattice.cli;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronlattice.core.config.ObjectMappers;
import io.cronlattice.spi.ImmutableDispatchRequest;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class LoggingDispatcherTest
{
    @Test
    public void writesOneJsonLinePerDispatch()
            throws Exception
    {
        ObjectMapper mapper = ObjectMappers.objectMapper();
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        LoggingDispatcher dispatcher = new LoggingDispatcher(mapper, new PrintStream(bytes, true, "UTF-8"));

        dispatcher.dispatch(ImmutableDispatchRequest.builder()
                .targetId("orders")
                .linkName("cron")
                .jobName("report")
                .scheduledTime(Instant.parse("2024-01-15T10:15:00Z"))
                .payload("{\"format\":\"csv\"}")
                .build());

        String[] lines = new String(bytes.toByteArray(), StandardCharsets.UTF_8).split("\n");
        assertThat(lines.length, is(1));
        JsonNode json = mapper.readTree(lines[0]);
        assertThat(json.get("targetId").asText(), is("orders"));
        assertThat(json.get("linkName").asText(), is("cron"));
        assertThat(json.get("jobName").asText(), is("report"));
        assertThat(json.get("scheduledTime").asText(), is("2024-01-15T10:15:00Z"));
        assertThat(json.get("payload").asText(), is("{\"format\":\"csv\"}"));
    }
}
