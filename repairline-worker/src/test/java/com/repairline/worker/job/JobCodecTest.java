package com.repairline.worker.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.repairline.worker.broker.BrokerMessage;
import com.repairline.worker.broker.PushEnvelope;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private final JobCodec codec = new JobCodec(objectMapper);

    private static String base64(String json) {
        return Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("A push envelope decodes into its job")
    void decodesPushEnvelope() throws Exception {
        String job = """
            {"type": "workflow:execute", "tenantId": "acme", "source": "scheduler",
             "scheduleId": "nightly", "scheduledAt": "2026-03-01T09:00:00Z",
             "payload": {"workflowId": "repair"}, "unknownField": 1}
            """;
        String body = """
            {"message": {"data": "%s", "message_id": "991", "attributes": {"origin": "cron"}},
             "subscription": "projects/p/subscriptions/jobs", "deliveryAttempt": 3}
            """.formatted(base64(job));

        BrokerMessage message = objectMapper.readValue(body, PushEnvelope.class).toBrokerMessage();
        WorkerJob decoded = codec.decode(message);

        assertThat(message.messageId()).isEqualTo("991");
        assertThat(message.deliveryAttempt()).isEqualTo(3);
        assertThat(message.attribute("origin")).isEqualTo("cron");
        assertThat(decoded.type()).isEqualTo("workflow:execute");
        assertThat(decoded.scheduledAt()).isEqualTo(Instant.parse("2026-03-01T09:00:00Z"));
        assertThat(decoded.payload().get("workflowId").asText()).isEqualTo("repair");
        assertThat(decoded.resolveKey("991")).isEqualTo("scheduler:acme:nightly:2026-03-01T09:00:00Z");
    }

    @Test
    @DisplayName("A job without tenant takes it from the attributes, then from the payload")
    void tenantFallbacks() {
        BrokerMessage withAttribute = new BrokerMessage("1", base64("{\"type\": \"t\"}"),
            Map.of(JobCodec.TENANT_ATTRIBUTE, "from-attr"), null, 1);
        BrokerMessage withPayloadOrg = new BrokerMessage("2",
            base64("{\"type\": \"t\", \"payload\": {\"orgId\": \"from-payload\"}}"), Map.of(), null, 1);

        assertThat(codec.decode(withAttribute).tenantId()).isEqualTo("from-attr");
        assertThat(codec.decode(withPayloadOrg).tenantId()).isEqualTo("from-payload");
    }

    @Test
    @DisplayName("Messages without a type or tenant are malformed")
    void missingFieldsAreMalformed() {
        BrokerMessage noType = new BrokerMessage("1", base64("{\"tenantId\": \"acme\"}"), Map.of(), null, 1);
        BrokerMessage noTenant = new BrokerMessage("2", base64("{\"type\": \"t\"}"), Map.of(), null, 1);
        BrokerMessage empty = new BrokerMessage("3", null, Map.of(), null, 1);

        assertThatThrownBy(() -> codec.decode(noType)).isInstanceOf(MalformedJobException.class)
            .hasMessageContaining("type");
        assertThatThrownBy(() -> codec.decode(noTenant)).isInstanceOf(MalformedJobException.class)
            .hasMessageContaining("tenantId");
        assertThatThrownBy(() -> codec.decode(empty)).isInstanceOf(MalformedJobException.class);
    }

    @Test
    @DisplayName("Encoded jobs decode back to the same job")
    void encodeThenDecode() {
        WorkerJob job = WorkerJob.builder("health:check", "acme")
            .requestId("req-1")
            .payload(objectMapper.createObjectNode().put("ping", true))
            .build();

        WorkerJob decoded = codec.decode(new BrokerMessage("1", codec.encode(job), Map.of(), null, 1));

        assertThat(decoded).isEqualTo(job);
    }
}
