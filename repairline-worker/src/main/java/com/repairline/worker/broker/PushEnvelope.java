package com.repairline.worker.broker;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Map;

/**
 * Body of a push delivery: the message wrapped with its subscription.
 *
 * <pre>
 * {
 *   "message": {"data": "eyJ0eXBlIjoi...", "messageId": "1234", "attributes": {...}},
 *   "subscription": "projects/p/subscriptions/jobs-push",
 *   "deliveryAttempt": 2
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PushEnvelope(
    PushedMessage message,
    String subscription,
    Integer deliveryAttempt
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PushedMessage(
        String data,
        @JsonAlias("message_id") String messageId,
        Map<String, String> attributes,
        @JsonAlias("publish_time") Instant publishTime
    ) {
    }

    public BrokerMessage toBrokerMessage() {
        if (message == null) {
            return new BrokerMessage(null, null, Map.of(), null, attempt());
        }
        return new BrokerMessage(
            message.messageId(),
            message.data(),
            message.attributes(),
            message.publishTime(),
            attempt()
        );
    }

    private int attempt() {
        return deliveryAttempt != null ? deliveryAttempt : 1;
    }
}
