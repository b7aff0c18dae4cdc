package com.repairline.worker.broker;

import java.time.Instant;
import java.util.Base64;
import java.util.Map;

/**
 * A message as delivered by the broker, push or pull.
 *
 * @param data base64-encoded job JSON
 * @param deliveryAttempt 1 on first delivery, incremented on each redelivery
 */
public record BrokerMessage(
    String messageId,
    String data,
    Map<String, String> attributes,
    Instant publishTime,
    int deliveryAttempt
) {
    public BrokerMessage {
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public static BrokerMessage of(String messageId, byte[] json) {
        return new BrokerMessage(messageId, Base64.getEncoder().encodeToString(json), Map.of(), null, 1);
    }

    /**
     * @throws IllegalArgumentException if the data is not valid base64
     */
    public byte[] decodedData() {
        return data != null ? Base64.getDecoder().decode(data) : new byte[0];
    }

    public String attribute(String name) {
        return attributes.get(name);
    }
}
