package com.repairline.worker.broker;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Pull-mode subscription with at-least-once delivery.
 *
 * A pulled message stays invisible to other consumers until its ack deadline passes,
 * after which it is delivered again unless acknowledged.
 */
public interface MessageBroker {

    /**
     * @param data base64-encoded message body
     * @return the broker-assigned message id
     */
    String publish(String data, Map<String, String> attributes);

    /**
     * Lease up to {@code maxMessages} visible messages.
     */
    List<ReceivedMessage> pull(int maxMessages, Duration ackDeadline);

    /**
     * Remove the message for good.
     *
     * @return false if the lease behind this ack id expired and the message was handed out again
     */
    boolean ack(String ackId);

    /**
     * Give the message back; it becomes visible again once the delay has passed.
     */
    boolean nack(String ackId, Duration redeliveryDelay);

    /**
     * A leased message with the id that acknowledges this particular delivery.
     */
    record ReceivedMessage(String ackId, BrokerMessage message) {
    }
}
