package com.repairline.worker.broker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * In-process broker for local runs and tests.
 * Messages delivered {@code maxDeliveryAttempts} times without an ack move to the dead letters.
 */
public class InMemoryMessageBroker implements MessageBroker {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageBroker.class);

    private final Clock clock;
    private final int maxDeliveryAttempts;
    private final Map<String, Entry> messages = new LinkedHashMap<>();
    private final List<BrokerMessage> deadLetters = new ArrayList<>();

    public InMemoryMessageBroker(Clock clock) {
        this(clock, 0);
    }

    /**
     * @param maxDeliveryAttempts deliveries before dead-lettering; 0 for unlimited
     */
    public InMemoryMessageBroker(Clock clock, int maxDeliveryAttempts) {
        this.clock = clock;
        this.maxDeliveryAttempts = maxDeliveryAttempts;
    }

    @Override
    public synchronized String publish(String data, Map<String, String> attributes) {
        String messageId = UUID.randomUUID().toString();
        messages.put(messageId, new Entry(messageId, data, attributes, clock.instant()));
        return messageId;
    }

    @Override
    public synchronized List<ReceivedMessage> pull(int maxMessages, Duration ackDeadline) {
        Instant now = clock.instant();
        List<ReceivedMessage> leased = new ArrayList<>();
        Iterator<Entry> it = messages.values().iterator();

        while (it.hasNext() && leased.size() < maxMessages) {
            Entry entry = it.next();
            if (entry.invisibleUntil.isAfter(now)) {
                continue;
            }
            if (maxDeliveryAttempts > 0 && entry.deliveryAttempt >= maxDeliveryAttempts) {
                log.warn("Message {} dead-lettered after {} deliveries", entry.messageId, entry.deliveryAttempt);
                deadLetters.add(entry.toMessage());
                it.remove();
                continue;
            }
            entry.deliveryAttempt++;
            entry.ackId = entry.messageId + ":" + entry.deliveryAttempt;
            entry.invisibleUntil = now.plus(ackDeadline);
            leased.add(new ReceivedMessage(entry.ackId, entry.toMessage()));
        }
        return leased;
    }

    @Override
    public synchronized boolean ack(String ackId) {
        Entry entry = findByAckId(ackId);
        if (entry == null) {
            return false;
        }
        messages.remove(entry.messageId);
        return true;
    }

    @Override
    public synchronized boolean nack(String ackId, Duration redeliveryDelay) {
        Entry entry = findByAckId(ackId);
        if (entry == null) {
            return false;
        }
        entry.invisibleUntil = clock.instant().plus(redeliveryDelay);
        return true;
    }

    /**
     * Messages not yet acknowledged, leased or not.
     */
    public synchronized int outstanding() {
        return messages.size();
    }

    public synchronized List<BrokerMessage> deadLetters() {
        return List.copyOf(deadLetters);
    }

    private Entry findByAckId(String ackId) {
        String messageId = ackId.substring(0, Math.max(0, ackId.lastIndexOf(':')));
        Entry entry = messages.get(messageId);
        return entry != null && ackId.equals(entry.ackId) ? entry : null;
    }

    private static final class Entry {
        private final String messageId;
        private final String data;
        private final Map<String, String> attributes;
        private final Instant publishTime;
        private int deliveryAttempt;
        private String ackId;
        private Instant invisibleUntil;

        private Entry(String messageId, String data, Map<String, String> attributes, Instant publishTime) {
            this.messageId = messageId;
            this.data = data;
            this.attributes = attributes;
            this.publishTime = publishTime;
            this.invisibleUntil = publishTime;
        }

        private BrokerMessage toMessage() {
            return new BrokerMessage(messageId, data, attributes, publishTime, deliveryAttempt);
        }
    }
}
