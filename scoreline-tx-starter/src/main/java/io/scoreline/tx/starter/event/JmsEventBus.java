package io.scoreline.tx.starter.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.scoreline.tx.core.event.DomainEvent;
import io.scoreline.tx.core.event.EventBus;
import jakarta.jms.Connection;
import jakarta.jms.ConnectionFactory;
import jakarta.jms.DeliveryMode;
import jakarta.jms.JMSException;
import jakarta.jms.Message;
import jakarta.jms.MessageProducer;
import jakarta.jms.Session;
import jakarta.jms.TextMessage;
import jakarta.jms.Topic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Publishes domain events as JSON text messages to a JMS topic. The event
 * type and id travel as message properties so subscribers can filter with
 * selectors.
 */
public class JmsEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(JmsEventBus.class);

    private final ConnectionFactory connectionFactory;
    private final ObjectMapper objectMapper;
    private final String topicName;
    private final long ttlMs;

    public JmsEventBus(ConnectionFactory connectionFactory, ObjectMapper objectMapper, String topicName, long ttlMs) {
        this.connectionFactory = connectionFactory;
        this.objectMapper = objectMapper;
        this.topicName = topicName;
        this.ttlMs = ttlMs;
    }

    @Override
    public void publish(DomainEvent event) {
        publishBatch(List.of(event));
    }

    /**
     * Sends all events over one connection and session.
     */
    @Override
    public void publishBatch(List<? extends DomainEvent> events) {
        if (events.isEmpty()) {
            return;
        }

        Connection connection = null;
        Session session = null;
        MessageProducer producer = null;

        try {
            connection = connectionFactory.createConnection();
            connection.start();

            session = connection.createSession(false, Session.AUTO_ACKNOWLEDGE);
            Topic topic = session.createTopic(topicName);
            producer = session.createProducer(topic);
            producer.setTimeToLive(ttlMs);

            for (DomainEvent event : events) {
                TextMessage message = session.createTextMessage(objectMapper.writeValueAsString(event));
                message.setStringProperty("eventType", event.getEventType());
                message.setStringProperty("eventId", event.getEventId());
                message.setLongProperty("timestamp", event.getOccurredAt().toEpochMilli());
                message.setJMSCorrelationID(event.getEventId());

                producer.send(message, DeliveryMode.PERSISTENT, Message.DEFAULT_PRIORITY, ttlMs);
                log.debug("Event {} ({}) sent to topic {}", event.getEventType(), event.getEventId(), topicName);
            }

        } catch (JMSException e) {
            log.error("Failed to publish {} event(s) to topic: {}", events.size(), topicName, e);
            throw new IllegalStateException("JMS send failed: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event is not serializable: " + e.getOriginalMessage(), e);
        } finally {
            closeResources(producer, session, connection);
        }
    }

    public String getTopicName() {
        return topicName;
    }

    private void closeResources(MessageProducer producer, Session session, Connection connection) {
        try {
            if (producer != null) producer.close();
        } catch (Exception e) {
            log.warn("Error closing producer: {}", e.getMessage());
        }

        try {
            if (session != null) session.close();
        } catch (Exception e) {
            log.warn("Error closing session: {}", e.getMessage());
        }

        try {
            if (connection != null) connection.close();
        } catch (Exception e) {
            log.warn("Error closing connection: {}", e.getMessage());
        }
    }
}
