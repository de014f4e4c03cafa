package ca.gc.cra.lattice.adapter.kafka;

import ca.gc.cra.lattice.validation.Strings;
import java.util.Objects;

/**
 * Maps lattice subjects onto the three Kafka topics the client uses.
 *
 * <p>Subjects under the inbox prefix go to the reply topic, subjects whose last token is
 * {@code events} go to the event topic and everything else (probes and control commands) goes to
 * the request topic. The full subject travels as the record key.</p>
 *
 * @param requestTopic topic carrying probes and control commands
 * @param replyTopic topic carrying replies addressed to inbox subjects
 * @param eventTopic topic carrying lifecycle events
 * @param inboxPrefix first subject token of reply subjects (e.g., {@code _INBOX})
 *
 * @since 0.1.0
 */
public record KafkaTopics(String requestTopic, String replyTopic, String eventTopic, String inboxPrefix) {

  public KafkaTopics {
    requestTopic = Strings.sanitizeTopic("requestTopic", requestTopic);
    replyTopic = Strings.sanitizeTopic("replyTopic", replyTopic);
    eventTopic = Strings.sanitizeTopic("eventTopic", eventTopic);
    inboxPrefix = Strings.requireSubject("inboxPrefix", inboxPrefix);
  }

  /**
   * Resolves the Kafka topic for a subject or subject pattern.
   *
   * @param subject dotted subject
   * @return Kafka topic name
   */
  public String topicFor(String subject) {
    Objects.requireNonNull(subject, "subject");
    if (subject.equals(inboxPrefix) || subject.startsWith(inboxPrefix + '.')) {
      return replyTopic;
    }
    if (subject.equals("events") || subject.endsWith(".events")) {
      return eventTopic;
    }
    return requestTopic;
  }
}
