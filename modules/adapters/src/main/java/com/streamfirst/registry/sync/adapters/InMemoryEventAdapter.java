package com.streamfirst.registry.sync.adapters;

import com.streamfirst.registry.sync.ports.EventPort;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory implementation of EventPort for testing and development. Events are delivered
 * synchronously within the same JVM and kept per topic so tests can inspect what was published.
 */
@Slf4j
public class InMemoryEventAdapter implements EventPort {

  private record Subscription(String topic, Class<?> eventType, Consumer<Object> handler) {}

  private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
  private final Map<String, List<Object>> published = new ConcurrentHashMap<>();
  private final AtomicLong subscriptionCounter = new AtomicLong(1);

  @Override
  public void publish(String topic, Object event) {
    log.debug("Publishing event to topic '{}': {}", topic, event.getClass().getSimpleName());
    published.computeIfAbsent(topic, k -> new CopyOnWriteArrayList<>()).add(event);

    int delivered = 0;
    for (Subscription subscription : subscriptions.values()) {
      if (!subscription.topic().equals(topic) || !subscription.eventType().isInstance(event)) {
        continue;
      }
      try {
        subscription.handler().accept(event);
        delivered++;
      } catch (Exception e) {
        log.error("Error delivering event to subscriber for topic '{}'", topic, e);
      }
    }
    log.debug("Published event to topic '{}' - delivered to {} subscribers", topic, delivered);
  }

  @Override
  public <T> String subscribe(String topic, Class<T> eventType, Consumer<T> handler) {
    String subscriptionId = "sub-" + subscriptionCounter.getAndIncrement();
    subscriptions.put(
        subscriptionId, new Subscription(topic, eventType, event -> handler.accept(eventType.cast(event))));
    log.info(
        "Subscribed to topic '{}' for type '{}' with ID {}", topic, eventType.getSimpleName(), subscriptionId);
    return subscriptionId;
  }

  @Override
  public boolean unsubscribe(String subscriptionId) {
    Subscription removed = subscriptions.remove(subscriptionId);
    if (removed == null) {
      log.debug("Subscription '{}' not found", subscriptionId);
      return false;
    }
    log.info("Unsubscribed subscription '{}' from topic '{}'", subscriptionId, removed.topic());
    return true;
  }

  /** Gets every event published on a topic, oldest first. */
  public List<Object> published(String topic) {
    return List.copyOf(published.getOrDefault(topic, List.of()));
  }

  /** Gets the events of one type published on a topic, oldest first. */
  public <T> List<T> published(String topic, Class<T> eventType) {
    return published(topic).stream().filter(eventType::isInstance).map(eventType::cast).toList();
  }

  /** Clears all subscriptions and published events. Useful for testing. */
  public void clear() {
    log.info("Clearing all subscriptions");
    subscriptions.clear();
    published.clear();
  }
}
