package com.streamfirst.registry.sync.ports;

import java.util.function.Consumer;

/**
 * Port for publishing events to interested listeners, such as reconciliation reports and operator
 * alerts.
 */
public interface EventPort {

  /** Topic every reconciliation report is published on. */
  String REPORTS_TOPIC = "registry-sync.reports";

  /** Topic for reports an operator must look at. */
  String ALERTS_TOPIC = "registry-sync.alerts";

  /**
   * Publishes an event to a topic. Delivery failures of individual subscribers are not propagated.
   *
   * @param topic the topic name
   * @param event the event payload
   */
  void publish(String topic, Object event);

  /**
   * Subscribes to events of a given type on a topic.
   *
   * @param topic the topic name
   * @param eventType the payload type to receive
   * @param handler called for each matching event
   * @return a subscription ID for unsubscribing
   */
  <T> String subscribe(String topic, Class<T> eventType, Consumer<T> handler);

  /**
   * Removes a subscription.
   *
   * @return true if the subscription existed
   */
  boolean unsubscribe(String subscriptionId);
}
