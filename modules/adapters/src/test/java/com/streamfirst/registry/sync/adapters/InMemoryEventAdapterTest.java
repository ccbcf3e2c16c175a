package com.streamfirst.registry.sync.adapters;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryEventAdapterTest {

  private final InMemoryEventAdapter events = new InMemoryEventAdapter();

  @Test
  void delivers_matching_events_to_subscribers() {
    List<String> received = new ArrayList<>();
    events.subscribe("reports", String.class, received::add);

    events.publish("reports", "first");
    events.publish("reports", 42);
    events.publish("alerts", "other topic");

    assertThat(received).containsExactly("first");
    assertThat(events.published("reports")).containsExactly("first", 42);
    assertThat(events.published("reports", Integer.class)).containsExactly(42);
  }

  @Test
  void failing_subscriber_does_not_stop_delivery() {
    List<String> received = new ArrayList<>();
    events.subscribe("reports", String.class, e -> {
      throw new IllegalStateException("subscriber failure");
    });
    events.subscribe("reports", String.class, received::add);

    events.publish("reports", "report");

    assertThat(received).containsExactly("report");
  }

  @Test
  void unsubscribed_handler_receives_nothing() {
    List<String> received = new ArrayList<>();
    String id = events.subscribe("reports", String.class, received::add);

    assertThat(events.unsubscribe(id)).isTrue();
    assertThat(events.unsubscribe(id)).isFalse();
    events.publish("reports", "report");

    assertThat(received).isEmpty();
  }
}
