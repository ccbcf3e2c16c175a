package com.streamfirst.registry.sync.adapters;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Records mutations performed by the in-memory adapters in the order they happened. Sharing one
 * journal between the registry and the artifact store lets tests check ordering across both.
 */
public class OperationJournal {

  /**
   * One recorded mutation.
   *
   * @param sequence global position in the journal
   * @param operation what was done, e.g. "create-package"
   * @param subject what it was done to, e.g. a run ID or an artifact URI
   */
  public record Entry(long sequence, String operation, String subject) {}

  private final AtomicLong sequence = new AtomicLong();
  private final List<Entry> entries = new ArrayList<>();

  public synchronized void record(String operation, String subject) {
    entries.add(new Entry(sequence.incrementAndGet(), operation, subject));
  }

  public synchronized List<Entry> entries() {
    return List.copyOf(entries);
  }

  public synchronized List<Entry> entries(String operation) {
    return entries.stream().filter(e -> e.operation().equals(operation)).toList();
  }

  /** Position of the first entry matching the filter, or -1. */
  public synchronized long firstSequence(Predicate<Entry> filter) {
    return entries.stream().filter(filter).mapToLong(Entry::sequence).findFirst().orElse(-1);
  }

  /** Position of the last entry matching the filter, or -1. */
  public synchronized long lastSequence(Predicate<Entry> filter) {
    return entries.stream().filter(filter).mapToLong(Entry::sequence).max().orElse(-1);
  }

  public synchronized void clear() {
    entries.clear();
  }
}
