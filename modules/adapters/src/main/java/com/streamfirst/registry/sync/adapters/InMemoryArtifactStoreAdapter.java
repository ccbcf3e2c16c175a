package com.streamfirst.registry.sync.adapters;

import com.streamfirst.registry.sync.domain.ArtifactLocation;
import com.streamfirst.registry.sync.domain.StorageException;
import com.streamfirst.registry.sync.ports.ArtifactStorePort;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory implementation of ArtifactStorePort for testing and development. Simulates object
 * storage using byte arrays. Data is lost when the application stops - not suitable for production
 * use.
 */
@Slf4j
public class InMemoryArtifactStoreAdapter implements ArtifactStorePort {

  public static final String PUT_ARTIFACT = "put-artifact";
  public static final String DELETE_ARTIFACT = "delete-artifact";

  private record StoredContent(byte[] bytes, String sha256) {}

  private final Map<ArtifactLocation, StoredContent> objects = new ConcurrentHashMap<>();
  private final AtomicInteger pendingPutFailures = new AtomicInteger();
  private final AtomicInteger putCount = new AtomicInteger();
  private final OperationJournal journal;

  public InMemoryArtifactStoreAdapter() {
    this(new OperationJournal());
  }

  public InMemoryArtifactStoreAdapter(OperationJournal journal) {
    this.journal = journal;
  }

  @Override
  public void put(ArtifactLocation location, Path file, String sha256) {
    if (pendingPutFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
      throw new StorageException("Injected write failure for " + location, null);
    }
    byte[] bytes;
    try {
      bytes = Files.readAllBytes(file);
    } catch (IOException e) {
      log.error("Failed to read {} for upload to {}", file, location, e);
      throw new StorageException("Failed to read " + file, e);
    }
    objects.put(location, new StoredContent(bytes, sha256));
    putCount.incrementAndGet();
    journal.record(PUT_ARTIFACT, location.uri());
    log.debug("Stored {} ({} bytes)", location, bytes.length);
  }

  @Override
  public Optional<StoredObject> stat(ArtifactLocation location) {
    StoredContent content = objects.get(location);
    if (content == null) {
      return Optional.empty();
    }
    return Optional.of(
        new StoredObject(location, content.bytes().length, Optional.ofNullable(content.sha256())));
  }

  @Override
  public boolean delete(ArtifactLocation location) {
    boolean removed = objects.remove(location) != null;
    if (removed) {
      journal.record(DELETE_ARTIFACT, location.uri());
      log.debug("Deleted {}", location);
    }
    return removed;
  }

  /** Gets the stored bytes at a location. */
  public Optional<byte[]> read(ArtifactLocation location) {
    return Optional.ofNullable(objects.get(location)).map(c -> Arrays.copyOf(c.bytes(), c.bytes().length));
  }

  public Set<ArtifactLocation> locations() {
    return Set.copyOf(objects.keySet());
  }

  /** Number of uploads performed so far. */
  public int putCount() {
    return putCount.get();
  }

  /** Makes the next {@code times} uploads fail with a retryable storage error. */
  public void failNextPuts(int times) {
    pendingPutFailures.set(times);
  }

  public void clear() {
    objects.clear();
    pendingPutFailures.set(0);
    putCount.set(0);
  }
}
