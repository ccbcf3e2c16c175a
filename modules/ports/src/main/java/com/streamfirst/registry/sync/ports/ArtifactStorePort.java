package com.streamfirst.registry.sync.ports;

import com.streamfirst.registry.sync.domain.ArtifactLocation;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Durable storage for repackaged archives. Writes must be overwrite-safe: putting the same location
 * twice leaves a single object holding the latest content.
 */
public interface ArtifactStorePort {

  /** Size and content hash of a stored object. */
  record StoredObject(ArtifactLocation location, long size, Optional<String> sha256) {}

  /**
   * Uploads a local file, replacing any object already at the location.
   *
   * @param location where to store the file
   * @param file the local file to upload
   * @param sha256 hex encoded SHA-256 of the file, kept with the object for later verification
   * @throws com.streamfirst.registry.sync.domain.StorageException if the write fails
   */
  void put(ArtifactLocation location, Path file, String sha256);

  /**
   * Describes the object at a location.
   *
   * @return the object's size and hash, or empty if nothing is stored there
   * @throws com.streamfirst.registry.sync.domain.StorageException if storage cannot be queried
   */
  Optional<StoredObject> stat(ArtifactLocation location);

  /**
   * Deletes the object at a location. Deleting a missing object is not an error.
   *
   * @return true if an object was removed
   */
  boolean delete(ArtifactLocation location);

  default boolean exists(ArtifactLocation location) {
    return stat(location).isPresent();
  }
}
