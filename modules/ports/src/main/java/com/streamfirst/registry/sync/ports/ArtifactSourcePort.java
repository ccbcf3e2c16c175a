package com.streamfirst.registry.sync.ports;

import com.streamfirst.registry.sync.domain.SourceModelVersion;
import java.nio.file.Path;

/** Fetches the raw artifact bundle of a source model version onto local disk. */
public interface ArtifactSourcePort {

  /**
   * Whether this source can fetch artifacts addressed by the given URI.
   *
   * @param artifactUri the version's artifact URI
   */
  boolean supports(String artifactUri);

  /**
   * Downloads the artifact bundle into an existing, empty directory. After the call the directory
   * holds the bundle's files, including its {@code MLmodel} manifest.
   *
   * @param version the version whose artifact to fetch
   * @param targetDirectory the directory to download into
   * @throws com.streamfirst.registry.sync.domain.RegistryAccessException if the source cannot be read
   * @throws com.streamfirst.registry.sync.domain.RepackagingException if the artifact does not exist
   */
  void download(SourceModelVersion version, Path targetDirectory);
}
