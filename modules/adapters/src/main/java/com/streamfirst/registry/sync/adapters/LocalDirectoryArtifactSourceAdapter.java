package com.streamfirst.registry.sync.adapters;

import com.streamfirst.registry.sync.domain.RepackagingException;
import com.streamfirst.registry.sync.domain.SourceModelVersion;
import com.streamfirst.registry.sync.domain.StorageException;
import com.streamfirst.registry.sync.ports.ArtifactSourcePort;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/** Reads artifact bundles from a local directory addressed by a {@code file:} URI. */
@Slf4j
public class LocalDirectoryArtifactSourceAdapter implements ArtifactSourcePort {

  private static final String SCHEME = "file:";

  @Override
  public boolean supports(String artifactUri) {
    return artifactUri != null && artifactUri.startsWith(SCHEME);
  }

  @Override
  public void download(SourceModelVersion version, Path targetDirectory) {
    Path source = Paths.get(URI.create(version.getArtifactUri()));
    if (!Files.isDirectory(source)) {
      throw new RepackagingException("Artifact directory " + source + " of " + version + " does not exist");
    }
    log.debug("Copying artifact of {} from {}", version, source);
    try (Stream<Path> paths = Files.walk(source)) {
      paths.forEach(path -> copy(source, path, targetDirectory));
    } catch (IOException | UncheckedIOException e) {
      throw new StorageException("Failed to copy artifact of " + version + " from " + source, e);
    }
  }

  private static void copy(Path sourceRoot, Path path, Path targetRoot) {
    Path target = targetRoot.resolve(sourceRoot.relativize(path).toString());
    try {
      if (Files.isDirectory(path)) {
        Files.createDirectories(target);
      } else {
        Files.copy(path, target);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
