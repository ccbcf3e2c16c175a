package com.streamfirst.registry.sync.application.packaging;

import com.streamfirst.registry.sync.domain.*;
import com.streamfirst.registry.sync.ports.ArtifactSourcePort;
import com.streamfirst.registry.sync.ports.ArtifactStorePort;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;

/**
 * Turns a source model version into the archive layout the serving containers expect and stores it at
 * the run's deterministic location.
 *
 * <p>The archive holds the flavor's model files, {@code requirements.txt} and {@code inference.py}
 * (taken from the bundle's {@code sagemaker/} directory, or the built-in defaults for the flavor) and
 * the {@code MLmodel} manifest at its root. Archives are reproducible, so repackaging a run whose
 * archive is already stored finds the same hash and skips the upload.
 */
@Slf4j
public class ArtifactRepackager {

  static final String REQUIREMENTS = "requirements.txt";
  static final String INFERENCE_SCRIPT = "inference.py";
  private static final String BUNDLE_OVERRIDES = "sagemaker";
  private static final String DEFAULTS_ROOT = "/flavors/";

  private final List<ArtifactSourcePort> artifactSources;
  private final ArtifactStorePort artifactStore;
  private final ImageReferenceResolver imageResolver;
  private final String artifactBucket;

  public ArtifactRepackager(
      List<ArtifactSourcePort> artifactSources,
      ArtifactStorePort artifactStore,
      ImageReferenceResolver imageResolver,
      String artifactBucket) {
    this.artifactSources = List.copyOf(artifactSources);
    this.artifactStore = artifactStore;
    this.imageResolver = imageResolver;
    this.artifactBucket = artifactBucket;
  }

  /**
   * Repackages a version and stores the archive.
   *
   * @param version the source version
   * @return the stored archive
   * @throws RepackagingException if the artifact is malformed or its flavor unsupported
   * @throws StorageException if staging or upload fails transiently, or the call was cancelled
   * @throws RegistryAccessException if the source artifact cannot be downloaded
   */
  public RepackagedArtifact repackage(SourceModelVersion version) {
    ArtifactSourcePort source = sourceFor(version.getArtifactUri());
    ArtifactLocation location =
        ArtifactLocation.forRun(artifactBucket, version.getModelName(), version.getRunId());

    Path workDirectory = createWorkDirectory();
    try {
      Path bundle = Files.createDirectory(workDirectory.resolve("bundle"));
      log.debug("Downloading artifact of {} from {}", version, version.getArtifactUri());
      source.download(version, bundle);
      checkCancelled(version);

      ModelManifest manifest = ModelManifest.read(bundle);
      ModelFlavor flavor = selectFlavor(version, manifest);
      ServingImage image = imageResolver.resolve(version, flavor, manifest);

      Path archive = workDirectory.resolve(ArtifactLocation.ARCHIVE_NAME);
      buildArchive(bundle, manifest, image.servedAs(), archive);
      checkCancelled(version);

      String sha256 = sha256(archive);
      long size = Files.size(archive);
      boolean uploaded = store(location, archive, sha256);

      log.info(
          "Repackaged {} as {} ({} bytes, flavor {}, {})",
          version,
          location,
          size,
          image.servedAs(),
          uploaded ? "uploaded" : "already stored");
      return new RepackagedArtifact(
          location, sha256, size, image.servedAs(), image, environment(image.servedAs(), location), uploaded);
    } catch (IOException | UncheckedIOException e) {
      throw new StorageException("Failed to stage archive for " + version, e);
    } finally {
      deleteQuietly(workDirectory);
    }
  }

  private ArtifactSourcePort sourceFor(String artifactUri) {
    return artifactSources.stream()
        .filter(s -> s.supports(artifactUri))
        .findFirst()
        .orElseThrow(
            () -> new RepackagingException("No artifact source can read " + artifactUri));
  }

  private ModelFlavor selectFlavor(SourceModelVersion version, ModelManifest manifest) {
    Optional<String> override = version.tag(SourceModelVersion.DEPLOY_FLAVOR_TAG);
    if (override.isPresent()) {
      log.info("Using flavor {} found in the tags of {}", override.get(), version);
      return ModelFlavor.of(override.get());
    }
    return ModelFlavor.select(manifest.flavors())
        .orElseThrow(() -> new RepackagingException("Manifest of " + version + " declares no flavor"));
  }

  void buildArchive(Path bundle, ModelManifest manifest, ModelFlavor flavor, Path archive)
      throws IOException {
    ArchiveBuilder builder = new ArchiveBuilder();

    Path data = bundle.resolve(flavor.sourceDataPath()).normalize();
    if (!data.startsWith(bundle) || !Files.exists(data)) {
      throw new RepackagingException(
          "Artifact bundle has no model data at '" + flavor.sourceDataPath() + "' for flavor " + flavor);
    }
    if (Files.isDirectory(data)) {
      builder.addTree(flavor.archiveDataPath(), data);
    } else {
      builder.addFile(joinArchivePath(flavor.archiveDataPath(), data.getFileName().toString()), data);
    }

    // Added after the model data so they replace a requirements.txt or inference.py at the bundle root.
    addServingFile(builder, bundle, flavor, REQUIREMENTS);
    addServingFile(builder, bundle, flavor, INFERENCE_SCRIPT);

    if (!builder.contains(ModelManifest.FILE_NAME)) {
      builder.addFile(ModelManifest.FILE_NAME, manifest.path());
    }
    builder.writeTo(archive);
  }

  private void addServingFile(ArchiveBuilder builder, Path bundle, ModelFlavor flavor, String name)
      throws IOException {
    Path provided = bundle.resolve(BUNDLE_OVERRIDES).resolve(name);
    if (Files.isRegularFile(provided)) {
      builder.addFile(name, provided);
      return;
    }
    String resource = DEFAULTS_ROOT + flavor.name() + "/" + name;
    try (InputStream in = ArtifactRepackager.class.getResourceAsStream(resource)) {
      if (in == null) {
        log.debug("No {} for flavor {}, archive will not contain one", name, flavor);
        return;
      }
      log.info("No {} for deployment in the bundle, using the default one for {}", name, flavor);
      builder.addBytes(name, in.readAllBytes());
    }
  }

  private boolean store(ArtifactLocation location, Path archive, String sha256) {
    Optional<ArtifactStorePort.StoredObject> existing = artifactStore.stat(location);
    if (existing.isPresent() && existing.get().sha256().filter(sha256::equals).isPresent()) {
      log.debug("Archive at {} already has hash {}, skipping upload", location, sha256);
      return false;
    }
    if (existing.isPresent()) {
      log.info("Overwriting archive at {} with new content", location);
    }
    artifactStore.put(location, archive, sha256);
    return true;
  }

  private static Map<String, String> environment(ModelFlavor flavor, ArtifactLocation location) {
    if (!flavor.usesInferenceScript()) {
      return Map.of();
    }
    Map<String, String> environment = new LinkedHashMap<>();
    environment.put("SAGEMAKER_SUBMIT_DIRECTORY", location.uri());
    environment.put("SAGEMAKER_PROGRAM", INFERENCE_SCRIPT);
    return environment;
  }

  private static String sha256(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      return DigestUtils.sha256Hex(in);
    }
  }

  private static String joinArchivePath(String directory, String name) {
    return directory.isEmpty() ? name : directory + "/" + name;
  }

  private static void checkCancelled(SourceModelVersion version) {
    if (Thread.currentThread().isInterrupted()) {
      throw new StorageException("Repackaging of " + version + " was cancelled", null);
    }
  }

  private static Path createWorkDirectory() {
    try {
      return Files.createTempDirectory("registry-sync-");
    } catch (IOException e) {
      throw new StorageException("Cannot create a working directory for repackaging", e);
    }
  }

  private static void deleteQuietly(Path directory) {
    try (Stream<Path> paths = Files.walk(directory)) {
      paths.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
    } catch (IOException e) {
      log.warn("Failed to clean up working directory {}", directory, e);
    }
  }
}
