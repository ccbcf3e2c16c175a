package com.streamfirst.registry.sync.application;

import com.streamfirst.registry.sync.application.RunResolution.Match;
import com.streamfirst.registry.sync.domain.*;
import com.streamfirst.registry.sync.domain.ReconciliationPlan.StaleField;
import com.streamfirst.registry.sync.ports.SourceRegistryPort;
import com.streamfirst.registry.sync.ports.TargetRegistryPort;
import java.util.*;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Matches source model versions with target packages by run ID. Version numbers and timestamps are
 * never used for matching: a version can be re-tagged without changing its run, and each registry
 * numbers its entries independently.
 */
@Slf4j
@RequiredArgsConstructor
public class IdentityResolver {

  private static final Comparator<SourceModelVersion> PREFERRED_VERSION =
      Comparator.comparing((SourceModelVersion v) -> v.getStage() == ModelStage.PRODUCTION)
          .thenComparingLong(SourceModelVersion::getVersion);

  private final SourceRegistryPort sourceRegistry;
  private final TargetRegistryPort targetRegistry;
  private final String artifactBucket;

  /**
   * Reads the current state of a model from both registries and pairs it up by run ID.
   *
   * @param modelName the model to resolve
   * @return one resolution per run ID seen on either side
   * @throws ResolutionException if either registry cannot be read
   */
  public ResolvedState resolve(ModelName modelName) {
    Map<RunId, SourceModelVersion> desired = readDesired(modelName);
    Map<Boolean, List<TargetModelPackage>> owned =
        readActual(modelName).stream()
            .collect(Collectors.partitioningBy(p -> isOwnedBy(p, modelName)));
    Map<RunId, List<TargetModelPackage>> actual =
        owned.get(true).stream().collect(Collectors.groupingBy(TargetModelPackage::getRunId));
    List<TargetModelPackage> foreign = owned.get(false);
    if (!foreign.isEmpty()) {
      log.warn(
          "Ignoring {} packages in group {} registered for other models with the same group name",
          foreign.size(),
          modelName.packageGroupName());
    }

    SortedSet<RunId> runIds = new TreeSet<>(Comparator.comparing(RunId::value));
    runIds.addAll(desired.keySet());
    runIds.addAll(actual.keySet());

    Map<RunId, RunResolution> runs = new LinkedHashMap<>();
    for (RunId runId : runIds) {
      runs.put(
          runId,
          resolveRun(modelName, runId, desired.get(runId), actual.getOrDefault(runId, List.of())));
    }

    log.debug(
        "Resolved model {}: {} deployable runs in source, {} runs with packages in target",
        modelName,
        desired.size(),
        actual.size());
    return new ResolvedState(modelName, runs, foreign);
  }

  private Map<RunId, SourceModelVersion> readDesired(ModelName modelName) {
    List<SourceModelVersion> versions;
    try {
      versions = sourceRegistry.listDeployableVersions(modelName);
    } catch (RuntimeException e) {
      throw new ResolutionException("Cannot read source registry for model " + modelName, e);
    }

    // A run registered more than once: keep the most deployable, then the newest version
    Map<RunId, SourceModelVersion> byRun = new HashMap<>();
    for (SourceModelVersion version : versions) {
      if (!version.getStage().isDeployable() || !version.getModelName().equals(modelName)) {
        continue;
      }
      byRun.merge(
          version.getRunId(),
          version,
          (a, b) -> PREFERRED_VERSION.compare(a, b) >= 0 ? a : b);
    }
    log.info(
        "There are {} versions of {} in Staging or Production in the source registry",
        byRun.size(),
        modelName);
    return byRun;
  }

  private List<TargetModelPackage> readActual(ModelName modelName) {
    List<TargetModelPackage> packages;
    try {
      packages = targetRegistry.listPackages(modelName.packageGroupName());
    } catch (RuntimeException e) {
      throw new ResolutionException(
          "Cannot read target registry group " + modelName.packageGroupName(), e);
    }
    log.info(
        "There are {} packages registered in target group {}",
        packages.size(),
        modelName.packageGroupName());
    return packages;
  }

  /**
   * Distinct model names can share a package group ("a_b" and "a-b"). A package tagged with another
   * model's name belongs to that model; untagged packages are treated as this model's.
   */
  private static boolean isOwnedBy(TargetModelPackage modelPackage, ModelName modelName) {
    String owner = modelPackage.getMetadata().get(PackageMetadata.MODEL_NAME);
    if (owner == null || owner.equals(modelName.value())) {
      return true;
    }
    log.debug("Package {} belongs to model {}, not {}", modelPackage.getPackageArn(), owner, modelName);
    return false;
  }

  private RunResolution resolveRun(
      ModelName modelName,
      RunId runId,
      SourceModelVersion desired,
      List<TargetModelPackage> packages) {
    ArtifactLocation expectedLocation = ArtifactLocation.forRun(artifactBucket, modelName, runId);

    // Keep the package already at the expected location, then the most recently created one
    List<TargetModelPackage> ranked = new ArrayList<>(packages);
    ranked.sort(
        Comparator.comparing((TargetModelPackage p) -> p.getArtifactLocation().equals(expectedLocation))
            .thenComparing(TargetModelPackage::getCreatedAt)
            .thenComparing(TargetModelPackage::getPackageArn)
            .reversed());
    TargetModelPackage kept = ranked.isEmpty() ? null : ranked.get(0);
    List<TargetModelPackage> duplicates = ranked.size() > 1 ? ranked.subList(1, ranked.size()) : List.of();
    if (!duplicates.isEmpty()) {
      log.warn("Run {} of model {} has {} duplicate packages", runId, modelName, duplicates.size());
    }

    if (desired == null) {
      return new RunResolution(
          runId, Optional.empty(), Optional.ofNullable(kept), duplicates, Match.TARGET_ONLY, Set.of(), false);
    }
    if (kept == null) {
      return new RunResolution(
          runId, Optional.of(desired), Optional.empty(), List.of(), Match.SOURCE_ONLY, Set.of(), false);
    }

    Set<StaleField> staleFields = EnumSet.noneOf(StaleField.class);
    if (kept.getApprovalStatus() != ApprovalStatus.forStage(desired.getStage())) {
      staleFields.add(StaleField.APPROVAL_STATUS);
    }
    if (kept.getSourceStage() != desired.getStage()) {
      staleFields.add(StaleField.SOURCE_STAGE);
    }
    boolean artifactStale = !kept.getArtifactLocation().equals(expectedLocation);
    Match match = staleFields.isEmpty() && !artifactStale ? Match.CONSISTENT : Match.STALE;
    return new RunResolution(
        runId, Optional.of(desired), Optional.of(kept), duplicates, match, staleFields, artifactStale);
  }
}
