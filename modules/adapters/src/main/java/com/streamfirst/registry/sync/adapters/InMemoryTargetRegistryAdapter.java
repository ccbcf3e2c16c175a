package com.streamfirst.registry.sync.adapters;

import com.streamfirst.registry.sync.domain.*;
import com.streamfirst.registry.sync.ports.TargetRegistryPort;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory implementation of TargetRegistryPort for testing and development. Keeps package groups in
 * maps, records every mutation in an {@link OperationJournal} and can be told to fail selected calls.
 */
@Slf4j
public class InMemoryTargetRegistryAdapter implements TargetRegistryPort {

  /** Calls that can be made to fail. */
  public enum Call {
    LIST,
    ENSURE_GROUP,
    CREATE,
    UPDATE,
    DELETE
  }

  public static final String CREATE_PACKAGE = "create-package";
  public static final String UPDATE_PACKAGE = "update-package";
  public static final String DELETE_PACKAGE = "delete-package";

  private static final String ARN_PREFIX = "arn:aws:sagemaker:local:000000000000:model-package/";

  // Group name to package ARN to package, in creation order
  private final Map<String, Map<String, TargetModelPackage>> groups = new HashMap<>();
  private final List<FailureRule> failures = new CopyOnWriteArrayList<>();
  private final AtomicLong packageCounter = new AtomicLong();
  private final OperationJournal journal;

  public InMemoryTargetRegistryAdapter() {
    this(new OperationJournal());
  }

  public InMemoryTargetRegistryAdapter(OperationJournal journal) {
    this.journal = journal;
  }

  @Override
  public List<TargetModelPackage> listPackages(String groupName) {
    checkFailure(Call.LIST, null);
    synchronized (groups) {
      Map<String, TargetModelPackage> packages = groups.get(groupName);
      if (packages == null) {
        log.debug("Package group {} does not exist", groupName);
        return List.of();
      }
      return List.copyOf(packages.values());
    }
  }

  @Override
  public void ensurePackageGroup(String groupName) {
    checkFailure(Call.ENSURE_GROUP, null);
    synchronized (groups) {
      if (!groups.containsKey(groupName)) {
        groups.put(groupName, new LinkedHashMap<>());
        journal.record("create-group", groupName);
        log.info("Created package group {}", groupName);
      }
    }
  }

  @Override
  public TargetModelPackage createPackage(PackageDraft draft) {
    checkFailure(Call.CREATE, draft.getRunId());
    synchronized (groups) {
      Map<String, TargetModelPackage> packages = groups.get(draft.getGroupName());
      if (packages == null) {
        throw new RegistryAccessException(
            FailureKind.NOT_FOUND, "Package group " + draft.getGroupName() + " does not exist");
      }
      String arn = ARN_PREFIX + draft.getGroupName() + "/" + packageCounter.incrementAndGet();
      TargetModelPackage created =
          TargetModelPackage.builder()
              .packageArn(arn)
              .groupName(draft.getGroupName())
              .runId(draft.getRunId())
              .approvalStatus(draft.getApprovalStatus())
              .sourceVersion(draft.getSourceVersion())
              .sourceStage(draft.getSourceStage())
              .artifactLocation(draft.getArtifactLocation())
              .imageReference(draft.getImageReference())
              .artifactSha256(draft.getArtifactSha256())
              .createdAt(Instant.now())
              .metadata(draft.getMetadata())
              .build();
      packages.put(arn, created);
      journal.record(CREATE_PACKAGE, draft.getRunId().value());
      log.debug("Created package {} for run {}", arn, draft.getRunId());
      return created;
    }
  }

  @Override
  public TargetModelPackage updateApproval(
      TargetModelPackage target, ApprovalStatus status, Map<String, String> metadata) {
    checkFailure(Call.UPDATE, target.getRunId());
    synchronized (groups) {
      Map<String, TargetModelPackage> packages = groups.get(target.getGroupName());
      TargetModelPackage current = packages == null ? null : packages.get(target.getPackageArn());
      if (current == null) {
        throw new RegistryAccessException(
            FailureKind.NOT_FOUND, "Package " + target.getPackageArn() + " does not exist");
      }
      ModelStage stage =
          metadata.containsKey(PackageMetadata.CURRENT_STAGE)
              ? ModelStage.parse(metadata.get(PackageMetadata.CURRENT_STAGE))
              : current.getSourceStage();
      TargetModelPackage updated =
          current.withApprovalStatus(status).withSourceStage(stage).withMetadata(Map.copyOf(metadata));
      packages.put(updated.getPackageArn(), updated);
      journal.record(UPDATE_PACKAGE, target.getRunId().value());
      log.debug("Updated package {} to {}", target.getPackageArn(), status);
      return updated;
    }
  }

  @Override
  public void deletePackage(TargetModelPackage target) {
    checkFailure(Call.DELETE, target.getRunId());
    synchronized (groups) {
      Map<String, TargetModelPackage> packages = groups.get(target.getGroupName());
      if (packages == null || packages.remove(target.getPackageArn()) == null) {
        throw new RegistryAccessException(
            FailureKind.NOT_FOUND, "Package " + target.getPackageArn() + " does not exist");
      }
      journal.record(DELETE_PACKAGE, target.getRunId().value());
      log.debug("Deleted package {}", target.getPackageArn());
    }
  }

  /**
   * Stores a package as is, bypassing the journal and failure rules. Useful for seeding state that an
   * earlier, interrupted pass could have left behind.
   */
  public TargetModelPackage seed(TargetModelPackage pkg) {
    synchronized (groups) {
      groups.computeIfAbsent(pkg.getGroupName(), k -> new LinkedHashMap<>()).put(pkg.getPackageArn(), pkg);
      return pkg;
    }
  }

  /** Makes the next {@code times} calls of a kind for a run fail. A null run ID matches any run. */
  public void failNext(Call call, RunId runId, FailureKind kind, int times) {
    failures.add(new FailureRule(call, runId, kind, times));
  }

  /** Makes every call of a kind for a run fail until {@link #clearFailures()}. */
  public void failAlways(Call call, RunId runId, FailureKind kind) {
    failures.add(new FailureRule(call, runId, kind, Integer.MAX_VALUE));
  }

  public void clearFailures() {
    failures.clear();
  }

  public OperationJournal journal() {
    return journal;
  }

  /** Gets every package of a group, for assertions. */
  public List<TargetModelPackage> packages(String groupName) {
    synchronized (groups) {
      return List.copyOf(groups.getOrDefault(groupName, Map.of()).values());
    }
  }

  public boolean groupExists(String groupName) {
    synchronized (groups) {
      return groups.containsKey(groupName);
    }
  }

  /** Clears all groups, failure rules and the journal. */
  public void clear() {
    synchronized (groups) {
      groups.clear();
    }
    failures.clear();
    journal.clear();
  }

  private void checkFailure(Call call, RunId runId) {
    for (FailureRule rule : failures) {
      if (rule.matches(call, runId) && rule.consume()) {
        log.debug("Injected {} failure for {} on run {}", rule.kind, call, runId);
        throw new RegistryAccessException(rule.kind, "Injected " + rule.kind + " failure for " + call);
      }
    }
  }

  private static final class FailureRule {
    private final Call call;
    private final RunId runId;
    private final FailureKind kind;
    private int remaining;

    FailureRule(Call call, RunId runId, FailureKind kind, int remaining) {
      this.call = call;
      this.runId = runId;
      this.kind = kind;
      this.remaining = remaining;
    }

    boolean matches(Call call, RunId runId) {
      return this.call == call && (this.runId == null || this.runId.equals(runId));
    }

    synchronized boolean consume() {
      if (remaining <= 0) {
        return false;
      }
      if (remaining != Integer.MAX_VALUE) {
        remaining--;
      }
      return true;
    }
  }
}
