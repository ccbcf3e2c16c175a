package com.streamfirst.registry.sync.ports;

import com.streamfirst.registry.sync.domain.ApprovalStatus;
import com.streamfirst.registry.sync.domain.PackageDraft;
import com.streamfirst.registry.sync.domain.TargetModelPackage;
import java.util.List;
import java.util.Map;

/**
 * Read and write access to the target model registry (a SageMaker style package registry). Packages
 * live in one package group per source model; downstream deployment tooling reads from it.
 *
 * <p>Implementations report failures as {@link
 * com.streamfirst.registry.sync.domain.RegistryAccessException} classified as retryable or fatal, and
 * never retry beyond what their transport does.
 */
public interface TargetRegistryPort {

  /**
   * Lists the packages of a group that carry a run ID. Packages without one were not created by this
   * service and are left out.
   *
   * @param groupName the package group
   * @return the managed packages; empty if the group does not exist
   */
  List<TargetModelPackage> listPackages(String groupName);

  /**
   * Creates the package group if it does not exist yet. Calling it for an existing group is a no-op.
   *
   * @param groupName the package group
   */
  void ensurePackageGroup(String groupName);

  /**
   * Registers a new package.
   *
   * @param draft the package contents
   * @return the registered package, with the handle assigned by the registry
   */
  TargetModelPackage createPackage(PackageDraft draft);

  /**
   * Changes a package's approval status and replaces its customer metadata.
   *
   * @param target the package to update
   * @param status the new approval status
   * @param metadata the full metadata to store
   * @return the package as stored after the update
   */
  TargetModelPackage updateApproval(
      TargetModelPackage target, ApprovalStatus status, Map<String, String> metadata);

  /**
   * Deregisters a package. Returns normally once the registry has confirmed the deletion.
   *
   * @param target the package to delete
   */
  void deletePackage(TargetModelPackage target);
}
