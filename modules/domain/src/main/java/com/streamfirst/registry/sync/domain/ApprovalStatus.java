package com.streamfirst.registry.sync.domain;

/** Approval status of a package in the target registry. */
public enum ApprovalStatus {
  APPROVED("Approved"),
  REJECTED("Rejected"),
  PENDING_MANUAL_APPROVAL("PendingManualApproval");

  private final String wireName;

  ApprovalStatus(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /** Staging and Production versions are approved; every other stage is rejected. */
  public static ApprovalStatus forStage(ModelStage stage) {
    return stage.isDeployable() ? APPROVED : REJECTED;
  }

  /**
   * Parses the target registry's spelling. A missing status is treated as pending, which is what the
   * target registry reports for packages created without one.
   */
  public static ApprovalStatus fromWireName(String wireName) {
    if (wireName == null || wireName.isBlank()) {
      return PENDING_MANUAL_APPROVAL;
    }
    for (ApprovalStatus status : values()) {
      if (status.wireName.equalsIgnoreCase(wireName) || status.name().equalsIgnoreCase(wireName)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown approval status: " + wireName);
  }
}
