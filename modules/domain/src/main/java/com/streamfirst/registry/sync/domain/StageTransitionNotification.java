package com.streamfirst.registry.sync.domain;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * An inbound trigger saying that something changed for a model upstream. It is only a trigger: the
 * engine always re-reads the full current state of the model and never trusts the version or stage
 * carried here. A notification without a version asks for a full sync of the model.
 */
@Value
@EqualsAndHashCode(of = "notificationId")
public class StageTransitionNotification {
  @NonNull String notificationId;
  @NonNull ModelName modelName;
  Long version;
  ModelStage newStage;
  @NonNull Instant receivedAt;

  /** Creates a notification for a stage transition reported by the source registry. */
  public static StageTransitionNotification transition(
      ModelName modelName, long version, ModelStage newStage) {
    return new StageTransitionNotification(
        UUID.randomUUID().toString(), modelName, version, newStage, Instant.now());
  }

  /** Creates a notification asking for a full sync of one model. */
  public static StageTransitionNotification fullSync(ModelName modelName) {
    return new StageTransitionNotification(
        UUID.randomUUID().toString(), modelName, null, null, Instant.now());
  }

  public Optional<Long> getVersion() {
    return Optional.ofNullable(version);
  }

  public Optional<ModelStage> getNewStage() {
    return Optional.ofNullable(newStage);
  }

  @Override
  public String toString() {
    return "StageTransitionNotification{"
        + "id="
        + notificationId
        + ", model="
        + modelName
        + (version != null ? ", version=" + version : ", fullSync")
        + (newStage != null ? ", newStage=" + newStage : "")
        + '}';
  }
}
