package com.streamfirst.registry.sync.ports;

import com.streamfirst.registry.sync.domain.ModelName;
import com.streamfirst.registry.sync.domain.SourceModelVersion;
import java.util.List;

/**
 * Read access to the source model registry (MLflow). The source registry owns versions and their
 * stages; this service only observes them.
 */
public interface SourceRegistryPort {

  /**
   * Lists every version of a model, in any stage.
   *
   * @param modelName the model to list
   * @return all versions currently registered for the model; empty if the model has none
   * @throws com.streamfirst.registry.sync.domain.RegistryAccessException if the registry cannot be
   *     queried
   */
  List<SourceModelVersion> listVersions(ModelName modelName);

  /**
   * Lists the versions of a model that are in a deployable stage. Adapters that can filter on the
   * server side should override this.
   */
  default List<SourceModelVersion> listDeployableVersions(ModelName modelName) {
    return listVersions(modelName).stream().filter(v -> v.getStage().isDeployable()).toList();
  }
}
