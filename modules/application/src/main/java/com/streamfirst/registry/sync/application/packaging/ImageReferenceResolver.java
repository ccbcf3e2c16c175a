package com.streamfirst.registry.sync.application.packaging;

import com.streamfirst.registry.sync.domain.ModelFlavor;
import com.streamfirst.registry.sync.domain.RepackagingException;
import com.streamfirst.registry.sync.domain.SourceModelVersion;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Chooses the serving image for a model version. In order of precedence: an image pinned by the
 * version's {@code sagemaker_deploy_image} tag, the image configured for the flavor (or its serving
 * framework), and finally the generic python_function image when the manifest declares that flavor.
 */
@Slf4j
public class ImageReferenceResolver {

  private final Map<String, String> flavorImages;
  private final Optional<String> pythonFunctionImage;

  public ImageReferenceResolver(Map<String, String> flavorImages, Optional<String> pythonFunctionImage) {
    this.flavorImages = Map.copyOf(flavorImages);
    this.pythonFunctionImage = pythonFunctionImage;
  }

  /**
   * @throws RepackagingException if no image can serve the flavor
   */
  public ServingImage resolve(SourceModelVersion version, ModelFlavor flavor, ModelManifest manifest) {
    Optional<String> pinned = version.tag(SourceModelVersion.DEPLOY_IMAGE_TAG);
    if (pinned.isPresent()) {
      log.info("Using image found in the tags of {}", version);
      return new ServingImage(pinned.get(), flavor);
    }

    String configured = flavorImages.get(flavor.name());
    if (configured == null) {
      configured = flavorImages.get(flavor.servingFramework());
    }
    if (configured != null) {
      log.debug("Using configured image for flavor {}: {}", flavor, configured);
      return new ServingImage(configured, flavor);
    }

    if (manifest.declares(ModelFlavor.PYTHON_FUNCTION.name()) && pythonFunctionImage.isPresent()) {
      log.info("No image configured for flavor {}, using python_function image", flavor);
      return new ServingImage(pythonFunctionImage.get(), ModelFlavor.PYTHON_FUNCTION);
    }

    throw new RepackagingException(
        "Unsupported model flavor '" + flavor + "': no serving image configured");
  }
}
