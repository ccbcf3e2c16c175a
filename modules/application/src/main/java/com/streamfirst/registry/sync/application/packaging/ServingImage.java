package com.streamfirst.registry.sync.application.packaging;

import com.streamfirst.registry.sync.domain.ModelFlavor;

/**
 * The container image chosen to serve a model, and the flavor it serves the model as.
 *
 * @param imageReference the image URI
 * @param servedAs the flavor whose serving contract the image implements
 */
public record ServingImage(String imageReference, ModelFlavor servedAs) {}
