package com.streamfirst.registry.sync.adapters.registry.sagemaker;

import com.streamfirst.registry.sync.domain.FailureKind;
import com.streamfirst.registry.sync.domain.RegistryAccessException;
import java.util.Locale;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sagemaker.model.ResourceNotFoundException;

/** Maps SageMaker SDK failures onto failure kinds. */
final class SageMakerFailures {

  private SageMakerFailures() {}

  static RegistryAccessException translate(String message, SdkException e) {
    FailureKind kind = classify(e);
    return new RegistryAccessException(kind, message + ": " + e.getMessage(), e);
  }

  static FailureKind classify(SdkException e) {
    if (e instanceof ResourceNotFoundException) {
      return FailureKind.NOT_FOUND;
    }
    if (e instanceof AwsServiceException service) {
      if (service.isThrottlingException()) {
        return FailureKind.THROTTLED;
      }
      int status = service.statusCode();
      String code =
          service.awsErrorDetails() == null || service.awsErrorDetails().errorCode() == null
              ? ""
              : service.awsErrorDetails().errorCode();
      if (status == 401 || status == 403 || code.startsWith("AccessDenied")) {
        return FailureKind.UNAUTHORIZED;
      }
      if (status == 404 || isMissingResource(service)) {
        return FailureKind.NOT_FOUND;
      }
      if (status >= 500) {
        return FailureKind.UNAVAILABLE;
      }
      return FailureKind.INVALID_REQUEST;
    }
    return FailureKind.UNAVAILABLE;
  }

  /** SageMaker reports unknown packages and groups as a validation error with this wording. */
  static boolean isMissingResource(SdkException e) {
    String message = e.getMessage();
    return message != null && message.toLowerCase(Locale.ROOT).contains("does not exist");
  }
}
