package com.streamfirst.registry.sync.adapters.storage.s3;

import com.streamfirst.registry.sync.domain.FailureKind;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkException;

/** Maps S3 SDK failures onto failure kinds. */
final class S3Failures {

  private S3Failures() {}

  static FailureKind classify(SdkException e) {
    if (e instanceof AwsServiceException service) {
      if (service.isThrottlingException()) {
        return FailureKind.THROTTLED;
      }
      int status = service.statusCode();
      if (status == 401 || status == 403) {
        return FailureKind.UNAUTHORIZED;
      }
      if (status == 404) {
        return FailureKind.NOT_FOUND;
      }
      if (status >= 500) {
        return FailureKind.UNAVAILABLE;
      }
      return FailureKind.INVALID_REQUEST;
    }
    // Client side: connection refused, timeouts, interrupted transfers
    return e.retryable() || e.getCause() != null ? FailureKind.UNAVAILABLE : FailureKind.INVALID_REQUEST;
  }
}
