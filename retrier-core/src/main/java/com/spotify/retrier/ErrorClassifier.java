package com.spotify.retrier;

import java.util.Optional;

/** Tells transport failures and service errors apart for {@link DefaultRetryCondition}. */
public interface ErrorClassifier {

  boolean isNetworkError(Throwable error);

  Optional<ServiceError> asServiceError(Throwable error);
}
