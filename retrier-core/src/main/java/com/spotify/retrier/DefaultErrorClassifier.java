package com.spotify.retrier;

import com.google.common.base.Throwables;
import java.io.IOException;
import java.util.Optional;

/**
 * Classifies by walking the causal chain: the first {@link ServiceError} found makes the error a
 * service error, otherwise any {@link IOException} makes it a network error.
 */
public class DefaultErrorClassifier implements ErrorClassifier {

  public static final DefaultErrorClassifier INSTANCE = new DefaultErrorClassifier();

  @Override
  public boolean isNetworkError(Throwable error) {
    if (error == null || asServiceError(error).isPresent()) {
      return false;
    }
    return Throwables.getCausalChain(error).stream().anyMatch(IOException.class::isInstance);
  }

  @Override
  public Optional<ServiceError> asServiceError(Throwable error) {
    if (error == null) {
      return Optional.empty();
    }
    return Throwables.getCausalChain(error).stream()
        .filter(ServiceError.class::isInstance)
        .map(ServiceError.class::cast)
        .findFirst();
  }
}
