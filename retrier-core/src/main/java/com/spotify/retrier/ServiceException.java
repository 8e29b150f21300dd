package com.spotify.retrier;

import static com.google.common.base.Preconditions.checkNotNull;

import javax.annotation.Nullable;

/** Default carrier for a {@link ServiceError}, thrown by operations on non-2xx responses. */
public class ServiceException extends Exception implements ServiceError {
  private final int httpStatusCode;
  private final String code;
  private final String serviceMessage;
  @Nullable private final String requestId;

  public ServiceException(
      int httpStatusCode, String code, String message, @Nullable String requestId) {
    super("Service error:" + code + ". " + message + ". http status code: " + httpStatusCode);
    this.httpStatusCode = httpStatusCode;
    this.code = checkNotNull(code, "code");
    this.serviceMessage = checkNotNull(message, "message");
    this.requestId = requestId;
  }

  public ServiceException(int httpStatusCode, String code, String message) {
    this(httpStatusCode, code, message, null);
  }

  @Override
  public int httpStatusCode() {
    return httpStatusCode;
  }

  @Override
  public String code() {
    return code;
  }

  @Override
  public String message() {
    return serviceMessage;
  }

  @Override
  @Nullable
  public String requestId() {
    return requestId;
  }
}
