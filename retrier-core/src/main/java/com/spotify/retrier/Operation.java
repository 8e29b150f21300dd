package com.spotify.retrier;

import io.grpc.Context;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * A single service call. Invoked once per attempt by {@link RetryExecutor}.
 *
 * <p>Implementations must be safe to invoke more than once for the same request: the executor only
 * does so when the policy asks for a retry and the binary body, if any, has been rewound.
 *
 * <p>Every {@link Exception} thrown by {@link #call}, checked or unchecked, is the error of that
 * attempt and is handed to the retry policy, so unchecked failures such as gRPC's {@code
 * StatusRuntimeException} can be retried. This also means a bug surfacing as a {@link
 * NullPointerException} is retried by a policy that retries everything. Only {@link Error}s end
 * the execution as {@link Exceptions.RecoveredFault}.
 *
 * @param <Q> request type
 * @param <R> response type
 */
@FunctionalInterface
public interface Operation<Q extends RetryableRequest, R extends Response> {

  /**
   * Performs the call.
   *
   * @param context the caller's context, also attached as {@link Context#current()}
   * @param request the request being retried
   * @param body the request's binary body positioned at its starting offset, or null
   * @param extraHeaders headers the executor adds to every attempt, read-only
   * @return the service response
   * @throws Exception any failure of this attempt; it is handed to the retry policy
   */
  R call(
      Context context, Q request, @Nullable SeekableBody body, Map<String, String> extraHeaders)
      throws Exception;
}
