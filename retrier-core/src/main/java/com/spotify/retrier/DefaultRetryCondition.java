package com.spotify.retrier;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Retry predicate of {@link RetryPolicy#defaultPolicy()}.
 *
 * <p>Service errors are looked up in a table keyed by (status, code); entries not in the table are
 * retried iff the status is in the 5xx range. Network errors are always retried, anything else
 * never.
 */
public final class DefaultRetryCondition implements Predicate<AttemptContext<?>> {

  /** Key of the service error table. */
  public record StatusAndCode(int httpStatusCode, String code) {}

  public static final ImmutableMap<StatusAndCode, Boolean> DEFAULT_TABLE =
      ImmutableMap.of(
          new StatusAndCode(409, "IncorrectState"), true,
          new StatusAndCode(429, "TooManyRequests"), true,
          new StatusAndCode(501, "MethodNotImplemented"), false);

  private final ErrorClassifier classifier;
  private final ImmutableMap<StatusAndCode, Boolean> table;

  public DefaultRetryCondition(ErrorClassifier classifier) {
    this(classifier, DEFAULT_TABLE);
  }

  public DefaultRetryCondition(ErrorClassifier classifier, Map<StatusAndCode, Boolean> table) {
    this.classifier = checkNotNull(classifier, "classifier");
    this.table = ImmutableMap.copyOf(table);
  }

  /** Returns a copy with the given table entry added or replaced. */
  public DefaultRetryCondition withEntry(int httpStatusCode, String code, boolean retry) {
    final StatusAndCode key = new StatusAndCode(httpStatusCode, code);
    final ImmutableMap.Builder<StatusAndCode, Boolean> builder = ImmutableMap.builder();
    table.forEach(
        (existing, value) -> {
          if (!existing.equals(key)) {
            builder.put(existing, value);
          }
        });
    builder.put(key, retry);
    return new DefaultRetryCondition(classifier, builder.build());
  }

  public ImmutableMap<StatusAndCode, Boolean> table() {
    return table;
  }

  @Override
  public boolean test(AttemptContext<?> attempt) {
    final Exception error = attempt.error();
    if (error == null) {
      // a non-2xx response without an error is the operation's decision to accept it
      return false;
    }
    if (classifier.isNetworkError(error)) {
      return true;
    }
    final Optional<ServiceError> serviceError = classifier.asServiceError(error);
    if (serviceError.isPresent()) {
      final int status = serviceError.get().httpStatusCode();
      final Boolean tabled = table.get(new StatusAndCode(status, serviceError.get().code()));
      if (tabled != null) {
        return tabled;
      }
      return status >= 500 && status < 600;
    }
    return false;
  }

  @Override
  public String toString() {
    return "DefaultRetryCondition{table=" + table + '}';
  }
}
