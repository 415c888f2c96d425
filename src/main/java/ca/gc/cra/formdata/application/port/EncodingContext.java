package ca.gc.cra.formdata.application.port;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-call context handed to {@link ValueIntrospector} unchanged. Holds caller-supplied user info such as locale
 * hints or feature switches for custom introspectors.
 *
 * @param userInfo immutable caller context; never {@code null}
 * @since 0.1.0
 */
public record EncodingContext(Map<String, Object> userInfo) {
  private static final EncodingContext EMPTY = new EncodingContext(Map.of());

  /**
   * Copies the user info into an immutable map.
   *
   * @throws NullPointerException if the map or any key/value is {@code null}
   */
  public EncodingContext {
    userInfo = Map.copyOf(Objects.requireNonNull(userInfo, "userInfo"));
  }

  /**
   * Returns a context without user info.
   *
   * @return shared empty context
   */
  public static EncodingContext empty() {
    return EMPTY;
  }

  /**
   * Looks up a user info entry.
   *
   * @param key entry key
   * @return value when present
   */
  public Optional<Object> get(String key) {
    return Optional.ofNullable(userInfo.get(key));
  }
}
