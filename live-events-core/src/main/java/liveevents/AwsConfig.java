package liveevents;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Connection descriptor for the default stream backend.
 *
 * <p>{@code endpoint} is {@code null} unless an override URL was configured, in which
 * case it holds that URL verbatim (scheme, host, port and trailing slash included).
 * Without an override the backend resolves its endpoint from {@code region}.
 * Credentials are either both set or both {@code null}; when absent the backend falls
 * back to its default credential chain.
 *
 * @param region          AWS region, never {@code null}
 * @param accessKeyId     static access key id, or {@code null}
 * @param secretAccessKey static secret key, or {@code null}
 * @param endpoint        endpoint override URL, or {@code null}
 */
public record AwsConfig(String region, String accessKeyId, String secretAccessKey, String endpoint) {

  public AwsConfig {
    Objects.requireNonNull(region, "region");
    if ((accessKeyId == null) != (secretAccessKey == null)) {
      throw new IllegalArgumentException("accessKeyId and secretAccessKey must be set together");
    }
  }

  /**
   * Parses raw settings into a descriptor. Pure; never touches the network.
   *
   * @param settings raw settings keyed by {@link ConfigKeys}
   * @return the descriptor
   */
  public static AwsConfig from(Map<String, ?> settings) {
    String keyId = ConfigKeys.lookup(settings, ConfigKeys.AWS_ACCESS_KEY_ID);
    String secret = ConfigKeys.lookup(settings,
        ConfigKeys.AWS_SECRET_ACCESS_KEY, ConfigKeys.LEGACY_AWS_SECRET_ACCESS_KEY);
    if (keyId == null || secret == null) {
      keyId = null;
      secret = null;
    }
    String region = ConfigKeys.lookup(settings, ConfigKeys.AWS_REGION);
    return new AwsConfig(
        region == null ? ConfigKeys.DEFAULT_REGION : region,
        keyId,
        secret,
        ConfigKeys.lookup(settings, ConfigKeys.AWS_ENDPOINT));
  }

  public Optional<String> endpointOverride() {
    return Optional.ofNullable(endpoint);
  }

  public boolean hasStaticCredentials() {
    return accessKeyId != null;
  }

  @Override
  public String toString() {
    return "AwsConfig{region=" + region
        + ", accessKeyId=" + accessKeyId
        + ", secretAccessKey=" + (secretAccessKey == null ? null : "****")
        + ", endpoint=" + endpoint + '}';
  }
}
