package liveevents;

import java.util.Map;

/**
 * Keys recognized in the live events settings map, with the legacy aliases still
 * accepted from older deployments.
 */
public final class ConfigKeys {
  public static final String STREAM_NAME = "stream_name";
  public static final String LEGACY_STREAM_NAME = "kinesis_stream_name";
  public static final String AWS_ACCESS_KEY_ID = "aws_access_key_id";
  public static final String AWS_SECRET_ACCESS_KEY = "aws_secret_access_key";
  public static final String LEGACY_AWS_SECRET_ACCESS_KEY = "aws_secret_access_key_dec";
  public static final String AWS_REGION = "aws_region";
  public static final String AWS_ENDPOINT = "aws_endpoint";

  public static final String DEFAULT_REGION = "us-east-1";

  private ConfigKeys() {
  }

  /**
   * Returns the first non-blank value among {@code keys}, exactly as stored.
   *
   * @param settings the settings map; may be {@code null}
   * @param keys     keys to try in order
   * @return the value, or {@code null} if every key is absent or blank
   */
  static String lookup(Map<String, ?> settings, String... keys) {
    if (settings == null) {
      return null;
    }
    for (String key : keys) {
      Object value = settings.get(key);
      if (value != null && !value.toString().isBlank()) {
        return value.toString();
      }
    }
    return null;
  }

  static String streamName(Map<String, ?> settings) {
    return lookup(settings, STREAM_NAME, LEGACY_STREAM_NAME);
  }
}
