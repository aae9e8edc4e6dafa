package liveevents.spring.boot;

import liveevents.ConfigKeys;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for live events.
 *
 * @see LiveEventsAutoConfiguration
 */
@ConfigurationProperties(prefix = "live-events")
public class LiveEventsProperties {

    /**
     * Destination stream. Live events are only auto-configured when this is set.
     */
    private String streamName;

    /**
     * Static AWS access key id; used only together with the secret key.
     */
    private String awsAccessKeyId;

    /**
     * Static AWS secret access key; used only together with the key id.
     */
    private String awsSecretAccessKey;

    /**
     * AWS region of the stream.
     */
    private String awsRegion;

    /**
     * Endpoint override URL, e.g. a local Kinesis emulator.
     */
    private String awsEndpoint;

    /**
     * Maximum number of events waiting for delivery; further events are dropped.
     */
    private int maxQueueSize = 1000;

    /**
     * How long shutdown waits for queued events to be delivered.
     */
    private Duration drainTimeout = Duration.ofSeconds(30);

    private final Metrics metrics = new Metrics();

    public String getStreamName() {
        return streamName;
    }

    public void setStreamName(String streamName) {
        this.streamName = streamName;
    }

    public String getAwsAccessKeyId() {
        return awsAccessKeyId;
    }

    public void setAwsAccessKeyId(String awsAccessKeyId) {
        this.awsAccessKeyId = awsAccessKeyId;
    }

    public String getAwsSecretAccessKey() {
        return awsSecretAccessKey;
    }

    public void setAwsSecretAccessKey(String awsSecretAccessKey) {
        this.awsSecretAccessKey = awsSecretAccessKey;
    }

    public String getAwsRegion() {
        return awsRegion;
    }

    public void setAwsRegion(String awsRegion) {
        this.awsRegion = awsRegion;
    }

    public String getAwsEndpoint() {
        return awsEndpoint;
    }

    public void setAwsEndpoint(String awsEndpoint) {
        this.awsEndpoint = awsEndpoint;
    }

    public int getMaxQueueSize() {
        return maxQueueSize;
    }

    public void setMaxQueueSize(int maxQueueSize) {
        this.maxQueueSize = maxQueueSize;
    }

    public Duration getDrainTimeout() {
        return drainTimeout;
    }

    public void setDrainTimeout(Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Returns the settings map understood by {@link liveevents.Client}, omitting unset
     * properties.
     *
     * @return settings keyed by {@link ConfigKeys}
     */
    public Map<String, Object> toSettings() {
        Map<String, Object> settings = new LinkedHashMap<>();
        putIfSet(settings, ConfigKeys.STREAM_NAME, streamName);
        putIfSet(settings, ConfigKeys.AWS_ACCESS_KEY_ID, awsAccessKeyId);
        putIfSet(settings, ConfigKeys.AWS_SECRET_ACCESS_KEY, awsSecretAccessKey);
        putIfSet(settings, ConfigKeys.AWS_REGION, awsRegion);
        putIfSet(settings, ConfigKeys.AWS_ENDPOINT, awsEndpoint);
        return settings;
    }

    private static void putIfSet(Map<String, Object> settings, String key, String value) {
        if (value != null && !value.isBlank()) {
            settings.put(key, value);
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "live_events";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
