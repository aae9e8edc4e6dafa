package liveevents.kinesis;

import liveevents.AwsConfig;
import liveevents.ConfigurationException;
import liveevents.spi.StreamBackend;
import liveevents.spi.StreamBackendFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.kinesis.KinesisClient;
import software.amazon.awssdk.services.kinesis.KinesisClientBuilder;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Builds a {@link KinesisStreamBackend} from an {@link AwsConfig}: region, optional
 * endpoint override, and static credentials when both keys are configured, otherwise
 * the SDK's default credential chain.
 *
 * <p>Registered in {@code META-INF/services/liveevents.spi.StreamBackendFactory}.
 */
public final class KinesisStreamBackendFactory implements StreamBackendFactory {

  @Override
  public String name() {
    return "kinesis";
  }

  @Override
  public StreamBackend create(AwsConfig config) {
    return new KinesisStreamBackend(buildClient(config));
  }

  static KinesisClient buildClient(AwsConfig config) {
    KinesisClientBuilder builder = KinesisClient.builder()
        .region(Region.of(config.region()))
        .credentialsProvider(credentials(config));
    if (config.endpoint() != null) {
      builder.endpointOverride(endpointUri(config.endpoint()));
    }
    return builder.build();
  }

  private static AwsCredentialsProvider credentials(AwsConfig config) {
    if (config.hasStaticCredentials()) {
      return StaticCredentialsProvider.create(
          AwsBasicCredentials.create(config.accessKeyId(), config.secretAccessKey()));
    }
    return DefaultCredentialsProvider.create();
  }

  private static URI endpointUri(String endpoint) {
    try {
      URI uri = new URI(endpoint);
      if (uri.getScheme() == null || uri.getHost() == null) {
        throw new ConfigurationException("aws_endpoint must be an absolute URL: " + endpoint);
      }
      return uri;
    } catch (URISyntaxException e) {
      throw new ConfigurationException("Invalid aws_endpoint: " + endpoint, e);
    }
  }
}
