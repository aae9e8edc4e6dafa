/**
 * Amazon Kinesis backend, the default {@link liveevents.spi.StreamBackend}.
 *
 * <p>Having this module on the class path is enough: {@link liveevents.StreamBackends}
 * discovers {@link liveevents.kinesis.KinesisStreamBackendFactory} through
 * {@link java.util.ServiceLoader}.
 */
package liveevents.kinesis;
