/**
 * Service Provider Interfaces (SPI) for extending the live events library.
 *
 * <p>These interfaces define the extension points that integrators implement
 * to plug in a stream transport and metrics.
 *
 * @see liveevents.spi.StreamBackend
 * @see liveevents.spi.StreamBackendFactory
 * @see liveevents.spi.MetricsExporter
 */
package liveevents.spi;
