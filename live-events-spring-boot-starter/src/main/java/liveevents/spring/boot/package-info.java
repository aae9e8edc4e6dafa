/**
 * Spring Boot auto-configuration for live events.
 *
 * <p>{@link liveevents.spring.boot.LiveEventsAutoConfiguration} configures the
 * process-wide {@link liveevents.LiveEvents} facade from {@code live-events.*}
 * application properties once {@code live-events.stream-name} is set.
 *
 * @see liveevents.spring.boot.LiveEventsAutoConfiguration
 * @see liveevents.spring.boot.LiveEventsProperties
 */
package liveevents.spring.boot;
