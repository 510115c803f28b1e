package io.github.dailies.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Application settings under the {@code dailies} prefix.
 *
 * @param timezone zone used for frequencies that do not name their own
 */
@ConfigurationProperties("dailies")
public record DailiesProperties(
        @DefaultValue("UTC") String timezone,
        @DefaultValue Scheduler scheduler,
        @DefaultValue Hub hub,
        @DefaultValue Session session
) {

    public record Scheduler(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("1m") Duration interval
    ) {}

    public record Hub(
            @DefaultValue("1024") int commandCapacity,
            @DefaultValue("256") int subscriberCapacity
    ) {}

    /** Keep-alive and framing limits for {@code /ws} connections. */
    public record Session(
            @DefaultValue("54s") Duration pingInterval,
            @DefaultValue("60s") Duration readTimeout,
            @DefaultValue("10s") Duration writeTimeout,
            @DefaultValue("512") int maxMessageBytes
    ) {}
}
