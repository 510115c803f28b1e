package io.github.dailies.gateway.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DailiesPropertiesTest {

    @Test
    void defaultsMatchKeepAliveContract() {
        DailiesProperties properties = bind(Map.of());

        assertThat(properties.timezone()).isEqualTo("UTC");
        assertThat(properties.scheduler().enabled()).isTrue();
        assertThat(properties.scheduler().interval()).isEqualTo(Duration.ofMinutes(1));
        assertThat(properties.hub().commandCapacity()).isEqualTo(1024);
        assertThat(properties.hub().subscriberCapacity()).isEqualTo(256);
        assertThat(properties.session().pingInterval()).isEqualTo(Duration.ofSeconds(54));
        assertThat(properties.session().readTimeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(properties.session().writeTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(properties.session().maxMessageBytes()).isEqualTo(512);
    }

    @Test
    void overridesAreBound() {
        DailiesProperties properties = bind(Map.of(
                "dailies.timezone", "Asia/Almaty",
                "dailies.scheduler.enabled", "false",
                "dailies.scheduler.interval", "30s",
                "dailies.session.ping-interval", "20s"));

        assertThat(properties.timezone()).isEqualTo("Asia/Almaty");
        assertThat(properties.scheduler().enabled()).isFalse();
        assertThat(properties.scheduler().interval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(properties.session().pingInterval()).isEqualTo(Duration.ofSeconds(20));
        assertThat(properties.session().readTimeout()).isEqualTo(Duration.ofSeconds(60));
    }

    private static DailiesProperties bind(Map<String, String> values) {
        return new Binder(new MapConfigurationPropertySource(values))
                .bindOrCreate("dailies", DailiesProperties.class);
    }
}
