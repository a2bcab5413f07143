package com.example.datalake.thinking.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "thinking")
@Validated
public class ThinkingProperties {

    private boolean renderThoughts = true;
    @Valid
    private final Server server = new Server();
    @Valid
    private final Session session = new Session();
    @Valid
    private final Heartbeat heartbeat = new Heartbeat();

    public boolean isRenderThoughts() {
        return renderThoughts;
    }

    public void setRenderThoughts(boolean renderThoughts) {
        this.renderThoughts = renderThoughts;
    }

    public Server getServer() {
        return server;
    }

    public Session getSession() {
        return session;
    }

    public Heartbeat getHeartbeat() {
        return heartbeat;
    }

    public static final class Server {
        @NotBlank
        private String name = "sequential-thinking-server";
        @NotBlank
        private String version = "0.2.0";

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getVersion() {
            return version;
        }

        public void setVersion(String version) {
            this.version = version;
        }
    }

    public static final class Session {
        @Min(1)
        private int maxSessions = 1000;

        public int getMaxSessions() {
            return maxSessions;
        }

        public void setMaxSessions(int maxSessions) {
            this.maxSessions = maxSessions;
        }
    }

    public static final class Heartbeat {
        @NotNull
        @DurationMin(nanos = 1)
        private Duration interval = Duration.ofSeconds(15);

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }
}
