package com.example.datalake.thinking.config;

import com.example.datalake.thinking.session.SessionStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class StreamingConfig {

    @Bean
    public SessionStore sessionStore(ThinkingProperties properties) {
        return new SessionStore(
                properties.getSession().getMaxSessions(),
                properties.isRenderThoughts(),
                System::nanoTime);
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler heartbeatScheduler() {
        return Schedulers.newParallel("sse-heartbeat", 2, true);
    }

    // inbound frames of one connection are handled on a single worker, in arrival order
    @Bean(destroyMethod = "dispose")
    public Scheduler dispatchScheduler() {
        return Schedulers.newBoundedElastic(
                Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE,
                Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE,
                "thought-dispatch");
    }
}
