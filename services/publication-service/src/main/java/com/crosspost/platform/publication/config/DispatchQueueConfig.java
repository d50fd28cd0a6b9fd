package com.crosspost.platform.publication.config;

import org.springframework.amqp.core.Queue;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DispatchQueueConfig {

    @Bean
    public Queue dispatchQueue(@Value("${publication.dispatch.queue:publication.scheduled}") String name) {
        return new Queue(name, true);
    }
}
