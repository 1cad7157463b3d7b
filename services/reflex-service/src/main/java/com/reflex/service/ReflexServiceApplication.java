package com.reflex.service;

import com.reflex.service.config.ReflexProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Reflex service: hosts the event mesh, its connection supervisor and the materialized views
 * behind a small HTTP API.
 *
 * <p>Configured by default:
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful}), which also stops the supervisor's
 *       probe loop and the view sweeper
 *   <li>Actuator health (including the store session), metrics and Prometheus endpoints
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(ReflexProperties.class)
public class ReflexServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(ReflexServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ReflexServiceApplication.class, args);
        log.info("Reflex service started successfully");
    }
}
