package com.clouddeploy;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.reactive.ReactiveUserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.r2dbc.repository.config.EnableR2dbcRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Cloud Deployment Platform API Server
 *
 * Multi-tenant account, application, deployment and function API
 * built with Spring Boot WebFlux.
 */
@SpringBootApplication(exclude = ReactiveUserDetailsServiceAutoConfiguration.class)
@EnableR2dbcRepositories
@EnableScheduling
@ConfigurationPropertiesScan
public class CloudDeployApplication {

    public static void main(String[] args) {
        SpringApplication.run(CloudDeployApplication.class, args);
    }

}
