package com.clouddeploy.config;

import io.r2dbc.spi.ConnectionFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.r2dbc.connection.init.ConnectionFactoryInitializer;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;

import java.time.Clock;

/**
 * Database configuration for the R2DBC PostgreSQL connection.
 */
@Configuration
public class DatabaseConfig {

    /**
     * Initialize database schema on startup.
     * Executes schema.sql when platform.database.initialize-schema is set.
     */
    @Bean
    public ConnectionFactoryInitializer initializer(ConnectionFactory connectionFactory,
                                                    PlatformProperties properties) {
        ConnectionFactoryInitializer initializer = new ConnectionFactoryInitializer();
        initializer.setConnectionFactory(connectionFactory);

        ResourceDatabasePopulator populator = new ResourceDatabasePopulator();
        populator.addScript(new ClassPathResource("schema.sql"));
        initializer.setDatabasePopulator(populator);
        initializer.setEnabled(properties.getDatabase().isInitializeSchema());

        return initializer;
    }

    /**
     * Clock shared by token issuing, rate limiting and deployment timestamps.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
