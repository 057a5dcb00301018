package com.clouddeploy.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Platform configuration bound from the {@code platform.*} namespace.
 */
@Data
@ConfigurationProperties(prefix = "platform")
public class PlatformProperties {

    private String baseDomain = "myplatform.app";

    private int maxAppsPerUser = 10;

    private final Auth auth = new Auth();

    private final RateLimit rateLimit = new RateLimit();

    private final Deployment deployment = new Deployment();

    private final Admin admin = new Admin();

    private final Database database = new Database();

    @Data
    public static class Auth {

        /**
         * HMAC secret for session tokens. When blank a random key is generated
         * at startup and tokens do not survive a restart.
         */
        private String jwtSecret = "";

        private Duration accessTokenTtl = Duration.ofMinutes(60);

        private Duration refreshTokenTtl = Duration.ofDays(7);

        /**
         * Number of random bytes in an API key secret.
         */
        private int apiKeyLength = 32;

        private String apiKeyPrefix = "cdp_";

        private int bcryptStrength = 10;
    }

    @Data
    public static class RateLimit {

        private boolean enabled = true;

        /**
         * Maximum admitted requests per client within the trailing window.
         */
        private int requests = 100;

        private Duration window = Duration.ofSeconds(60);

        private String healthCheckPath = "/health";

        private Duration evictionInterval = Duration.ofMinutes(5);
    }

    @Data
    public static class Deployment {

        private int queueCapacity = 256;

        private int workers = 1;

        /**
         * Pause before each simulated build stage.
         */
        private Duration stepDelay = Duration.ZERO;
    }

    @Data
    public static class Admin {

        private boolean bootstrap = false;

        private String email = "admin@myplatform.app";

        private String username = "admin";

        private String password = "";
    }

    @Data
    public static class Database {

        private boolean initializeSchema = true;
    }
}
