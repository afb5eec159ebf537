package com.stressease.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Strongly-typed application configuration.
 * Bound from application.yml under the "stressease" prefix.
 */
@ConfigurationProperties(prefix = "stressease")
@Data
public class StressEaseProperties {

    private Auth auth = new Auth();
    private Session session = new Session();
    private Crisis crisis = new Crisis();
    private Quiz quiz = new Quiz();

    @Data
    public static class Auth {
        /** HMAC secret used to verify bearer tokens (at least 32 bytes) */
        private String jwtSecret = "";
        /** Expected "iss" claim; empty means any issuer is accepted */
        private String issuer = "";
    }

    @Data
    public static class Session {
        /** memory | redis */
        private String store = "memory";
        /** Idle expiry for the redis store */
        private long ttlMinutes = 60;
        private long lockTimeoutMs = 30000;
        private int lockStripes = 64;
    }

    @Data
    public static class Crisis {
        private Patterns patterns = new Patterns();
        private String defaultCountry = "India";

        /**
         * Phrase lists per risk category. An empty list means the built-in
         * defaults for that category are used.
         */
        @Data
        public static class Patterns {
            private List<String> suicide = new ArrayList<>();
            private List<String> selfHarm = new ArrayList<>();
            private List<String> general = new ArrayList<>();
        }
    }

    @Data
    public static class Quiz {
        private int maxNotesLength = 2000;
        private int historyDefaultLimit = 30;
        private int historyMaxLimit = 100;
    }
}
