package com.github.dimitryivaniuta.solar.payments.config;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application-level configuration properties.
 *
 * <p>Bound from {@code app.*}; every value has a default suitable for local runs.</p>
 */
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private final Clients clients = new Clients();
    private final Outbox outbox = new Outbox();
    private final Payments payments = new Payments();
    private final Cache cache = new Cache();

    @Getter
    @Setter
    public static class Clients {
        private final Remote userService = new Remote("http://localhost:3001");
        private final Remote projectService = new Remote("http://localhost:3002");
        private final Remote contractorService = new Remote("http://localhost:3003");

        /**
         * TCP connect timeout for all remote calls.
         */
        private Duration connectTimeout = Duration.ofSeconds(2);

        /**
         * Response timeout for all remote calls.
         */
        private Duration readTimeout = Duration.ofSeconds(5);

        private int maxConnections = 50;
        private int maxConnectionsPerRoute = 20;
    }

    @Getter
    @Setter
    public static class Remote {
        private String baseUrl;

        public Remote() {
        }

        Remote(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }

    @Getter
    @Setter
    public static class Outbox {
        /**
         * Kafka topic name for payment events.
         */
        private String paymentsEventsTopic = "payments-events";

        /**
         * Max number of commands per batch.
         */
        private int batchSize = 100;

        /**
         * Fixed delay between dispatcher runs in milliseconds.
         */
        private long publishIntervalMs = 1000L;

        /**
         * Kafka send acknowledgment timeout.
         */
        private Duration sendTimeout = Duration.ofSeconds(5);

        /**
         * Max number of attempts before moving to DEAD.
         */
        private int maxAttempts = 10;

        /**
         * Base backoff used for retries (exponential).
         */
        private Duration baseBackoff = Duration.ofSeconds(1);

        /**
         * Maximum backoff cap.
         */
        private Duration maxBackoff = Duration.ofMinutes(2);
    }

    @Getter
    @Setter
    public static class Payments {
        private String currency = "SAR";

        /**
         * Zone used to decide what "today" is for due dates and overdue days.
         */
        private String zone = "Asia/Riyadh";

        /**
         * Smallest monthly installment a BNPL plan may have.
         */
        private BigDecimal minInstallment = new BigDecimal("100.00");

        /**
         * Roles allowed to release funds to contractors and read any payment.
         */
        private List<String> adminRoles = new ArrayList<>(List.of("admin", "super_admin"));

        /**
         * Project status required before a payment method can be selected.
         */
        private String selectableProjectStatus = "payment_pending";
    }

    @Getter
    @Setter
    public static class Cache {
        /**
         * TTL of the cached payment details view.
         */
        private Duration detailsTtl = Duration.ofMinutes(10);
    }
}
