package com.assessval.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunables for the valuation core, bound from the {@code assessval} namespace.
 * <pre>
 * assessval:
 *   discovery:
 *     default-count: 5
 *     max-count: 50
 *   lineage:
 *     default-limit: 100
 *     max-limit: 1000
 *   concurrency:
 *     max-update-attempts: 3
 *     backoff-millis: 25
 * </pre>
 */
@ConfigurationProperties(prefix = "assessval")
@Data
public class ValuationProperties {

    private Discovery discovery = new Discovery();

    private Lineage lineage = new Lineage();

    private Concurrency concurrency = new Concurrency();

    @Data
    public static class Discovery {

        /**
         * Number of comparables returned when the caller does not ask for a count.
         */
        private int defaultCount = 5;

        /**
         * Upper bound on a requested count.
         */
        private int maxCount = 50;
    }

    @Data
    public static class Lineage {

        private int defaultLimit = 100;

        private int maxLimit = 1000;
    }

    @Data
    public static class Concurrency {

        /**
         * Total attempts (first try included) for a tracked update that loses an
         * optimistic-lock race before it is reported as a conflict.
         */
        private int maxUpdateAttempts = 3;

        private long backoffMillis = 25;
    }
}
