package com.envelope.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.envelope.backend.enums.TransactionScope;

/**
 * Tuning for the monthly overview.
 *
 * @param transactionScope which accounts count towards income and total spending
 * @param loaderPoolSize   threads used to read the four ledger feeds concurrently
 */
@ConfigurationProperties(prefix = "envelope.overview")
public record OverviewProperties(
        TransactionScope transactionScope,
        Integer loaderPoolSize
) {
    public OverviewProperties {
        if (transactionScope == null) {
            transactionScope = TransactionScope.ALL_ACCOUNTS;
        }
        if (loaderPoolSize == null || loaderPoolSize <= 0) {
            loaderPoolSize = 4;
        }
    }

    public static OverviewProperties defaults() {
        return new OverviewProperties(null, null);
    }
}
