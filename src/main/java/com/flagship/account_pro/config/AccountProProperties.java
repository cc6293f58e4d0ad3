package com.flagship.account_pro.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * Application settings bound from {@code accountpro.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "accountpro")
public class AccountProProperties {

    @Valid
    @NotNull
    private Seed seed = new Seed();

    @Valid
    @NotNull
    private Dashboard dashboard = new Dashboard();

    @Valid
    @NotNull
    private Balance balance = new Balance();

    @Data
    public static class Seed {
        /**
         * Load the demo accounts on start-up.
         */
        private boolean enabled = true;
    }

    @Data
    public static class Dashboard {
        /**
         * Number of recently created accounts shown on the dashboard.
         */
        @Min(1)
        private int recentLimit = 5;
    }

    @Data
    public static class Balance {
        /**
         * Largest balance accepted on create and edit.
         */
        @NotNull
        @DecimalMin("0")
        private BigDecimal max = new BigDecimal("1000000");
    }
}
