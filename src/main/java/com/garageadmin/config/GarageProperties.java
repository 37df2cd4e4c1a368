package com.garageadmin.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything under the {@code garage.*} prefix in application.properties.
 * Most values are fed from environment variables (see the properties file).
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "garage")
public class GarageProperties {

    /** Enables encrypted (but unverified) transport to Postgres. */
    private boolean production = false;

    /** Root directory for archived files; also served under /uploads/**. */
    private String uploadRoot = "uploads";

    private final Cors cors = new Cors();
    private final Pdf pdf = new Pdf();
    private final Invoice invoice = new Invoice();
    private final Catalog catalog = new Catalog();

    @Getter
    @Setter
    public static class Cors {
        // empty list = any origin (bring-up mode)
        private List<String> allowedOrigins = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Pdf {
        private String logoPath = "assets/logo.png";
    }

    @Getter
    @Setter
    public static class Invoice {
        /** Charged per day in the garage, in RWF. */
        private BigDecimal stayRate = new BigDecimal("5000");
        private BigDecimal taxRate = new BigDecimal("0.18");
    }

    @Getter
    @Setter
    public static class Catalog {
        private boolean seed = true;
    }
}
