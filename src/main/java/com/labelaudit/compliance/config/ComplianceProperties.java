package com.labelaudit.compliance.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "compliance")
public class ComplianceProperties {
    /**
     * Spring resource location of the rule catalogue JSON.
     */
    @NotBlank
    private String catalogueLocation = "classpath:rule-catalogue.json";
    /**
     * Score at or above which a scan counts as compliant in manufacturer analytics.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double compliantThreshold = 0.75;

    @Valid
    private History history = new History();
    @Valid
    private Trend trend = new Trend();

    public String getCatalogueLocation() {
        return catalogueLocation;
    }

    public void setCatalogueLocation(String catalogueLocation) {
        this.catalogueLocation = catalogueLocation;
    }

    public double getCompliantThreshold() {
        return compliantThreshold;
    }

    public void setCompliantThreshold(double compliantThreshold) {
        this.compliantThreshold = compliantThreshold;
    }

    public History getHistory() {
        return history;
    }

    public void setHistory(History history) {
        this.history = history;
    }

    public Trend getTrend() {
        return trend;
    }

    public void setTrend(Trend trend) {
        this.trend = trend;
    }

    public static class History {
        /**
         * "file" (default) or "memory".
         */
        private String store = "file";
        /**
         * Directory holding one event log and one profile snapshot per manufacturer.
         * Defaults to "tmp/manufacturer-history" when not set.
         */
        private String directory = "tmp/manufacturer-history";

        public String getStore() {
            return store;
        }

        public void setStore(String store) {
            this.store = store;
        }

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }
    }

    public static class Trend {
        /** Entries per comparison window */
        @Min(1)
        private int window = 5;
        /** Minimum difference of window means that counts as a change */
        @DecimalMin("0.0")
        private double epsilon = 0.01;

        public int getWindow() {
            return window;
        }

        public void setWindow(int window) {
            this.window = window;
        }

        public double getEpsilon() {
            return epsilon;
        }

        public void setEpsilon(double epsilon) {
            this.epsilon = epsilon;
        }
    }
}
