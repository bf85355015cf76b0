package com.example.admission.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "admission")
public class AdmissionProperties {

    /**
     * If true, the client key is taken from X-Real-IP or the first X-Forwarded-For hop.
     * Only enable behind a proxy that overwrites those headers.
     */
    private boolean trustForwardedHeaders;

    /**
     * Delay between idle-client sweeps.
     */
    private long sweepIntervalMs = 30_000L;

    /**
     * Limit groups by name. "default" gates every route without a group of its own.
     */
    private Map<String, Group> groups = new LinkedHashMap<>();

    public boolean isTrustForwardedHeaders() {
        return trustForwardedHeaders;
    }

    public void setTrustForwardedHeaders(boolean trustForwardedHeaders) {
        this.trustForwardedHeaders = trustForwardedHeaders;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public void setSweepIntervalMs(long sweepIntervalMs) {
        this.sweepIntervalMs = sweepIntervalMs;
    }

    public Map<String, Group> getGroups() {
        return groups;
    }

    public void setGroups(Map<String, Group> groups) {
        this.groups = groups;
    }

    public static class Group {

        /**
         * Admissions allowed per client in each window.
         */
        private int maxRequests;

        private Duration window = Duration.ofSeconds(60);

        /**
         * How long an idle client is remembered. Defaults to three windows when unset.
         */
        private Duration retention;

        /**
         * Other groups whose limits also apply to requests routed to this group, checked in order
         * after this group's own limit. A request is admitted only if every one of them admits it.
         */
        private List<String> tiers = new ArrayList<>();

        public int getMaxRequests() {
            return maxRequests;
        }

        public void setMaxRequests(int maxRequests) {
            this.maxRequests = maxRequests;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }

        public List<String> getTiers() {
            return tiers;
        }

        public void setTiers(List<String> tiers) {
            this.tiers = tiers;
        }
    }
}
