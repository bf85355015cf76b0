package com.example.admission.controller.dto;

import com.example.admission.model.LimitPolicy;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class LimitResponse {

    private String message;
    private String group;
    private int limit;

    /**
     * Whole seconds, truncated. Sub-second windows show as 0; {@link #window} is exact.
     */
    @JsonProperty("window_seconds")
    private long windowSeconds;

    /**
     * ISO-8601 duration, e.g. {@code PT1M} or {@code PT0.25S}.
     */
    private String window;

    public LimitResponse() {
    }

    public LimitResponse(String message, String group, LimitPolicy policy) {
        this.message = message;
        this.group = group;
        this.limit = policy.getMaxRequests();
        this.windowSeconds = policy.getWindow().getSeconds();
        this.window = policy.getWindow().toString();
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getGroup() {
        return group;
    }

    public void setGroup(String group) {
        this.group = group;
    }

    public int getLimit() {
        return limit;
    }

    public void setLimit(int limit) {
        this.limit = limit;
    }

    public long getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(long windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    public String getWindow() {
        return window;
    }

    public void setWindow(String window) {
        this.window = window;
    }
}
