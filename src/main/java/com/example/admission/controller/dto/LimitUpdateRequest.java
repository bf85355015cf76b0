package com.example.admission.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class LimitUpdateRequest {

    private Integer limit;

    /**
     * Optional; the group's current window is kept when absent.
     */
    @JsonProperty("window_seconds")
    private Long windowSeconds;

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }

    public Long getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(Long windowSeconds) {
        this.windowSeconds = windowSeconds;
    }
}
