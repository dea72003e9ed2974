package com.seamtalk.presentation.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Provider latency reported alongside collaborator responses.
 */
record Timing(@JsonProperty("ttfb_ms") long ttfbMs, @JsonProperty("total_ms") long totalMs) {
}
