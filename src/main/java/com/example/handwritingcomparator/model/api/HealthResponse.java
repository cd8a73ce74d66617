package com.example.handwritingcomparator.model.api;

import java.time.Instant;

public record HealthResponse(String status, Instant timestamp, String analysisProvider) {
}
