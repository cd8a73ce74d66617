package com.example.handwritingcomparator.model.api;

public record ApiInfoResponse(String message, String version) {
}
