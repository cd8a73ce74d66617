package com.example.handwritingcomparator.model.api;

public record MessageResponse(String message) {
}
