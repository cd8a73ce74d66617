package com.example.handwritingcomparator.model;

public record ImageSize(int width, int height) {
}
