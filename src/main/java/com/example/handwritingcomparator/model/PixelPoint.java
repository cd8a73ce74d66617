package com.example.handwritingcomparator.model;

public record PixelPoint(int x, int y) {
}
