package com.delta.listingimport.ingest.render;

public record Viewport(int width, int height) {
}
