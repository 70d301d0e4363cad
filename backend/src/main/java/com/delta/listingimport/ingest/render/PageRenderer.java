package com.delta.listingimport.ingest.render;

/**
 * Page loading capability handed to every parser. Implementations own their underlying session
 * (HTTP client, browser process) between {@link #start()} and {@link #close()}.
 */
public interface PageRenderer extends AutoCloseable {

    void start();

    boolean isStarted();

    RenderedPage render(RenderRequest request);

    @Override
    void close();
}
