package com.stellarcast.media.compose;

/**
 * Turns an HTML document into a PNG screenshot of the whole page.
 */
public interface HtmlSnapshotter {

    byte[] snapshot(String html, int width);
}
