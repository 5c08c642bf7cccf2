package com.stellarcast.media.compose;

import com.stellarcast.common.result.ErrorKind;
import com.stellarcast.common.result.Outcome;
import com.stellarcast.media.apod.PictureOfDay;
import com.stellarcast.media.translate.Translator;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Composes the "puzzle mode" card: translated explanation plus picture,
 * rendered through markdown and a light or dark stylesheet.
 */
@Slf4j
public class ApodImageComposer implements ImageComposer {

    static final int RENDER_WIDTH = 600;

    private final Translator translator;
    private final HtmlSnapshotter snapshotter;
    private final String css;

    public ApodImageComposer(Translator translator, HtmlSnapshotter snapshotter, boolean darkMode) {
        this.translator = translator;
        this.snapshotter = snapshotter;
        this.css = loadStylesheet(darkMode ? "css/dark.css" : "css/light.css");
    }

    @Override
    public Outcome<byte[]> compose(PictureOfDay picture) {
        if (!picture.isDeliverableImage()) {
            return Outcome.failed(ErrorKind.MEDIA_TYPE_MISMATCH, "not an image: " + picture.getMediaType());
        }
        try {
            String explanation = translator.translateOrOriginal(
                    picture.getExplanation() == null ? "" : picture.getExplanation());
            String html = ApodCardTemplate.html(picture, explanation, css);
            byte[] png = snapshotter.snapshot(html, RENDER_WIDTH);
            if (png == null || png.length == 0) {
                return Outcome.failed(ErrorKind.COMPOSE_FAILURE, "renderer produced no image");
            }
            return Outcome.ok(png);
        } catch (RuntimeException e) {
            log.error("Failed to compose APOD image for {}: {}", picture.getDate(), e.getMessage());
            return Outcome.failed(ErrorKind.COMPOSE_FAILURE, e.getMessage());
        }
    }

    String stylesheet() {
        return css;
    }

    private static String loadStylesheet(String resource) {
        try (InputStream in = ApodImageComposer.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing stylesheet resource: " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
