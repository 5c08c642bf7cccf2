package com.stellarcast.media.compose;

import com.stellarcast.media.apod.PictureOfDay;
import com.vladsch.flexmark.html.HtmlRenderer;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.data.MutableDataSet;

/**
 * Markdown card for a picture of the day and the HTML page it renders to.
 */
public final class ApodCardTemplate {

    private ApodCardTemplate() {
    }

    private static final String NO_COPYRIGHT = "None";

    private static final Parser PARSER;
    private static final HtmlRenderer RENDERER;

    static {
        MutableDataSet options = new MutableDataSet();
        options.set(HtmlRenderer.ESCAPE_HTML, true);
        PARSER = Parser.builder(options).build();
        RENDERER = HtmlRenderer.builder(options).build();
    }

    static String markdown(PictureOfDay picture, String explanation) {
        String copyright = picture.getCopyright() != null && !picture.getCopyright().isBlank()
                ? picture.getCopyright().trim()
                : NO_COPYRIGHT;
        return "# Astronomy Picture of the Day\n\n"
                + "## " + oneLine(picture.getTitle()) + "\n\n"
                + "![APOD](" + picture.getUrl() + ")\n\n"
                + explanation.trim() + "\n\n"
                + "---\n\n"
                + "**Copyright:** " + oneLine(copyright) + "\n\n"
                + "**Date:** " + oneLine(picture.getDate()) + "\n";
    }

    /**
     * Full HTML document for the card, styled by {@code css}.
     */
    public static String html(PictureOfDay picture, String explanation, String css) {
        String body = RENDERER.render(PARSER.parse(markdown(picture, explanation)));
        return "<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"utf-8\">\n<style>\n"
                + css
                + "\n</style>\n</head>\n<body>\n<div class=\"container\">\n"
                + body
                + "</div>\n</body>\n</html>\n";
    }

    private static String oneLine(String value) {
        return value == null ? "" : value.replaceAll("\\s+", " ").trim();
    }
}
