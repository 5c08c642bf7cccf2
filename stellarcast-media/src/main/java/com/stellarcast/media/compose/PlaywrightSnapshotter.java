package com.stellarcast.media.compose;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.options.ScreenshotType;
import lombok.extern.slf4j.Slf4j;

/**
 * Headless Chromium snapshotter. The browser is launched on first use and
 * reused; Playwright objects are not thread-safe, so snapshots are serialized.
 */
@Slf4j
public class PlaywrightSnapshotter implements HtmlSnapshotter, AutoCloseable {

    private Playwright playwright;
    private Browser browser;

    @Override
    public synchronized byte[] snapshot(String html, int width) {
        ensureBrowser();
        Page page = browser.newPage(new Browser.NewPageOptions().setViewportSize(width, 100));
        try {
            page.setContent(html);
            return page.screenshot(new Page.ScreenshotOptions()
                    .setFullPage(true)
                    .setType(ScreenshotType.PNG));
        } finally {
            page.close();
        }
    }

    private void ensureBrowser() {
        if (browser != null && browser.isConnected()) {
            return;
        }
        if (playwright == null) {
            playwright = Playwright.create();
        }
        browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(true));
        log.info("Launched headless Chromium for image composition");
    }

    @Override
    public synchronized void close() {
        if (browser != null) {
            browser.close();
            browser = null;
        }
        if (playwright != null) {
            playwright.close();
            playwright = null;
        }
    }
}
