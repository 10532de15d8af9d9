package me.golemcore.toolgate.adapter.outbound.browser;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.LoadState;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolgate.domain.model.BrowserPage;
import me.golemcore.toolgate.infrastructure.config.ToolgateProperties;
import me.golemcore.toolgate.port.outbound.BrowserPort;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * Playwright implementation of BrowserPort.
 *
 * <p>
 * Playwright objects are bound to the thread that created them, so every
 * browser operation runs on one dedicated thread. The registry additionally
 * routes the browser tool through the desktop lane, which keeps page loads from
 * different sessions from interleaving in the shared window.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code toolgate.tools.browser.enabled} - Enable/disable browser
 * <li>{@code toolgate.tools.browser.headless} - Run in headless mode
 * <li>{@code toolgate.tools.browser.timeout} - Page load timeout (ms)
 * <li>{@code toolgate.tools.browser.user-agent} - Custom user agent
 * </ul>
 *
 * <p>
 * Lazy initialization: Browser is only launched on first use.
 */
@Component
@Slf4j
public class PlaywrightAdapter implements BrowserPort {

    private final ToolgateProperties.BrowserToolProperties config;
    private final ExecutorService browserThread;

    private Playwright playwright;
    private Browser browser;
    private BrowserContext context;
    private volatile boolean initialized = false;

    public PlaywrightAdapter(ToolgateProperties properties) {
        this.config = properties.getTools().getBrowser();
        this.browserThread = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "playwright");
            t.setDaemon(true);
            return t;
        });
    }

    @SuppressWarnings("PMD.CloseResource")
    private void ensureInitialized() {
        if (initialized || !config.isEnabled()) {
            return;
        }

        Playwright pw = null;
        Browser br = null;
        try {
            pw = Playwright.create();
            br = pw.chromium().launch(new BrowserType.LaunchOptions().setHeadless(config.isHeadless()));

            Browser.NewContextOptions contextOptions = new Browser.NewContextOptions();
            if (config.getUserAgent() != null && !config.getUserAgent().isBlank()) {
                contextOptions.setUserAgent(config.getUserAgent());
            }

            this.context = br.newContext(contextOptions);
            this.browser = br;
            this.playwright = pw;
            initialized = true;

            log.info("[Browser] Playwright initialized (headless: {})", config.isHeadless());
        } catch (PlaywrightException e) {
            log.warn("[Browser] Failed to initialize Playwright: {}", e.getMessage());
            if (br != null) {
                closeQuietly(br::close);
            }
            if (pw != null) {
                closeQuietly(pw::close);
            }
        }
    }

    @PreDestroy
    public void destroy() {
        close();
        browserThread.shutdownNow();
    }

    @Override
    public CompletableFuture<BrowserPage> navigate(String url) {
        return onPage(url, LoadState.DOMCONTENTLOADED, page -> BrowserPage.builder()
                .url(page.url())
                .title(page.title())
                .html(page.content())
                .text(extractText(page))
                .build());
    }

    @Override
    public CompletableFuture<String> getHtml(String url) {
        return navigate(url).thenApply(BrowserPage::getHtml);
    }

    @Override
    public CompletableFuture<byte[]> screenshot(String url) {
        return onPage(url, LoadState.NETWORKIDLE,
                page -> page.screenshot(new Page.ScreenshotOptions().setFullPage(true)));
    }

    @SuppressWarnings("PMD.UseTryWithResources")
    private <T> CompletableFuture<T> onPage(String url, LoadState loadState, Function<Page, T> action) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            if (!isAvailable()) {
                throw new IllegalStateException("Browser not available or disabled");
            }

            Page page = context.newPage();
            try {
                page.setDefaultTimeout(config.getTimeout());
                page.navigate(url);
                page.waitForLoadState(loadState);
                return action.apply(page);
            } finally {
                page.close();
            }
        }, browserThread);
    }

    @Override
    public void close() {
        if (!initialized) {
            return;
        }
        CompletableFuture.runAsync(() -> {
            closeQuietly(context::close);
            closeQuietly(browser::close);
            closeQuietly(playwright::close);
            initialized = false;
            log.info("[Browser] Playwright browser closed");
        }, browserThread).join();
    }

    @Override
    public boolean isAvailable() {
        return config.isEnabled() && browser != null && browser.isConnected();
    }

    private String extractText(Page page) {
        try {
            // Remove script and style elements, then get text content
            return page.evaluate("""
                    (() => {
                        const clone = document.body.cloneNode(true);
                        const scripts = clone.querySelectorAll('script, style, noscript');
                        scripts.forEach(el => el.remove());
                        return clone.innerText;
                    })()
                    """).toString();
        } catch (PlaywrightException e) {
            log.warn("[Browser] Failed to extract text from page", e);
            return page.textContent("body");
        }
    }

    private static void closeQuietly(Runnable closer) {
        try {
            closer.run();
        } catch (PlaywrightException e) {
            log.trace("[Browser] Error closing browser resource: {}", e.getMessage());
        }
    }
}
