package me.golemcore.toolgate.tools;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolgate.domain.component.ToolComponent;
import me.golemcore.toolgate.domain.model.BrowserPage;
import me.golemcore.toolgate.domain.model.RequestContext;
import me.golemcore.toolgate.domain.model.ToolDefinition;
import me.golemcore.toolgate.domain.model.ToolFailureKind;
import me.golemcore.toolgate.domain.model.ToolResult;
import me.golemcore.toolgate.infrastructure.config.ToolgateProperties;
import me.golemcore.toolgate.port.outbound.BrowserPort;
import org.springframework.stereotype.Component;

import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Tool for browsing web pages with the shared browser window.
 *
 * <p>
 * Desktop-category: the registry runs it through the desktop lane so two
 * sessions never drive the browser at the same time.
 *
 * <p>
 * Modes:
 * <ul>
 * <li>{@code text} - page title and visible text (default)
 * <li>{@code html} - raw HTML
 * <li>{@code screenshot} - full-page PNG, base64 encoded in the result data
 * </ul>
 *
 * <p>
 * Only http and https URLs are accepted; bare hosts get {@code https://}.
 */
@Component
@Slf4j
public class BrowserTool implements ToolComponent {

    public static final String NAME = "browser";

    private static final String PARAM_URL = "url";
    private static final String TYPE_STRING = "string";
    private static final int MAX_TEXT_LENGTH = 10_000;

    private static final ToolDefinition DEFINITION = ToolDefinition.builder()
            .name(NAME)
            .description("Browse a web page and extract its content. Returns the page title and text content.")
            .inputSchema(Map.of(
                    "type", "object",
                    "properties", Map.of(
                            PARAM_URL, Map.of(
                                    "type", TYPE_STRING,
                                    "description", "The URL to browse"),
                            "mode", Map.of(
                                    "type", TYPE_STRING,
                                    "description", "What to extract: 'text' (default), 'html', or 'screenshot'",
                                    "enum", List.of("text", "html", "screenshot"))),
                    "required", List.of(PARAM_URL)))
            .build();

    private final BrowserPort browserPort;
    private final boolean enabled;

    public BrowserTool(BrowserPort browserPort, ToolgateProperties properties) {
        this.browserPort = browserPort;
        this.enabled = properties.getTools().getBrowser().isEnabled();
    }

    @Override
    public ToolDefinition getDefinition() {
        return DEFINITION;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public CompletableFuture<ToolResult> execute(RequestContext context, Map<String, Object> parameters) {
        Object rawUrl = parameters.get(PARAM_URL);
        if (rawUrl == null || rawUrl.toString().isBlank()) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, "URL is required"));
        }
        String url = rawUrl.toString().trim();

        // Only allow http/https schemes to prevent file://, javascript:, data: attacks
        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            if (url.contains("://") || url.startsWith("javascript:") || url.startsWith("data:")
                    || url.startsWith("file:")) {
                return CompletableFuture.completedFuture(
                        ToolResult.failure(ToolFailureKind.VALIDATION_FAILED, "Only http and https URLs are allowed"));
            }
            url = "https://" + url;
        }

        Object mode = parameters.getOrDefault("mode", "text");
        String target = url;
        CompletableFuture<ToolResult> result = switch (mode.toString()) {
        case "html" -> browserPort.getHtml(target).thenApply(BrowserTool::htmlResult);
        case "screenshot" -> browserPort.screenshot(target).thenApply(bytes -> screenshotResult(target, bytes));
        default -> browserPort.navigate(target).thenApply(BrowserTool::textResult);
        };
        return result.exceptionally(e -> {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.warn("[Browser] Failed for URL {}: {}", target, cause.getMessage());
            return ToolResult.failure("Failed to browse page: " + cause.getMessage());
        });
    }

    private static ToolResult textResult(BrowserPage page) {
        String text = page.getText();
        if (text != null && text.length() > MAX_TEXT_LENGTH) {
            text = text.substring(0, MAX_TEXT_LENGTH) + "\n... (truncated)";
        }
        String output = String.format("**%s**%n%nURL: %s%n%n%s", page.getTitle(), page.getUrl(), text);
        return ToolResult.success(output, Map.of(
                "title", page.getTitle() != null ? page.getTitle() : "",
                PARAM_URL, page.getUrl() != null ? page.getUrl() : ""));
    }

    private static ToolResult htmlResult(String html) {
        if (html != null && html.length() > MAX_TEXT_LENGTH * 2) {
            return ToolResult.success(html.substring(0, MAX_TEXT_LENGTH * 2) + "\n... (truncated)");
        }
        return ToolResult.success(html);
    }

    private static ToolResult screenshotResult(String url, byte[] screenshot) {
        String base64 = Base64.getEncoder().encodeToString(screenshot);
        return ToolResult.success(
                "Screenshot of " + url + " captured (" + screenshot.length + " bytes)",
                Map.of("screenshot_base64", base64, "format", "png"));
    }
}
