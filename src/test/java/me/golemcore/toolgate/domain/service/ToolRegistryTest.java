package me.golemcore.toolgate.domain.service;

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

import me.golemcore.toolgate.adapter.outbound.lane.SingleWorkerDesktopLane;
import me.golemcore.toolgate.domain.catalog.CapabilityCatalog;
import me.golemcore.toolgate.domain.model.AccessLevel;
import me.golemcore.toolgate.domain.model.AskMode;
import me.golemcore.toolgate.domain.model.CancellationSignal;
import me.golemcore.toolgate.domain.model.Capability;
import me.golemcore.toolgate.domain.model.Origin;
import me.golemcore.toolgate.domain.model.Platform;
import me.golemcore.toolgate.domain.model.RequestContext;
import me.golemcore.toolgate.domain.model.ToolCall;
import me.golemcore.toolgate.domain.model.ToolFailureKind;
import me.golemcore.toolgate.domain.model.ToolResult;
import me.golemcore.toolgate.infrastructure.config.ToolgateProperties;
import me.golemcore.toolgate.port.outbound.ApprovalPort;
import me.golemcore.toolgate.testsupport.StubTool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolRegistryTest {

    private static final String SHELL = "shell";
    private static final String FILE = "file";
    private static final String BROWSER = "browser";
    private static final String COMMAND = "command";
    private static final String TRUNCATION_MARKER = "\n\n[Output truncated: exceeded 100000 characters]";

    @TempDir
    Path home;

    private ToolgateProperties properties;
    private AccessPolicy policy;
    private ApprovalPort approvalPort;
    private CommandSafeguard safeguard;
    private StubTool shell;
    private StubTool file;
    private ToolRegistry registry;
    private SingleWorkerDesktopLane lane;
    private ExecutorService callers;

    @BeforeEach
    void setUp() {
        properties = new ToolgateProperties();
        policy = new AccessPolicy(new CommandClassifier(), AccessLevel.ALLOWLIST, AskMode.ON_MISS);
        approvalPort = mock(ApprovalPort.class);
        policy.setApprovalPort(approvalPort);
        safeguard = new CommandSafeguard(Platform.LINUX, home);
        shell = StubTool.command(SHELL);
        file = StubTool.returning(FILE, "file contents");
        registry = newRegistry(CapabilityCatalog.of(Platform.LINUX,
                Capability.builder().tool(shell).category(CapabilityCatalog.CATEGORY_SYSTEM).build(),
                Capability.builder().tool(file).category("files").build()));
        callers = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        callers.shutdownNow();
        if (lane != null) {
            lane.shutdown();
        }
    }

    private ToolRegistry newRegistry(CapabilityCatalog catalog) {
        return new ToolRegistry(catalog, policy, safeguard, properties);
    }

    private static ToolCall call(String name, Map<String, Object> input) {
        return ToolCall.builder().id("call-1").name(name).input(input).build();
    }

    // ==================== APPROVAL ====================

    @Test
    void shouldRunAllowlistedCommandWithoutApproval() {
        ToolResult result = registry.execute(RequestContext.user(), call(SHELL, Map.of(COMMAND, "ls -la")));

        assertTrue(result.isSuccess());
        assertEquals("ran: ls -la", result.getContent());
        verify(approvalPort, never()).requestApproval(any(), anyString(), anyString(), anyMap());
    }

    @Test
    void shouldAskBeforeUnsafeCommandAndStillEnforceSafeguard() {
        when(approvalPort.requestApproval(any(), anyString(), eq(SHELL), anyMap()))
                .thenReturn(CompletableFuture.completedFuture(true));

        ToolResult result = registry.execute(RequestContext.user(), call(SHELL, Map.of(COMMAND, "rm -rf /")));

        verify(approvalPort).requestApproval(any(), anyString(), eq(SHELL), anyMap());
        assertTrue(result.isError());
        assertEquals(ToolFailureKind.SAFEGUARD_BLOCKED, result.getFailureKind());
        assertTrue(result.getContent().startsWith("BLOCKED: "));
        assertEquals(0, shell.calls());
    }

    @Test
    void shouldNotExecuteWhenApprovalDenied() {
        when(approvalPort.requestApproval(any(), anyString(), anyString(), anyMap()))
                .thenReturn(CompletableFuture.completedFuture(false));

        ToolResult result = registry.execute(RequestContext.user(),
                call(SHELL, Map.of(COMMAND, "npm install left-pad")));

        assertEquals(ToolFailureKind.APPROVAL_DENIED, result.getFailureKind());
        assertEquals("Tool execution denied by user", result.getContent());
        assertEquals(0, shell.calls());
    }

    @Test
    void shouldExecuteAfterApprovalGranted() {
        when(approvalPort.requestApproval(any(), anyString(), anyString(), anyMap()))
                .thenReturn(CompletableFuture.completedFuture(true));

        ToolResult result = registry.execute(RequestContext.user(),
                call(SHELL, Map.of(COMMAND, "npm install left-pad")));

        assertTrue(result.isSuccess());
        assertEquals(1, shell.calls());
    }

    @Test
    void shouldAskForNonCommandToolFlaggedForApproval() {
        StubTool mailer = new StubTool("mailer", true,
                input -> CompletableFuture.completedFuture(ToolResult.success("sent")));
        registry.register(mailer, "productivity");
        when(approvalPort.requestApproval(any(), anyString(), eq("mailer"), anyMap()))
                .thenReturn(CompletableFuture.completedFuture(false));

        ToolResult result = registry.execute(RequestContext.user(), call("mailer", Map.of()));

        assertEquals(ToolFailureKind.APPROVAL_DENIED, result.getFailureKind());
        assertEquals(0, mailer.calls());
    }

    @Test
    void shouldAutoApproveSystemOrigin() {
        ToolResult result = registry.execute(RequestContext.of(Origin.SYSTEM),
                call(SHELL, Map.of(COMMAND, "npm test")));

        assertTrue(result.isSuccess());
        verify(approvalPort, never()).requestApproval(any(), anyString(), anyString(), anyMap());
    }

    @Test
    void shouldCancelWhileWaitingForApproval() throws Exception {
        CompletableFuture<Boolean> neverAnswered = new CompletableFuture<>();
        when(approvalPort.requestApproval(any(), anyString(), anyString(), anyMap())).thenReturn(neverAnswered);
        CancellationSignal signal = CancellationSignal.create();
        RequestContext ctx = RequestContext.builder().origin(Origin.USER).cancellation(signal).build();

        Future<ToolResult> pending = callers.submit(
                () -> registry.execute(ctx, call(SHELL, Map.of(COMMAND, "npm install"))));
        verify(approvalPort, timeout(2000)).requestApproval(any(), anyString(), anyString(),
                anyMap());
        signal.cancel();

        ToolResult result = pending.get(5, TimeUnit.SECONDS);
        assertEquals(ToolFailureKind.CANCELLED, result.getFailureKind());
        assertEquals(0, shell.calls());
        verify(approvalPort).cancel(anyString());
    }

    @Test
    void shouldStopWaitingForApprovalAtDeadline() {
        when(approvalPort.requestApproval(any(), anyString(), anyString(), anyMap()))
                .thenReturn(new CompletableFuture<>());
        RequestContext ctx = RequestContext.user().withDeadline(Instant.now().plusMillis(200));

        ToolResult result = registry.execute(ctx, call(SHELL, Map.of(COMMAND, "npm install")));

        assertEquals(ToolFailureKind.CANCELLED, result.getFailureKind());
        assertEquals(0, shell.calls());
    }

    // ==================== ORIGIN ====================

    @Test
    void shouldDenyShellForCommOrigin() {
        ToolResult result = registry.execute(RequestContext.of(Origin.COMM), call(SHELL, Map.of(COMMAND, "ls")));

        assertEquals(ToolFailureKind.ORIGIN_DENIED, result.getFailureKind());
        assertEquals("Tool \"shell\" is not permitted for comm-origin requests", result.getContent());
        assertEquals(0, shell.calls());
    }

    @Test
    void shouldDenyOriginRegardlessOfAccessLevel() {
        policy.setLevel(AccessLevel.FULL);

        ToolResult result = registry.execute(RequestContext.of(Origin.PLUGIN), call(SHELL, Map.of(COMMAND, "ls")));

        assertEquals(ToolFailureKind.ORIGIN_DENIED, result.getFailureKind());
    }

    @Test
    void shouldAllowFileReadForCommOrigin() {
        ToolResult result = registry.execute(RequestContext.of(Origin.COMM),
                call(FILE, Map.of("action", "read", "path", "notes.txt")));

        assertTrue(result.isSuccess());
        assertEquals("file contents", result.getContent());
    }

    // ==================== LOOKUP ====================

    @Test
    void shouldReportUnknownToolWithHintAndAvailableTools() {
        ToolResult result = registry.execute(RequestContext.user(), call("web_search", Map.of("query", "x")));

        assertEquals(ToolFailureKind.UNKNOWN_TOOL, result.getFailureKind());
        assertTrue(result.getContent().contains("\"web_search\" does not exist"));
        assertTrue(result.getContent().contains("INSTEAD USE: browser("));
        assertTrue(result.getContent().contains("Your available tools are: file, shell"));
    }

    @Test
    void shouldSanitizeToolNames() {
        ToolResult result = registry.execute(RequestContext.user(), call("file<|tool_call|>", Map.of()));

        assertTrue(result.isSuccess());
        assertEquals(1, file.calls());
    }

    @Test
    void shouldRejectDisabledTool() {
        file.setEnabled(false);

        ToolResult result = registry.execute(RequestContext.user(), call(FILE, Map.of()));

        assertEquals(ToolFailureKind.DISABLED, result.getFailureKind());
        assertEquals(0, file.calls());
        assertFalse(registry.listDefinitions().stream().anyMatch(d -> FILE.equals(d.getName())));
    }

    // ==================== EXECUTION ====================

    @Test
    void shouldTruncateOversizedOutputToExactCap() {
        registry.register(StubTool.returning("dump", "x".repeat(150_000)), null);

        ToolResult result = registry.execute(RequestContext.user(), call("dump", Map.of()));

        assertEquals(100_000 + TRUNCATION_MARKER.length(), result.getContent().length());
        assertEquals("x".repeat(100_000) + TRUNCATION_MARKER, result.getContent());
        assertTrue(result.isSuccess());
    }

    @Test
    void shouldLeaveOutputAtCapUntouched() {
        registry.register(StubTool.returning("dump", "x".repeat(100_000)), null);

        ToolResult result = registry.execute(RequestContext.user(), call("dump", Map.of()));

        assertEquals(100_000, result.getContent().length());
    }

    @Test
    void shouldConvertToolExceptionsToFailures() {
        registry.register(new StubTool("broken", false,
                input -> CompletableFuture.failedFuture(new IllegalStateException("disk on fire"))), null);

        ToolResult result = registry.execute(RequestContext.user(), call("broken", Map.of()));

        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertTrue(result.getContent().contains("disk on fire"));
    }

    @Test
    void shouldTimeOutSlowTool() {
        properties.getRegistry().setToolTimeoutSeconds(1);
        ToolRegistry fast = newRegistry(CapabilityCatalog.of(Platform.LINUX));
        fast.register(new StubTool("slow", false, input -> new CompletableFuture<>()), null);

        ToolResult result = fast.execute(RequestContext.user(), call("slow", Map.of()));

        assertTrue(result.isError());
        assertTrue(result.getContent().contains("timed out"));
    }

    @Test
    void shouldRejectNonPositiveResultCap() {
        properties.getRegistry().setMaxResultChars(0);

        assertThrows(IllegalArgumentException.class, () -> newRegistry(CapabilityCatalog.of(Platform.LINUX)));
    }

    @Test
    void shouldRejectMissingCall() {
        ToolResult result = registry.execute(RequestContext.user(), null);

        assertTrue(result.isError());
        assertEquals(ToolFailureKind.VALIDATION_FAILED, result.getFailureKind());
    }

    @Test
    void shouldUseFullUuidForApprovalRequests() {
        when(approvalPort.requestApproval(any(), anyString(), eq(SHELL), anyMap()))
                .thenReturn(CompletableFuture.completedFuture(false));

        registry.execute(RequestContext.user(), call(SHELL, Map.of(COMMAND, "rm -rf build")));

        ArgumentCaptor<String> requestId = ArgumentCaptor.forClass(String.class);
        verify(approvalPort).requestApproval(any(), requestId.capture(), eq(SHELL), anyMap());
        assertEquals(requestId.getValue(), UUID.fromString(requestId.getValue()).toString());
    }

    // ==================== DESKTOP LANE ====================

    @Test
    void shouldSerializeDesktopToolsThroughLane() throws Exception {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        List<Integer> order = new ArrayList<>();
        StubTool browser = new StubTool(BROWSER, false, input -> {
            int now = active.incrementAndGet();
            maxActive.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(150);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            synchronized (order) {
                order.add((Integer) input.get("n"));
            }
            active.decrementAndGet();
            return CompletableFuture.completedFuture(ToolResult.success("page " + input.get("n")));
        });
        registry.register(browser, CapabilityCatalog.CATEGORY_DESKTOP);
        lane = new SingleWorkerDesktopLane();
        registry.attachDesktopLane(lane);

        Future<ToolResult> first = callers.submit(
                () -> registry.execute(RequestContext.user(), call(BROWSER, Map.of("n", 1))));
        Future<ToolResult> second = callers.submit(
                () -> registry.execute(RequestContext.user(), call(BROWSER, Map.of("n", 2))));

        assertTrue(first.get(5, TimeUnit.SECONDS).isSuccess());
        assertTrue(second.get(5, TimeUnit.SECONDS).isSuccess());
        assertEquals(1, maxActive.get());
        assertEquals(2, order.size());
        assertEquals(2, browser.calls());
    }

    @Test
    void shouldRunNonDesktopToolsConcurrently() throws Exception {
        CountDownLatch bothStarted = new CountDownLatch(2);
        StubTool rendezvous = new StubTool("rendezvous", false, input -> {
            bothStarted.countDown();
            try {
                boolean met = bothStarted.await(3, TimeUnit.SECONDS);
                return CompletableFuture.completedFuture(met ? ToolResult.success("met")
                        : ToolResult.failure("ran alone"));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return CompletableFuture.completedFuture(ToolResult.failure("interrupted"));
            }
        });
        registry.register(rendezvous, null);
        lane = new SingleWorkerDesktopLane();
        registry.attachDesktopLane(lane);

        Future<ToolResult> first = callers.submit(
                () -> registry.execute(RequestContext.user(), call("rendezvous", Map.of())));
        Future<ToolResult> second = callers.submit(
                () -> registry.execute(RequestContext.user(), call("rendezvous", Map.of())));

        assertEquals("met", first.get(5, TimeUnit.SECONDS).getContent());
        assertEquals("met", second.get(5, TimeUnit.SECONDS).getContent());
    }

    @Test
    void shouldRunDesktopToolsInlineWithoutLane() {
        StubTool browser = StubTool.returning(BROWSER, "inline page");
        registry.register(browser, CapabilityCatalog.CATEGORY_DESKTOP);

        assertFalse(registry.hasDesktopLane());
        assertEquals("inline page", registry.execute(RequestContext.user(), call(BROWSER, Map.of())).getContent());
        assertTrue(registry.isDesktopTool(BROWSER));
    }

    @Test
    void shouldCancelWhileWaitingInLane() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch blockerStarted = new CountDownLatch(1);
        StubTool blocker = new StubTool("screen", false, input -> {
            blockerStarted.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return CompletableFuture.completedFuture(ToolResult.success("done"));
        });
        registry.register(blocker, CapabilityCatalog.CATEGORY_DESKTOP);
        lane = new SingleWorkerDesktopLane();
        registry.attachDesktopLane(lane);

        Future<ToolResult> holder = callers.submit(
                () -> registry.execute(RequestContext.user(), call("screen", Map.of())));
        assertTrue(blockerStarted.await(2, TimeUnit.SECONDS));

        CancellationSignal signal = CancellationSignal.create();
        RequestContext ctx = RequestContext.builder().origin(Origin.USER).cancellation(signal).build();
        Future<ToolResult> waiter = callers.submit(() -> registry.execute(ctx, call("screen", Map.of())));
        Thread.sleep(100);
        signal.cancel();

        assertEquals(ToolFailureKind.CANCELLED, waiter.get(2, TimeUnit.SECONDS).getFailureKind());
        release.countDown();
        assertTrue(holder.get(5, TimeUnit.SECONDS).isSuccess());
        assertEquals(1, blocker.calls());
    }

    @Test
    void shouldHoldLaneUntilCancelledDesktopToolFinishes() throws Exception {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        ExecutorService toolThreads = Executors.newCachedThreadPool();
        StubTool screen = new StubTool("screen", false, input -> CompletableFuture.supplyAsync(() -> {
            int now = active.incrementAndGet();
            maxActive.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(600);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            active.decrementAndGet();
            return ToolResult.success("ok");
        }, toolThreads));
        registry.register(screen, CapabilityCatalog.CATEGORY_DESKTOP);
        lane = new SingleWorkerDesktopLane();
        registry.attachDesktopLane(lane);

        try {
            CancellationSignal signal = CancellationSignal.create();
            RequestContext cancellable = RequestContext.builder().origin(Origin.USER).cancellation(signal).build();
            Future<ToolResult> first = callers.submit(() -> registry.execute(cancellable, call("screen", Map.of())));
            Thread.sleep(100);
            Future<ToolResult> second = callers.submit(
                    () -> registry.execute(RequestContext.user(), call("screen", Map.of())));
            Thread.sleep(50);
            signal.cancel();

            assertEquals(ToolFailureKind.CANCELLED, first.get(2, TimeUnit.SECONDS).getFailureKind());
            assertEquals("ok", second.get(5, TimeUnit.SECONDS).getContent());
            assertEquals(1, maxActive.get());
            assertEquals(2, screen.calls());
        } finally {
            toolThreads.shutdownNow();
        }
    }

    // ==================== REGISTRATION ====================

    @Test
    void shouldNotifyListenersOnRegisterAndUnregister() {
        List<String> events = new ArrayList<>();
        registry.addListener((added, removed) -> events.add("+" + added + " -" + removed));

        registry.register(StubTool.returning("extra", "x"), null);
        assertTrue(registry.unregister("extra"));
        assertFalse(registry.unregister("extra"));

        assertEquals(List.of("+[extra] -[]", "+[] -[extra]"), events);
    }

    @Test
    void shouldListDefinitionsSortedByName() {
        registry.register(StubTool.returning("alpha", "a"), null);

        assertEquals(List.of("alpha", FILE, SHELL),
                registry.listDefinitions().stream().map(d -> d.getName()).toList());
    }
}
