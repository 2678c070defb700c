package com.kernelgate.core.picker;

import com.kernelgate.core.auth.CredentialNegotiator;
import com.kernelgate.core.metrics.PickerMetrics;
import com.kernelgate.core.model.ConnectionOptions;
import com.kernelgate.core.model.FailureKind;
import com.kernelgate.core.model.GatewayDescriptor;
import com.kernelgate.core.model.KernelSpec;
import com.kernelgate.core.model.KernelSpecFilters;
import com.kernelgate.core.model.PickerOutcome;
import com.kernelgate.core.model.PickerState;
import com.kernelgate.core.model.ResolvedKernel;
import com.kernelgate.core.model.SessionDescriptor;
import com.kernelgate.core.model.StartSessionRequest;
import com.kernelgate.core.resolver.GatewayResolver;
import com.kernelgate.core.resolver.SessionResolver;
import com.kernelgate.gateway.GatewayCatalog;
import com.kernelgate.gateway.GatewayClient;
import com.kernelgate.gateway.GatewayException;
import com.kernelgate.gateway.GatewaySession;
import com.kernelgate.gateway.TransportDefaults;
import com.kernelgate.ui.Chooser;
import com.kernelgate.ui.DocumentContext;
import com.kernelgate.ui.FailureReporter;
import com.kernelgate.ui.Prompter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class KernelPickerTest {

    private static final KernelSpec PYTHON3 = new KernelSpec("python3", "Python 3", "python");
    private static final KernelSpec IR = new KernelSpec("ir", "R", "R");

    private GatewayCatalog catalog;
    private GatewayClient client;
    private SimpleMeterRegistry registry;
    private KernelPickerFactory factory;
    private ScriptedChooser chooser;
    private Prompter prompter;
    private FailureReporter reporter;
    private List<ResolvedKernel> chosen;
    private GatewaySession session;

    @BeforeEach
    void setUp() {
        catalog = mock(GatewayCatalog.class);
        client = mock(GatewayClient.class);
        registry = new SimpleMeterRegistry();
        var metrics = new PickerMetrics(registry);
        var gatewayResolver = new GatewayResolver(client, new CredentialNegotiator(metrics),
                new TransportDefaults(Duration.ofSeconds(30), Duration.ofSeconds(10)));
        var sessionResolver = new SessionResolver(client, metrics);
        factory = new KernelPickerFactory(catalog, gatewayResolver, sessionResolver, metrics);

        chooser = new ScriptedChooser();
        prompter = mock(Prompter.class);
        reporter = mock(FailureReporter.class);
        chosen = new ArrayList<>();
        session = mock(GatewaySession.class);
        when(session.id()).thenReturn("sess-1");

        when(catalog.listGateways()).thenReturn(List.of(
                new GatewayDescriptor("lab", ConnectionOptions.of("http://lab:8888"))));
    }

    private KernelPicker picker(DocumentContext document, Executor executor) {
        return factory.create(chooser, prompter, reporter, document, chosen::add, executor);
    }

    private KernelPicker picker() {
        return picker(DocumentContext.of("/work/nb.py", "python"), Runnable::run);
    }

    @Test
    @DisplayName("no configured gateways reports once and never shows the chooser")
    void noGateways() {
        when(catalog.listGateways()).thenReturn(List.of());

        PickerOutcome outcome = picker().toggle(KernelSpecFilters.any()).join();

        assertEquals(PickerState.IDLE, outcome.state());
        verify(reporter).reportFailure(KernelPicker.NO_GATEWAYS_TITLE, KernelPicker.NO_GATEWAYS_DESCRIPTION);
        assertTrue(chooser.shown().isEmpty());
        assertTrue(chosen.isEmpty());
    }

    @Nested
    @DisplayName("successful resolution")
    class Success {

        @Test
        @DisplayName("new python3 session for a python document")
        void newSession() {
            when(client.getKernelSpecs(any())).thenReturn(List.of(PYTHON3, IR));
            when(client.listSessions(any())).thenReturn(List.of());
            when(client.startSession(any())).thenReturn(session);
            when(session.getKernelSpec()).thenReturn(PYTHON3);
            chooser.pick("lab").pick(SessionDescriptor.Unbound.NEW_SESSION_LABEL).pick("Python 3");

            var kernelPicker = picker();
            PickerOutcome outcome = kernelPicker.toggle(KernelSpecFilters.forLanguage("python")).join();

            assertEquals(PickerState.DONE, outcome.state());
            assertEquals(1, chosen.size());
            ResolvedKernel resolved = chosen.get(0);
            assertSame(resolved, outcome.resolvedKernel().orElseThrow());
            assertEquals("lab", resolved.gatewayName());
            assertEquals("python3", resolved.kernelSpec().name());
            assertEquals("python", resolved.language());
            assertSame(session, resolved.session());
            assertEquals(PickerState.DONE, kernelPicker.state());

            assertEquals(List.of("Python 3"), chooser.shown().get(2));
            var request = ArgumentCaptor.forClass(StartSessionRequest.class);
            verify(client).startSession(request.capture());
            assertEquals("python3", request.getValue().kernelName());
            assertTrue(request.getValue().path().startsWith("/work/nb.py-"));
            verify(session, never()).close();
            verifyNoInteractions(reporter);
            assertEquals(1.0, registry.find("kernelgate.resolutions.total").tag("outcome", "done").counter().count());
        }

        @Test
        @DisplayName("unsaved documents get an unsaved session path")
        void unsavedDocument() {
            when(client.getKernelSpecs(any())).thenReturn(List.of(PYTHON3));
            when(client.listSessions(any())).thenReturn(List.of());
            when(client.startSession(any())).thenReturn(session);
            when(session.getKernelSpec()).thenReturn(PYTHON3);
            chooser.pick("lab").pick(SessionDescriptor.Unbound.NEW_SESSION_LABEL).pick("Python 3");

            picker(DocumentContext.of(null, "python"), Runnable::run).toggle(KernelSpecFilters.any()).join();

            verify(client).startSession(argThat(request -> request.path().startsWith("unsaved-")));
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        void dismissingGatewayChoiceCancels() {
            chooser.dismiss();

            PickerOutcome outcome = picker().toggle(KernelSpecFilters.any()).join();

            assertEquals(PickerState.CANCELLED, outcome.state());
            verifyNoInteractions(client, reporter);
            assertTrue(chosen.isEmpty());
        }

        @Test
        void cancellingCredentialsEndsQuietly() {
            when(client.getKernelSpecs(any()))
                    .thenThrow(new GatewayException(FailureKind.STRUCTURED, 401, "Unauthorized", "401"));
            chooser.pick("lab").pick("Cancel");

            PickerOutcome outcome = picker().toggle(KernelSpecFilters.any()).join();

            assertEquals(PickerState.CANCELLED, outcome.state());
            verify(client, times(1)).getKernelSpecs(any());
            verifyNoInteractions(reporter);
        }

        @Test
        @DisplayName("no document language closes the session and never reports a kernel")
        void noDocumentLanguage() {
            when(client.getKernelSpecs(any())).thenReturn(List.of(PYTHON3));
            when(client.listSessions(any())).thenReturn(List.of());
            when(client.startSession(any())).thenReturn(session);
            when(session.getKernelSpec()).thenReturn(PYTHON3);
            chooser.pick("lab").pick(SessionDescriptor.Unbound.NEW_SESSION_LABEL).pick("Python 3");

            PickerOutcome outcome = picker(DocumentContext.of("/work/nb.py", null), Runnable::run)
                    .toggle(KernelSpecFilters.any()).join();

            assertEquals(PickerState.CANCELLED, outcome.state());
            verify(session).close();
            assertTrue(chosen.isEmpty());
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("a timed out gateway is reported with the generic message")
        void unreachable() {
            when(client.getKernelSpecs(any()))
                    .thenThrow(new GatewayException(FailureKind.TIMEOUT, GatewayException.NO_STATUS, "ETIMEDOUT", "t"));
            chooser.pick("lab");

            PickerOutcome outcome = picker().toggle(KernelSpecFilters.any()).join();

            assertEquals(PickerState.FAILED, outcome.state());
            verify(reporter, times(1)).reportFailure(KernelPicker.CONNECTION_FAILED);
        }

        @Test
        @DisplayName("a fatal listing failure is reported once")
        void fatalListing() {
            when(client.getKernelSpecs(any())).thenReturn(List.of(PYTHON3));
            when(client.listSessions(any()))
                    .thenThrow(new GatewayException(FailureKind.STRUCTURED, 500, "boom", "500"));
            chooser.pick("lab");

            PickerOutcome outcome = picker().toggle(KernelSpecFilters.any()).join();

            assertEquals(PickerState.FAILED, outcome.state());
            verify(reporter, times(1)).reportFailure("Connection to gateway failed");
            assertTrue(chosen.isEmpty());
            assertEquals(1.0, registry.find("kernelgate.resolutions.total").tag("outcome", "failed").counter().count());
        }

        @Test
        @DisplayName("a failing spec lookup after connecting closes the session")
        void kernelSpecLookupFails() {
            when(client.getKernelSpecs(any())).thenReturn(List.of(PYTHON3));
            when(client.listSessions(any())).thenReturn(List.of());
            when(client.startSession(any())).thenReturn(session);
            when(session.getKernelSpec())
                    .thenThrow(new GatewayException(FailureKind.STRUCTURED, 404, "gone", "spec missing"));
            chooser.pick("lab").pick(SessionDescriptor.Unbound.NEW_SESSION_LABEL).pick("Python 3");

            PickerOutcome outcome = picker().toggle(KernelSpecFilters.any()).join();

            assertEquals(PickerState.FAILED, outcome.state());
            verify(session).close();
            verify(reporter).reportFailure(KernelPicker.CONNECTION_FAILED);
        }
    }

    @Nested
    @DisplayName("failures after the user cancelled")
    class FailureAfterCancel {

        @Test
        @DisplayName("a timeout arriving after a cancel ends the resolution quietly")
        void timeoutAfterCancel() {
            var kernelPicker = picker();
            when(client.getKernelSpecs(any())).thenAnswer(invocation -> {
                kernelPicker.destroy();
                throw new GatewayException(FailureKind.TIMEOUT, GatewayException.NO_STATUS, "ETIMEDOUT", "t");
            });
            chooser.pick("lab");

            PickerOutcome outcome = kernelPicker.toggle(KernelSpecFilters.any()).join();

            assertEquals(PickerState.CANCELLED, outcome.state());
            verifyNoInteractions(reporter);
        }

        @Test
        @DisplayName("a listing failure arriving after a cancel ends the resolution quietly")
        void listingFailureAfterCancel() {
            var kernelPicker = picker();
            when(client.getKernelSpecs(any())).thenReturn(List.of(PYTHON3));
            when(client.listSessions(any())).thenAnswer(invocation -> {
                kernelPicker.destroy();
                throw new GatewayException(FailureKind.STRUCTURED, 500, "boom", "500");
            });
            chooser.pick("lab");

            PickerOutcome outcome = kernelPicker.toggle(KernelSpecFilters.any()).join();

            assertEquals(PickerState.CANCELLED, outcome.state());
            assertEquals(PickerState.CANCELLED, kernelPicker.state());
            verifyNoInteractions(reporter);
            assertEquals(1.0, registry.find("kernelgate.resolutions.total").tag("outcome", "cancelled").counter().count());
            assertNull(registry.find("kernelgate.resolutions.total").tag("outcome", "failed").counter());
        }
    }

    @Test
    @DisplayName("a chooser failure during user input ends the resolution without a report")
    void chooserFailure() {
        Chooser broken = mock(Chooser.class);
        doThrow(new UncheckedIOException("Failed to read choice from terminal", new IOException("closed")))
                .when(broken).show();
        var kernelPicker = factory.create(broken, prompter, reporter,
                DocumentContext.of("/work/nb.py", "python"), chosen::add, Runnable::run);

        PickerOutcome outcome = kernelPicker.toggle(KernelSpecFilters.any()).join();

        assertEquals(PickerState.CANCELLED, outcome.state());
        assertEquals(PickerState.CANCELLED, kernelPicker.state());
        verifyNoInteractions(reporter, client);
        assertEquals(1.0, registry.find("kernelgate.resolutions.total").tag("outcome", "cancelled").counter().count());
    }

    @Test
    @DisplayName("destroy stops the worker thread of pickers created without an executor")
    void defaultWorkerStopsOnDestroy() throws InterruptedException {
        long before = liveWorkerThreads();
        List<KernelPicker> pickers = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            chooser.dismiss();
            var kernelPicker = factory.create(chooser, prompter, reporter,
                    DocumentContext.of("/work/nb.py", "python"), chosen::add);
            assertEquals(PickerState.CANCELLED, kernelPicker.toggle(KernelSpecFilters.any()).join().state());
            pickers.add(kernelPicker);
        }
        assertTrue(liveWorkerThreads() > before);

        pickers.forEach(KernelPicker::destroy);

        long deadline = System.currentTimeMillis() + 5000;
        while (liveWorkerThreads() > before && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertEquals(before, liveWorkerThreads());
    }

    private static long liveWorkerThreads() {
        return Thread.getAllStackTraces().keySet().stream()
                .filter(thread -> thread.isAlive() && thread.getName().equals("kernel-picker"))
                .count();
    }

    @Test
    @DisplayName("a toggle while running returns the running resolution")
    void singleFlight() {
        List<Runnable> queued = new ArrayList<>();
        var kernelPicker = picker(DocumentContext.of("/work/nb.py", "python"), queued::add);

        var first = kernelPicker.toggle(KernelSpecFilters.any());
        var second = kernelPicker.toggle(KernelSpecFilters.any());

        assertSame(first, second);
        assertEquals(1, queued.size());
        verify(catalog, times(1)).listGateways();

        chooser.dismiss();
        queued.get(0).run();
        assertEquals(PickerState.CANCELLED, first.join().state());

        kernelPicker.toggle(KernelSpecFilters.any());
        assertEquals(2, queued.size());
    }

    @Test
    @DisplayName("destroy cancels the running resolution and releases the chooser")
    void destroy() {
        List<Runnable> queued = new ArrayList<>();
        var kernelPicker = picker(DocumentContext.of("/work/nb.py", "python"), queued::add);
        var outcome = kernelPicker.toggle(KernelSpecFilters.any());

        kernelPicker.destroy();
        queued.get(0).run();

        assertEquals(PickerState.CANCELLED, outcome.join().state());
        assertEquals(1, chooser.destroyCount());
        assertTrue(chooser.shown().isEmpty());
        assertEquals(Optional.empty(), outcome.join().resolvedKernel());
    }
}
