package com.kernelgate.core.picker;

import com.kernelgate.core.logging.MdcContext;
import com.kernelgate.core.metrics.PickerMetrics;
import com.kernelgate.core.model.GatewayDescriptor;
import com.kernelgate.core.model.KernelSpec;
import com.kernelgate.core.model.PickerOutcome;
import com.kernelgate.core.model.PickerState;
import com.kernelgate.core.model.ResolvedKernel;
import com.kernelgate.core.resolver.GatewayResolution;
import com.kernelgate.core.resolver.GatewayResolver;
import com.kernelgate.core.resolver.SessionResolver;
import com.kernelgate.gateway.GatewayCatalog;
import com.kernelgate.gateway.GatewaySession;
import com.kernelgate.ui.Chooser;
import com.kernelgate.ui.ChooserItem;
import com.kernelgate.ui.ChooserMessages;
import com.kernelgate.ui.DocumentContext;
import com.kernelgate.ui.FailureReporter;
import com.kernelgate.ui.Prompter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Top-level kernel picker: gateway selection, spec discovery, session choice and
 * binding, driven through one shared {@link Chooser}.
 *
 * <p>Single-flight: a {@link #toggle} while a resolution is running returns the
 * running resolution's future. Each resolution runs on the configured executor
 * and blocks there on user input and gateway calls, one at a time.
 *
 * <p>Only two things escape the resolvers: user cancellation, which ends the
 * resolution silently, and fatal failures, which are reported once with a generic
 * message. {@code onChosen} is called at most once per resolution and only with a
 * fully bound kernel.
 */
public class KernelPicker {

    private static final Logger log = LoggerFactory.getLogger(KernelPicker.class);

    static final String NO_GATEWAYS_TITLE = "No remote kernel gateways available";
    static final String NO_GATEWAYS_DESCRIPTION =
            "Use the kernelgate.gateways setting to specify the list of remote servers. "
                    + "Remote kernels can run on either a Jupyter Kernel Gateway or a Jupyter notebook server.";
    static final String CONNECTION_FAILED = "Connection to gateway failed";

    private final GatewayCatalog catalog;
    private final GatewayResolver gatewayResolver;
    private final SessionResolver sessionResolver;
    private final PickerMetrics metrics;
    private final Chooser chooser;
    private final Prompter prompter;
    private final FailureReporter reporter;
    private final DocumentContext document;
    private final Consumer<ResolvedKernel> onChosen;
    private final Executor executor;
    private final boolean ownsExecutor;

    private CompletableFuture<PickerOutcome> inFlight;
    private volatile ResolutionContext current;

    KernelPicker(GatewayCatalog catalog, GatewayResolver gatewayResolver, SessionResolver sessionResolver,
                 PickerMetrics metrics, Chooser chooser, Prompter prompter, FailureReporter reporter,
                 DocumentContext document, Consumer<ResolvedKernel> onChosen, Executor executor,
                 boolean ownsExecutor) {
        this.catalog = catalog;
        this.gatewayResolver = gatewayResolver;
        this.sessionResolver = sessionResolver;
        this.metrics = metrics;
        this.chooser = chooser;
        this.prompter = prompter;
        this.reporter = reporter;
        this.document = document;
        this.onChosen = onChosen;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    /**
     * Starts a resolution for kernels accepted by {@code specFilter}.
     *
     * @return completes with the terminal outcome; IDLE when no gateway is configured
     */
    public synchronized CompletableFuture<PickerOutcome> toggle(Predicate<KernelSpec> specFilter) {
        if (inFlight != null && !inFlight.isDone()) {
            log.info("Kernel picker already running, ignoring toggle");
            return inFlight;
        }

        List<GatewayDescriptor> gateways = catalog.listGateways();
        if (gateways.isEmpty()) {
            reporter.reportFailure(NO_GATEWAYS_TITLE, NO_GATEWAYS_DESCRIPTION);
            metrics.recordResolution("idle");
            return CompletableFuture.completedFuture(PickerOutcome.of(PickerState.IDLE));
        }

        var ctx = new ResolutionContext(
                UUID.randomUUID().toString(),
                new PickerView(chooser, prompter),
                new PickerStateMachine(),
                document.filePath().orElse("unsaved") + "-" + UUID.randomUUID(),
                specFilter);
        current = ctx;

        var future = new CompletableFuture<PickerOutcome>();
        inFlight = future;
        executor.execute(() -> {
            try {
                future.complete(run(ctx, gateways));
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            }
        });
        return future;
    }

    /**
     * State of the latest resolution, IDLE before the first one.
     */
    public PickerState state() {
        var ctx = current;
        return ctx == null ? PickerState.IDLE : ctx.state();
    }

    /**
     * Cancels the running resolution, if any, and releases the chooser. A worker
     * thread created for this picker is stopped as well.
     */
    public void destroy() {
        var ctx = current;
        if (ctx != null) {
            ctx.view().destroy();
        } else {
            chooser.destroy();
        }
        if (ownsExecutor && executor instanceof ExecutorService worker) {
            worker.shutdownNow();
        }
    }

    private PickerOutcome run(ResolutionContext ctx, List<GatewayDescriptor> gateways) {
        long startMs = System.currentTimeMillis();
        MdcContext.setResolution(ctx.id());
        try {
            PickerOutcome outcome = resolve(ctx, gateways);
            metrics.recordResolution(outcome.state().name().toLowerCase());
            return outcome;
        } catch (RuntimeException e) {
            if (ctx.state().isTerminal()) {
                throw e;
            }
            if (ctx.isCancelled()) {
                log.debug("Discarding failure in state {}, resolution was cancelled: {}", ctx.state(), e.getMessage());
                metrics.recordResolution("cancelled");
                return cancel(ctx);
            }
            if (!ctx.machine().canTransitionTo(PickerState.FAILED)) {
                // Only gateway calls fail a resolution; anything else during user input ends it.
                log.error("Resolution aborted in state {}", ctx.state(), e);
                metrics.recordResolution("cancelled");
                return cancel(ctx);
            }
            log.error("Resolution failed in state {}", ctx.state(), e);
            metrics.recordResolution("failed");
            return fail(ctx);
        } finally {
            metrics.recordResolutionDuration(System.currentTimeMillis() - startMs);
            MdcContext.clear();
        }
    }

    private PickerOutcome resolve(ResolutionContext ctx, List<GatewayDescriptor> gateways) {
        ctx.transition(PickerState.GATEWAY_SELECTION);
        List<ChooserItem<GatewayDescriptor>> items = gateways.stream()
                .map(gateway -> new ChooserItem<>(gateway.name(), gateway))
                .toList();
        Optional<GatewayDescriptor> gateway = ctx.view().choose(items,
                ChooserMessages.info("Select a gateway", "No gateways available"));
        if (gateway.isEmpty()) {
            return cancel(ctx);
        }

        ctx.setGatewayName(gateway.get().name());
        MdcContext.setGateway(ctx.id(), gateway.get().name());
        ctx.transition(PickerState.SPEC_DISCOVERY);
        ctx.view().showStatus(ChooserMessages.loading("Loading sessions...", "No sessions available"));

        GatewayResolution resolution = gatewayResolver.resolve(ctx, gateway.get());
        if (ctx.isCancelled()) {
            return cancel(ctx);
        }
        if (resolution instanceof GatewayResolution.Unreachable) {
            return fail(ctx);
        }
        if (!(resolution instanceof GatewayResolution.Resolved resolved)) {
            return cancel(ctx);
        }

        Optional<GatewaySession> session =
                sessionResolver.resolveSession(ctx, resolved.options(), resolved.kernelSpecs());
        if (session.isEmpty()) {
            return cancel(ctx);
        }
        return bind(ctx, session.get());
    }

    private PickerOutcome bind(ResolutionContext ctx, GatewaySession session) {
        ctx.view().hide();
        KernelSpec kernelSpec;
        try {
            kernelSpec = session.getKernelSpec();
        } catch (RuntimeException e) {
            session.close();
            throw e;
        }

        Optional<String> language = document.language();
        if (language.isEmpty() || ctx.isCancelled()) {
            log.info("No document to bind kernel '{}' to, closing session {}", kernelSpec.name(), session.id());
            session.close();
            return cancel(ctx);
        }

        var resolved = new ResolvedKernel(ctx.gatewayName(), kernelSpec, language.get(), session);
        ctx.transition(PickerState.DONE);
        log.info("Bound kernel '{}' on gateway '{}' (session {})",
                kernelSpec.name(), ctx.gatewayName(), session.id());
        onChosen.accept(resolved);
        return PickerOutcome.done(resolved);
    }

    private PickerOutcome cancel(ResolutionContext ctx) {
        ctx.view().hide();
        ctx.transition(PickerState.CANCELLED);
        log.debug("Resolution cancelled");
        return PickerOutcome.of(PickerState.CANCELLED);
    }

    private PickerOutcome fail(ResolutionContext ctx) {
        ctx.view().hide();
        ctx.transition(PickerState.FAILED);
        reporter.reportFailure(CONNECTION_FAILED);
        return PickerOutcome.of(PickerState.FAILED);
    }
}
