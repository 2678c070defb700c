package com.kernelgate.core.resolver;

import com.kernelgate.core.metrics.PickerMetrics;
import com.kernelgate.core.model.ConnectionOptions;
import com.kernelgate.core.model.FailureKind;
import com.kernelgate.core.model.KernelSpec;
import com.kernelgate.core.model.PickerState;
import com.kernelgate.core.model.SessionDescriptor;
import com.kernelgate.core.model.SessionModel;
import com.kernelgate.core.model.StartSessionRequest;
import com.kernelgate.core.picker.ResolutionContext;
import com.kernelgate.gateway.GatewayClient;
import com.kernelgate.gateway.GatewayException;
import com.kernelgate.gateway.GatewaySession;
import com.kernelgate.ui.ChooserItem;
import com.kernelgate.ui.ChooserMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lets the user attach to a running session or start a new one, and binds it.
 *
 * <p>Gateways may refuse to enumerate sessions on purpose; a permission-denied
 * listing therefore goes straight to starting a new session. Any other listing
 * failure is fatal.
 */
@Service
public class SessionResolver {

    private static final Logger log = LoggerFactory.getLogger(SessionResolver.class);

    static final String LISTING_UNSUPPORTED = "This gateway does not support listing sessions";

    private final GatewayClient client;
    private final PickerMetrics metrics;
    private final String homeDirectory;

    @Autowired
    public SessionResolver(GatewayClient client, PickerMetrics metrics) {
        this(client, metrics, System.getProperty("user.home"));
    }

    SessionResolver(GatewayClient client, PickerMetrics metrics, String homeDirectory) {
        this.client = client;
        this.metrics = metrics;
        this.homeDirectory = homeDirectory;
    }

    /**
     * Runs session choice and binding for an already discovered gateway.
     *
     * @return the bound session, or empty when the user cancelled
     * @throws GatewayException when listing, attaching or starting fails fatally
     */
    public Optional<GatewaySession> resolveSession(ResolutionContext ctx, ConnectionOptions options,
                                                   List<KernelSpec> kernelSpecs) {
        ctx.transition(PickerState.SESSION_LISTING);

        List<SessionModel> running;
        try {
            running = client.listSessions(options);
        } catch (GatewayException e) {
            if (e.getKind() != FailureKind.PERMISSION_DENIED) {
                throw e;
            }
            log.warn("Gateway does not allow listing sessions, starting a new one: {}", e.getMessage());
            metrics.recordListingForbidden();
            return startNew(ctx, SessionDescriptor.Unbound.newSession(kernelSpecs, options), true);
        }
        if (ctx.isCancelled()) {
            return Optional.empty();
        }

        List<SessionDescriptor> choices = sessionChoices(running, kernelSpecs, options);
        List<ChooserItem<SessionDescriptor>> items = choices.stream()
                .map(choice -> new ChooserItem<>(choice.label(), choice))
                .toList();

        Optional<SessionDescriptor> chosen = ctx.view().choose(items,
                new ChooserMessages(null, null, "No sessions available", null));
        if (chosen.isEmpty()) {
            return Optional.empty();
        }
        return chosen.get().fold(
                bound -> attach(ctx, bound),
                unbound -> startNew(ctx, unbound, false));
    }

    /**
     * The synthetic new-session entry followed by every running session whose kernel
     * is among {@code kernelSpecs}. Sessions without a kernel name are kept.
     */
    List<SessionDescriptor> sessionChoices(List<SessionModel> running, List<KernelSpec> kernelSpecs,
                                           ConnectionOptions options) {
        Set<String> kernelNames = kernelSpecs.stream().map(KernelSpec::name).collect(Collectors.toSet());
        var choices = new ArrayList<SessionDescriptor>();
        choices.add(SessionDescriptor.Unbound.newSession(kernelSpecs, options));
        for (SessionModel session : running) {
            boolean matches = session.kernelName().map(kernelNames::contains).orElse(true);
            if (matches) {
                choices.add(new SessionDescriptor.Bound(label(session), session, options));
            }
        }
        return choices;
    }

    String label(SessionModel session) {
        if (session.path() != null && !session.path().isEmpty()) {
            return tildify(session.path());
        }
        if (session.notebookPath() != null && !session.notebookPath().isEmpty()) {
            return tildify(session.notebookPath());
        }
        return "Session " + session.id();
    }

    String tildify(String path) {
        if (homeDirectory == null || homeDirectory.isEmpty()) {
            return path;
        }
        String home = homeDirectory.endsWith(File.separator)
                ? homeDirectory.substring(0, homeDirectory.length() - 1)
                : homeDirectory;
        if (path.equals(home)) {
            return "~";
        }
        if (path.startsWith(home + File.separator)) {
            return "~" + path.substring(home.length());
        }
        return path;
    }

    private Optional<GatewaySession> attach(ResolutionContext ctx, SessionDescriptor.Bound bound) {
        ctx.transition(PickerState.CONNECTING);
        log.info("Attaching to session {}", bound.session().id());
        GatewaySession session = client.connectToSession(bound.session().id(), bound.options());
        return keepUnlessCancelled(ctx, session);
    }

    private Optional<GatewaySession> startNew(ResolutionContext ctx, SessionDescriptor.Unbound unbound,
                                              boolean listingUnsupported) {
        ctx.transition(PickerState.KERNEL_SELECTION);
        List<ChooserItem<KernelSpec>> items = unbound.kernelSpecs().stream()
                .map(spec -> new ChooserItem<>(spec.displayName(), spec))
                .toList();
        var messages = new ChooserMessages("Select a session", null, "No kernel specs available",
                listingUnsupported ? LISTING_UNSUPPORTED : null);

        Optional<KernelSpec> spec = ctx.view().choose(items, messages);
        if (spec.isEmpty()) {
            return Optional.empty();
        }

        ctx.transition(PickerState.CONNECTING);
        var request = new StartSessionRequest(unbound.options(), spec.get().name(), ctx.sessionPath());
        log.info("Starting session for kernel '{}' at {}", spec.get().name(), ctx.sessionPath());
        return keepUnlessCancelled(ctx, client.startSession(request));
    }

    private Optional<GatewaySession> keepUnlessCancelled(ResolutionContext ctx, GatewaySession session) {
        if (ctx.isCancelled()) {
            log.debug("Closing session {}, resolution was cancelled while connecting", session.id());
            session.close();
            return Optional.empty();
        }
        return Optional.of(session);
    }
}
