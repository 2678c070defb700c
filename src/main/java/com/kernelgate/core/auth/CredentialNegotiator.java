package com.kernelgate.core.auth;

import com.kernelgate.core.metrics.PickerMetrics;
import com.kernelgate.core.model.ConnectionOptions;
import com.kernelgate.core.model.NegotiationOutcome;
import com.kernelgate.core.picker.PickerView;
import com.kernelgate.ui.ChooserItem;
import com.kernelgate.ui.ChooserMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Asks the user how to authenticate after a gateway rejected (or seemed to reject)
 * a request, and produces the options to retry with.
 *
 * <p>Never mutates its input; a cancelled round returns the input unchanged.
 * Cancelling is not a failure, it tells the caller to abandon the resolution.
 */
@Service
public class CredentialNegotiator {

    private static final Logger log = LoggerFactory.getLogger(CredentialNegotiator.class);

    static final String CONNECTION_FAILED_INFO =
            "Connection to gateway failed. Your settings may be incorrect, the server may be "
                    + "unavailable, or you may lack sufficient privileges to complete the connection.";

    enum Strategy {
        TOKEN("Authenticate with a token"),
        COOKIE("Authenticate with a cookie"),
        CANCEL("Cancel");

        final String label;

        Strategy(String label) {
            this.label = label;
        }
    }

    private final PickerMetrics metrics;

    public CredentialNegotiator(PickerMetrics metrics) {
        this.metrics = metrics;
    }

    public Negotiation negotiate(ConnectionOptions options, PickerView view) {
        List<ChooserItem<Strategy>> items = List.of(
                new ChooserItem<>(Strategy.TOKEN.label, Strategy.TOKEN),
                new ChooserItem<>(Strategy.COOKIE.label, Strategy.COOKIE),
                new ChooserItem<>(Strategy.CANCEL.label, Strategy.CANCEL));

        Strategy strategy = view.choose(items, ChooserMessages.info(CONNECTION_FAILED_INFO, null))
                .orElse(Strategy.CANCEL);

        Negotiation result = switch (strategy) {
            case TOKEN -> view.promptForText("Token:")
                    .map(token -> new Negotiation(NegotiationOutcome.TOKEN_APPLIED, options.withToken(token)))
                    .orElseGet(() -> Negotiation.cancelled(options));
            case COOKIE -> view.promptForText("Cookie:")
                    .map(cookie -> new Negotiation(NegotiationOutcome.COOKIE_APPLIED,
                            CookieAuthentication.apply(options, cookie)))
                    .orElseGet(() -> Negotiation.cancelled(options));
            case CANCEL -> {
                view.hide();
                yield Negotiation.cancelled(options);
            }
        };

        log.info("Credential negotiation for {} ended with {}", options.baseUrl(), result.outcome());
        metrics.recordNegotiation(result.outcome().name().toLowerCase());
        return result;
    }
}
