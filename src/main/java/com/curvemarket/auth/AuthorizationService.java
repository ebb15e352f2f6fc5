package com.curvemarket.auth;

import com.curvemarket.domain.model.MarketParameters;
import com.curvemarket.exception.ErrorCode;
import com.curvemarket.exception.GuardViolationException;
import com.curvemarket.exception.UnauthorizedException;
import com.curvemarket.state.MarketStateStore;
import java.math.BigInteger;
import java.time.Clock;
import org.springframework.stereotype.Component;

/**
 * Gatekeeper for every signed or authority-only engine call.
 *
 * <p>Signed calls carry a deadline (epoch seconds) and are bound to the initiator's current
 * nonce. A call is accepted only if the deadline has not passed and every required signature
 * recovers to the right account; the initiator's nonce then advances by one, which makes each
 * signature single-use.
 */
@Component
public class AuthorizationService {

    private final SignatureVerifier signatureVerifier;
    private final MarketStateStore store;
    private final Clock clock;

    public AuthorizationService(SignatureVerifier signatureVerifier, MarketStateStore store, Clock clock) {
        this.signatureVerifier = signatureVerifier;
        this.store = store;
        this.clock = clock;
    }

    public Eip712Domain domain() {
        MarketParameters parameters = store.parameters();
        return Eip712Domain.forMarket(parameters.getChainId(), parameters.getMarketAddress());
    }

    public BigInteger nonceOf(String initiator) {
        return store.nonceOf(initiator);
    }

    public String authority() {
        return store.state().getAuthority();
    }

    /** Requires signatures from both the initiator and the market authority. */
    public void authorizeDual(
            String initiator,
            long deadline,
            TypedMessage message,
            String initiatorSignature,
            String authoritySignature) {
        requireNotExpired(deadline);
        requireSignature(message, initiatorSignature, initiator, "initiator");
        requireSignature(message, authoritySignature, authority(), "authority");
        store.incrementNonce(initiator);
    }

    /** Requires only the authority's countersignature on a message naming {@code initiator}. */
    public void authorizeByAuthority(String initiator, long deadline, TypedMessage message, String authoritySignature) {
        requireNotExpired(deadline);
        requireSignature(message, authoritySignature, authority(), "authority");
        store.incrementNonce(initiator);
    }

    public void requireAuthority(String caller) {
        if (caller == null || !caller.equalsIgnoreCase(authority())) {
            throw new UnauthorizedException("Caller " + caller + " is not the market authority");
        }
    }

    private void requireNotExpired(long deadline) {
        long now = clock.instant().getEpochSecond();
        if (now > deadline) {
            throw new GuardViolationException(
                    ErrorCode.SIGNATURE_EXPIRED, "Signature deadline " + deadline + " passed at " + now);
        }
    }

    private void requireSignature(TypedMessage message, String signature, String expectedSigner, String role) {
        if (!signatureVerifier.verify(domain(), message, signature, expectedSigner)) {
            throw new UnauthorizedException(
                    ErrorCode.INVALID_SIGNATURE, "Invalid " + role + " signature on " + message.primaryType());
        }
    }
}
