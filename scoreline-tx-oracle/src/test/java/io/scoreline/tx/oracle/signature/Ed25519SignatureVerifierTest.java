package io.scoreline.tx.oracle.signature;

import io.scoreline.tx.core.exception.BusinessRuleException;
import io.scoreline.tx.oracle.model.FeedPrice;
import io.scoreline.tx.oracle.model.UpdateSnapshotRequest;
import io.scoreline.tx.oracle.support.OracleKeys;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class Ed25519SignatureVerifierTest {

    private static final long TIMESTAMP = 1_772_366_400L;
    private static final List<FeedPrice> FEEDS = List.of(
        new FeedPrice("BTC/USD", "64250.12", 2),
        new FeedPrice("ETH/USD", "3120.5", 1));

    private final Ed25519SignatureVerifier verifier = new Ed25519SignatureVerifier();
    private final OracleKeys keys = OracleKeys.generate();

    @Test
    void canonicalMessage_isTimestampColonCompactJson() {
        assertEquals("1772366400:[{\"pair\":\"BTC/USD\",\"price\":\"64250.12\",\"decimals\":2},"
                + "{\"pair\":\"ETH/USD\",\"price\":\"3120.5\",\"decimals\":1}]",
            SignedMessage.canonical(TIMESTAMP, FEEDS));
    }

    @Test
    void recoverSigner_validSignature_returnsClaimedSigner() {
        assertEquals(keys.address(), verifier.recoverSigner(keys.request(TIMESTAMP, FEEDS), null));
    }

    @Test
    void recoverSigner_noClaimedSigner_usesExpectedSigner() {
        UpdateSnapshotRequest request = new UpdateSnapshotRequest(TIMESTAMP, FEEDS, keys.sign(TIMESTAMP, FEEDS));

        assertEquals(keys.address(), verifier.recoverSigner(request, keys.address()));
    }

    @Test
    void recoverSigner_noSignerAtAll_rejected() {
        UpdateSnapshotRequest request = new UpdateSnapshotRequest(TIMESTAMP, FEEDS, keys.sign(TIMESTAMP, FEEDS));

        BusinessRuleException error = assertThrows(BusinessRuleException.class,
            () -> verifier.recoverSigner(request, null));

        assertEquals("signer-unknown", error.getRule());
    }

    @Test
    void recoverSigner_differentTimestamp_rejected() {
        UpdateSnapshotRequest request = new UpdateSnapshotRequest(TIMESTAMP + 1, FEEDS,
            keys.sign(TIMESTAMP, FEEDS), keys.address());

        BusinessRuleException error = assertThrows(BusinessRuleException.class,
            () -> verifier.recoverSigner(request, null));

        assertEquals("signature-invalid", error.getRule());
    }

    @Test
    void recoverSigner_signatureFromAnotherKey_rejected() {
        OracleKeys other = OracleKeys.generate();
        UpdateSnapshotRequest request = new UpdateSnapshotRequest(TIMESTAMP, FEEDS,
            other.sign(TIMESTAMP, FEEDS), keys.address());

        assertThrows(BusinessRuleException.class, () -> verifier.recoverSigner(request, null));
    }

    @Test
    void recoverSigner_malformedInputs_rejected() {
        UpdateSnapshotRequest badSignature = new UpdateSnapshotRequest(TIMESTAMP, FEEDS, "%%%", keys.address());
        UpdateSnapshotRequest badSigner = new UpdateSnapshotRequest(TIMESTAMP, FEEDS,
            keys.sign(TIMESTAMP, FEEDS), "bm90LWEta2V5");

        assertEquals("signature-invalid",
            assertThrows(BusinessRuleException.class, () -> verifier.recoverSigner(badSignature, null)).getRule());
        assertEquals("signer-invalid",
            assertThrows(BusinessRuleException.class, () -> verifier.recoverSigner(badSigner, null)).getRule());
    }
}
