package io.scoreline.tx.oracle.signature;

import io.scoreline.tx.core.exception.BusinessRuleException;
import io.scoreline.tx.oracle.model.UpdateSnapshotRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * Ed25519 verification. Signers are identified by their Base64 X.509 encoded
 * public key, signatures are Base64. Ed25519 cannot recover the key from a
 * signature, so the claimed signer of the request is used, falling back to
 * the expected signer.
 */
public class Ed25519SignatureVerifier implements SignatureVerifier {

    private static final Logger log = LoggerFactory.getLogger(Ed25519SignatureVerifier.class);

    public static final String ALGORITHM = "Ed25519";

    @Override
    public String recoverSigner(UpdateSnapshotRequest request, String expectedSigner) {
        String signer = request.hasSigner() ? request.getSigner().trim() : expectedSigner;
        if (signer == null || signer.trim().isEmpty()) {
            throw new BusinessRuleException("signer-unknown",
                "Request carries no signer and no oracle signer is configured");
        }

        PublicKey publicKey = decodePublicKey(signer);
        byte[] signatureBytes = decode(request.getSignature(), "signature");

        boolean valid;
        try {
            Signature verifier = Signature.getInstance(ALGORITHM);
            verifier.initVerify(publicKey);
            verifier.update(SignedMessage.canonicalBytes(request.getTimestamp(), request.getFeeds()));
            valid = verifier.verify(signatureBytes);
        } catch (GeneralSecurityException e) {
            throw new BusinessRuleException("signature-invalid", "Signature could not be verified: " + e.getMessage(), e);
        }

        if (!valid) {
            log.warn("Rejected oracle signature for signer {}", abbreviate(signer));
            throw new BusinessRuleException("signature-invalid", "Invalid signature");
        }
        return signer;
    }

    private static PublicKey decodePublicKey(String signer) {
        byte[] encoded = decode(signer, "signer");
        try {
            return KeyFactory.getInstance(ALGORITHM).generatePublic(new X509EncodedKeySpec(encoded));
        } catch (GeneralSecurityException e) {
            throw new BusinessRuleException("signer-invalid", "Signer is not an Ed25519 public key", e);
        }
    }

    private static byte[] decode(String value, String field) {
        try {
            return Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            throw new BusinessRuleException(field + "-invalid", "Malformed " + field + ": not Base64", e);
        }
    }

    private static String abbreviate(String signer) {
        return signer.length() <= 16 ? signer : signer.substring(signer.length() - 16);
    }
}
