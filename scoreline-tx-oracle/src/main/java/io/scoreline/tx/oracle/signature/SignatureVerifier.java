package io.scoreline.tx.oracle.signature;

import io.scoreline.tx.oracle.model.UpdateSnapshotRequest;

/**
 * Checks the signature of an oracle submission.
 */
public interface SignatureVerifier {

    /**
     * Verifies the request signature and returns the identity of the signer.
     *
     * @param request        the signed submission
     * @param expectedSigner signer to verify against when the scheme cannot
     *                       recover it from the signature alone; may be null
     * @return the signer the signature is valid for
     * @throws io.scoreline.tx.core.exception.BusinessRuleException if the
     *         signature does not verify
     */
    String recoverSigner(UpdateSnapshotRequest request, String expectedSigner);
}
