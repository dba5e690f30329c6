// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.crypto;

import sh.custos.core.types.Address;
import sh.custos.core.types.Hash;
import sh.custos.core.types.HexData;

/**
 * Decides whether a signature over a digest was produced by a given signer.
 * <p>
 * Implementations may recover an externally owned key ({@link EcdsaSignatureVerifier})
 * or ask a contract signer through ERC-1271. Malformed signatures are reported
 * as {@code false}, never as an exception.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SignatureVerifier {

    /**
     * @param signer    the expected signer
     * @param hash      the signed digest, used as is (no message prefix is applied)
     * @param signature the signature bytes
     * @return true if {@code signer} produced {@code signature} over {@code hash}
     */
    boolean isValidSignatureNow(Address signer, Hash hash, HexData signature);
}
