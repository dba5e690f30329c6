// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.crypto;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.custos.core.types.Address;
import sh.custos.core.types.Hash;
import sh.custos.core.types.HexData;

/**
 * {@link SignatureVerifier} for externally owned accounts.
 * <p>
 * Accepts only the packed 65-byte {@code r || s || v} form with {@code v} in
 * {27, 28} and a low {@code s} (EIP-2), so every signature has exactly one
 * accepted encoding. The signer is recovered with
 * {@link Secp256k1#recoverAddress(byte[], Signature)} and compared with the
 * expected address. The zero address never validates.
 *
 * @since 0.1.0
 */
public final class EcdsaSignatureVerifier implements SignatureVerifier {

    private static final Logger log = LoggerFactory.getLogger(EcdsaSignatureVerifier.class);

    private static final int V_OFFSET = 27;

    @Override
    public boolean isValidSignatureNow(final Address signer, final Hash hash, final HexData signature) {
        Objects.requireNonNull(signer, "signer");
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(signature, "signature");
        if (signer.isZero() || signature.byteLength() != Signature.PACKED_LENGTH) {
            return false;
        }
        final byte[] packed = signature.toBytes();
        final int v = packed[Signature.PACKED_LENGTH - 1] & 0xFF;
        if (v != V_OFFSET && v != V_OFFSET + 1) {
            log.debug("signature rejected for {}: v={} is not 27 or 28", signer, v);
            return false;
        }
        try {
            final Signature parsed = Signature.fromBytes(packed);
            if (!Secp256k1.isCanonical(parsed)) {
                log.debug("signature rejected for {}: s is in the upper half of the curve order", signer);
                return false;
            }
            return Secp256k1.recoverAddress(hash.toBytes(), parsed).equals(signer);
        } catch (IllegalArgumentException e) {
            log.debug("signature rejected for {}: {}", signer, e.getMessage());
            return false;
        }
    }
}
