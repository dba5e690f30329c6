// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.crypto;

import java.util.Objects;

import org.bouncycastle.crypto.digests.KeccakDigest;

/**
 * Ethereum's Keccak-256: the pre-standard padding, not NIST SHA3-256.
 *
 * <pre>{@code
 * byte[] selectorHash = Keccak256.hash("transfer(address,uint256)".getBytes(StandardCharsets.UTF_8));
 * byte[] joined = Keccak256.hash(publicX, publicY);
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Keccak256 {

    /** Output size in bytes. */
    public static final int DIGEST_LENGTH = 32;

    // KeccakDigest is stateful; doFinal resets it for the next use on the same thread.
    private static final ThreadLocal<KeccakDigest> DIGEST = ThreadLocal.withInitial(() -> new KeccakDigest(256));

    private Keccak256() {
    }

    /**
     * Hashes the concatenation of {@code parts}.
     *
     * @return the 32-byte digest
     */
    public static byte[] hash(final byte[]... parts) {
        Objects.requireNonNull(parts, "parts");
        final KeccakDigest digest = DIGEST.get();
        for (byte[] part : parts) {
            Objects.requireNonNull(part, "part");
            digest.update(part, 0, part.length);
        }
        final byte[] out = new byte[DIGEST_LENGTH];
        digest.doFinal(out, 0);
        return out;
    }
}
