// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.math.ec.ECAlgorithms;
import org.bouncycastle.math.ec.ECCurve;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import org.bouncycastle.util.BigIntegers;

import sh.custos.core.types.Address;

/**
 * secp256k1 curve constants, account address derivation and signer recovery.
 *
 * <pre>{@code
 * Address signer = Secp256k1.recoverAddress(digest, Signature.fromBytes(packed));
 * boolean canonical = Secp256k1.isCanonical(signature);
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Secp256k1 {

    private static final X9ECParameters PARAMS = CustomNamedCurves.getByName("secp256k1");
    private static final ECCurve CURVE = PARAMS.getCurve();
    private static final ECPoint G = PARAMS.getG();

    /** Order {@code n} of the base point. */
    public static final BigInteger CURVE_ORDER = PARAMS.getN();

    /** {@code n / 2}: the largest {@code s} a canonical (EIP-2) signature may carry. */
    public static final BigInteger HALF_CURVE_ORDER = CURVE_ORDER.shiftRight(1);

    private static final int DIGEST_LENGTH = 32;

    private Secp256k1() {
    }

    /**
     * @return true if {@code s} lies in the lower half of the curve order
     */
    public static boolean isCanonical(final Signature signature) {
        Objects.requireNonNull(signature, "signature");
        final BigInteger s = new BigInteger(1, signature.s());
        return s.signum() > 0 && s.compareTo(HALF_CURVE_ORDER) <= 0;
    }

    /**
     * Recovers the address whose key produced {@code signature} over {@code digest}.
     * <p>
     * Recovery alone does not reject the high-s twin of a signature; callers that
     * need a unique encoding check {@link #isCanonical(Signature)} as well.
     *
     * @param digest    the 32-byte signed digest
     * @param signature the signature
     * @return the recovered address
     * @throws IllegalArgumentException if the digest length is wrong or no key can be recovered
     */
    public static Address recoverAddress(final byte[] digest, final Signature signature) {
        Objects.requireNonNull(digest, "digest");
        Objects.requireNonNull(signature, "signature");
        if (digest.length != DIGEST_LENGTH) {
            throw new IllegalArgumentException("digest must be 32 bytes, got " + digest.length);
        }
        final BigInteger r = new BigInteger(1, signature.r());
        final BigInteger s = new BigInteger(1, signature.s());
        if (!inScalarRange(r) || !inScalarRange(s)) {
            throw new IllegalArgumentException("signature scalar outside [1, n)");
        }

        final ECPoint nonce;
        try {
            nonce = CURVE.decodePoint(compressed(r, signature.recoveryId()));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("r is not the x coordinate of a curve point", e);
        }

        // Q = r^-1 * (s*R - e*G)
        final BigInteger rInverse = r.modInverse(CURVE_ORDER);
        final BigInteger e = new BigInteger(1, digest);
        final ECPoint publicKey = ECAlgorithms.sumOfTwoMultiplies(
                nonce, s.multiply(rInverse).mod(CURVE_ORDER),
                G, e.negate().multiply(rInverse).mod(CURVE_ORDER)).normalize();
        if (publicKey.isInfinity()) {
            throw new IllegalArgumentException("signature recovers to the point at infinity");
        }
        return addressOf(publicKey);
    }

    static Address addressOf(final BigInteger secret) {
        return addressOf(new FixedPointCombMultiplier().multiply(G, secret).normalize());
    }

    static boolean inScalarRange(final BigInteger value) {
        return value.signum() > 0 && value.compareTo(CURVE_ORDER) < 0;
    }

    private static Address addressOf(final ECPoint publicKey) {
        final byte[] uncompressed = publicKey.getEncoded(false);
        final byte[] digest = Keccak256.hash(Arrays.copyOfRange(uncompressed, 1, uncompressed.length));
        return Address.fromBytes(Arrays.copyOfRange(digest, 12, DIGEST_LENGTH));
    }

    private static byte[] compressed(final BigInteger x, final int parity) {
        final byte[] encoded = new byte[33];
        encoded[0] = (byte) (parity == 1 ? 0x03 : 0x02);
        System.arraycopy(BigIntegers.asUnsignedByteArray(32, x), 0, encoded, 1, 32);
        return encoded;
    }
}
