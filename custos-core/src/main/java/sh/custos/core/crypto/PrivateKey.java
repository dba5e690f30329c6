// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import sh.custos.core.types.Address;
import sh.custos.primitives.Hex;

/**
 * secp256k1 private key reduced to the account it controls.
 * <p>
 * The scalar is only used to derive the address during construction and is not
 * retained. {@link #toString()} therefore shows nothing but the address.
 *
 * @since 0.1.0
 */
public final class PrivateKey {

    private static final int KEY_LENGTH = 32;

    private final Address address;

    private PrivateKey(final byte[] keyBytes) {
        try {
            if (keyBytes.length != KEY_LENGTH) {
                throw new IllegalArgumentException("private key must be " + KEY_LENGTH + " bytes, got "
                        + keyBytes.length);
            }
            final BigInteger secret = new BigInteger(1, keyBytes);
            if (!Secp256k1.inScalarRange(secret)) {
                throw new IllegalArgumentException("private key outside [1, n)");
            }
            this.address = Secp256k1.addressOf(secret);
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }

    /**
     * @param hex the key, with or without {@code 0x}
     * @throws IllegalArgumentException if the hex or the key is invalid
     */
    public static PrivateKey fromHex(final String hex) {
        Objects.requireNonNull(hex, "hex");
        return new PrivateKey(Hex.decode(hex));
    }

    /**
     * @param keyBytes the 32-byte key; zeroed before this method returns
     * @throws IllegalArgumentException if the key is invalid
     */
    public static PrivateKey fromBytes(final byte[] keyBytes) {
        Objects.requireNonNull(keyBytes, "keyBytes");
        return new PrivateKey(keyBytes);
    }

    public Address toAddress() {
        return address;
    }

    @Override
    public String toString() {
        return "PrivateKey[address=" + address + "]";
    }
}
