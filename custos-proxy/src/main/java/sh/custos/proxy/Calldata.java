// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.proxy;

import java.util.Objects;

import sh.custos.core.types.HexData;
import sh.custos.core.types.Selector;
import sh.custos.proxy.error.MalformedCalldataException;

/**
 * A payload split into its function selector and the encoded arguments after it.
 *
 * @param selector  first four bytes of the payload
 * @param remainder everything after the selector, possibly empty
 * @since 0.1.0
 */
public record Calldata(Selector selector, HexData remainder) {

    public Calldata {
        Objects.requireNonNull(selector, "selector");
        Objects.requireNonNull(remainder, "remainder");
    }

    /**
     * @param payload raw calldata
     * @return the split payload
     * @throws MalformedCalldataException if the payload is shorter than a selector
     */
    public static Calldata split(final HexData payload) {
        Objects.requireNonNull(payload, "payload");
        try {
            if (payload.byteLength() < Selector.BYTE_LENGTH) {
                throw new IllegalArgumentException("payload of " + payload.byteLength()
                        + " bytes has no selector");
            }
            return new Calldata(
                    Selector.fromBytes(payload.slice(0, Selector.BYTE_LENGTH).toBytes()),
                    payload.slice(Selector.BYTE_LENGTH, payload.byteLength()));
        } catch (IllegalArgumentException e) {
            throw new MalformedCalldataException("malformed calldata " + payload, e);
        }
    }
}
