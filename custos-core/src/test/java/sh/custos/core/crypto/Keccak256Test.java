// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.crypto;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import sh.custos.primitives.Hex;

class Keccak256Test {

    @Test
    void hashesEmptyInput() {
        assertEquals("0xc5d2460186f7233c927e7db2dcc703c0e500b653ca82273b7bfad8045d85a470",
                Hex.encode(Keccak256.hash(new byte[0])));
    }

    @Test
    void partsHashAsTheirConcatenation() {
        byte[] a = "hello ".getBytes(StandardCharsets.UTF_8);
        byte[] b = "world".getBytes(StandardCharsets.UTF_8);
        assertArrayEquals(Keccak256.hash("hello world".getBytes(StandardCharsets.UTF_8)), Keccak256.hash(a, b));
    }

    @Test
    void digestIsResetBetweenCalls() {
        byte[] permit = "permit".getBytes(StandardCharsets.UTF_8);
        Keccak256.hash(new byte[] {1, 2, 3});
        assertEquals("0x10ec05aa319b6958a87b81f9887ffc395d1d4a9e3203fefda7f12ae099375a8f",
                Hex.encode(Keccak256.hash(permit)));
        assertArrayEquals(Keccak256.hash(permit), Keccak256.hash(permit));
    }
}
