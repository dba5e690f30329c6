// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.types;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class AddressTest {

    @Test
    void normalizesToLowercase() {
        Address address = new Address("0xAbCdEfabcdefABCDEFabcdefabcdefABCDEFabcd");
        assertEquals("0xabcdefabcdefabcdefabcdefabcdefabcdefabcd", address.value());
        assertEquals(new Address("0xabcdefabcdefabcdefabcdefabcdefabcdefabcd"), address);
    }

    @Test
    void rejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> new Address("0x1234"));
        assertThrows(IllegalArgumentException.class, () -> new Address("abcdefabcdefabcdefabcdefabcdefabcdefabcd"));
        assertThrows(IllegalArgumentException.class, () -> new Address("0xzzcdefabcdefabcdefabcdefabcdefabcdefabcd"));
        assertThrows(NullPointerException.class, () -> new Address(null));
    }

    @Test
    void zeroAddress() {
        assertTrue(Address.ZERO.isZero());
        assertFalse(new Address("0x0000000000000000000000000000000000000001").isZero());
    }

    @Test
    void bytesConversion() {
        byte[] raw = new byte[20];
        raw[19] = 0x2a;
        Address address = Address.fromBytes(raw);
        assertEquals("0x000000000000000000000000000000000000002a", address.value());
        assertArrayEquals(raw, address.toBytes());
        assertThrows(IllegalArgumentException.class, () -> Address.fromBytes(new byte[19]));
    }

    @Test
    void serializesAsPlainString() throws Exception {
        Address address = new Address("0x000000000000000000000000000000000000002a");
        assertEquals("\"0x000000000000000000000000000000000000002a\"",
                new ObjectMapper().writeValueAsString(address));
    }
}
