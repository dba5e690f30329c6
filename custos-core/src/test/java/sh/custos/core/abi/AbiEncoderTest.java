// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.abi;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;
import java.util.List;

import org.junit.jupiter.api.Test;

import sh.custos.core.types.Address;
import sh.custos.core.types.HexData;
import sh.custos.primitives.Hex;

class AbiEncoderTest {

    private static final Address RECIPIENT = new Address("0x1111111111111111111111111111111111111111");

    private static String word(long value) {
        return String.format("%064x", value);
    }

    @Test
    void encodesTransferCall() {
        HexData data = AbiEncoder.encodeFunction("transfer(address,uint256)",
                List.of(new AddressType(RECIPIENT), UInt.uint256(BigInteger.valueOf(1000))));

        assertEquals("0xa9059cbb"
                + "0000000000000000000000001111111111111111111111111111111111111111"
                + word(1000), data.value());
    }

    @Test
    void encodesMaxUint256() {
        BigInteger max = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);
        byte[] encoded = AbiEncoder.encode(List.of(UInt.uint256(max)));
        assertEquals("0x" + "f".repeat(64), Hex.encode(encoded));
    }

    @Test
    void encodesBool() {
        byte[] encoded = AbiEncoder.encode(List.of(new Bool(true), new Bool(false)));
        assertEquals("0x" + word(1) + word(0), Hex.encode(encoded));
    }

    @Test
    void encodesDynamicBytesWithPadding() {
        byte[] encoded = AbiEncoder.encode(List.of(Bytes.dynamic(new HexData("0x1234"))));
        assertEquals("0x" + word(0x20) + word(2) + "1234" + "0".repeat(60), Hex.encode(encoded));
    }

    @Test
    void encodesStaticBytes32InPlace() {
        byte[] raw = new byte[32];
        raw[0] = (byte) 0xab;
        byte[] encoded = AbiEncoder.encode(List.of(Bytes.fixed(raw), new Bool(true)));
        assertEquals("0xab" + "0".repeat(62) + word(1), Hex.encode(encoded));
    }

    @Test
    void encodesArrayOfDynamicBytes() {
        Array<Bytes> calls = Array.dynamic(List.of(Bytes.dynamic(new HexData("0xaabb"))), "bytes");
        HexData data = AbiEncoder.encodeFunction("multicall(bytes[])", List.of(calls));

        assertEquals("0xac9650d8"
                + word(0x20)   // offset of the array
                + word(1)      // array length
                + word(0x20)   // offset of element 0, relative to the element area
                + word(2)      // element length
                + "aabb" + "0".repeat(60), data.value());
    }

    @Test
    void mixesStaticAndDynamicArguments() {
        Array<Bytes> proof = Array.dynamic(List.of(), "bytes32");
        byte[] encoded = AbiEncoder.encode(List.of(UInt.uint256(BigInteger.TEN), proof, new Bool(true)));
        assertEquals("0x" + word(10) + word(0x60) + word(1) + word(0), Hex.encode(encoded));
    }

    @Test
    void rejectsNullArguments() {
        assertThrows(NullPointerException.class, () -> AbiEncoder.encode(null));
    }
}
