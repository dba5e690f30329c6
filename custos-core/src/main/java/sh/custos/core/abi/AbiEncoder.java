// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.abi;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import sh.custos.core.error.AbiEncodingException;
import sh.custos.core.types.HexData;
import sh.custos.core.types.Selector;

/**
 * Encodes typed values in the Solidity contract ABI format.
 *
 * <p>
 * Handles static and dynamic types, left/right padding and head/tail offset
 * calculation.
 *
 * <pre>{@code
 * HexData data = AbiEncoder.encodeFunction(
 *         Selector.of("transfer(address,uint256)"),
 *         List.of(new AddressType(recipient), UInt.uint256(amount)));
 * }</pre>
 *
 * @see AbiDecoder
 * @since 0.1.0
 */
public final class AbiEncoder {

    private static final int SLOT_SIZE = 32;

    private AbiEncoder() {
    }

    /**
     * Encodes a list of values as a tuple, i.e. function arguments without a selector.
     *
     * @param args the values to encode
     * @return the encoded bytes
     * @throws AbiEncodingException if a value cannot be encoded
     */
    public static byte[] encode(List<? extends AbiType> args) {
        Objects.requireNonNull(args, "args");
        return encodeTuple(args);
    }

    /**
     * Encodes a function call: the selector followed by the encoded arguments.
     *
     * @param selector the function selector
     * @param args     the arguments
     * @return the calldata
     */
    public static HexData encodeFunction(Selector selector, List<? extends AbiType> args) {
        Objects.requireNonNull(selector, "selector");
        byte[] encodedArgs = encode(args);
        byte[] result = new byte[Selector.BYTE_LENGTH + encodedArgs.length];
        System.arraycopy(selector.toBytes(), 0, result, 0, Selector.BYTE_LENGTH);
        System.arraycopy(encodedArgs, 0, result, Selector.BYTE_LENGTH, encodedArgs.length);
        return HexData.fromBytes(result);
    }

    /**
     * Encodes a function call from its canonical signature.
     *
     * @param signature the function signature (e.g., "transfer(address,uint256)")
     * @param args      the arguments
     * @return the calldata
     */
    public static HexData encodeFunction(String signature, List<? extends AbiType> args) {
        return encodeFunction(Selector.of(signature), args);
    }

    private static byte[] encodeTuple(List<? extends AbiType> components) {
        int headSize = 0;
        for (AbiType component : components) {
            headSize += component.byteSize();
        }

        List<byte[]> heads = new ArrayList<>(components.size());
        List<byte[]> tails = new ArrayList<>();
        int currentTailOffset = headSize;

        for (AbiType component : components) {
            if (component.isDynamic()) {
                heads.add(encodeUInt256(BigInteger.valueOf(currentTailOffset)));
                byte[] tail = encodeType(component);
                tails.add(tail);
                currentTailOffset += tail.length;
            } else {
                heads.add(encodeType(component));
            }
        }

        byte[] result = new byte[currentTailOffset];
        int offset = 0;
        for (byte[] head : heads) {
            System.arraycopy(head, 0, result, offset, head.length);
            offset += head.length;
        }
        for (byte[] tail : tails) {
            System.arraycopy(tail, 0, result, offset, tail.length);
            offset += tail.length;
        }
        return result;
    }

    private static byte[] encodeType(AbiType type) {
        if (type instanceof UInt u) {
            return encodeUInt256(u.value());
        }
        if (type instanceof AddressType a) {
            byte[] result = new byte[SLOT_SIZE];
            System.arraycopy(a.value().toBytes(), 0, result, 12, 20);
            return result;
        }
        if (type instanceof Bool b) {
            byte[] result = new byte[SLOT_SIZE];
            if (b.value()) {
                result[SLOT_SIZE - 1] = 1;
            }
            return result;
        }
        if (type instanceof Bytes b) {
            return encodeBytes(b);
        }
        if (type instanceof Array<?> a) {
            return encodeArray(a);
        }
        if (type instanceof Tuple t) {
            return encodeTuple(t.components());
        }
        throw new AbiEncodingException("Unsupported ABI type: " + type.typeName());
    }

    private static byte[] encodeUInt256(BigInteger value) {
        if (value.signum() < 0) {
            throw new AbiEncodingException("Unsigned value cannot be negative: " + value);
        }
        if (value.bitLength() > 256) {
            throw new AbiEncodingException("Value too large for uint256: " + value);
        }
        byte[] bytes = value.toByteArray();
        // drop the sign byte BigInteger adds when the top bit is set
        int start = bytes.length > SLOT_SIZE ? bytes.length - SLOT_SIZE : 0;
        byte[] result = new byte[SLOT_SIZE];
        System.arraycopy(bytes, start, result, SLOT_SIZE - (bytes.length - start), bytes.length - start);
        return result;
    }

    private static byte[] encodeBytes(Bytes bytes) {
        byte[] data = bytes.value().toBytes();
        byte[] paddedData = padRight(data);
        if (!bytes.isDynamic()) {
            return paddedData;
        }
        byte[] result = new byte[SLOT_SIZE + paddedData.length];
        System.arraycopy(encodeUInt256(BigInteger.valueOf(data.length)), 0, result, 0, SLOT_SIZE);
        System.arraycopy(paddedData, 0, result, SLOT_SIZE, paddedData.length);
        return result;
    }

    private static byte[] encodeArray(Array<?> array) {
        byte[] elements = encodeTuple(array.values());
        if (!array.isDynamicLength()) {
            return elements;
        }
        byte[] result = new byte[SLOT_SIZE + elements.length];
        System.arraycopy(encodeUInt256(BigInteger.valueOf(array.values().size())), 0, result, 0, SLOT_SIZE);
        System.arraycopy(elements, 0, result, SLOT_SIZE, elements.length);
        return result;
    }

    private static byte[] padRight(byte[] data) {
        int padding = (SLOT_SIZE - (data.length % SLOT_SIZE)) % SLOT_SIZE;
        if (padding == 0) {
            return data;
        }
        byte[] result = new byte[data.length + padding];
        System.arraycopy(data, 0, result, 0, data.length);
        return result;
    }
}
