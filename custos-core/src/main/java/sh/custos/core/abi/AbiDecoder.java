// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.abi;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import sh.custos.core.error.AbiDecodingException;
import sh.custos.core.types.Address;
import sh.custos.core.types.HexData;

/**
 * Decodes ABI-encoded return data into {@link AbiType} values.
 *
 * @see AbiEncoder
 * @since 0.1.0
 */
public final class AbiDecoder {

    private static final int SLOT_SIZE = 32;
    private static final int ADDRESS_PADDING_BYTES = 12;

    private AbiDecoder() {
    }

    /**
     * Decodes {@code data} as a tuple of the given schemas.
     *
     * @param data    the encoded bytes
     * @param schemas the expected shapes, in order
     * @return one decoded value per schema
     * @throws AbiDecodingException if the data is too short or malformed
     */
    public static List<AbiType> decode(byte[] data, List<TypeSchema> schemas) {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(schemas, "schemas");
        if (data.length < schemas.size() * SLOT_SIZE) {
            throw new AbiDecodingException("Data too short for schema heads. Expected: "
                    + schemas.size() * SLOT_SIZE + ", Available: " + data.length);
        }
        List<AbiType> results = new ArrayList<>(schemas.size());
        int headOffset = 0;
        for (TypeSchema schema : schemas) {
            if (schema.isDynamic()) {
                int tailOffset = toIntExact(readWord(data, headOffset), "dynamic type offset");
                results.add(decodeDynamicBytes(data, tailOffset));
            } else {
                results.add(decodeStatic(data, headOffset, schema));
            }
            headOffset += SLOT_SIZE;
        }
        return results;
    }

    /**
     * Decodes a single static word, e.g. the return value of {@code balanceOf}.
     *
     * @param data   the encoded return data
     * @param schema the expected shape
     * @return the decoded value
     */
    public static AbiType decodeSingle(byte[] data, TypeSchema schema) {
        return decode(data, List.of(schema)).get(0);
    }

    private static AbiType decodeStatic(byte[] data, int offset, TypeSchema schema) {
        if (schema instanceof TypeSchema.UIntSchema s) {
            BigInteger value = readWord(data, offset);
            if (value.bitLength() > s.width()) {
                throw new AbiDecodingException("Value " + value + " exceeds " + s.typeName());
            }
            return new UInt(s.width(), value);
        }
        if (schema instanceof TypeSchema.AddressSchema) {
            for (int i = 0; i < ADDRESS_PADDING_BYTES; i++) {
                if (data[offset + i] != 0) {
                    throw new AbiDecodingException("Dirty upper bytes in address word at offset " + offset);
                }
            }
            byte[] raw = Arrays.copyOfRange(data, offset + ADDRESS_PADDING_BYTES, offset + SLOT_SIZE);
            return new AddressType(Address.fromBytes(raw));
        }
        if (schema instanceof TypeSchema.BoolSchema) {
            BigInteger value = readWord(data, offset);
            if (value.compareTo(BigInteger.ONE) > 0) {
                throw new AbiDecodingException("Invalid bool word: " + value);
            }
            return new Bool(value.signum() == 1);
        }
        if (schema instanceof TypeSchema.BytesSchema s) {
            return Bytes.fixed(Arrays.copyOfRange(data, offset, offset + s.size()));
        }
        throw new AbiDecodingException("Unsupported schema: " + schema.typeName());
    }

    private static AbiType decodeDynamicBytes(byte[] data, int offset) {
        validateOffset(data, offset + SLOT_SIZE - 1, "bytes length");
        int length = toIntExact(readWord(data, offset), "bytes length");
        int dataOffset = offset + SLOT_SIZE;
        if (length > 0) {
            validateOffset(data, dataOffset + length - 1, "bytes data");
        }
        return Bytes.dynamic(HexData.fromBytes(Arrays.copyOfRange(data, dataOffset, dataOffset + length)));
    }

    private static BigInteger readWord(byte[] data, int offset) {
        validateOffset(data, offset + SLOT_SIZE - 1, "word");
        return new BigInteger(1, Arrays.copyOfRange(data, offset, offset + SLOT_SIZE));
    }

    private static int toIntExact(BigInteger value, String what) {
        if (value.bitLength() > 31) {
            throw new AbiDecodingException(what + " too large: " + value);
        }
        return value.intValueExact();
    }

    private static void validateOffset(byte[] data, int offset, String what) {
        if (offset < 0 || offset >= data.length) {
            throw new AbiDecodingException("Offset out of bounds for " + what + ": " + offset
                    + " (length " + data.length + ")");
        }
    }
}
