// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.custos.core.abi;

/**
 * Describes the shape of an ABI value to decode.
 *
 * <p>
 * Only the shapes returned by the token, vault and permit contracts the proxy
 * talks to are modelled: unsigned integers, addresses, booleans and byte strings.
 *
 * @since 0.1.0
 */
public sealed interface TypeSchema permits
        TypeSchema.UIntSchema,
        TypeSchema.AddressSchema,
        TypeSchema.BoolSchema,
        TypeSchema.BytesSchema {

    boolean isDynamic();

    String typeName();

    record UIntSchema(int width) implements TypeSchema {
        public UIntSchema {
            if (width % 8 != 0 || width < 8 || width > 256) {
                throw new IllegalArgumentException("Invalid uint width: " + width);
            }
        }

        @Override
        public boolean isDynamic() {
            return false;
        }

        @Override
        public String typeName() {
            return "uint" + width;
        }
    }

    record AddressSchema() implements TypeSchema {
        @Override
        public boolean isDynamic() {
            return false;
        }

        @Override
        public String typeName() {
            return "address";
        }
    }

    record BoolSchema() implements TypeSchema {
        @Override
        public boolean isDynamic() {
            return false;
        }

        @Override
        public String typeName() {
            return "bool";
        }
    }

    /**
     * Byte string schema. A {@code null} size denotes dynamic {@code bytes};
     * otherwise {@code bytesN} with N in [1, 32].
     */
    record BytesSchema(Integer size) implements TypeSchema {
        public BytesSchema {
            if (size != null && (size < 1 || size > 32)) {
                throw new IllegalArgumentException("Invalid bytes size: " + size);
            }
        }

        public static BytesSchema dynamic() {
            return new BytesSchema(null);
        }

        @Override
        public boolean isDynamic() {
            return size == null;
        }

        @Override
        public String typeName() {
            return size == null ? "bytes" : "bytes" + size;
        }
    }
}
