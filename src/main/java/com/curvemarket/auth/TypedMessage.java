package com.curvemarket.auth;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A typed structured message in EIP-712 form: a primary type plus ordered, typed fields.
 *
 * <p>Supported field types are {@code address}, {@code bool}, {@code uint8}, {@code uint256},
 * {@code address[]} and {@code bool[]}.
 */
public record TypedMessage(String primaryType, List<Field> fields) {

    public record Field(String name, String type, Object value) {}

    public TypedMessage {
        fields = List.copyOf(fields);
    }

    /** Type signature, e.g. {@code ClosePosition(address trader,bool isYes,uint256 nonce,uint256 deadline)}. */
    public String encodeType() {
        return fields.stream()
                .map(field -> field.type() + " " + field.name())
                .collect(Collectors.joining(",", primaryType + "(", ")"));
    }

    public static Builder builder(String primaryType) {
        return new Builder(primaryType);
    }

    public static final class Builder {

        private final String primaryType;
        private final List<Field> fields = new ArrayList<>();

        private Builder(String primaryType) {
            this.primaryType = primaryType;
        }

        public Builder address(String name, String value) {
            fields.add(new Field(name, "address", value));
            return this;
        }

        public Builder bool(String name, boolean value) {
            fields.add(new Field(name, "bool", value));
            return this;
        }

        public Builder uint8(String name, int value) {
            fields.add(new Field(name, "uint8", BigInteger.valueOf(value)));
            return this;
        }

        public Builder uint256(String name, BigInteger value) {
            fields.add(new Field(name, "uint256", value));
            return this;
        }

        public Builder addressArray(String name, List<String> values) {
            fields.add(new Field(name, "address[]", List.copyOf(values)));
            return this;
        }

        public Builder boolArray(String name, List<Boolean> values) {
            fields.add(new Field(name, "bool[]", List.copyOf(values)));
            return this;
        }

        public TypedMessage build() {
            return new TypedMessage(primaryType, fields);
        }
    }
}
