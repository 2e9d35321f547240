package org.fastbuild.lsp.evaluator.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The value of a BFF variable. All variants are immutable, so a value can be shared between
 * variables, struct members and recorded evaluations without copying.
 */
public sealed interface Value permits Value.Bool, Value.Int, Value.Str, Value.Array, Value.Struct {

    /**
     * @return The kind of this value.
     */
    ValueType type();

    /**
     * @return A description for error messages, e.g. "an Integer".
     */
    default String describe() {
        return type().withArticle();
    }

    /**
     * Represents a boolean value.
     * @param value The boolean value.
     */
    record Bool(boolean value) implements Value {
        @Override
        public ValueType type() {
            return ValueType.BOOLEAN;
        }
    }

    /**
     * Represents a 32-bit integer value.
     * @param value The integer value.
     */
    record Int(int value) implements Value {
        @Override
        public ValueType type() {
            return ValueType.INTEGER;
        }
    }

    /**
     * Represents a string value.
     * @param value The string value.
     */
    record Str(String value) implements Value {
        @Override
        public ValueType type() {
            return ValueType.STRING;
        }
    }

    /**
     * Represents an array. Arrays only ever hold Strings or Structs, all of the same kind; an empty
     * array has no element type yet.
     * @param items The items in order.
     */
    record Array(List<Value> items) implements Value {

        private static final Array EMPTY = new Array(List.of());

        public Array {
            items = List.copyOf(items);
        }

        public static Array empty() {
            return EMPTY;
        }

        public boolean isEmpty() {
            return items.isEmpty();
        }

        /**
         * @return The type of the first item, or empty for an empty array.
         */
        public Optional<ValueType> elementType() {
            return items.isEmpty() ? Optional.empty() : Optional.of(items.get(0).type());
        }

        /**
         * @return "an Array of Strings", "an Array of Structs" or "an empty Array".
         */
        public String describeWithElements() {
            return elementType().map(t -> "an Array of " + t.plural()).orElse("an empty Array");
        }

        @Override
        public ValueType type() {
            return ValueType.ARRAY;
        }
    }

    /**
     * Represents a struct. Members keep insertion order, but two structs are equal when they have
     * the same member names with equal values, regardless of order and of the owning definitions.
     * @param members The members by name.
     */
    record Struct(Map<String, StructMember> members) implements Value {

        public Struct {
            members = Collections.unmodifiableMap(new LinkedHashMap<>(members));
        }

        public static Struct empty() {
            return new Struct(Map.of());
        }

        @Override
        public ValueType type() {
            return ValueType.STRUCT;
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) {
                return true;
            }
            if (!(other instanceof Struct that) || members.size() != that.members.size()) {
                return false;
            }
            for (Map.Entry<String, StructMember> entry : members.entrySet()) {
                StructMember otherMember = that.members.get(entry.getKey());
                if (otherMember == null || !entry.getValue().value().equals(otherMember.value())) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public int hashCode() {
            int hash = 0;
            for (Map.Entry<String, StructMember> entry : members.entrySet()) {
                hash += Objects.hash(entry.getKey(), entry.getValue().value());
            }
            return hash;
        }
    }
}
