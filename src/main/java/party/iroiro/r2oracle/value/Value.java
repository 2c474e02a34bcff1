package party.iroiro.r2oracle.value;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonPrimitive;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.List;

/**
 * Dynamically typed value exchanged with the query front end
 *
 * <p>
 * The hierarchy is closed: the only subclasses are the nested ones, so a switch over
 * {@link #getType()} covers every value.
 * </p>
 *
 * <p>
 * {@link #toString()} renders JSON. Binary values become Base64 strings, non-finite
 * floats become the strings {@code "NaN"}, {@code "Infinity"} and {@code "-Infinity"},
 * and extended values inside arrays are rendered as their payload.
 * </p>
 */
public abstract class Value {
    public static final Value NULL = new Null();

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private Value() {
    }

    public enum Type {
        NULL, BOOL, I32, I64, F32, F64, STRING, BINARY, ARRAY, EXT,
    }

    public abstract Type getType();

    abstract JsonElement toJson();

    public boolean isNull() {
        return getType() == Type.NULL;
    }

    @Override
    public String toString() {
        return GSON.toJson(toJson());
    }

    public static Value of(boolean value) {
        return new Bool(value);
    }

    public static Value of(int value) {
        return new I32(value);
    }

    public static Value of(long value) {
        return new I64(value);
    }

    public static Value of(float value) {
        return new F32(value);
    }

    public static Value of(double value) {
        return new F64(value);
    }

    public static Value of(String value) {
        return value == null ? NULL : new Str(value);
    }

    public static Value of(byte[] value) {
        return value == null ? NULL : new Binary(value);
    }

    /**
     * @param values elements, where {@code null} stands for {@link #NULL}
     * @return an immutable array value
     */
    public static Value array(List<Value> values) {
        return new Array(values);
    }

    public static Value array(Value... values) {
        return new Array(Arrays.asList(values));
    }

    public static Value ext(ExtTag tag, Value payload) {
        return new Ext(tag, payload);
    }

    /**
     * Builds an extended value from a front-end tag name
     *
     * @param tag     tag name, e.g. {@code "Decimal"}
     * @param payload the wrapped value
     * @return the extended value
     * @throws party.iroiro.r2oracle.ConversionException if the tag is unknown
     */
    public static Value ext(String tag, Value payload) {
        return new Ext(ExtTag.of(tag), payload);
    }

    @EqualsAndHashCode(callSuper = false)
    public static final class Null extends Value {
        private Null() {
        }

        @Override
        public Type getType() {
            return Type.NULL;
        }

        @Override
        JsonElement toJson() {
            return JsonNull.INSTANCE;
        }
    }

    @EqualsAndHashCode(callSuper = false)
    public static final class Bool extends Value {
        private final boolean value;

        private Bool(boolean value) {
            this.value = value;
        }

        public boolean getValue() {
            return value;
        }

        @Override
        public Type getType() {
            return Type.BOOL;
        }

        @Override
        JsonElement toJson() {
            return new JsonPrimitive(value);
        }
    }

    @EqualsAndHashCode(callSuper = false)
    public static final class I32 extends Value {
        private final int value;

        private I32(int value) {
            this.value = value;
        }

        public int getValue() {
            return value;
        }

        @Override
        public Type getType() {
            return Type.I32;
        }

        @Override
        JsonElement toJson() {
            return new JsonPrimitive(value);
        }
    }

    @EqualsAndHashCode(callSuper = false)
    public static final class I64 extends Value {
        private final long value;

        private I64(long value) {
            this.value = value;
        }

        public long getValue() {
            return value;
        }

        @Override
        public Type getType() {
            return Type.I64;
        }

        @Override
        JsonElement toJson() {
            return new JsonPrimitive(value);
        }
    }

    @EqualsAndHashCode(callSuper = false)
    public static final class F32 extends Value {
        private final float value;

        private F32(float value) {
            this.value = value;
        }

        public float getValue() {
            return value;
        }

        @Override
        public Type getType() {
            return Type.F32;
        }

        @Override
        JsonElement toJson() {
            if (Float.isNaN(value) || Float.isInfinite(value)) {
                return new JsonPrimitive(String.valueOf(value));
            }
            return new JsonPrimitive(value);
        }
    }

    @EqualsAndHashCode(callSuper = false)
    public static final class F64 extends Value {
        private final double value;

        private F64(double value) {
            this.value = value;
        }

        public double getValue() {
            return value;
        }

        @Override
        public Type getType() {
            return Type.F64;
        }

        @Override
        JsonElement toJson() {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return new JsonPrimitive(String.valueOf(value));
            }
            return new JsonPrimitive(value);
        }
    }

    @EqualsAndHashCode(callSuper = false)
    public static final class Str extends Value {
        private final String value;

        private Str(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        @Override
        public Type getType() {
            return Type.STRING;
        }

        @Override
        JsonElement toJson() {
            return new JsonPrimitive(value);
        }
    }

    @EqualsAndHashCode(callSuper = false)
    public static final class Binary extends Value {
        private final byte[] value;

        private Binary(byte[] value) {
            this.value = value;
        }

        /**
         * @return the backing array, not a copy
         */
        public byte[] getValue() {
            return value;
        }

        @Override
        public Type getType() {
            return Type.BINARY;
        }

        @Override
        JsonElement toJson() {
            return new JsonPrimitive(Base64.getEncoder().encodeToString(value));
        }
    }

    @EqualsAndHashCode(callSuper = false)
    public static final class Array extends Value {
        private final List<Value> values;

        private Array(List<Value> values) {
            ArrayList<Value> copy = new ArrayList<>(values.size());
            for (Value value : values) {
                copy.add(value == null ? NULL : value);
            }
            this.values = Collections.unmodifiableList(copy);
        }

        public List<Value> getValues() {
            return values;
        }

        @Override
        public Type getType() {
            return Type.ARRAY;
        }

        @Override
        JsonElement toJson() {
            JsonArray array = new JsonArray(values.size());
            for (Value value : values) {
                array.add(value.toJson());
            }
            return array;
        }
    }

    @EqualsAndHashCode(callSuper = false)
    public static final class Ext extends Value {
        private final ExtTag tag;
        private final Value payload;

        private Ext(ExtTag tag, Value payload) {
            this.tag = tag;
            this.payload = payload == null ? NULL : payload;
        }

        public ExtTag getTag() {
            return tag;
        }

        public Value getPayload() {
            return payload;
        }

        @Override
        public Type getType() {
            return Type.EXT;
        }

        @Override
        JsonElement toJson() {
            return payload.toJson();
        }

        @Override
        public String toString() {
            return tag + "(" + payload + ")";
        }
    }
}
