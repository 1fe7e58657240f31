package com.cadenza.jackson;

import com.fasterxml.jackson.core.JsonGenerator;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Writer for field values that are not nodes, tokens or lists.
 * Numbers keep their Java type, except that NaN and infinities become null.
 * Values with no JSON counterpart are written as their string form.
 */
final class ScalarValues {

    private ScalarValues() {
        // Utility class
    }

    static void write(Object value, JsonGenerator gen) throws IOException {
        if (value == null) {
            gen.writeNull();
        } else if (value instanceof Double d) {
            if (d.isInfinite() || d.isNaN()) {
                gen.writeNull();
            } else {
                gen.writeNumber(d);
            }
        } else if (value instanceof Float f) {
            if (f.isInfinite() || f.isNaN()) {
                gen.writeNull();
            } else {
                gen.writeNumber(f);
            }
        } else if (value instanceof Long l) {
            gen.writeNumber(l);
        } else if (value instanceof Integer i) {
            gen.writeNumber(i);
        } else if (value instanceof Short s) {
            gen.writeNumber(s);
        } else if (value instanceof Byte b) {
            gen.writeNumber(b);
        } else if (value instanceof BigInteger bi) {
            gen.writeNumber(bi);
        } else if (value instanceof BigDecimal bd) {
            gen.writeNumber(bd);
        } else if (value instanceof Number n) {
            gen.writeNumber(n.doubleValue());
        } else if (value instanceof Boolean b) {
            gen.writeBoolean(b);
        } else if (value instanceof Enum<?> e) {
            gen.writeString(e.name());
        } else {
            gen.writeString(String.valueOf(value));
        }
    }
}
