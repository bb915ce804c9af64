package com.typstparser.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.math.BigInteger;

/**
 * Custom serializer that formats floats like JavaScript does.
 * Integral values are written without a fraction, non-finite values as null.
 */
public class JavaScriptNumberSerializer extends JsonSerializer<Double> {
    @Override
    public void serialize(Double value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value == null || value.isInfinite() || value.isNaN()) {
            gen.writeNull();
        } else if (value == Math.floor(value) && Math.abs(value) <= 9007199254740992.0) {
            // Only convert to long within safe integer range (2^53)
            gen.writeNumber(value.longValue());
        } else if (value == Math.floor(value) && Math.abs(value) < 1e21) {
            // JavaScript prints these as full integer strings
            gen.writeNumber(new BigInteger(String.format("%.0f", value)));
        } else {
            gen.writeNumber(value);
        }
    }
}
