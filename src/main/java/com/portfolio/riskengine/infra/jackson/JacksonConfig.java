package com.portfolio.riskengine.infra.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.Module;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

@Configuration
public class JacksonConfig {

    /** Writes NaN and infinities as JSON {@code null}. */
    @Bean
    public Module nonFiniteDoubleModule() {
        SimpleModule module = new SimpleModule("non-finite-doubles");
        module.addSerializer(Double.class, new NonFiniteDoubleSerializer());
        module.addSerializer(double.class, new NonFiniteDoubleSerializer());
        return module;
    }

    static final class NonFiniteDoubleSerializer extends StdSerializer<Double> {

        NonFiniteDoubleSerializer() {
            super(Double.class);
        }

        @Override
        public void serialize(Double value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            if (value == null || !Double.isFinite(value)) {
                gen.writeNull();
            } else {
                gen.writeNumber(value);
            }
        }
    }
}
