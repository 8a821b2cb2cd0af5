package com.gt.linker.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.linker.model.Severity;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class SeveritySerializer extends JsonSerializer<Severity> {
    @Override
    public void serialize(Severity severity, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeString(severity.getCode());
    }
}
