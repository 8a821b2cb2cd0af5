package com.gt.linker.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.gt.linker.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

// The grading backend sends severity as free text; unknown values are treated as absent.
@Component
public class SeverityDeserializer extends JsonDeserializer<Severity> {

    private static final Logger log = LoggerFactory.getLogger(SeverityDeserializer.class);

    @Override
    public Severity deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException {
        String code = jsonParser.getValueAsString();
        if (code == null || code.isBlank()) {
            return null;
        }

        try {
            return Severity.fromCode(code.trim());
        } catch (IllegalArgumentException ex) {
            log.warn("Ignoring unknown severity {}", code);
            return null;
        }
    }
}
