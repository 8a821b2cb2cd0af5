package com.gt.linker.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gt.linker.model.MasteryTier;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class MasteryTierSerializer extends JsonSerializer<MasteryTier> {
    @Override
    public void serialize(MasteryTier masteryTier, JsonGenerator jsonGenerator, SerializerProvider serializerProvider) throws IOException {
        jsonGenerator.writeString(masteryTier.getCode());
    }
}
