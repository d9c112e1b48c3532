package com.ganesh.store.index;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ganesh.store.Item;

import java.io.IOException;

/**
 * JSON form of {@link Item} records inside the index engine.
 */
final class ItemCodec {
    private final ObjectMapper objectMapper;

    ItemCodec() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    byte[] encode(Item item) throws IOException {
        return objectMapper.writeValueAsBytes(item);
    }

    Item decode(byte[] record) throws IOException {
        return objectMapper.readValue(record, Item.class);
    }
}
