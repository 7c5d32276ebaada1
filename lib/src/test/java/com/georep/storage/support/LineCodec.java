package com.georep.storage.support;

import com.georep.storage.config.PayloadFormat;
import com.georep.storage.transport.PayloadCodec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Codec for the fake service's body format: one {@code partitionKey|rowKey} line per entity.
 */
public class LineCodec implements PayloadCodec {
    
    @Override
    public byte[] serializeRequestBody(Object operation, PayloadFormat format) {
        return String.valueOf(operation).getBytes(StandardCharsets.UTF_8);
    }
    
    @Override
    public <T> List<T> parseEntities(byte[] body, String contentType, Class<T> entityType,
                                     PayloadFormat format) throws IOException {
        if (entityType != TestEntity.class) {
            throw new IOException("Unsupported entity type " + entityType.getName());
        }
        String text = new String(body, StandardCharsets.UTF_8);
        List<T> entities = new ArrayList<>();
        if (text.isEmpty()) {
            return entities;
        }
        for (String line : text.split("\n")) {
            int separator = line.indexOf('|');
            if (separator < 0) {
                throw new IOException("Malformed entity line: " + line);
            }
            entities.add(entityType.cast(new TestEntity(line.substring(0, separator), line.substring(separator + 1))));
        }
        return entities;
    }
    
    public static byte[] encode(List<TestEntity> entities) {
        StringBuilder sb = new StringBuilder();
        for (TestEntity entity : entities) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(entity.partitionKey()).append('|').append(entity.rowKey());
        }
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }
}
