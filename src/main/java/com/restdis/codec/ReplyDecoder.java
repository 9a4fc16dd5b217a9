package com.restdis.codec;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Ham JSON cevabını çağıranın istediği türe çözer. Depo boolean ve bayt dizisi
 * argümanlarını metin olarak sakladığı için bu iki tür metinden de okunur:
 * {@code "1"/"0"} boolean'a, metnin UTF-8 baytları {@code byte[]}'e çevrilir.
 * Diğer türler Jackson ile çözülür.
 */
public final class ReplyDecoder
{
    private final ObjectMapper mapper;

    public ReplyDecoder(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public Object decode(JsonNode node, Type type) throws IOException
    {
        if (node == null || node.isNull()) {
            return null;
        }
        JavaType javaType = mapper.getTypeFactory().constructType(type);
        Class<?> raw = javaType.getRawClass();
        if (raw == Boolean.class || raw == boolean.class) {
            if (node.isTextual()) {
                String text = node.asText();
                return "1".equals(text) || Boolean.parseBoolean(text);
            }
            if (node.isNumber()) {
                return node.asLong() != 0L;
            }
        }
        if (raw == byte[].class && node.isTextual()) {
            return node.asText().getBytes(StandardCharsets.UTF_8);
        }
        return mapper.readerFor(javaType).readValue(node);
    }
}
