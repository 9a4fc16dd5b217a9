package com.restdis.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.restdis.constants.RestProtocol;

/**
 * Tek bir komutun REST zarfındaki sonucudur: ya {@code {"result": ...}} ya da
 * {@code {"error": "..."}}. Başarılı sonuç ham JSON ağacı olarak tutulur ve ancak
 * çağıran bir hedef tür verdiğinde çözülür. Sunucu zarfı bu kayıttan üretir,
 * istemci aynı kayda geri okur; boru hattı cevabı bu kayıtların sıralı listesidir.
 */
public record Reply(String error, JsonNode result)
{
    public Reply
    {
        error = error == null ? "" : error;
    }

    public static Reply success(JsonNode result)
    {
        return new Reply("", result == null ? NullNode.getInstance() : result);
    }

    public static Reply failure(String message)
    {
        return new Reply(message == null || message.isEmpty() ? "ERR" : message, null);
    }

    public boolean isError()
    {
        return !error.isEmpty();
    }

    public ObjectNode toJson()
    {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        if (isError()) {
            node.put(RestProtocol.FIELD_ERROR, error);
        } else {
            node.set(RestProtocol.FIELD_RESULT, result == null ? NullNode.getInstance() : result);
        }
        return node;
    }

    /**
     * Sunucudan gelen bir zarf nesnesini okur. {@code error} alanı metin değilse
     * yok sayılır; {@code result} alanı hiç yoksa sonuç {@code null} kalır.
     */
    public static Reply fromJson(JsonNode node)
    {
        if (node == null || !node.isObject()) {
            return new Reply("", null);
        }
        JsonNode error = node.get(RestProtocol.FIELD_ERROR);
        String message = error != null && error.isTextual() ? error.asText() : "";
        return new Reply(message, node.get(RestProtocol.FIELD_RESULT));
    }
}
