package com.restdis.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.restdis.constants.RestProtocol;

/**
 * Dağıtıcının HTTP katmanına döndürdüğü durum kodu ve JSON gövdesidir. Gövdesi
 * {@code null} olan sonuçlar boş gövdeyle yazılır.
 */
public record DispatchResult(int status, JsonNode body)
{
    public static DispatchResult of(CommandOutcome outcome)
    {
        return new DispatchResult(outcome.status(), outcome.reply().toJson());
    }

    public static DispatchResult error(int status, String message)
    {
        return new DispatchResult(status, JsonNodeFactory.instance.objectNode()
                .put(RestProtocol.FIELD_ERROR, message));
    }

    public static DispatchResult empty(int status)
    {
        return new DispatchResult(status, null);
    }

    public boolean hasBody()
    {
        return body != null;
    }
}
