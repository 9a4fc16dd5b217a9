package com.restdis.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.restdis.constants.RestProtocol;
import com.restdis.core.Reply;

/**
 * Tek bir komut yürütmesinin zarfı ve tek başına çağrıldığında kullanılacak HTTP
 * durum kodudur. Boru hattı içinde durum kodu yok sayılır.
 */
public record CommandOutcome(Reply reply, int status)
{
    public static CommandOutcome success(JsonNode value)
    {
        return new CommandOutcome(Reply.success(value), RestProtocol.STATUS_OK);
    }

    public static CommandOutcome failure(String message)
    {
        return new CommandOutcome(Reply.failure(message), RestProtocol.STATUS_BAD_REQUEST);
    }

    public boolean isSuccess()
    {
        return status == RestProtocol.STATUS_OK;
    }
}
