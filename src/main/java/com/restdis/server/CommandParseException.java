package com.restdis.server;

import com.restdis.constants.RestProtocol;

/**
 * İstek gövdesi veya yolu komuta çevrilemediğinde fırlatılır. Mesajlar
 * {@link RestProtocol} içindeki sabit öneklerdir ve istemciler tarafından
 * eşleştirildiği için değiştirilmeden döndürülür.
 */
public class CommandParseException extends RuntimeException
{
    private final int status;

    public CommandParseException(String message)
    {
        this(message, RestProtocol.STATUS_BAD_REQUEST, null);
    }

    public CommandParseException(String message, Throwable cause)
    {
        this(message, RestProtocol.STATUS_BAD_REQUEST, cause);
    }

    public CommandParseException(String message, int status, Throwable cause)
    {
        super(message, cause);
        this.status = status;
    }

    public int status()
    {
        return status;
    }
}
