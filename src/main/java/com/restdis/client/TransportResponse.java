package com.restdis.client;

public record TransportResponse(int status, String statusMessage, byte[] body)
{
    public TransportResponse
    {
        statusMessage = statusMessage == null ? "" : statusMessage;
        body = body == null ? new byte[0] : body;
    }
}
