package com.restdis.client;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

public record TransportRequest(URI url, Map<String, String> headers, byte[] body)
{
    public TransportRequest
    {
        Objects.requireNonNull(url, "url");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        body = body == null ? new byte[0] : body;
    }
}
