package com.restdis.server;

import java.io.IOException;
import java.util.Objects;

/**
 * HTTP katmanından bağımsız gelen istek görünümüdür. Gövde, kimlik doğrulama ve
 * metot kontrolünden sonra okunur; bu yüzden {@link BodyReader} ile tembel verilir.
 */
public record RestCall(String method, String path, String rawQuery, String authorization, BodyReader body)
{
    public RestCall
    {
        Objects.requireNonNull(method, "method");
        path = path == null ? "/" : path;
        body = body == null ? () -> new byte[0] : body;
    }

    public static RestCall of(String method, String path, String rawQuery, String authorization, byte[] body)
    {
        byte[] bytes = body == null ? new byte[0] : body;
        return new RestCall(method, path, rawQuery, authorization, () -> bytes);
    }

    @FunctionalInterface
    public interface BodyReader
    {
        byte[] read() throws IOException;
    }
}
