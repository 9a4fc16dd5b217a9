package com.restdis.client;

import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Vert.x {@link WebClient} ile çalışan HTTP katmanıdır. Çağrılar çağıran thread
 * üzerinde cevap gelene kadar bloklanır; bu yüzden olay döngüsü thread'lerinden
 * kullanılmamalıdır.
 */
public final class VertxRestTransport implements RestTransport, AutoCloseable
{
    private final WebClient webClient;
    private final long timeoutMillis;

    public VertxRestTransport(Vertx vertx, long timeoutMillis)
    {
        Objects.requireNonNull(vertx, "vertx");
        this.timeoutMillis = Math.max(1L, timeoutMillis);
        this.webClient = WebClient.create(vertx, new WebClientOptions()
                .setTcpNoDelay(true)
                .setUserAgent("restdis"));
    }

    @Override
    public TransportResponse post(TransportRequest request)
    {
        HttpRequest<Buffer> httpRequest = webClient.postAbs(request.url().toString())
                .timeout(timeoutMillis);
        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            httpRequest.putHeader(header.getKey(), header.getValue());
        }

        HttpResponse<Buffer> response;
        try {
            response = httpRequest.sendBuffer(Buffer.buffer(request.body()))
                    .toCompletionStage()
                    .toCompletableFuture()
                    .get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RestClientException(RestClientException.Reason.TRANSPORT, "interrupted while calling " + request.url(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new RestClientException(RestClientException.Reason.TRANSPORT, String.valueOf(cause.getMessage()), cause);
        } catch (TimeoutException e) {
            throw new RestClientException(RestClientException.Reason.TRANSPORT, "timed out calling " + request.url(), e);
        }

        Buffer body = response.body();
        return new TransportResponse(response.statusCode(), response.statusMessage(),
                body == null ? new byte[0] : body.getBytes());
    }

    @Override
    public void close()
    {
        webClient.close();
    }
}
