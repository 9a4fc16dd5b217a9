package com.restdis.client;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Gönderilen istekleri kaydeden ve önceden sıraya konmuş cevapları döndüren
 * test taşıyıcısıdır.
 */
final class RecordingTransport implements RestTransport
{
    final List<TransportRequest> requests = new ArrayList<>();
    private final Deque<TransportResponse> responses = new ArrayDeque<>();

    RecordingTransport reply(int status, String body)
    {
        responses.add(new TransportResponse(status, status == 200 ? "OK" : "Bad Request",
                body.getBytes(StandardCharsets.UTF_8)));
        return this;
    }

    RecordingTransport ok(String body)
    {
        return reply(200, body);
    }

    TransportRequest last()
    {
        return requests.get(requests.size() - 1);
    }

    String lastBody()
    {
        return new String(last().body(), StandardCharsets.UTF_8);
    }

    @Override
    public TransportResponse post(TransportRequest request)
    {
        requests.add(request);
        TransportResponse response = responses.poll();
        if (response == null) {
            throw new RestClientException(RestClientException.Reason.TRANSPORT, "no response queued");
        }
        return response;
    }
}
