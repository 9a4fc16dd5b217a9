package com.restdis.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.restdis.codec.ArgumentEncoder;
import com.restdis.constants.RestProtocol;
import com.restdis.core.Command;
import com.restdis.core.Reply;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link RestClient#newRequest()} ile açılan ve komutları kuyrukta biriktiren
 * istektir. Kuyrukta tek komut varsa normal çağrı, birden fazla varsa
 * {@code /pipeline} çağrısı yapılır. Boru hattı atomik değildir: bir komutun
 * hatası diğerlerinin çalışmasını engellemez.
 * <p>
 * Eşzamanlı kullanım için uygun değildir; kuyruk her {@code exec*} çağrısında
 * boşaltılır ve istek sonra yeniden kullanılabilir.
 */
public final class RestRequest
{
    private static final int MAX_ERROR_BODY = 512;

    private final RestClient client;
    private final String token;
    private final List<Command> queue = new ArrayList<>();

    RestRequest(RestClient client, String token)
    {
        this.client = Objects.requireNonNull(client, "client");
        this.token = token;
    }

    /**
     * Komutu kuyruğa ekler; ağ çağrısı yapılmaz. Argümanlar
     * {@link ArgumentEncoder} kurallarıyla kodlanır.
     */
    public RestRequest send(String command, Object... args)
    {
        if (command == null || command.isEmpty()) {
            throw new RestClientException(RestClientException.Reason.EMPTY_COMMAND, "restdis: empty command");
        }
        Object[] values = args == null ? new Object[]{null} : args;
        List<Object> encoded = new ArrayList<>(values.length);
        for (Object arg : values) {
            encoded.add(ArgumentEncoder.encode(arg));
        }
        queue.add(new Command(command, encoded));
        return this;
    }

    public int pending()
    {
        return queue.size();
    }

    /**
     * Kuyruktaki tüm komutları çalıştırır ve cevapları sırasıyla hedeflere çözer.
     * Cevaptan fazla hedef verilirse hiçbir hedefe dokunulmadan hata fırlatılır;
     * eksik hedef verilirse kalan cevaplar atılır. Hatalı cevaplar arasından en
     * küçük sıradaki {@link CommandException} olarak fırlatılır, ancak önce diğer
     * başarılı cevaplar hedeflerine yazılır.
     */
    public void exec(Destination<?>... destinations)
    {
        Destination<?>[] targets = destinations == null ? new Destination<?>[0] : destinations;
        List<Reply> replies = transmit();
        if (targets.length > replies.size()) {
            throw new RestClientException(RestClientException.Reason.TOO_MANY_DESTINATIONS,
                    "restdis: too many destination values");
        }

        CommandException first = null;
        for (int i = 0; i < targets.length; i++) {
            Reply reply = replies.get(i);
            if (reply.isError()) {
                if (first == null) {
                    first = new CommandException(reply.error(), i);
                }
                continue;
            }
            Destination<?> target = targets[i];
            if (target != null && reply.result() != null) {
                decodeInto(target, reply.result());
            }
        }
        if (first != null) {
            throw first;
        }
    }

    /**
     * Verilen komutu kuyruğun sonuna ekleyip hepsini çalıştırır, yalnızca son
     * komutun cevabını döndürür. Önceki komutların hataları yok sayılır; son komut
     * hatalıysa sırası önceki komutlar hiç yokmuş gibi {@code 0} olarak bildirilir.
     */
    public <T> T execOne(Class<T> type, String command, Object... args)
    {
        Destination<T> target = type == null ? null : Destination.of(type);
        execOneInto(target, command, args);
        return target == null ? null : target.value();
    }

    public void execOneInto(Destination<?> target, String command, Object... args)
    {
        send(command, args);
        List<Reply> replies = transmit();
        if (replies.isEmpty()) {
            throw new RestClientException(RestClientException.Reason.DECODE, "restdis: empty reply");
        }
        Reply last = replies.get(replies.size() - 1);
        if (last.isError()) {
            throw new CommandException(last.error(), 0);
        }
        if (target != null && last.result() != null) {
            decodeInto(target, last.result());
        }
    }

    /**
     * Kuyruktaki komutları çalıştırıp tüm cevapları hatalarıyla birlikte döndürür.
     * Yalnızca isteğin kendisi başarısız olursa hata fırlatılır.
     */
    public List<Reply> execRaw()
    {
        return transmit();
    }

    private List<Reply> transmit()
    {
        if (queue.isEmpty()) {
            throw new RestClientException(RestClientException.Reason.NO_COMMAND, "restdis: no command to execute");
        }
        List<Command> batch = new ArrayList<>(queue);
        queue.clear();

        boolean pipeline = batch.size() > 1;
        byte[] body;
        try {
            if (pipeline) {
                List<List<Object>> commands = new ArrayList<>(batch.size());
                for (Command command : batch) {
                    commands.add(command.toWireArray());
                }
                body = client.mapper().writeValueAsBytes(commands);
            } else {
                body = client.mapper().writeValueAsBytes(batch.get(0).toWireArray());
            }
        } catch (JsonProcessingException e) {
            throw new RestClientException(RestClientException.Reason.DECODE, "restdis: failed to encode request", e);
        }

        URI url = pipeline ? client.pipelineUrl() : client.baseUrl();
        TransportResponse response = client.transport().post(new TransportRequest(url, headers(), body));
        if (response.status() != RestProtocol.STATUS_OK) {
            throw statusError(response);
        }
        return readReplies(response.body(), pipeline, batch.size());
    }

    private Map<String, String> headers()
    {
        Map<String, String> headers = new HashMap<>(client.headers());
        headers.putIfAbsent("Content-Type", "application/json");
        boolean explicitAuth = headers.keySet().stream()
                .anyMatch(RestProtocol.AUTHORIZATION_HEADER::equalsIgnoreCase);
        if (!explicitAuth) {
            headers.put(RestProtocol.AUTHORIZATION_HEADER, RestProtocol.BEARER_PREFIX + token);
        }
        return headers;
    }

    private RestClientException statusError(TransportResponse response)
    {
        byte[] raw = response.body();
        byte[] limited = raw.length > MAX_ERROR_BODY ? Arrays.copyOf(raw, MAX_ERROR_BODY) : raw;
        if (limited.length == 0) {
            String status = (response.status() + " " + response.statusMessage()).trim();
            return new RestClientException(RestClientException.Reason.TRANSPORT, "[" + response.status() + "]: " + status);
        }

        String text = "[" + response.status() + "]: " + new String(limited, StandardCharsets.UTF_8);
        Reply reply;
        try {
            reply = Reply.fromJson(client.mapper().readTree(limited));
        } catch (IOException e) {
            return new RestClientException(RestClientException.Reason.TRANSPORT, text, e);
        }
        if (reply.isError()) {
            // Tekil çağrıda da hata komuta değil isteğe aittir.
            return new CommandException(reply.error(), CommandException.NO_INDEX);
        }
        return new RestClientException(RestClientException.Reason.TRANSPORT, text);
    }

    private List<Reply> readReplies(byte[] body, boolean pipeline, int expected)
    {
        JsonNode root;
        try {
            root = client.mapper().readTree(body);
        } catch (IOException e) {
            throw new RestClientException(RestClientException.Reason.DECODE, "restdis: failed to decode reply", e);
        }
        List<Reply> replies = new ArrayList<>();
        if (pipeline) {
            if (root == null || !root.isArray()) {
                throw new RestClientException(RestClientException.Reason.DECODE, "restdis: pipeline reply is not an array");
            }
            if (root.size() != expected) {
                throw new RestClientException(RestClientException.Reason.DECODE,
                        "restdis: pipeline reply has " + root.size() + " entries, expected " + expected);
            }
            for (JsonNode node : root) {
                replies.add(Reply.fromJson(node));
            }
        } else {
            if (root == null || !root.isObject()) {
                throw new RestClientException(RestClientException.Reason.DECODE, "restdis: reply is not an object");
            }
            replies.add(Reply.fromJson(root));
        }
        return replies;
    }

    private void decodeInto(Destination<?> target, JsonNode node)
    {
        try {
            target.assign(client.decoder().decode(node, target.type()));
        } catch (IOException | IllegalArgumentException e) {
            throw new RestClientException(RestClientException.Reason.DECODE,
                    "restdis: cannot decode " + node + " into " + target.type().getTypeName(), e);
        }
    }
}
