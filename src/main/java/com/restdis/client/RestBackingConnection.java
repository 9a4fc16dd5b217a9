package com.restdis.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.restdis.constants.RestProtocol;
import com.restdis.net.BackingConnection;
import com.restdis.net.BackingStoreException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * REST istemcisini sunucunun beklediği {@link BackingConnection} sözleşmesiyle
 * sunar; her komut tek bir REST çağrısına dönüşür. Komut hataları
 * {@link BackingStoreException} olarak ham mesajlarıyla taşınır.
 */
public final class RestBackingConnection implements BackingConnection
{
    private final RestClient client;
    private final RestConnectionFactory factory;
    private String token;

    RestBackingConnection(RestClient client, RestConnectionFactory factory)
    {
        this.client = Objects.requireNonNull(client, "client");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    @Override
    public Object execute(String command, List<Object> args)
    {
        if (RestProtocol.CMD_AUTH.equalsIgnoreCase(command) && (args.size() == 1 || args.size() == 2)) {
            String username = args.size() == 2 ? String.valueOf(args.get(0)) : "default";
            String password = String.valueOf(args.get(args.size() - 1));
            token = factory.tokenFor(username, password);
            return "OK";
        }

        RestRequest request = token == null ? client.newRequest() : client.newRequestWithToken(token);
        Destination<JsonNode> reply = Destination.of(JsonNode.class);
        try {
            request.execOneInto(reply, command, args.toArray());
        } catch (RestClientException e) {
            throw new BackingStoreException(e.getMessage(), e);
        }
        return toValue(reply.value());
    }

    static Object toValue(JsonNode node)
    {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isArray()) {
            List<Object> values = new ArrayList<>(node.size());
            for (JsonNode child : node) {
                values.add(toValue(child));
            }
            return values;
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            fields.put(field.getKey(), toValue(field.getValue()));
        }
        return fields;
    }

    @Override
    public void close()
    {
        token = null;
    }
}
