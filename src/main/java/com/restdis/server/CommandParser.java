package com.restdis.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.restdis.constants.RestProtocol;
import com.restdis.core.Command;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * REST isteğini komuta çeviren saf ayrıştırıcıdır; ağ katmanına bağımlılığı yoktur.
 * Üç biçim desteklenir:
 * <ul>
 *     <li>kök yol: gövde tek bir JSON dizisidir, {@code ["SET", "a", 1]}</li>
 *     <li>{@code /pipeline}: gövde dizilerden oluşan bir dizidir</li>
 *     <li>diğer yollar: komut sırasıyla yol parçalarından, varsa ham gövdeden (tek
 *     argüman olarak) ve sorgu dizesindeki çiftlerden birleştirilir</li>
 * </ul>
 */
public final class CommandParser
{
    private final ObjectMapper mapper;

    public CommandParser(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Sondaki eğik çizgiyi atar; kök yol boş string olarak döner.
     */
    public static String normalizePath(String path)
    {
        if (path == null) {
            return RestProtocol.ROOT_PATH;
        }
        String normalized = path.startsWith("/") ? path : "/" + path;
        if (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    public Command parseSingle(byte[] body)
    {
        JsonNode node = readTree(body, RestProtocol.ERR_PARSE_COMMAND);
        if (node.isNull()) {
            throw new CommandParseException(RestProtocol.ERR_EMPTY_COMMAND);
        }
        if (!node.isArray()) {
            throw new CommandParseException(RestProtocol.ERR_PARSE_COMMAND);
        }
        return toCommand((ArrayNode) node, RestProtocol.ERR_EMPTY_COMMAND);
    }

    /**
     * Boru hattı gövdesini iç dizilere ayırır. Her iç dizi ayrı ayrı
     * {@link #toCommand(ArrayNode, String)} ile çözülür, böylece boş bir iç dizi
     * yalnızca kendi sırasını hatalı yapar.
     */
    public List<ArrayNode> parsePipeline(byte[] body)
    {
        JsonNode node = readTree(body, RestProtocol.ERR_PARSE_PIPELINE);
        if (node.isNull()) {
            throw new CommandParseException(RestProtocol.ERR_EMPTY_PIPELINE);
        }
        if (!node.isArray()) {
            throw new CommandParseException(RestProtocol.ERR_PARSE_PIPELINE);
        }
        List<ArrayNode> commands = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            // null komut boş komut sayılır ve yalnızca kendi sırasında hata verir.
            if (element.isNull()) {
                commands.add(JsonNodeFactory.instance.arrayNode());
                continue;
            }
            if (!element.isArray()) {
                throw new CommandParseException(RestProtocol.ERR_PARSE_PIPELINE);
            }
            commands.add((ArrayNode) element);
        }
        if (commands.isEmpty()) {
            throw new CommandParseException(RestProtocol.ERR_EMPTY_PIPELINE);
        }
        return commands;
    }

    public Command toCommand(ArrayNode array, String emptyMessage)
    {
        if (array.isEmpty()) {
            throw new CommandParseException(emptyMessage);
        }
        String name = textOf(array.get(0));
        List<Object> args = new ArrayList<>(array.size() - 1);
        for (int i = 1; i < array.size(); i++) {
            args.add(toValue(array.get(i)));
        }
        return new Command(name, args);
    }

    /**
     * Yol, gövde ve sorgu dizesinden komut oluşturur. Gövde bölünmeden tek argüman
     * olarak eklenir; {@code k=v} çifti iki, değersiz anahtar tek argüman üretir.
     * Kimlik doğrulama için kullanılan {@code _token} çifti argümanlara eklenmez.
     */
    public static Command parsePath(String path, byte[] body, String rawQuery)
    {
        String normalized = normalizePath(path);
        List<String> segments = new ArrayList<>();
        String[] parts = normalized.split("/", -1);
        for (int i = 1; i < parts.length; i++) {
            segments.add(parts[i]);
        }

        if (body != null && body.length > 0) {
            segments.add(new String(body, StandardCharsets.UTF_8));
        }

        if (rawQuery != null && !rawQuery.isEmpty()) {
            for (String pair : rawQuery.split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                int eq = pair.indexOf('=');
                String key = decode(eq < 0 ? pair : pair.substring(0, eq));
                if (RestProtocol.TOKEN_QUERY_PARAM.equals(key)) {
                    continue;
                }
                segments.add(key);
                if (eq >= 0) {
                    segments.add(decode(pair.substring(eq + 1)));
                }
            }
        }

        if (segments.isEmpty()) {
            throw new CommandParseException(RestProtocol.ERR_EMPTY_COMMAND);
        }
        return new Command(segments.get(0), new ArrayList<>(segments.subList(1, segments.size())));
    }

    /**
     * İstek token'ını bulur: {@code _token} sorgu parametresi varsa o kazanır,
     * yoksa {@code Authorization} başlığından {@code Bearer } öneki atılarak alınır.
     */
    public static String requestToken(String rawQuery, String authorizationHeader)
    {
        if (rawQuery != null && !rawQuery.isEmpty()) {
            for (String pair : rawQuery.split("&")) {
                int eq = pair.indexOf('=');
                if (eq < 0) {
                    continue;
                }
                if (RestProtocol.TOKEN_QUERY_PARAM.equals(decode(pair.substring(0, eq)))) {
                    String token = decode(pair.substring(eq + 1));
                    if (!token.isEmpty()) {
                        return token;
                    }
                }
            }
        }
        if (authorizationHeader == null) {
            return "";
        }
        if (authorizationHeader.startsWith(RestProtocol.BEARER_PREFIX)) {
            return authorizationHeader.substring(RestProtocol.BEARER_PREFIX.length());
        }
        return authorizationHeader;
    }

    private JsonNode readTree(byte[] body, String errorMessage)
    {
        if (body == null || body.length == 0) {
            throw new CommandParseException(errorMessage);
        }
        try {
            JsonNode node = mapper.readTree(body);
            if (node == null || node.isMissingNode()) {
                throw new CommandParseException(errorMessage);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new CommandParseException(errorMessage, e);
        } catch (IOException e) {
            throw new CommandParseException(e.getMessage(), RestProtocol.STATUS_INTERNAL_ERROR, e);
        }
    }

    static String textOf(JsonNode node)
    {
        if (node == null || node.isNull()) {
            return "";
        }
        if (node.isTextual()) {
            return node.asText();
        }
        return node.toString();
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
            return node.canConvertToLong() ? (Object) node.longValue() : node.bigIntegerValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        // İç içe dizi ve nesneler JSON metni olarak iletilir.
        return node.toString();
    }

    /**
     * Yalnızca yüzde kaçışlarını çözer; {@code +} olduğu gibi kalır.
     */
    private static String decode(String value)
    {
        return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
    }
}
