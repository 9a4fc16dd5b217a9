package com.restdis.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.restdis.constants.RestProtocol;
import com.restdis.core.Command;
import com.restdis.net.BackingConnection;
import com.restdis.net.BackingConnectionFactory;
import com.restdis.net.BackingStoreException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * REST isteğini komuta çevirip depo bağlantısında çalıştıran ve sonucu REST
 * zarfına yazan sunucu çekirdeğidir. Her istek sırasıyla şu adımlardan geçer:
 * kimlik doğrulama (401), metot kontrolü (405), gövdenin okunması (500),
 * bağlantının alınması, token kullanıcısı için {@code AUTH}, yola göre
 * ayrıştırma ve yürütme. Bağlantı sonuç ne olursa olsun istek sonunda kapatılır.
 * <p>
 * Sınıf HTTP sunucusundan bağımsızdır; {@link com.restdis.api.CommandResource}
 * yalnızca isteği {@link RestCall} olarak verir ve {@link DispatchResult} yazar.
 */
public final class RestDispatcher
{
    private static final Logger LOG = Logger.getLogger(RestDispatcher.class);

    private final String apiToken;
    private final TokenStore tokenStore;
    private final BackingConnectionFactory connectionFactory;
    private final CommandParser parser;
    private final CommandExecutor executor;
    private final RestTokenIssuer tokenIssuer;

    public RestDispatcher(String apiToken,
                          TokenStore tokenStore,
                          BackingConnectionFactory connectionFactory,
                          ObjectMapper mapper)
    {
        this.apiToken = apiToken == null ? "" : apiToken;
        this.tokenStore = Objects.requireNonNull(tokenStore, "tokenStore");
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        this.parser = new CommandParser(mapper);
        this.executor = new CommandExecutor(mapper);
        this.tokenIssuer = new RestTokenIssuer(tokenStore, executor);
    }

    public DispatchResult dispatch(RestCall call)
    {
        String token = CommandParser.requestToken(call.rawQuery(), call.authorization());
        Optional<Credential> identity = authenticate(token);
        if (identity.isEmpty()) {
            return DispatchResult.error(RestProtocol.STATUS_UNAUTHORIZED, RestProtocol.ERR_UNAUTHORIZED);
        }

        if (!RestProtocol.METHOD_GET.equalsIgnoreCase(call.method())
                && !RestProtocol.METHOD_POST.equalsIgnoreCase(call.method())) {
            return DispatchResult.empty(RestProtocol.STATUS_METHOD_NOT_ALLOWED);
        }

        byte[] body;
        try {
            body = call.body().read();
        } catch (IOException e) {
            LOG.debugf(e, "Failed to read request body for %s", call.path());
            return DispatchResult.error(RestProtocol.STATUS_INTERNAL_ERROR, String.valueOf(e.getMessage()));
        }

        BackingConnection connection;
        try {
            connection = connectionFactory.open();
        } catch (BackingStoreException e) {
            LOG.debugf(e, "Failed to acquire backing connection");
            return DispatchResult.error(RestProtocol.STATUS_INTERNAL_ERROR, e.getMessage());
        }

        try (connection) {
            Credential credential = identity.get();
            if (!credential.isEmpty()) {
                CommandOutcome auth = executor.run(connection,
                        Command.of(RestProtocol.CMD_AUTH, credential.username(), credential.password()));
                if (!auth.isSuccess()) {
                    return DispatchResult.of(auth);
                }
            }
            return route(connection, call, body);
        }
    }

    private DispatchResult route(BackingConnection connection, RestCall call, byte[] body)
    {
        String path = CommandParser.normalizePath(call.path());
        try {
            if (RestProtocol.ROOT_PATH.equals(path)) {
                return DispatchResult.of(execute(connection, parser.parseSingle(body)));
            }
            if (RestProtocol.PIPELINE_PATH.equals(path)) {
                return pipeline(connection, parser.parsePipeline(body));
            }
            return DispatchResult.of(execute(connection, CommandParser.parsePath(call.path(), body, call.rawQuery())));
        } catch (CommandParseException e) {
            return DispatchResult.error(e.status(), e.getMessage());
        }
    }

    /**
     * Komutlar sırayla ve birbirinden bağımsız çalıştırılır; bir komutun hatası
     * sonrakileri durdurmaz. Zarf dizisi her durumda 200 ile döner.
     */
    private DispatchResult pipeline(BackingConnection connection, List<ArrayNode> commands)
    {
        ArrayNode results = JsonNodeFactory.instance.arrayNode();
        for (ArrayNode raw : commands) {
            CommandOutcome outcome;
            try {
                outcome = execute(connection, parser.toCommand(raw, RestProtocol.ERR_EMPTY_PIPELINE_COMMAND));
            } catch (CommandParseException e) {
                outcome = CommandOutcome.failure(e.getMessage());
            }
            results.add(outcome.reply().toJson());
        }
        return new DispatchResult(RestProtocol.STATUS_OK, results);
    }

    CommandOutcome execute(BackingConnection connection, Command command)
    {
        if (RestTokenIssuer.isRestTokenCommand(command)) {
            return tokenIssuer.issue(connection, command);
        }
        return executor.run(connection, command);
    }

    /**
     * Yönetici token'ı boş kimlik, {@link TokenStore} kaydı ise o kullanıcının
     * kimlik bilgisini döndürür. Boş token hiçbir zaman eşleşmez.
     */
    Optional<Credential> authenticate(String token)
    {
        if (token == null || token.isEmpty()) {
            return Optional.empty();
        }
        if (!apiToken.isEmpty() && apiToken.equals(token)) {
            return Optional.of(Credential.NONE);
        }
        return tokenStore.lookup(token);
    }
}
