package com.restdis.server;

import com.restdis.constants.RestProtocol;
import com.restdis.core.Command;
import com.restdis.net.BackingConnection;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Objects;

/**
 * {@code ACL RESTTOKEN <kullanıcı> <parola>} komutunu karşılar. Kimlik bilgisi
 * önce depoda {@code AUTH} ile doğrulanır; başarılı olursa depodan
 * {@code ACL GENPASS} ile rastgele bir sır istenir, {@link TokenStore} içine
 * kaydedilir ve komutun sonucu olarak döndürülür. Sonraki isteklerde bu sır
 * yönetici token'ı gibi kullanılır ve istek o kullanıcı adına çalışır.
 */
public final class RestTokenIssuer
{
    private static final Logger LOG = Logger.getLogger(RestTokenIssuer.class);

    private final TokenStore tokenStore;
    private final CommandExecutor executor;

    RestTokenIssuer(TokenStore tokenStore, CommandExecutor executor)
    {
        this.tokenStore = Objects.requireNonNull(tokenStore, "tokenStore");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    static boolean isRestTokenCommand(Command command)
    {
        if (!command.isNamed(RestProtocol.CMD_ACL) || command.args().isEmpty()) {
            return false;
        }
        Object sub = command.args().get(0);
        return sub != null && RestProtocol.ACL_RESTTOKEN.equalsIgnoreCase(String.valueOf(sub));
    }

    CommandOutcome issue(BackingConnection connection, Command command)
    {
        List<Object> args = command.args();
        if (args.size() != 3) {
            return CommandOutcome.failure(RestProtocol.ERR_RESTTOKEN_SYNTAX);
        }
        Credential credential = new Credential(String.valueOf(args.get(1)), String.valueOf(args.get(2)));

        CommandOutcome auth = executor.run(connection,
                Command.of(RestProtocol.CMD_AUTH, credential.username(), credential.password()));
        if (!auth.isSuccess()) {
            return auth;
        }

        CommandOutcome generated = executor.run(connection, Command.of(RestProtocol.CMD_ACL, RestProtocol.ACL_GENPASS));
        if (!generated.isSuccess()) {
            return generated;
        }
        var secret = generated.reply().result();
        if (secret == null || !secret.isTextual() || secret.asText().isEmpty()) {
            return CommandOutcome.failure(RestProtocol.ERR_GENPASS_REPLY);
        }

        tokenStore.issue(secret.asText(), credential);
        LOG.debugf("Issued REST token for user %s", credential.username());
        return generated;
    }
}
