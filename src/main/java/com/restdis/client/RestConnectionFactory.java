package com.restdis.client;

import com.restdis.constants.RestProtocol;
import com.restdis.net.BackingConnection;
import com.restdis.net.BackingConnectionFactory;
import com.restdis.net.BackingStoreException;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Başka bir REST uç noktasını depo olarak kullanan bağlantı fabrikasıdır. REST
 * durumsuz olduğu için {@code AUTH} karşı tarafta {@code ACL RESTTOKEN} ile token
 * alınarak karşılanır; alınan token'lar kimlik bilgisi başına saklanır ve sonraki
 * bağlantılarda yeniden kullanılır.
 */
public final class RestConnectionFactory implements BackingConnectionFactory
{
    private static final Logger LOG = Logger.getLogger(RestConnectionFactory.class);

    private final RestClient client;
    private final Map<String, String> userTokens = new ConcurrentHashMap<>();

    public RestConnectionFactory(RestClient client)
    {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public BackingConnection open()
    {
        return new RestBackingConnection(client, this);
    }

    @Override
    public void close()
    {
        if (client.transport() instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                LOG.warn("Failed to close REST transport", e);
            }
        }
    }

    String tokenFor(String username, String password)
    {
        String key = username + '\u0000' + password;
        String cached = userTokens.get(key);
        if (cached != null) {
            return cached;
        }
        String token;
        try {
            token = client.newRequest().execOne(String.class, RestProtocol.CMD_ACL, RestProtocol.ACL_RESTTOKEN, username, password);
        } catch (RestClientException e) {
            throw new BackingStoreException(e.getMessage(), e);
        }
        if (token == null || token.isEmpty()) {
            throw new BackingStoreException("ERR upstream returned an empty REST token");
        }
        LOG.debugf("Obtained upstream REST token for user %s", username);
        String previous = userTokens.putIfAbsent(key, token);
        return previous != null ? previous : token;
    }
}
