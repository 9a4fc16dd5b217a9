package com.restdis.net.redis;

import com.restdis.codec.ArgumentEncoder;
import com.restdis.net.BackingConnection;
import com.restdis.net.BackingStoreException;
import io.vertx.redis.client.Command;
import io.vertx.redis.client.RedisConnection;
import io.vertx.redis.client.Request;
import io.vertx.redis.client.Response;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Havuzdan alınmış bir Vert.x {@link RedisConnection} üzerinde komut çalıştırır.
 * Argümanlar düz metne çevrilerek gönderilir, cevaplar ise
 * {@link BackingConnection} sözleşmesindeki Java türlerine dönüştürülür.
 * <p>
 * Bağlantının durumunu değiştiren bir komut ({@code AUTH}, {@code SELECT} gibi)
 * gelirse havuz bağlantısı dokunulmadan havuza bırakılır ve istek kalan
 * komutlarını kendine ait, havuzsuz bir bağlantıda sürdürür. Bu bağlantı istek
 * sonunda soketiyle birlikte kapatılır; kullanıcı kimliği ya da seçili
 * veritabanı havuzdaki bağlantılara hiçbir zaman taşınmaz.
 */
final class VertxRedisConnection implements BackingConnection
{
    private static final Logger LOG = Logger.getLogger(VertxRedisConnection.class);

    private static final Set<String> CONNECTION_STATE_COMMANDS = Set.of(
            "auth", "select", "hello", "reset", "client", "multi", "watch", "readonly", "readwrite");

    private final Supplier<DedicatedConnection> dedicatedConnector;
    private final long timeoutMillis;
    private RedisConnection connection;
    private DedicatedConnection dedicated;
    private boolean closed;

    VertxRedisConnection(RedisConnection pooled, Supplier<DedicatedConnection> dedicatedConnector, long timeoutMillis)
    {
        this.connection = Objects.requireNonNull(pooled, "pooled");
        this.dedicatedConnector = Objects.requireNonNull(dedicatedConnector, "dedicatedConnector");
        this.timeoutMillis = timeoutMillis;
    }

    @Override
    public Object execute(String command, List<Object> args)
    {
        if (closed) {
            throw new IllegalStateException("connection is closed");
        }
        if (dedicated == null && CONNECTION_STATE_COMMANDS.contains(command.toLowerCase(Locale.ROOT))) {
            moveToDedicated(command);
        }
        Request request = Request.cmd(Command.create(command));
        for (Object arg : args) {
            request.arg(ArgumentEncoder.toText(arg));
        }
        return toValue(Futures.await(connection.send(request), timeoutMillis));
    }

    /**
     * Önceki komutlar bağlantı durumunu değiştirmediği için geçişte kaybolan bir
     * durum yoktur.
     */
    private void moveToDedicated(String command)
    {
        DedicatedConnection fresh = dedicatedConnector.get();
        RedisConnection pooled = connection;
        connection = fresh.connection();
        dedicated = fresh;
        LOG.debugf("Moved request to a dedicated connection before %s", command);
        release(pooled);
    }

    static Object toValue(Response response)
    {
        if (response == null) {
            return null;
        }
        switch (response.type()) {
            case SIMPLE:
            case BULK:
                return response.toString();
            case NUMBER:
                Number number = response.toNumber();
                if (number instanceof Double || number instanceof Float) {
                    return number.doubleValue();
                }
                return number.longValue();
            case BOOLEAN:
                return response.toBoolean();
            case ERROR:
                throw new BackingStoreException(response.toString());
            default:
                List<Object> values = new ArrayList<>(response.size());
                for (Response child : response) {
                    values.add(toValue(child));
                }
                return values;
        }
    }

    @Override
    public void close()
    {
        if (closed) {
            return;
        }
        closed = true;
        release(connection);
        if (dedicated != null) {
            try {
                dedicated.release().run();
            } catch (RuntimeException e) {
                LOG.warn("Failed to close dedicated backing connection", e);
            }
        }
    }

    private void release(RedisConnection target)
    {
        try {
            Futures.await(target.close(), timeoutMillis);
        } catch (RuntimeException e) {
            LOG.warn("Failed to release backing connection", e);
        }
    }
}
