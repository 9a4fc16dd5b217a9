package com.restdis.net.redis;

import com.restdis.net.BackingConnection;
import com.restdis.net.BackingConnectionFactory;
import com.restdis.net.BackingStoreException;
import io.vertx.core.Vertx;
import io.vertx.redis.client.ProtocolVersion;
import io.vertx.redis.client.Redis;
import io.vertx.redis.client.RedisConnection;
import io.vertx.redis.client.RedisOptions;
import org.jboss.logging.Logger;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Vert.x Redis istemcisinin bağlantı havuzunu kullanarak istek başına
 * {@link VertxRedisConnection} üreten fabrikadır. Havuz ilk bağlantı talebinde
 * ısınır; istemci oluşturulurken sunucuya bağlanılmaz. Cevaplar RESP2 biçiminde
 * istenir, böylece {@code HGETALL} gibi komutlar düz dizi döndürür. Bağlantı
 * durumunu değiştiren istekler için havuz dışında ayrı bağlantı açılır.
 */
public final class VertxRedisConnectionFactory implements BackingConnectionFactory
{
    private static final Logger LOG = Logger.getLogger(VertxRedisConnectionFactory.class);

    private final Vertx vertx;
    private final RedisOptions dedicatedOptions;
    private final Redis redis;
    private final long timeoutMillis;
    private final AtomicBoolean closed = new AtomicBoolean();

    public VertxRedisConnectionFactory(Vertx vertx,
                                       String connectionString,
                                       int maxPoolSize,
                                       int maxPoolWaiting,
                                       long timeoutMillis)
    {
        this.vertx = Objects.requireNonNull(vertx, "vertx");
        Objects.requireNonNull(connectionString, "connectionString");
        RedisOptions options = new RedisOptions()
                .setConnectionString(connectionString)
                .setMaxPoolSize(Math.max(1, maxPoolSize))
                .setMaxPoolWaiting(Math.max(0, maxPoolWaiting))
                .setPreferredProtocolVersion(ProtocolVersion.RESP2);
        this.dedicatedOptions = new RedisOptions(options).setMaxPoolSize(1);
        this.redis = Redis.createClient(vertx, options);
        this.timeoutMillis = Math.max(1L, timeoutMillis);
        LOG.infof("Redis backing store configured with pool size %d", options.getMaxPoolSize());
    }

    @Override
    public BackingConnection open()
    {
        if (closed.get()) {
            throw new IllegalStateException("Redis connection factory is closed");
        }
        RedisConnection connection = Futures.await(redis.connect(), timeoutMillis);
        if (connection == null) {
            throw new BackingStoreException("ERR no connection available");
        }
        return new VertxRedisConnection(connection, this::openDedicated, timeoutMillis);
    }

    /**
     * Tek bağlantılık ayrı bir istemci açar. Bağlantı dizesindeki parola ve
     * veritabanı seçimi bu istemcide de uygulanır.
     */
    DedicatedConnection openDedicated()
    {
        if (closed.get()) {
            throw new IllegalStateException("Redis connection factory is closed");
        }
        Redis client = Redis.createClient(vertx, dedicatedOptions);
        try {
            RedisConnection connection = Futures.await(client.connect(), timeoutMillis);
            return new DedicatedConnection(connection, client::close);
        } catch (RuntimeException e) {
            client.close();
            throw e;
        }
    }

    @Override
    public void close()
    {
        if (closed.compareAndSet(false, true)) {
            redis.close();
        }
    }
}
