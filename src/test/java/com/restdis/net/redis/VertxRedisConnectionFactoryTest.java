package com.restdis.net.redis;

import com.restdis.net.BackingStoreException;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VertxRedisConnectionFactoryTest
{
    private Vertx vertx;

    @BeforeEach
    void setUp()
    {
        vertx = Vertx.vertx();
    }

    @AfterEach
    void tearDown()
    {
        vertx.close().toCompletionStage().toCompletableFuture().join();
    }

    @Nested
    class Awaiting
    {
        // Bu test tamamlanmış future değerinin döndüğünü doğrular.
        @Test
        void completed_future_returns_value()
        {
            assertEquals("OK", Futures.await(Future.succeededFuture("OK"), 1000));
        }

        // Bu test başarısız future mesajının depo hatası olarak taşındığını doğrular.
        @Test
        void failed_future_keeps_store_message()
        {
            BackingStoreException e = assertThrows(BackingStoreException.class,
                    () -> Futures.await(Future.failedFuture("WRONGTYPE Operation against a key"), 1000));
            assertEquals("WRONGTYPE Operation against a key", e.getMessage());
        }

        // Bu test tamamlanmayan future'ın zaman aşımına uğradığını doğrular.
        @Test
        void pending_future_times_out()
        {
            Promise<String> never = Promise.promise();
            BackingStoreException e = assertThrows(BackingStoreException.class,
                    () -> Futures.await(never.future(), 50));
            assertTrue(e.getMessage().contains("timed out"));
        }
    }

    @Nested
    class Factory
    {
        // Bu test ulaşılamayan sunucuda bağlantı hatasının depo hatası olduğunu doğrular.
        @Test
        void unreachable_server_fails_with_store_error()
        {
            VertxRedisConnectionFactory factory = new VertxRedisConnectionFactory(vertx, "redis://127.0.0.1:1", 2, 4, 5000);
            try {
                assertThrows(BackingStoreException.class, factory::open);
            } finally {
                factory.close();
            }
        }

        // Bu test kapatılan fabrikanın yeni bağlantı vermediğini doğrular.
        @Test
        void closed_factory_refuses_connections()
        {
            VertxRedisConnectionFactory factory = new VertxRedisConnectionFactory(vertx, "redis://127.0.0.1:1", 2, 4, 5000);
            factory.close();
            factory.close();
            assertThrows(IllegalStateException.class, factory::open);
        }

        // Bu test ayrı bağlantının ulaşılamayan sunucuda depo hatası verdiğini doğrular.
        @Test
        void dedicated_connection_to_unreachable_server_fails_with_store_error()
        {
            VertxRedisConnectionFactory factory = new VertxRedisConnectionFactory(vertx, "redis://127.0.0.1:1", 2, 4, 5000);
            try {
                assertThrows(BackingStoreException.class, factory::openDedicated);
            } finally {
                factory.close();
            }
        }

        // Bu test kapatılan fabrikanın ayrı bağlantı da açmadığını doğrular.
        @Test
        void closed_factory_refuses_dedicated_connections()
        {
            VertxRedisConnectionFactory factory = new VertxRedisConnectionFactory(vertx, "redis://127.0.0.1:1", 2, 4, 5000);
            factory.close();
            assertThrows(IllegalStateException.class, factory::openDedicated);
        }
    }
}
