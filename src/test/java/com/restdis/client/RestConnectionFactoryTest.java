package com.restdis.client;

import com.restdis.net.BackingConnection;
import com.restdis.net.BackingStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RestConnectionFactoryTest
{
    private RecordingTransport transport;
    private RestConnectionFactory factory;

    @BeforeEach
    void setUp()
    {
        transport = new RecordingTransport();
        factory = new RestConnectionFactory(RestClient.builder("http://upstream:8080").apiToken("admin").transport(transport).build());
    }

    // Bu test cevapların bağlantı sözleşmesindeki Java türlerine çevrildiğini doğrular.
    @Test
    void replies_become_plain_java_values()
    {
        transport.ok("{\"result\":\"v\"}")
                .ok("{\"result\":3}")
                .ok("{\"result\":[\"a\",1,null]}")
                .ok("{\"result\":{\"f\":\"v\"}}")
                .ok("{\"result\":null}");
        try (BackingConnection connection = factory.open()) {
            assertEquals("v", connection.execute("GET", "k"));
            assertEquals(3L, connection.execute("INCR", "n"));
            assertEquals(java.util.Arrays.asList("a", 1L, null), connection.execute("LRANGE", "l", 0, -1));
            assertEquals(Map.of("f", "v"), connection.execute("HGETALL", "h"));
            assertNull(connection.execute("GET", "missing"));
        }
        assertEquals("[\"LRANGE\",\"l\",0,-1]", new String(transport.requests.get(2).body()));
    }

    // Bu test karşı tarafın hata mesajının aynen taşındığını doğrular.
    @Test
    void upstream_error_keeps_message()
    {
        transport.reply(400, "{\"error\":\"WRONGTYPE Operation against a key holding the wrong kind of value\"}");
        try (BackingConnection connection = factory.open()) {
            BackingStoreException e = assertThrows(BackingStoreException.class, () -> connection.execute("INCR", "h"));
            assertEquals("WRONGTYPE Operation against a key holding the wrong kind of value", e.getMessage());
        }
    }

    // Bu test AUTH'un karşı taraftan token alıp sonraki komutlarda kullandığını doğrular.
    @Test
    void auth_switches_to_user_token()
    {
        transport.ok("{\"result\":\"user-token\"}").ok("{\"result\":\"user\"}");
        try (BackingConnection connection = factory.open()) {
            assertEquals("OK", connection.execute("AUTH", "user", "pwd"));
            assertEquals("[\"ACL\",\"RESTTOKEN\",\"user\",\"pwd\"]", new String(transport.requests.get(0).body()));
            assertEquals("Bearer admin", transport.requests.get(0).headers().get("Authorization"));

            connection.execute("ACL", "WHOAMI");
            assertEquals("Bearer user-token", transport.last().headers().get("Authorization"));
        }
    }

    // Bu test aynı kimlik bilgisi için token'ın tekrar istenmediğini doğrular.
    @Test
    void user_tokens_are_cached()
    {
        transport.ok("{\"result\":\"user-token\"}").ok("{\"result\":\"PONG\"}").ok("{\"result\":\"PONG\"}");
        try (BackingConnection first = factory.open()) {
            first.execute("AUTH", "user", "pwd");
            first.execute("PING");
        }
        try (BackingConnection second = factory.open()) {
            second.execute("AUTH", "user", "pwd");
            second.execute("PING");
        }
        assertEquals(3, transport.requests.size());
        assertEquals("Bearer user-token", transport.last().headers().get("Authorization"));
    }

    // Bu test tek argümanlı AUTH'un varsayılan kullanıcıyla yapıldığını doğrular.
    @Test
    void single_argument_auth_uses_default_user()
    {
        transport.ok("{\"result\":\"t\"}");
        try (BackingConnection connection = factory.open()) {
            connection.execute("AUTH", "secret");
        }
        assertEquals("[\"ACL\",\"RESTTOKEN\",\"default\",\"secret\"]", new String(transport.last().body()));
    }

    // Bu test yanlış parolanın depo hatası olarak döndüğünü doğrular.
    @Test
    void wrong_password_is_store_error()
    {
        transport.reply(400, "{\"error\":\"WRONGPASS invalid username-password pair or user is disabled.\"}");
        try (BackingConnection connection = factory.open()) {
            BackingStoreException e = assertThrows(BackingStoreException.class,
                    () -> connection.execute("AUTH", "user", "bad"));
            assertTrue(e.getMessage().startsWith("WRONGPASS"));
        }
    }

    // Bu test kapatılan bağlantının token'ı unuttuğunu doğrular.
    @Test
    void closed_connection_forgets_token()
    {
        transport.ok("{\"result\":\"user-token\"}").ok("{\"result\":\"PONG\"}");
        BackingConnection connection = factory.open();
        connection.execute("AUTH", "user", "pwd");
        connection.close();
        connection.execute("PING");
        assertEquals("Bearer admin", transport.last().headers().get("Authorization"));
    }
}
