package com.restdis.net.redis;

import io.vertx.redis.client.RedisConnection;

import java.util.Objects;

/**
 * Havuza hiç girmeyen, yalnızca tek bir istek için açılmış bağlantıdır.
 * {@code release} bağlantının sahibi olan istemciyi kapatır, böylece soket de
 * kapanır ve bağlantıdaki kimlik ya da veritabanı seçimi başka isteğe geçmez.
 */
record DedicatedConnection(RedisConnection connection, Runnable release)
{
    DedicatedConnection
    {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(release, "release");
    }
}
