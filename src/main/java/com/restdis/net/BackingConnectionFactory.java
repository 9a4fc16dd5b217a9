package com.restdis.net;

/**
 * İstek başına yeni bir {@link BackingConnection} sağlar. Havuzlama politikası
 * tamamen implementasyonun sorumluluğundadır.
 */
public interface BackingConnectionFactory extends AutoCloseable
{
    BackingConnection open();

    @Override
    default void close() {}
}
