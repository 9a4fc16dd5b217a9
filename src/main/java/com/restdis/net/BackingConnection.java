package com.restdis.net;

import java.util.List;

/**
 * Komutları gerçek veri deposunda çalıştıran bağlantı sözleşmesidir. Her REST
 * isteği kendi bağlantısını alır ve istek bittiğinde kapatır; bağlantılar
 * istekler arasında paylaşılmaz.
 * <p>
 * Başarılı cevaplar {@code null}, {@link String}, {@link Long}, {@link Double},
 * {@link Boolean} veya bu türlerden oluşan {@link List} ya da {@link java.util.Map}
 * olarak döner. Deponun döndürdüğü hata mesajları {@link BackingStoreException}
 * ile aynen taşınır.
 */
public interface BackingConnection extends AutoCloseable
{
    Object execute(String command, List<Object> args);

    default Object execute(String command, Object... args)
    {
        return execute(command, List.of(args));
    }

    @Override
    void close();
}
