package com.restdis.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Optional;

/**
 * {@code application.properties} içindeki "app" önekli değerleri tip güvenli
 * şekilde okuyan yapılandırma arayüzüdür. Sunucu tarafı yönetici token'ını,
 * arka uç ise komutların çalıştırılacağı depoyu ve bağlantı havuzu ayarlarını
 * tanımlar.
 */
@ConfigMapping(prefix = "app")
public interface AppProperties
{
    Server server();
    Backend backend();

    interface Server {
        /**
         * Tanımlı değilse yalnızca RESTTOKEN token'ları kabul edilir.
         */
        Optional<String> apiToken();
    }

    interface Backend {
        /**
         * {@code redis://}, {@code rediss://} veya {@code unix://} Redis'e;
         * {@code http://} ve {@code https://} başka bir REST uç noktasına gider.
         */
        @WithDefault("redis://127.0.0.1:6379")
        String url();

        Optional<String> token();

        @WithDefault("16")
        int maxPoolSize();

        @WithDefault("64")
        int maxPoolWaiting();

        @WithDefault("10000")
        long timeoutMillis();
    }
}
