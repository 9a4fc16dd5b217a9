package com.restdis.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.restdis.client.RestClient;
import com.restdis.client.RestConnectionFactory;
import com.restdis.client.VertxRestTransport;
import com.restdis.net.BackingConnectionFactory;
import com.restdis.net.redis.VertxRedisConnectionFactory;
import com.restdis.server.RestDispatcher;
import com.restdis.server.TokenStore;
import io.vertx.core.Vertx;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.util.Locale;

/**
 * CDI tarafından yönetilen bu yapılandırma sınıfı REST sunucusunun ihtiyaç
 * duyduğu tekil bean'leri üretir: süreç ömürlü {@link TokenStore}, ayarlardaki
 * adrese göre seçilen depo bağlantı fabrikası ve bunları bir araya getiren
 * {@link RestDispatcher}. Bağlantı fabrikası uygulama kapanırken kapatılır.
 */
@ApplicationScoped
public class AppConfig
{
    private static final Logger LOG = Logger.getLogger(AppConfig.class);

    private final AppProperties properties;

    @Inject
    public AppConfig(AppProperties properties)
    {
        this.properties = properties;
    }

    @Produces
    @Singleton
    public TokenStore tokenStore()
    {
        return new TokenStore();
    }

    @Produces
    @Singleton
    public BackingConnectionFactory backingConnectionFactory(Vertx vertx, ObjectMapper mapper)
    {
        var backend = properties.backend();
        String url = backend.url();
        String scheme = url.toLowerCase(Locale.ROOT);
        if (scheme.startsWith("http://") || scheme.startsWith("https://")) {
            LOG.infof("Using REST backend %s", url);
            RestClient client = RestClient.builder(url)
                    .apiToken(backend.token().orElse(""))
                    .transport(new VertxRestTransport(vertx, backend.timeoutMillis()))
                    .mapper(mapper)
                    .build();
            return new RestConnectionFactory(client);
        }
        LOG.infof("Using Redis backend %s", redactPassword(url));
        return new VertxRedisConnectionFactory(vertx, url, backend.maxPoolSize(), backend.maxPoolWaiting(),
                backend.timeoutMillis());
    }

    void disposeBackingConnectionFactory(@Disposes BackingConnectionFactory factory)
    {
        factory.close();
    }

    @Produces
    @Singleton
    public RestDispatcher restDispatcher(TokenStore tokenStore,
                                         BackingConnectionFactory connectionFactory,
                                         ObjectMapper mapper)
    {
        String apiToken = properties.server().apiToken().orElse("");
        if (apiToken.isEmpty()) {
            LOG.warn("app.server.api-token is not set, every request will be rejected as unauthorized");
        }
        return new RestDispatcher(apiToken, tokenStore, connectionFactory, mapper);
    }

    static String redactPassword(String url)
    {
        int scheme = url.indexOf("://");
        int at = url.lastIndexOf('@');
        if (scheme < 0 || at < scheme) {
            return url;
        }
        return url.substring(0, scheme + 3) + "***" + url.substring(at);
    }
}
