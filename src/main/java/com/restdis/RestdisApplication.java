package com.restdis;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;

/**
 * Quarkus uygulaması için giriş noktasıdır. REST sunucusu Quarkus'un HTTP
 * katmanı üzerinde çalışır; ana thread kapanma sinyali gelene kadar bekletilir.
 */
@QuarkusMain
public class RestdisApplication implements QuarkusApplication
{
    @Override
    public int run(String... args)
    {
        Quarkus.waitForExit();
        return 0;
    }

    public static void main(String... args)
    {
        Quarkus.run(RestdisApplication.class, args);
    }
}
