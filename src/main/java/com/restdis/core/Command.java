package com.restdis.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Komut adı ve kodlanmış argümanlarından oluşan değiştirilemez komut kaydıdır.
 * Ad gönderim sırasında olduğu gibi korunur; yönlendirme kararları büyük/küçük
 * harf duyarsız verilir.
 */
public record Command(String name, List<Object> args)
{
    public Command
    {
        Objects.requireNonNull(name, "name");
        args = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));
    }

    public static Command of(String name, Object... args)
    {
        List<Object> list = new ArrayList<>(args.length);
        Collections.addAll(list, args);
        return new Command(name, list);
    }

    public boolean isNamed(String candidate)
    {
        return name.equalsIgnoreCase(candidate);
    }

    /**
     * Ad ve argümanları tek bir sıralı dizi olarak döndürür; REST gövdesindeki
     * {@code ["CMD", arg1, ...]} biçimine karşılık gelir.
     */
    public List<Object> toWireArray()
    {
        List<Object> out = new ArrayList<>(args.size() + 1);
        out.add(name);
        out.addAll(args);
        return out;
    }
}
