package com.restdis.client;

import com.fasterxml.jackson.core.type.TypeReference;

import java.lang.reflect.Type;
import java.util.Objects;

/**
 * Bir komut cevabının çözüleceği hedef türü ve çözülen değeri tutar.
 * {@link RestRequest#exec(Destination[])} cevapları sırasıyla bu hedeflere yazar;
 * bir sıradaki {@code null} hedef o cevabın bilinçli olarak atlandığını belirtir.
 * Cevap JSON {@code null} ise hedef atanmış sayılır ve değeri {@code null} olur.
 */
public final class Destination<T>
{
    private final Type type;
    private T value;
    private boolean assigned;

    private Destination(Type type)
    {
        this.type = Objects.requireNonNull(type, "type");
    }

    public static <T> Destination<T> of(Class<T> type)
    {
        return new Destination<>(type);
    }

    public static <T> Destination<T> of(TypeReference<T> type)
    {
        return new Destination<>(type.getType());
    }

    public Type type()
    {
        return type;
    }

    public T value()
    {
        return value;
    }

    public boolean isAssigned()
    {
        return assigned;
    }

    @SuppressWarnings("unchecked")
    void assign(Object decoded)
    {
        this.value = (T) decoded;
        this.assigned = true;
    }
}
