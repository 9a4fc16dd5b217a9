package com.restdis.client;

import java.util.Objects;

/**
 * REST istemcisinin fırlattığı tüm hataların temelidir. {@link Reason} hatanın
 * kaynağını ayırt eder: kullanım hataları (boş komut, kuyrukta komut olmaması,
 * fazla hedef), ağ/HTTP hataları, cevap çözme hataları ve deponun kendi döndürdüğü
 * komut hataları ({@link CommandException}).
 */
public class RestClientException extends RuntimeException
{
    public enum Reason
    {
        EMPTY_COMMAND,
        NO_COMMAND,
        TOO_MANY_DESTINATIONS,
        TRANSPORT,
        DECODE,
        COMMAND
    }

    private final Reason reason;

    public RestClientException(Reason reason, String message)
    {
        this(reason, message, null);
    }

    public RestClientException(Reason reason, String message, Throwable cause)
    {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason()
    {
        return reason;
    }
}
