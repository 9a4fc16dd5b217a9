package com.restdis.net;

/**
 * Veri deposunun bir komuta döndürdüğü hatayı ya da bağlantı seviyesindeki bir
 * arızayı temsil eder. Mesaj deponun ham hata metnidir ({@code WRONGTYPE ...},
 * {@code ERR unknown command ...} gibi) ve REST zarfına değiştirilmeden yazılır.
 */
public class BackingStoreException extends RuntimeException
{
    public BackingStoreException(String message)
    {
        super(message);
    }

    public BackingStoreException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
