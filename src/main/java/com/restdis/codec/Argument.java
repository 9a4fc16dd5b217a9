package com.restdis.codec;

/**
 * Kendi komut argümanı temsilini üretebilen değerler için sözleşmedir. Kodlayıcı
 * bu arayüzü gören her değerde {@link #toArgument()} sonucunu kodlar; dönen değer
 * tekrar bir {@code Argument} ise ikinci kez açılmaz, metne çevrilir.
 */
public interface Argument
{
    /**
     * Tipik olarak {@link String} veya {@code byte[]} döndürülmelidir.
     */
    Object toArgument();
}
