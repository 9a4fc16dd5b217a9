package com.restdis.codec;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

/**
 * Çağıranın verdiği karışık türdeki argümanları REST gövdesine yazılabilecek
 * kanonik biçime dönüştürür. Metinler ve bayt dizileri string olarak, tam sayı ve
 * kayan noktalı sayılar sayı olarak korunur; boolean değerler {@code "1"/"0"},
 * null ise boş string olur. Tanınmayan türler hata üretmeden metne çevrilir.
 * <p>
 * Sunucu tarafı için {@link #toText(Object)} aynı kuralları depo bağlantısının
 * beklediği düz metin argümanına uygular.
 */
public final class ArgumentEncoder
{
    private ArgumentEncoder() {}

    public static Object encode(Object arg)
    {
        return encode(arg, true);
    }

    private static Object encode(Object arg, boolean unwrapArgument)
    {
        if (arg == null) {
            return "";
        }
        if (arg instanceof String s) {
            return s;
        }
        if (arg instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        if (arg instanceof Long || arg instanceof Integer || arg instanceof Short || arg instanceof Byte) {
            return ((Number) arg).longValue();
        }
        if (arg instanceof Double || arg instanceof Float) {
            return ((Number) arg).doubleValue();
        }
        if (arg instanceof Boolean b) {
            return b ? "1" : "0";
        }
        if (arg instanceof Argument argument) {
            if (unwrapArgument) {
                return encode(argument.toArgument(), false);
            }
            return String.valueOf(argument);
        }
        // Kalan sayı türleri ve diğer her şey; uyumluluk için hata üretilmez.
        return String.valueOf(arg);
    }

    public static String toText(Object arg)
    {
        Object encoded = encode(arg);
        if (encoded instanceof String s) {
            return s;
        }
        if (encoded instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) {
                return d.toString();
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        return String.valueOf(encoded);
    }
}
