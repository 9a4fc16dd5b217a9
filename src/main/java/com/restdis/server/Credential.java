package com.restdis.server;

import java.util.Objects;

/**
 * REST token'ının temsil ettiği kullanıcı adı/parola çiftidir. Yönetici token'ı
 * ile gelen istekler {@link #NONE} kimliğini taşır ve depoya ek kimlik doğrulama
 * komutu gönderilmez.
 */
public record Credential(String username, String password)
{
    public static final Credential NONE = new Credential("", "");

    public Credential
    {
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(password, "password");
    }

    public boolean isEmpty()
    {
        return username.isEmpty() && password.isEmpty();
    }

    @Override
    public String toString()
    {
        return "Credential{username='" + username + "'}";
    }
}
