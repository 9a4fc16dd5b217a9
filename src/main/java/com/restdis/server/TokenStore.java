package com.restdis.server;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@code ACL RESTTOKEN} ile verilen token'ları temsil ettikleri kimlik bilgisine
 * eşleyen süreç ömürlü depodur. Kayıtlar hiçbir zaman silinmez ve diske yazılmaz;
 * sunucu yeniden başladığında tüm token'lar geçersiz olur. Okuma ve yazmalar tek
 * bir kilitle sıralanır, kilit yalnızca harita erişimi süresince tutulur.
 */
public final class TokenStore
{
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Credential> tokens = new HashMap<>();

    public void issue(String token, Credential credential)
    {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(credential, "credential");
        if (token.isEmpty()) {
            throw new IllegalArgumentException("token must not be empty");
        }
        lock.lock();
        try {
            tokens.put(token, credential);
        } finally {
            lock.unlock();
        }
    }

    public Optional<Credential> lookup(String token)
    {
        if (token == null || token.isEmpty()) {
            return Optional.empty();
        }
        lock.lock();
        try {
            return Optional.ofNullable(tokens.get(token));
        } finally {
            lock.unlock();
        }
    }

    public int size()
    {
        lock.lock();
        try {
            return tokens.size();
        } finally {
            lock.unlock();
        }
    }
}
