package com.restdis.support;

import io.quarkus.test.Mock;
import jakarta.inject.Singleton;

/**
 * Quarkus testlerinde gerçek Redis yerine kullanılan bellek içi depo bean'idir.
 */
@Mock
@Singleton
public class MockBackingStore extends InMemoryBackingStore
{
    public MockBackingStore()
    {
        requireUserAuth("user", "pwd");
    }
}
