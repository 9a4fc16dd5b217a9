package com.restdis.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest
{
    // Bu test bağlantı adresindeki parolanın loglardan gizlendiğini doğrular.
    @Test
    void password_is_redacted_from_url()
    {
        assertEquals("redis://***@db:6379/0", AppConfig.redactPassword("redis://user:secret@db:6379/0"));
        assertEquals("redis://127.0.0.1:6379", AppConfig.redactPassword("redis://127.0.0.1:6379"));
    }
}
