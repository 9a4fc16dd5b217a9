package com.restdis.client;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CommandExceptionTest
{
    // Bu test hata türünün mesajın ilk kelimesi olduğunu doğrular.
    @Test
    void kind_is_first_word()
    {
        assertEquals("WRONGTYPE", new CommandException("WRONGTYPE Operation against a key", 0).kind());
        assertEquals("ERR", new CommandException("ERR syntax error", 0).kind());
    }

    // Bu test boşluk içermeyen mesajda türün boş olduğunu doğrular.
    @Test
    void single_word_message_has_empty_kind()
    {
        assertEquals("", new CommandException("Unauthorized", CommandException.NO_INDEX).kind());
        assertEquals("", new CommandException("", 0).kind());
    }

    // Bu test komut hatasının nedeninin COMMAND olduğunu doğrular.
    @Test
    void reason_is_command()
    {
        CommandException e = new CommandException("ERR x", 3);
        assertEquals(RestClientException.Reason.COMMAND, e.reason());
        assertEquals(3, e.pipelineIndex());
        assertEquals("ERR x", e.message());
    }
}
