package com.restdis.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.restdis.core.Command;
import com.restdis.net.BackingConnection;
import com.restdis.net.BackingStoreException;
import org.jboss.logging.Logger;

import java.util.Objects;

/**
 * Komutu depo bağlantısında bir kez çalıştırır ve cevabı REST zarfına çevirir.
 * Deponun hatası 400 durumuyla ve ham mesajıyla döner; yeniden deneme yapılmaz.
 */
final class CommandExecutor
{
    private static final Logger LOG = Logger.getLogger(CommandExecutor.class);

    private final ObjectMapper mapper;

    CommandExecutor(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    CommandOutcome run(BackingConnection connection, Command command)
    {
        Object value;
        try {
            value = connection.execute(command.name(), command.args());
        } catch (BackingStoreException e) {
            LOG.debugf("Command %s failed: %s", command.name(), e.getMessage());
            return CommandOutcome.failure(e.getMessage());
        }
        JsonNode node = mapper.valueToTree(value);
        return CommandOutcome.success(node);
    }
}
