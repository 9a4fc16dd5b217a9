package com.restdis.client;

/**
 * Deponun bir komut için döndürdüğü hatadır. {@link #kind()} mesajın ilk
 * kelimesidir ({@code ERR}, {@code WRONGTYPE}, {@code WRONGPASS} gibi; mesaj tek
 * kelimeyse boştur). {@link #pipelineIndex()} hatanın gönderilen toplu istek
 * içindeki sırasıdır; belirli bir komuta ait değilse {@code -1} olur.
 */
public class CommandException extends RestClientException
{
    public static final int NO_INDEX = -1;

    private final String kind;
    private final int pipelineIndex;

    public CommandException(String message, int pipelineIndex)
    {
        super(Reason.COMMAND, message);
        this.kind = kindOf(message);
        this.pipelineIndex = pipelineIndex;
    }

    static String kindOf(String message)
    {
        if (message == null) {
            return "";
        }
        int space = message.indexOf(' ');
        return space < 0 ? "" : message.substring(0, space);
    }

    public String message()
    {
        return getMessage();
    }

    public String kind()
    {
        return kind;
    }

    public int pipelineIndex()
    {
        return pipelineIndex;
    }
}
