package com.alibou.randomchat.exception;

/** Кэш и хранилище расходятся, например у сохранённого сообщения нет отправителя. */
public class InconsistentStateException extends ChatSyncException {

    public InconsistentStateException(String message) {
        super(message);
    }
}
