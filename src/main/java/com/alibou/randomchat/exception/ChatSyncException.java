package com.alibou.randomchat.exception;

/**
 * Базовый тип ошибок слоя синхронизации чатов.
 * Ожидаемое отсутствие (нет чата, нет сообщения, неактивный отправитель)
 * исключением не считается: сервисы возвращают {@code Optional} или {@code boolean}.
 */
public abstract class ChatSyncException extends RuntimeException {

    protected ChatSyncException(String message) {
        super(message);
    }

    protected ChatSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
