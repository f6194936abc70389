package com.alibou.randomchat.exception;

/** Сбой операции хранилища. */
public class StorageException extends ChatSyncException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
