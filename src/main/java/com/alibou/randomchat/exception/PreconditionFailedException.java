package com.alibou.randomchat.exception;

public class PreconditionFailedException extends ChatSyncException {

    public PreconditionFailedException(String message) {
        super(message);
    }
}
