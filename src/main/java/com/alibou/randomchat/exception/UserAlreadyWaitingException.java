package com.alibou.randomchat.exception;

import lombok.Getter;

@Getter
public class UserAlreadyWaitingException extends ChatSyncException {

    private final String emailOrLoginId;

    public UserAlreadyWaitingException(String emailOrLoginId) {
        super("Пользователь \"" + emailOrLoginId + "\" уже подключён");
        this.emailOrLoginId = emailOrLoginId;
    }
}
