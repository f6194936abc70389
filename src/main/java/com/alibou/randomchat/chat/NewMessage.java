package com.alibou.randomchat.chat;

import java.time.Instant;

/** Входящее сообщение; {@code type} по умолчанию {@link MessageType#MESSAGE}. */
public record NewMessage(String message, Instant time, String senderId, MessageType type) {

    public NewMessage {
        if (type == null) type = MessageType.MESSAGE;
    }

    public NewMessage(String message, Instant time, String senderId) {
        this(message, time, senderId, MessageType.MESSAGE);
    }
}
