package com.alibou.randomchat.store;

import com.alibou.randomchat.chat.MessageType;

import java.time.Instant;

/**
 * Сохранённое сообщение в виде, пригодном для клиента.
 * {@code sender} равен null, если записи отправителя больше нет.
 */
public record StoredMessage(String id,
                            String message,
                            StoredUser sender,
                            MessageType type,
                            Instant createdAt) {
}
