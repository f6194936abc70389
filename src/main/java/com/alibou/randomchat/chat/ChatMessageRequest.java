package com.alibou.randomchat.chat;

import java.time.Instant;

/**
 * Payload клиента для операций с сообщениями. {@code id} нужен правке и удалению,
 * {@code time} отправке (если не задано, берётся время сервера).
 */
public record ChatMessageRequest(String chatId, String id, String message, Instant time) {
}
