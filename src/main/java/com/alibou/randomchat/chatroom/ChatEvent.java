package com.alibou.randomchat.chatroom;

import com.alibou.randomchat.cache.CachedChat;
import com.alibou.randomchat.cache.CachedMessage;

import java.util.List;
import java.util.Map;

/** Всё, что рассылается в топик чата. */
public record ChatEvent(String event, String chatId, Object payload) {

    public static final String TOPIC_PREFIX = "/topic/chat.";

    public static String topic(String chatId) {
        return TOPIC_PREFIX + chatId;
    }

    public static ChatEvent started(CachedChat chat) {
        return new ChatEvent("chat.started", chat.getId(), chat.getUserIds());
    }

    public static ChatEvent closed(String chatId, List<String> inactiveUserIds) {
        return new ChatEvent("chat.closed", chatId, Map.of("inactiveUserIds", inactiveUserIds));
    }

    public static ChatEvent messageCreated(String chatId, CachedMessage message) {
        return new ChatEvent("message.created", chatId, message);
    }

    public static ChatEvent messageEdited(String chatId, String messageId, String text) {
        return new ChatEvent("message.edited", chatId, Map.of("id", messageId, "message", text));
    }

    public static ChatEvent messageDeleted(String chatId, String messageId) {
        return new ChatEvent("message.deleted", chatId, Map.of("id", messageId));
    }
}
