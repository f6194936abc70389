package com.alibou.randomchat.user;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Подключённый пользователь: ждёт собеседника или уже в чатах.
 * Один и тот же экземпляр переходит из очереди в активные.
 */
@Getter @Setter
@NoArgsConstructor
public class ChatUser {

    private String id;              // id в хранилище, null до сохранения
    private String email;
    private String loginId;
    private String currentChatId;
    private String attachToken;     // секрет для подключения новых вкладок

    private final List<ChatConnection> connections = new ArrayList<>();
    private final Set<String> connectionIds = new LinkedHashSet<>();
    private final List<String> chatIds = new ArrayList<>();

    public ChatUser(String loginId, String email) {
        this.loginId = loginId;
        this.email   = StringUtils.hasText(email) ? email : null;
        this.attachToken = UUID.randomUUID().toString();
    }

    /** Ключ пользователя во всех индексах. В хранилище не пишется. */
    public String getEmailOrLoginId() {
        return email != null ? email : loginId;
    }

    /** Совпадает ли предъявленный токен; сравнение за постоянное время. */
    public boolean acceptsAttachToken(String token) {
        return attachToken != null && token != null
                && MessageDigest.isEqual(attachToken.getBytes(StandardCharsets.UTF_8),
                                         token.getBytes(StandardCharsets.UTF_8));
    }

    public boolean isPersisted() {
        return id != null;
    }

    /* ---------- соединения ---------- */

    public void addConnection(ChatConnection connection) {
        if (connectionIds.add(connection.getId())) {
            connections.add(connection);
        }
    }

    public boolean removeConnection(String connectionId) {
        if (!connectionIds.remove(connectionId)) return false;
        connections.removeIf(c -> c.getId().equals(connectionId));
        return true;
    }

    public List<ChatConnection> getConnections() {
        return Collections.unmodifiableList(connections);
    }

    public Set<String> getConnectionIds() {
        return Collections.unmodifiableSet(connectionIds);
    }

    /* ---------- чаты ---------- */

    public void addChatId(String chatId) {
        chatIds.add(chatId);
    }

    public boolean removeChatId(String chatId) {
        return chatIds.removeIf(chatId::equals);
    }

    public List<String> getChatIds() {
        return Collections.unmodifiableList(chatIds);
    }

    @Override
    public String toString() {
        return "ChatUser[" + getEmailOrLoginId() + ", id=" + id + ", chats=" + chatIds + "]";
    }
}
