package com.alibou.randomchat.support;

import com.alibou.randomchat.chat.MessageType;
import com.alibou.randomchat.exception.StorageException;
import com.alibou.randomchat.store.ChatStore;
import com.alibou.randomchat.store.StoredChat;
import com.alibou.randomchat.store.StoredMessage;
import com.alibou.randomchat.store.StoredUser;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * {@link ChatStore} kept in maps. {@link #failOn} makes the n-th call of an
 * operation throw a {@link StorageException}.
 */
public class InMemoryChatStore implements ChatStore {

    private record ChatRow(String id, List<String> memberIds, List<String> messageIds, Instant createdAt) {}

    private record MessageRow(String id, String message, String senderId, MessageType type, Instant createdAt) {}

    private final Map<String, StoredUser> users    = new LinkedHashMap<>();
    private final Map<String, ChatRow>    chats    = new LinkedHashMap<>();
    private final Map<String, MessageRow> messages = new LinkedHashMap<>();

    private final Map<String, Integer> calls  = new HashMap<>();
    private final Map<String, Integer> failAt = new HashMap<>();

    private Instant now = Instant.parse("2025-01-01T00:00:00Z");

    /** The {@code nth} call (1-based, counted from now) of {@code operation} fails. */
    public synchronized InMemoryChatStore failOn(String operation, int nth) {
        failAt.put(operation, calls.getOrDefault(operation, 0) + nth);
        return this;
    }

    public synchronized int callsOf(String operation) {
        return calls.getOrDefault(operation, 0);
    }

    public synchronized int userCount() {
        return users.size();
    }

    public synchronized int chatCount() {
        return chats.size();
    }

    public synchronized int messageCount() {
        return messages.size();
    }

    public synchronized boolean hasUser(String id) {
        return users.containsKey(id);
    }

    public synchronized boolean hasMessage(String id) {
        return messages.containsKey(id);
    }

    public synchronized String messageText(String id) {
        return messages.get(id).message();
    }

    /** Simulates a message whose sender record vanished. */
    public synchronized void orphan(String messageId) {
        MessageRow row = messages.get(messageId);
        messages.put(messageId, new MessageRow(row.id(), row.message(), null, row.type(), row.createdAt()));
    }

    /* ===== users ===== */

    @Override
    public synchronized List<StoredUser> findUsers() {
        tick("findUsers");
        return List.copyOf(users.values());
    }

    @Override
    public synchronized List<String> findChatIdsByMember(String userId) {
        tick("findChatIdsByMember");
        return chats.values().stream()
                .filter(c -> c.memberIds().contains(userId))
                .map(ChatRow::id)
                .toList();
    }

    @Override
    public synchronized StoredUser createUser(String email, String loginId, String currentChatId,
                                              String attachToken) {
        tick("createUser");
        StoredUser user = new StoredUser(UUID.randomUUID().toString(), email, loginId, currentChatId, attachToken);
        users.put(user.id(), user);
        return user;
    }

    @Override
    public synchronized void deleteUser(String userId) {
        tick("deleteUser");
        users.remove(userId);
        chats.values().forEach(c -> c.memberIds().remove(userId));
        messages.replaceAll((id, m) -> userId.equals(m.senderId())
                ? new MessageRow(m.id(), m.message(), null, m.type(), m.createdAt())
                : m);
    }

    /* ===== chats ===== */

    @Override
    public synchronized List<StoredChat> findChats() {
        tick("findChats");
        return chats.values().stream()
                .map(c -> new StoredChat(c.id(),
                        c.memberIds().stream().map(users::get).toList(),
                        c.messageIds().stream().map(this::toStored).toList(),
                        c.createdAt()))
                .toList();
    }

    @Override
    public synchronized StoredChat createChat(String chatId, List<String> memberIds) {
        tick("createChat");
        for (String id : memberIds) {
            if (!users.containsKey(id)) throw new StorageException("Unknown chat member " + id);
        }
        ChatRow row = new ChatRow(chatId, new ArrayList<>(memberIds), new ArrayList<>(), now);
        chats.put(chatId, row);
        return new StoredChat(chatId, memberIds.stream().map(users::get).toList(), List.of(), now);
    }

    @Override
    public synchronized void deleteChat(String chatId) {
        tick("deleteChat");
        chats.remove(chatId);
    }

    @Override
    public synchronized void appendMessageRef(String chatId, String messageId) {
        tick("appendMessageRef");
        ChatRow chat = chats.get(chatId);
        if (chat == null) throw new StorageException("Unknown chat " + chatId);
        chat.messageIds().add(messageId);
    }

    /* ===== messages ===== */

    @Override
    public synchronized StoredMessage createMessage(String message, String senderUserId,
                                                    MessageType type, Instant createdAt) {
        tick("createMessage");
        if (!users.containsKey(senderUserId)) throw new StorageException("Unknown sender " + senderUserId);
        MessageRow row = new MessageRow(UUID.randomUUID().toString(), message, senderUserId, type, createdAt);
        messages.put(row.id(), row);
        return toStored(row.id());
    }

    @Override
    public synchronized void updateMessageText(String messageId, String message) {
        tick("updateMessageText");
        MessageRow row = messages.get(messageId);
        if (row == null) throw new StorageException("Unknown message " + messageId);
        messages.put(messageId, new MessageRow(row.id(), message, row.senderId(), row.type(), row.createdAt()));
    }

    @Override
    public synchronized void deleteMessage(String messageId) {
        tick("deleteMessage");
        messages.remove(messageId);
        chats.values().forEach(c -> c.messageIds().remove(messageId));
    }

    @Override
    public synchronized void deleteMessages(Collection<String> messageIds) {
        tick("deleteMessages");
        messageIds.forEach(messages::remove);
        chats.values().forEach(c -> c.messageIds().removeAll(messageIds));
    }

    private StoredMessage toStored(String messageId) {
        MessageRow row = messages.get(messageId);
        StoredUser sender = row.senderId() == null ? null : users.get(row.senderId());
        return new StoredMessage(row.id(), row.message(), sender, row.type(), row.createdAt());
    }

    private void tick(String operation) {
        int n = calls.merge(operation, 1, Integer::sum);
        if (failAt.containsKey(operation) && failAt.get(operation) == n) {
            failAt.remove(operation);
            throw new StorageException("Injected failure of " + operation + " #" + n);
        }
    }
}
