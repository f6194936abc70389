package com.alibou.randomchat.store;

import com.alibou.randomchat.chat.MessageType;
import com.alibou.randomchat.exception.StorageException;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Долговременное хранилище пользователей, чатов и сообщений.
 * Любой сбой записи или чтения сообщается как {@link StorageException}.
 */
public interface ChatStore {

    /* ===== пользователи ===== */

    List<StoredUser> findUsers();

    /** id чатов пользователя, от старых к новым. */
    List<String> findChatIdsByMember(String userId);

    StoredUser createUser(String email, String loginId, String currentChatId, String attachToken);

    void deleteUser(String userId);

    /* ===== чаты ===== */

    /** Все чаты вместе с участниками, сообщениями и их отправителями. */
    List<StoredChat> findChats();

    StoredChat createChat(String chatId, List<String> memberIds);

    void deleteChat(String chatId);

    void appendMessageRef(String chatId, String messageId);

    /* ===== сообщения ===== */

    StoredMessage createMessage(String message, String senderUserId, MessageType type, Instant createdAt);

    void updateMessageText(String messageId, String message);

    void deleteMessage(String messageId);

    void deleteMessages(Collection<String> messageIds);
}
