package com.alibou.randomchat.store;

import com.alibou.randomchat.chat.MessageType;
import com.alibou.randomchat.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.function.Supplier;

/**
 * {@link ChatStore} на Spring Data JPA.
 *
 * <p>Каждый вызов идёт в своей транзакции (или во внешней). Сбой коммита
 * происходит внутри {@link #tx}, поэтому тоже переводится в StorageException.
 */
@Slf4j
@Component
public class JpaChatStore implements ChatStore {

    private final ActiveUserRepository users;
    private final ChatRepository       chats;
    private final MessageRepository    messages;
    private final TransactionTemplate  transactions;
    private final TransactionTemplate  readOnly;
    private final Clock                clock;

    public JpaChatStore(ActiveUserRepository users,
                        ChatRepository chats,
                        MessageRepository messages,
                        PlatformTransactionManager transactionManager,
                        Clock clock) {
        this.users        = users;
        this.chats        = chats;
        this.messages     = messages;
        this.transactions = new TransactionTemplate(transactionManager);
        this.readOnly     = new TransactionTemplate(transactionManager);
        this.readOnly.setReadOnly(true);
        this.clock        = clock;
    }

    /* ===== пользователи ===== */

    @Override
    public List<StoredUser> findUsers() {
        return tx(readOnly, "find users",
                () -> users.findAll().stream().map(ActiveUserEntity::toStored).toList());
    }

    @Override
    public List<String> findChatIdsByMember(String userId) {
        return tx(readOnly, "find chats of user " + userId,
                () -> chats.findAllByUsersIdOrderByCreatedAtAsc(userId).stream()
                        .map(ChatEntity::getId)
                        .toList());
    }

    @Override
    public StoredUser createUser(String email, String loginId, String currentChatId, String attachToken) {
        return tx(transactions, "создание пользователя " + loginId, () -> users.saveAndFlush(
                ActiveUserEntity.builder()
                        .email(email)
                        .loginId(loginId)
                        .currentChatId(currentChatId)
                        .attachToken(attachToken)
                        .build()).toStored());
    }

    @Override
    public void deleteUser(String userId) {
        tx(transactions, "удаление пользователя " + userId, () -> {
            messages.detachSender(userId);
            chats.findAllByUsersIdOrderByCreatedAtAsc(userId)
                    .forEach(c -> c.getUsers().removeIf(u -> u.getId().equals(userId)));
            users.findById(userId).ifPresent(users::delete);
            users.flush();
            return null;
        });
    }

    /* ===== чаты ===== */

    @Override
    public List<StoredChat> findChats() {
        return tx(readOnly, "find chats",
                () -> chats.findAllByOrderByCreatedAtAsc().stream().map(ChatEntity::toStored).toList());
    }

    @Override
    public StoredChat createChat(String chatId, List<String> memberIds) {
        return tx(transactions, "создание чата " + chatId, () -> {
            List<ActiveUserEntity> members = memberIds.stream()
                    .map(id -> users.findById(id)
                            .orElseThrow(() -> new StorageException("Неизвестный участник чата " + id)))
                    .toList();
            return chats.saveAndFlush(new ChatEntity(chatId, members, clock.instant())).toStored();
        });
    }

    @Override
    public void deleteChat(String chatId) {
        tx(transactions, "удаление чата " + chatId, () -> {
            messages.detachChat(chatId);
            chats.findById(chatId).ifPresent(chats::delete);
            chats.flush();
            return null;
        });
    }

    @Override
    public void appendMessageRef(String chatId, String messageId) {
        tx(transactions, "добавление сообщения " + messageId + " в чат " + chatId, () -> {
            ChatEntity chat = chats.findById(chatId)
                    .orElseThrow(() -> new StorageException("Неизвестный чат " + chatId));
            MessageEntity message = messages.findById(messageId)
                    .orElseThrow(() -> new StorageException("Неизвестное сообщение " + messageId));
            message.setChatPosition(messages.lastPosition(chatId) + 1);
            message.setChat(chat);
            chat.getMessages().add(message);
            messages.flush();
            return null;
        });
    }

    /* ===== сообщения ===== */

    @Override
    public StoredMessage createMessage(String message, String senderUserId, MessageType type, Instant createdAt) {
        return tx(transactions, "создание сообщения от " + senderUserId, () -> {
            ActiveUserEntity sender = users.findById(senderUserId)
                    .orElseThrow(() -> new StorageException("Неизвестный отправитель " + senderUserId));
            return messages.saveAndFlush(MessageEntity.builder()
                    .message(message)
                    .sender(sender)
                    .type(type)
                    .createdAt(createdAt)
                    .build()).toStored();
        });
    }

    @Override
    public void updateMessageText(String messageId, String message) {
        tx(transactions, "правка сообщения " + messageId, () -> {
            MessageEntity entity = messages.findById(messageId)
                    .orElseThrow(() -> new StorageException("Неизвестное сообщение " + messageId));
            entity.setMessage(message);
            messages.flush();
            return null;
        });
    }

    @Override
    public void deleteMessage(String messageId) {
        tx(transactions, "удаление сообщения " + messageId, () -> {
            messages.findById(messageId).ifPresent(messages::delete);
            messages.flush();
            return null;
        });
    }

    @Override
    public void deleteMessages(Collection<String> messageIds) {
        if (messageIds.isEmpty()) return;
        tx(transactions, "удаление сообщений: " + messageIds.size(),
                () -> {
                    messages.deleteAllByIdInBatch(messageIds);
                    return null;
                });
    }

    private static <T> T tx(TransactionTemplate template, String what, Supplier<T> work) {
        try {
            return template.execute(status -> work.get());
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Сбой хранилища: {} ({})", what, ex.getMessage());
            throw new StorageException("Не удалось: " + what, ex);
        }
    }
}
