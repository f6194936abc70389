package com.alibou.randomchat.chat;

import com.alibou.randomchat.cache.CachedChat;
import com.alibou.randomchat.cache.CachedMessage;
import com.alibou.randomchat.cache.ChatCache;
import com.alibou.randomchat.exception.StorageException;
import com.alibou.randomchat.store.ChatStore;
import com.alibou.randomchat.store.StoredMessage;
import com.alibou.randomchat.user.ChatUser;
import com.alibou.randomchat.user.SessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Сообщения чатов из кэша.
 *
 * <ul>
 *   <li>неизвестный чат или неактивный отправитель дают обычный результат «не найдено»</li>
 *   <li>кэш меняется только после успешной записи в хранилище</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatMessageService {

    private final ChatCache cache;
    private final ChatStore chatStore;
    private final SessionRegistry sessions;

    /**
     * Сохраняет сообщение и кладёт его в кэш под новым id.
     *
     * @return сообщение из кэша или empty, если отправитель не активен или чата нет
     * @throws StorageException если хранилище отклонило запись; кэш не изменён
     */
    public Optional<CachedMessage> addMessage(String chatId, NewMessage incoming) {
        return cache.write(() -> {
            ChatUser sender = sessions.findActiveUser(incoming.senderId()).orElse(null);
            if (sender == null) {
                log.warn("Сообщение в {} отброшено: отправитель {} не активен", chatId, incoming.senderId());
                return Optional.<CachedMessage>empty();
            }
            CachedChat chat = cache.getChat(chatId);
            if (chat == null) {
                log.warn("Сообщение от {} отброшено: чата {} нет", incoming.senderId(), chatId);
                return Optional.<CachedMessage>empty();
            }

            StoredMessage stored = chatStore.createMessage(
                    incoming.message(), sender.getId(), incoming.type(), incoming.time());
            try {
                chatStore.appendMessageRef(chatId, stored.id());
            } catch (StorageException ex) {
                discard(stored.id());
                throw ex;
            }

            CachedMessage cached = CachedMessage.builder()
                    .id(stored.id())
                    .message(stored.message())
                    .senderId(sender.getEmailOrLoginId())
                    .time(stored.createdAt())
                    .type(stored.type())
                    .build();
            chat.getMessages().put(cached.getId(), cached);

            log.info("💾 Сообщение {} сохранено в чате {} ({})", cached.getId(), chatId, cached.getSenderId());
            return Optional.of(cached.toBuilder().build());
        });
    }

    /** @return false, если чата нет или удаление в хранилище не удалось */
    public boolean removeMessage(String chatId, String messageId) {
        return cache.write(() -> {
            CachedChat chat = cache.getChat(chatId);
            if (chat == null) return false;

            try {
                chatStore.deleteMessage(messageId);
            } catch (StorageException ex) {
                log.warn("Сообщение {} чата {} не удалено: {}", messageId, chatId, ex.getMessage());
                return false;
            }
            chat.getMessages().remove(messageId);
            return true;
        });
    }

    /** @return false, если нет чата или сообщения либо обновление не удалось */
    public boolean editMessage(String chatId, MessageEdit edit) {
        return cache.write(() -> {
            CachedChat chat = cache.getChat(chatId);
            if (chat == null) return false;
            CachedMessage cached = chat.getMessages().get(edit.id());
            if (cached == null) return false;

            try {
                chatStore.updateMessageText(edit.id(), edit.message());
            } catch (StorageException ex) {
                log.warn("Сообщение {} чата {} не изменено: {}", edit.id(), chatId, ex.getMessage());
                return false;
            }
            cached.setMessage(edit.message());
            return true;
        });
    }

    /** Сообщения чата в порядке добавления. Для неизвестного чата пусто. */
    public List<CachedMessage> getMessages(String chatId) {
        return cache.read(() -> {
            CachedChat chat = cache.getChat(chatId);
            return chat == null ? List.<CachedMessage>of() : chat.snapshot().orderedMessages();
        });
    }

    private void discard(String messageId) {
        try {
            chatStore.deleteMessage(messageId);
        } catch (StorageException ex) {
            log.error("В хранилище осталось осиротевшее сообщение {}: {}", messageId, ex.getMessage());
        }
    }
}
