package com.alibou.randomchat.chatroom;

import com.alibou.randomchat.cache.CachedChat;
import com.alibou.randomchat.cache.ChatCache;
import com.alibou.randomchat.exception.PreconditionFailedException;
import com.alibou.randomchat.exception.StorageException;
import com.alibou.randomchat.store.ChatStore;
import com.alibou.randomchat.store.StoredChat;
import com.alibou.randomchat.store.StoredUser;
import com.alibou.randomchat.user.ChatUser;
import com.alibou.randomchat.user.SessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Создание и закрытие чатов: хранилище, кэш и состояние сессий
 * участников меняются согласованно.
 *
 * <p>При создании сначала пишем в хранилище, кэш трогаем только после
 * успешной записи; при сбое удаляем созданные этим вызовом записи
 * пользователей, кэш остаётся прежним. Закрытие идёт до конца: ошибки
 * хранилища только логируются.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChatRoomService {

    private final ChatCache       cache;
    private final ChatStore       chatStore;
    private final SessionRegistry sessions;

    /* =======================================================================
                                   CREATE
       ======================================================================= */

    /**
     * Новый чат для переданных пользователей, все они становятся активными.
     *
     * @throws StorageException если запись в хранилище не удалась; кэш не тронут
     * @throws PreconditionFailedException если различных пользователей меньше двух
     */
    public CachedChat createChat(List<ChatUser> users) {
        long distinct = users.stream().map(ChatUser::getEmailOrLoginId).distinct().count();
        if (users.size() < 2 || distinct != users.size()) {
            throw new PreconditionFailedException("Для чата нужны минимум два разных пользователя, получено: " + users);
        }
        return cache.write(() -> {
            String chatId = UUID.randomUUID().toString();

            /* 1) записи в хранилище, кэш ещё не меняется */
            Map<ChatUser, String> createdIds = new IdentityHashMap<>();
            StoredChat stored;
            try {
                for (ChatUser user : users) {
                    if (!user.isPersisted()) {
                        StoredUser created = chatStore.createUser(
                                user.getEmail(), user.getLoginId(), chatId, user.getAttachToken());
                        createdIds.put(user, created.id());
                    }
                }
                List<String> memberIds = users.stream()
                        .map(u -> createdIds.getOrDefault(u, u.getId()))
                        .toList();
                stored = chatStore.createChat(chatId, memberIds);
            } catch (StorageException ex) {
                log.warn("Чат {} не создан, откатываем новых пользователей: {}", chatId, createdIds.size());
                createdIds.values().forEach(this::deleteQuietly);
                throw ex;
            }

            /* 2) кэш и сессии: только операции над памятью */
            for (ChatUser user : users) {
                String newId = createdIds.get(user);
                if (newId != null) user.setId(newId);
                user.setCurrentChatId(chatId);
                user.addChatId(chatId);
                sessions.promoteToActive(user);
            }

            CachedChat chat = new CachedChat(
                    stored.id(),
                    users.stream().map(ChatUser::getEmailOrLoginId).toList(),
                    stored.createdAt());
            cache.putChat(chat);

            /* 3) подписки на канал чата: побочный эффект, ошибки только логируем */
            users.forEach(user -> sessions.joinChat(user, chatId));

            log.info("Создан новый чат {} ({})", chat.getId(), String.join(" ↔ ", chat.getUserIds()));
            return chat.snapshot();
        });
    }

    /* =======================================================================
                                   CLOSE
       ======================================================================= */

    /**
     * Закрывает чат и удаляет его сообщения. Участники, у которых не осталось
     * чатов, удаляются целиком.
     *
     * @return id пользователей, ставших неактивными, или empty, если чата нет в кэше
     */
    public Optional<List<String>> closeChat(String chatId) {
        return cache.write(() -> {
            bestEffort("удаление чата " + chatId, () -> chatStore.deleteChat(chatId));

            CachedChat chat = cache.getChat(chatId);
            if (chat == null) {
                return Optional.<List<String>>empty();
            }

            bestEffort("удаление сообщений чата " + chatId,
                    () -> chatStore.deleteMessages(List.copyOf(chat.getMessages().keySet())));

            List<String> inactive = new ArrayList<>();
            for (String userId : chat.getUserIds()) {
                ChatUser user = cache.getActiveUser(userId);
                if (user == null) continue;

                user.removeChatId(chatId);
                if (user.getChatIds().isEmpty()) {
                    user.setCurrentChatId(null);
                    bestEffort("удаление пользователя " + userId, () -> sessions.removeActiveUser(user));
                    if (!inactive.contains(userId)) inactive.add(userId);
                } else if (chatId.equals(user.getCurrentChatId())) {
                    List<String> remaining = user.getChatIds();
                    user.setCurrentChatId(remaining.get(remaining.size() - 1));
                }
            }

            cache.removeChat(chatId);
            log.info("Чат {} закрыт, неактивны: {}", chatId, inactive);
            return Optional.of(inactive);
        });
    }

    /**
     * Закрывает все чаты пользователя.
     *
     * @return id закрытого чата → пользователи, ставшие из-за него неактивными
     */
    public Map<String, List<String>> leaveAllChats(String emailOrLoginId) {
        return cache.write(() -> {
            Map<String, List<String>> closed = new LinkedHashMap<>();
            ChatUser user = cache.getActiveUser(emailOrLoginId);
            if (user == null) return closed;

            for (String chatId : List.copyOf(user.getChatIds())) {
                closeChat(chatId).ifPresent(inactive -> closed.put(chatId, inactive));
            }
            return closed;
        });
    }

    /* =======================================================================
                                  QUERIES
       ======================================================================= */

    public Optional<CachedChat> getChat(String chatId) {
        return cache.read(() -> Optional.ofNullable(cache.getChat(chatId)).map(CachedChat::snapshot));
    }

    public boolean chatExists(String chatId) {
        return cache.read(() -> cache.getChat(chatId) != null);
    }

    public int getChatsCount(String emailOrLoginId) {
        return sessions.getChatsCount(emailOrLoginId);
    }

    /* ===== служебное ===== */

    private void deleteQuietly(String userId) {
        bestEffort("откат пользователя " + userId, () -> chatStore.deleteUser(userId));
    }

    private static void bestEffort(String what, Runnable storeCall) {
        try {
            storeCall.run();
        } catch (StorageException ex) {
            log.error("Не удалось: {}, продолжаем ({})", what, ex.getMessage());
        }
    }
}
