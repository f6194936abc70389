package com.alibou.randomchat.user;

import com.alibou.randomchat.cache.ChatCache;
import com.alibou.randomchat.exception.StorageException;
import com.alibou.randomchat.exception.UserAlreadyWaitingException;
import com.alibou.randomchat.store.ChatStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Жизненный цикл пользователей (ожидание → активен) поверх {@link ChatCache}.
 *
 * <p>Активные пользователи дополнительно индексируются по id соединения,
 * loginId и email, поиск не перебирает карту. Индексы меняются только под
 * write-блокировкой кэша, вместе с самой картой активных.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionRegistry {

    private final ChatCache cache;
    private final ChatStore chatStore;

    /* вторичные индексы карты активных, значение = emailOrLoginId */
    private final Map<String, String> byConnectionId = new ConcurrentHashMap<>();
    private final Map<String, String> byLoginId      = new ConcurrentHashMap<>();
    private final Map<String, String> byEmail        = new ConcurrentHashMap<>();

    /* =======================================================================
                                  WAITING
       ======================================================================= */

    public ChatUser addToWaitingList(String loginId, String email, ChatConnection connection) {
        ChatUser user = new ChatUser(loginId, email);
        user.addConnection(connection);
        String key = user.getEmailOrLoginId();

        return cache.write(() -> {
            if (cache.getWaitingUser(key) != null || cache.getActiveUser(key) != null) {
                throw new UserAlreadyWaitingException(key);
            }
            cache.putWaitingUser(user);
            log.info("WAITING ⇢ {}@{} (waiting={})", key, connection.getId(), cache.waitingCount());
            return user;
        });
    }

    public void removeFromWaitingList(String emailOrLoginId) {
        cache.update(() -> {
            if (cache.removeWaitingUser(emailOrLoginId) != null) {
                log.info("LEFT WAITING ⇢ {}", emailOrLoginId);
            }
        });
    }

    public Optional<ChatUser> getWaitingUser(String emailOrLoginId) {
        return cache.read(() -> Optional.ofNullable(cache.getWaitingUser(emailOrLoginId)));
    }

    public int waitingCount() {
        return cache.read(cache::waitingCount);
    }

    /* =======================================================================
                                  ACTIVE
       ======================================================================= */

    /** Переносит этот же экземпляр в карту активных. */
    public void promoteToActive(ChatUser user) {
        cache.update(() -> {
            cache.removeWaitingUser(user.getEmailOrLoginId());
            cache.putActiveUser(user);
            index(user);
        });
    }

    /**
     * Убирает пользователя из активных и удаляет его запись в хранилище.
     * Из кэша он уходит даже при сбое удаления.
     *
     * @throws StorageException если запись не удалось удалить
     */
    public void removeActiveUser(ChatUser user) {
        cache.update(() -> {
            if (cache.removeActiveUser(user.getEmailOrLoginId()) != null) {
                unindex(user);
            }
            log.info("INACTIVE ⇢ {}", user.getEmailOrLoginId());
            if (user.isPersisted()) {
                chatStore.deleteUser(user.getId());
            }
        });
    }

    /** Ищет по id соединения, email или loginId. */
    public Optional<ChatUser> findActiveUser(String search) {
        return findActiveUser(new ActiveUserQuery(search, search, search));
    }

    public Optional<ChatUser> findActiveUser(ActiveUserQuery query) {
        return cache.read(() -> {
            String key = null;
            if (query.socketId() != null) key = byConnectionId.get(query.socketId());
            if (key == null && query.email() != null) key = byEmail.get(query.email());
            if (key == null && query.loginId() != null) key = byLoginId.get(query.loginId());
            return Optional.ofNullable(key).map(cache::getActiveUser);
        });
    }

    /** emailOrLoginId владельца соединения, если он участник чата. */
    public Optional<String> findChatMember(String connectionId, String chatId) {
        return cache.read(() -> Optional.ofNullable(byConnectionId.get(connectionId))
                .map(cache::getActiveUser)
                .filter(u -> u.getChatIds().contains(chatId))
                .map(ChatUser::getEmailOrLoginId));
    }

    /** Активный пользователь только по emailOrLoginId. */
    public Optional<ChatUser> getActiveUser(String emailOrLoginId) {
        return cache.read(() -> Optional.ofNullable(cache.getActiveUser(emailOrLoginId)));
    }

    public boolean isActive(String emailOrLoginId) {
        return cache.read(() -> cache.getActiveUser(emailOrLoginId) != null);
    }

    /** 0 для неизвестных. */
    public int getChatsCount(String emailOrLoginId) {
        return cache.read(() -> {
            ChatUser user = cache.getActiveUser(emailOrLoginId);
            return user == null ? 0 : user.getChatIds().size();
        });
    }

    /* =======================================================================
                                CONNECTIONS
       ======================================================================= */

    /**
     * Ещё одна вкладка известного пользователя. Вкладка предъявляет токен,
     * выданный при входе.
     *
     * @return false, если пользователь не найден или токен не совпал
     */
    public boolean attachConnection(String emailOrLoginId, String attachToken, ChatConnection connection) {
        return cache.write(() -> {
            ChatUser active = cache.getActiveUser(emailOrLoginId);
            ChatUser user = active != null ? active : cache.getWaitingUser(emailOrLoginId);
            if (user == null) return false;
            if (!user.acceptsAttachToken(attachToken)) {
                log.warn("ATTACH ⇢ {}@{} отклонён: неверный токен", emailOrLoginId, connection.getId());
                return false;
            }

            user.addConnection(connection);
            if (active != null) {
                byConnectionId.put(connection.getId(), emailOrLoginId);
                active.getChatIds().forEach(chatId -> joinQuietly(connection, chatId));
            }
            return true;
        });
    }

    /** Пользователь (ожидающий или активный), которому принадлежит соединение. */
    public Optional<ChatUser> findUserByConnection(String connectionId) {
        return cache.read(() -> {
            String key = byConnectionId.get(connectionId);
            if (key != null) return Optional.ofNullable(cache.getActiveUser(key));
            for (String id : cache.waitingIds()) {
                ChatUser waiting = cache.getWaitingUser(id);
                if (waiting != null && waiting.getConnectionIds().contains(connectionId)) {
                    return Optional.of(waiting);
                }
            }
            return Optional.<ChatUser>empty();
        });
    }

    /**
     * Забывает закрытое соединение. Ожидающий без соединений покидает
     * очередь; активный сохраняет чаты, чтобы переподключившийся клиент
     * нашёл их снова.
     */
    public Optional<ChatUser> detachConnection(String connectionId) {
        return cache.write(() -> {
            String key = byConnectionId.remove(connectionId);
            if (key != null) {
                ChatUser user = cache.getActiveUser(key);
                if (user != null) user.removeConnection(connectionId);
                return Optional.ofNullable(user);
            }
            for (String id : cache.waitingIds()) {
                ChatUser waiting = cache.getWaitingUser(id);
                if (waiting != null && waiting.removeConnection(connectionId)) {
                    if (waiting.getConnectionIds().isEmpty()) {
                        cache.removeWaitingUser(id);
                        log.info("LEFT WAITING ⇢ {} (закрыто последнее соединение {})", id, connectionId);
                    }
                    return Optional.of(waiting);
                }
            }
            return Optional.<ChatUser>empty();
        });
    }

    /**
     * Подписывает все соединения пользователя на канал чата. Сбой отдельного
     * соединения не прерывает остальные: клиент переподпишется при attach.
     */
    public void joinChat(ChatUser user, String chatId) {
        user.getConnections().forEach(connection -> joinQuietly(connection, chatId));
    }

    /* ===== служебное ===== */

    private static void joinQuietly(ChatConnection connection, String chatId) {
        try {
            connection.joinChannel(chatId);
        } catch (RuntimeException ex) {
            log.warn("Соединение {} не подписано на чат {}: {}", connection.getId(), chatId, ex.getMessage());
        }
    }

    private void index(ChatUser user) {
        String key = user.getEmailOrLoginId();
        user.getConnectionIds().forEach(c -> byConnectionId.put(c, key));
        byLoginId.put(user.getLoginId(), key);
        if (user.getEmail() != null) byEmail.put(user.getEmail(), key);
    }

    private void unindex(ChatUser user) {
        String key = user.getEmailOrLoginId();
        user.getConnectionIds().forEach(c -> byConnectionId.remove(c, key));
        byLoginId.remove(user.getLoginId(), key);
        if (user.getEmail() != null) byEmail.remove(user.getEmail(), key);
    }
}
