package com.alibou.randomchat.cache;

import com.alibou.randomchat.user.ChatUser;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Память сервера: ожидающие, активные пользователи и чаты.
 *
 * <p>Сами карты ничего не гарантируют. Любое многошаговое изменение
 * (хранилище, кэш, учёт участников) выполняется внутри {@link #write} и
 * исключает другие изменения и читателей через {@link #read}. Блокировка
 * реентерабельна: писатель может вызывать читателей и вложенных писателей,
 * читатель писателя вызывать не должен.
 */
@Slf4j
@Component
public class ChatCache {

    /** emailOrLoginId → waiting user */
    private final Map<String, ChatUser> waitingUsers = new ConcurrentHashMap<>();
    /** emailOrLoginId → active user */
    private final Map<String, ChatUser> activeUsers = new ConcurrentHashMap<>();
    /** chatId → chat */
    private final Map<String, CachedChat> chats = new ConcurrentHashMap<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    /* ===== блокировка ===== */

    public <T> T write(Supplier<T> mutation) {
        return locked(lock.writeLock(), mutation);
    }

    public void update(Runnable mutation) {
        locked(lock.writeLock(), () -> {
            mutation.run();
            return null;
        });
    }

    public <T> T read(Supplier<T> query) {
        return locked(lock.readLock(), query);
    }

    public boolean isWriteLockedByCurrentThread() {
        return lock.isWriteLockedByCurrentThread();
    }

    private static <T> T locked(Lock l, Supplier<T> body) {
        l.lock();
        try {
            return body.get();
        } finally {
            l.unlock();
        }
    }

    /* ===== ожидающие ===== */

    public ChatUser getWaitingUser(String id) {
        return waitingUsers.get(id);
    }

    public void putWaitingUser(ChatUser user) {
        waitingUsers.put(user.getEmailOrLoginId(), user);
    }

    public ChatUser removeWaitingUser(String id) {
        return waitingUsers.remove(id);
    }

    public List<String> waitingIds() {
        return new ArrayList<>(waitingUsers.keySet());
    }

    public int waitingCount() {
        return waitingUsers.size();
    }

    /* ===== активные ===== */

    public ChatUser getActiveUser(String id) {
        return activeUsers.get(id);
    }

    public void putActiveUser(ChatUser user) {
        activeUsers.put(user.getEmailOrLoginId(), user);
    }

    public ChatUser removeActiveUser(String id) {
        return activeUsers.remove(id);
    }

    public Collection<ChatUser> activeUsers() {
        return List.copyOf(activeUsers.values());
    }

    /* ===== чаты ===== */

    public CachedChat getChat(String chatId) {
        return chats.get(chatId);
    }

    public void putChat(CachedChat chat) {
        chats.put(chat.getId(), chat);
    }

    public CachedChat removeChat(String chatId) {
        return chats.remove(chatId);
    }

    public int chatCount() {
        return chats.size();
    }

    @PreDestroy
    public void clear() {
        update(() -> {
            log.info("Сброс кэша: ожидают {}, активны {}, чатов {}",
                    waitingUsers.size(), activeUsers.size(), chats.size());
            waitingUsers.clear();
            activeUsers.clear();
            chats.clear();
        });
    }
}
