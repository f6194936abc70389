package com.alibou.randomchat.pairing;

import com.alibou.randomchat.cache.CachedChat;
import com.alibou.randomchat.cache.ChatCache;
import com.alibou.randomchat.chatroom.ChatRoomService;
import com.alibou.randomchat.exception.PreconditionFailedException;
import com.alibou.randomchat.exception.StorageException;
import com.alibou.randomchat.user.ChatUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Случайно выбирает двух ожидающих и запускает их чат.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PairingService {

    private final ChatCache       cache;
    private final ChatRoomService chatRoomService;
    private final Random          random;

    /**
     * Забирает из очереди двух разных случайных пользователей.
     *
     * @throws PreconditionFailedException если ожидают меньше двух
     */
    public List<ChatUser> pickRandomPair() {
        return cache.write(() -> {
            List<String> waitingIds = cache.waitingIds();
            if (waitingIds.size() < 2) {
                throw new PreconditionFailedException(
                        "Для пары нужны двое ожидающих, сейчас: " + waitingIds.size());
            }

            List<ChatUser> pair = new ArrayList<>(2);
            for (int i = 0; i < 2; i++) {
                int index = random.nextInt(waitingIds.size());
                String id = waitingIds.remove(index);
                pair.add(cache.removeWaitingUser(id));
            }
            log.debug("Пара {} ↔ {} выбрана (ещё ожидают {})",
                    pair.get(0).getEmailOrLoginId(), pair.get(1).getEmailOrLoginId(), cache.waitingCount());
            return pair;
        });
    }

    /**
     * Подбор пары и создание чата одним исключительным шагом.
     * Если чат не сохранился, оба возвращаются в очередь.
     *
     * @return новый чат или empty, если ожидают меньше двух
     * @throws StorageException если чат не удалось сохранить
     */
    public Optional<CachedChat> pairNext() {
        return cache.write(() -> {
            if (cache.waitingCount() < 2) return Optional.<CachedChat>empty();

            List<ChatUser> pair = pickRandomPair();
            try {
                return Optional.of(chatRoomService.createChat(pair));
            } catch (StorageException ex) {
                pair.forEach(cache::putWaitingUser);
                log.warn("Пара {} ↔ {} возвращена в очередь: {}",
                        pair.get(0).getEmailOrLoginId(), pair.get(1).getEmailOrLoginId(), ex.getMessage());
                throw ex;
            }
        });
    }
}
