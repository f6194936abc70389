package com.alibou.randomchat.cache;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Чат в кэше. Участники хранятся как emailOrLoginId, сообщения в порядке
 * добавления, чтобы клиент мог показать историю.
 */
@Getter
public class CachedChat {

    private final String  id;
    private final List<String> userIds;
    private final Map<String, CachedMessage> messages;
    private final Instant createdAt;

    public CachedChat(String id, List<String> userIds, Instant createdAt) {
        this(id, userIds, new LinkedHashMap<>(), createdAt);
    }

    public CachedChat(String id, List<String> userIds,
                      Map<String, CachedMessage> messages, Instant createdAt) {
        this.id        = id;
        this.userIds   = List.copyOf(userIds);
        this.messages  = new LinkedHashMap<>(messages);
        this.createdAt = createdAt;
    }

    /** Отвязанная копия, её можно отдавать за пределы блокировки. */
    public CachedChat snapshot() {
        Map<String, CachedMessage> copied = new LinkedHashMap<>();
        messages.forEach((k, m) -> copied.put(k, m.toBuilder().build()));
        return new CachedChat(id, userIds, copied, createdAt);
    }

    public List<CachedMessage> orderedMessages() {
        return Collections.unmodifiableList(new ArrayList<>(messages.values()));
    }
}
