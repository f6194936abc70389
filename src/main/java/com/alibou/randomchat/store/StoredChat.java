package com.alibou.randomchat.store;

import java.time.Instant;
import java.util.List;

public record StoredChat(String id,
                         List<StoredUser> members,
                         List<StoredMessage> messages,
                         Instant createdAt) {

    public StoredChat {
        members  = List.copyOf(members);
        messages = List.copyOf(messages);
    }
}
