package com.alibou.randomchat.store;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MessageRepository extends JpaRepository<MessageEntity, String> {

    @Query("select coalesce(max(m.chatPosition), -1L) from MessageEntity m where m.chat.id = :chatId")
    long lastPosition(@Param("chatId") String chatId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update MessageEntity m set m.sender = null where m.sender.id = :userId")
    int detachSender(@Param("userId") String userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update MessageEntity m set m.chat = null where m.chat.id = :chatId")
    int detachChat(@Param("chatId") String chatId);
}
