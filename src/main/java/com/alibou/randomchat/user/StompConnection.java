package com.alibou.randomchat.user;

import com.alibou.randomchat.chatroom.ChatEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageSendingOperations;
import org.springframework.messaging.simp.SimpMessageType;

/**
 * Одна STOMP-сессия. Подписывается сам клиент, поэтому «подписать на канал»
 * значит сообщить сессии, на какой топик подписаться.
 */
@Slf4j
@RequiredArgsConstructor
public class StompConnection implements ChatConnection {

    public static final String CHANNEL_QUEUE = "/queue/channels";

    private final String sessionId;
    private final SimpMessageSendingOperations messaging;

    @Override
    public String getId() {
        return sessionId;
    }

    @Override
    public void joinChannel(String channelId) {
        send(CHANNEL_QUEUE, new ChannelJoin(channelId, ChatEvent.topic(channelId)));
        log.debug("Сессия {} приглашена в {}", sessionId, channelId);
    }

    /** Сообщение только этой сессии, по user-destination {@code /user/queue/...}. */
    public void send(String queue, Object payload) {
        SimpMessageHeaderAccessor headers = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        headers.setSessionId(sessionId);
        headers.setLeaveMutable(true);
        messaging.convertAndSendToUser(sessionId, queue, payload, headers.getMessageHeaders());
    }

    public record ChannelJoin(String chatId, String topic) {}
}
