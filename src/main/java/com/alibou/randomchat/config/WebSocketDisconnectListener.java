package com.alibou.randomchat.config;

import com.alibou.randomchat.user.SessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/** Забывает соединение закрытой STOMP-сессии. */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebSocketDisconnectListener implements ApplicationListener<SessionDisconnectEvent> {

    private final SessionRegistry sessions;

    @Override
    public void onApplicationEvent(SessionDisconnectEvent event) {
        String sessionId = event.getSessionId();
        sessions.detachConnection(sessionId).ifPresentOrElse(
                user -> log.info("DISCONNECT ⇢ {}@{} (осталось соединений: {})",
                        user.getEmailOrLoginId(), sessionId, user.getConnectionIds().size()),
                () -> log.debug("DISCONNECT ⇢ неизвестная сессия {}", sessionId));
    }
}
