package com.alibou.randomchat.logging;

import org.slf4j.MDC;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessageHandler;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ExecutorChannelInterceptor;
import org.springframework.stereotype.Component;

/**
 * Кладёт в MDC id STOMP-сессии и native-заголовки клиента
 * {@code loginId} / {@code chatId} на время обработки входящего сообщения.
 */
@Component
public class StompMdcInterceptor implements ExecutorChannelInterceptor {

    static final String SESSION_ID = "sessionId";
    static final String LOGIN_ID   = "loginId";
    static final String CHAT_ID    = "chatId";

    @Override
    public Message<?> beforeHandle(Message<?> message, MessageChannel channel, MessageHandler handler) {
        StompHeaderAccessor acc = StompHeaderAccessor.wrap(message);
        put(SESSION_ID, acc.getSessionId());
        put(LOGIN_ID, acc.getFirstNativeHeader(LOGIN_ID));
        put(CHAT_ID, acc.getFirstNativeHeader(CHAT_ID));
        return message;
    }

    @Override
    public void afterMessageHandled(Message<?> message, MessageChannel channel,
                                    MessageHandler handler, Exception ex) {
        MDC.remove(SESSION_ID);
        MDC.remove(LOGIN_ID);
        MDC.remove(CHAT_ID);
    }

    private static void put(String key, String value) {
        if (value != null) MDC.put(key, value);
    }
}
