package com.alibou.randomchat.user;

import com.alibou.randomchat.chatroom.ChatEvent;
import com.alibou.randomchat.chatroom.ChatRoomService;
import com.alibou.randomchat.config.ChatProperties;
import com.alibou.randomchat.exception.ChatSyncException;
import com.alibou.randomchat.pairing.PairingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageSendingOperations;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;

/**
 * Вход, подключение вкладок и выход. Действующий пользователь всегда
 * определяется по STOMP-сессии, а не по данным из payload.
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class UserController {

    public static final String WAITING_TOPIC = "/topic/waiting";
    public static final String SESSION_QUEUE = "/queue/session";

    private final SessionRegistry              sessions;
    private final PairingService               pairingService;
    private final ChatRoomService              chatRoomService;
    private final SimpMessageSendingOperations messaging;
    private final ChatProperties               properties;

    /** Новый пользователь ищет собеседника. */
    @MessageMapping("/user.join")
    public void join(@Payload JoinRequest request,
                     @Header("simpSessionId") String sessionId) {
        StompConnection connection = new StompConnection(sessionId, messaging);
        ChatUser user = sessions.addToWaitingList(request.loginId(), request.email(), connection);
        connection.send(SESSION_QUEUE, new SessionTicket(user.getEmailOrLoginId(), user.getAttachToken()));

        if (properties.getPairing().isAutoPair()) {
            pairingService.pairNext().ifPresent(chat ->
                    messaging.convertAndSend(ChatEvent.topic(chat.getId()), ChatEvent.started(chat)));
        }
        messaging.convertAndSend(WAITING_TOPIC, sessions.waitingCount());
    }

    /** Ещё одна вкладка пользователя, который уже ждёт или общается. */
    @MessageMapping("/user.attach")
    @SendToUser("/queue/errors")
    public ErrorNotice attach(@Payload AttachRequest request,
                              @Header("simpSessionId") String sessionId) {
        if (!sessions.attachConnection(request.emailOrLoginId(), request.attachToken(),
                new StompConnection(sessionId, messaging))) {
            return new ErrorNotice("AttachRejected", "Нельзя подключиться к " + request.emailOrLoginId());
        }
        return null;
    }

    /** Выход из очереди ожидания или закрытие всех чатов пользователя этой сессии. */
    @MessageMapping("/user.leave")
    @SendToUser("/queue/errors")
    public ErrorNotice leave(@Header("simpSessionId") String sessionId) {
        ChatUser user = sessions.findUserByConnection(sessionId).orElse(null);
        if (user == null) {
            return new ErrorNotice("NotFound", "С этой сессией не связан ни один пользователь");
        }
        String id = user.getEmailOrLoginId();
        if (sessions.getWaitingUser(id).isPresent()) {
            sessions.removeFromWaitingList(id);
            messaging.convertAndSend(WAITING_TOPIC, sessions.waitingCount());
            return null;
        }
        chatRoomService.leaveAllChats(id).forEach((chatId, inactive) ->
                messaging.convertAndSend(ChatEvent.topic(chatId), ChatEvent.closed(chatId, inactive)));
        return null;
    }

    @MessageExceptionHandler(ChatSyncException.class)
    @SendToUser("/queue/errors")
    public ErrorNotice handleFailure(ChatSyncException ex) {
        log.warn("Операция пользователя не выполнена: {}", ex.getMessage());
        return new ErrorNotice(ex.getClass().getSimpleName(), ex.getMessage());
    }
}
