package com.alibou.randomchat.chat;

import com.alibou.randomchat.cache.CachedMessage;
import com.alibou.randomchat.chatroom.ChatEvent;
import com.alibou.randomchat.exception.ChatSyncException;
import com.alibou.randomchat.user.ErrorNotice;
import com.alibou.randomchat.user.SessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageSendingOperations;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

@Slf4j
@Controller
@RequiredArgsConstructor
public class ChatController {

    private final ChatMessageService           chatMessageService;
    private final SessionRegistry              sessions;
    private final SimpMessageSendingOperations messaging;
    private final Clock                        clock;

    @MessageMapping("/chat.send")
    @SendToUser("/queue/errors")
    public ErrorNotice send(@Payload ChatMessageRequest request,
                            @Header("simpSessionId") String sessionId) {
        Optional<String> sender = sessions.findChatMember(sessionId, request.chatId());
        if (sender.isEmpty()) {
            return notFound("Вы не участник чата " + request.chatId());
        }

        NewMessage incoming = new NewMessage(
                request.message(),
                request.time() != null ? request.time() : clock.instant(),
                sender.get());

        Optional<CachedMessage> saved = chatMessageService.addMessage(request.chatId(), incoming);
        if (saved.isEmpty()) {
            return notFound("Чат " + request.chatId() + " не существует");
        }
        messaging.convertAndSend(ChatEvent.topic(request.chatId()),
                ChatEvent.messageCreated(request.chatId(), saved.get()));
        return null;
    }

    @MessageMapping("/chat.edit")
    @SendToUser("/queue/errors")
    public ErrorNotice edit(@Payload ChatMessageRequest request,
                            @Header("simpSessionId") String sessionId) {
        if (sessions.findChatMember(sessionId, request.chatId()).isEmpty()
                || !chatMessageService.editMessage(request.chatId(), new MessageEdit(request.id(), request.message()))) {
            return notFound("Сообщение " + request.id() + " не удалось изменить");
        }
        messaging.convertAndSend(ChatEvent.topic(request.chatId()),
                ChatEvent.messageEdited(request.chatId(), request.id(), request.message()));
        return null;
    }

    @MessageMapping("/chat.delete")
    @SendToUser("/queue/errors")
    public ErrorNotice delete(@Payload ChatMessageRequest request,
                              @Header("simpSessionId") String sessionId) {
        if (sessions.findChatMember(sessionId, request.chatId()).isEmpty()
                || !chatMessageService.removeMessage(request.chatId(), request.id())) {
            return notFound("Сообщение " + request.id() + " не удалось удалить");
        }
        messaging.convertAndSend(ChatEvent.topic(request.chatId()),
                ChatEvent.messageDeleted(request.chatId(), request.id()));
        return null;
    }

    /** История чата, в порядке добавления. */
    @GetMapping("/chats/{chatId}/messages")
    public ResponseEntity<List<CachedMessage>> findChatMessages(@PathVariable String chatId) {
        return ResponseEntity.ok(chatMessageService.getMessages(chatId));
    }

    @MessageExceptionHandler(ChatSyncException.class)
    @SendToUser("/queue/errors")
    public ErrorNotice handleFailure(ChatSyncException ex) {
        log.warn("Операция с чатом не выполнена: {}", ex.getMessage());
        return new ErrorNotice(ex.getClass().getSimpleName(), ex.getMessage());
    }

    private static ErrorNotice notFound(String message) {
        return new ErrorNotice("NotFound", message);
    }
}
