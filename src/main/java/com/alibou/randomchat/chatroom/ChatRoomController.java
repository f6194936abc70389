package com.alibou.randomchat.chatroom;

import com.alibou.randomchat.cache.CachedChat;
import com.alibou.randomchat.pairing.PairingService;
import com.alibou.randomchat.user.ErrorNotice;
import com.alibou.randomchat.user.SessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageSendingOperations;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/chats")
public class ChatRoomController {

    private final ChatRoomService              chatRoomService;
    private final PairingService               pairingService;
    private final SessionRegistry              sessions;
    private final SimpMessageSendingOperations messaging;

    /** Участник завершает чат. */
    @MessageMapping("/chat.close")
    @SendToUser("/queue/errors")
    public ErrorNotice close(@Payload String chatId,
                             @Header("simpSessionId") String sessionId) {
        if (sessions.findChatMember(sessionId, chatId).isEmpty()) {
            return new ErrorNotice("NotFound", "Вы не участник чата " + chatId);
        }

        List<String> inactive = chatRoomService.closeChat(chatId).orElse(null);
        if (inactive == null) {
            return new ErrorNotice("NotFound", "Чат " + chatId + " не существует");
        }
        messaging.convertAndSend(ChatEvent.topic(chatId), ChatEvent.closed(chatId, inactive));
        return null;
    }

    @GetMapping("/{chatId}")
    public ResponseEntity<CachedChat> chat(@PathVariable String chatId) {
        return chatRoomService.getChat(chatId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/waiting/count")
    public Map<String, Integer> waitingCount() {
        return Map.of("waiting", sessions.waitingCount());
    }

    @GetMapping("/users/{emailOrLoginId}/count")
    public Map<String, Integer> chatsCount(@PathVariable String emailOrLoginId) {
        return Map.of("chats", chatRoomService.getChatsCount(emailOrLoginId));
    }

    /** Ручной подбор пары (когда авто-подбор выключен). */
    @PostMapping("/pair")
    public ResponseEntity<CachedChat> pair() {
        return pairingService.pairNext()
                .map(chat -> {
                    messaging.convertAndSend(ChatEvent.topic(chat.getId()), ChatEvent.started(chat));
                    return ResponseEntity.ok(chat);
                })
                .orElse(ResponseEntity.noContent().build());
    }
}
