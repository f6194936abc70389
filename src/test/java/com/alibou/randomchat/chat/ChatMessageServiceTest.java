package com.alibou.randomchat.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;

import com.alibou.randomchat.cache.CachedChat;
import com.alibou.randomchat.cache.CachedMessage;
import com.alibou.randomchat.cache.ChatCache;
import com.alibou.randomchat.exception.StorageException;
import com.alibou.randomchat.store.ChatStore;
import com.alibou.randomchat.store.StoredMessage;
import com.alibou.randomchat.store.StoredUser;
import com.alibou.randomchat.support.RecordingConnection;
import com.alibou.randomchat.user.ChatUser;
import com.alibou.randomchat.user.SessionRegistry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ChatMessageServiceTest {

    private static final String CHAT_ID = "chat-1";
    private static final Instant T0 = Instant.parse("2025-01-01T10:00:00Z");

    @Mock
    private ChatStore chatStore;

    private ChatCache cache;
    private SessionRegistry sessions;
    private ChatMessageService chatMessageService;
    private CachedChat chat;

    @BeforeEach
    void setUp() {
        cache = new ChatCache();
        sessions = new SessionRegistry(cache, chatStore);
        chatMessageService = new ChatMessageService(cache, chatStore, sessions);

        activeUser("anon-1", "ann@example.com", "user-1");
        activeUser("anon-2", null, "user-2");
        chat = new CachedChat(CHAT_ID, List.of("ann@example.com", "anon-2"), T0);
        cache.putChat(chat);
    }

    @Test
    @DisplayName("a stored message is cached under its store id and attributed to the sender")
    void addMessage_cachesStoredMessage() {
        StoredUser ann = new StoredUser("user-1", "ann@example.com", "anon-1", CHAT_ID, null);
        when(chatStore.createMessage("hello", "user-1", MessageType.MESSAGE, T0))
                .thenReturn(new StoredMessage("m-1", "hello", ann, MessageType.MESSAGE, T0));

        CachedMessage result = chatMessageService
                .addMessage(CHAT_ID, new NewMessage("hello", T0, "anon-1"))
                .orElseThrow();

        assertThat(result.getId()).isEqualTo("m-1");
        assertThat(result.getSenderId()).isEqualTo("ann@example.com");
        assertThat(result.getType()).isEqualTo(MessageType.MESSAGE);
        assertThat(chat.getMessages()).containsOnlyKeys("m-1");
        verify(chatStore).appendMessageRef(CHAT_ID, "m-1");
    }

    @Test
    @DisplayName("messages keep the order in which they were added")
    void getMessages_insertionOrder() {
        StoredUser bob = new StoredUser("user-2", null, "anon-2", CHAT_ID, null);
        when(chatStore.createMessage(anyString(), eq("user-2"), any(), any()))
                .thenReturn(new StoredMessage("m-2", "second", bob, MessageType.MESSAGE, T0.plusSeconds(1)))
                .thenReturn(new StoredMessage("m-1", "first", bob, MessageType.MESSAGE, T0));

        chatMessageService.addMessage(CHAT_ID, new NewMessage("second", T0.plusSeconds(1), "anon-2"));
        chatMessageService.addMessage(CHAT_ID, new NewMessage("first", T0, "anon-2"));

        assertThat(chatMessageService.getMessages(CHAT_ID))
                .extracting(CachedMessage::getId)
                .containsExactly("m-2", "m-1");
        assertThat(chatMessageService.getMessages("missing")).isEmpty();
    }

    @Test
    @DisplayName("a sender who is not active is rejected without touching the store")
    void addMessage_inactiveSender() {
        assertThat(chatMessageService.addMessage(CHAT_ID, new NewMessage("hi", T0, "ghost"))).isEmpty();

        assertThat(chat.getMessages()).isEmpty();
        verifyNoInteractions(chatStore);
    }

    @Test
    @DisplayName("a message to an unknown chat is rejected without touching the store")
    void addMessage_unknownChat() {
        assertThat(chatMessageService.addMessage("missing", new NewMessage("hi", T0, "anon-1"))).isEmpty();

        verify(chatStore, never()).createMessage(any(), any(), any(), any());
    }

    @Test
    @DisplayName("when the message cannot be linked to the chat it is discarded and not cached")
    void addMessage_linkFailure() {
        StoredUser ann = new StoredUser("user-1", "ann@example.com", "anon-1", CHAT_ID, null);
        when(chatStore.createMessage(any(), any(), any(), any()))
                .thenReturn(new StoredMessage("m-1", "hello", ann, MessageType.MESSAGE, T0));
        doThrow(new StorageException("link failed")).when(chatStore).appendMessageRef(CHAT_ID, "m-1");

        assertThatThrownBy(() -> chatMessageService.addMessage(CHAT_ID, new NewMessage("hello", T0, "anon-1")))
                .isInstanceOf(StorageException.class);

        verify(chatStore).deleteMessage("m-1");
        assertThat(chat.getMessages()).isEmpty();
    }

    @Test
    @DisplayName("editing an unknown message id changes nothing")
    void editMessage_unknownId() {
        chat.getMessages().put("m-1", message("m-1", "original"));

        assertThat(chatMessageService.editMessage(CHAT_ID, new MessageEdit("m-9", "changed"))).isFalse();
        assertThat(chatMessageService.editMessage("missing", new MessageEdit("m-1", "changed"))).isFalse();

        assertThat(chat.getMessages()).containsOnlyKeys("m-1");
        assertThat(chat.getMessages().get("m-1").getMessage()).isEqualTo("original");
        verify(chatStore, never()).updateMessageText(any(), any());
    }

    @Test
    @DisplayName("an edit replaces the text in place")
    void editMessage_updatesText() {
        chat.getMessages().put("m-1", message("m-1", "original"));

        assertThat(chatMessageService.editMessage(CHAT_ID, new MessageEdit("m-1", "changed"))).isTrue();

        verify(chatStore).updateMessageText("m-1", "changed");
        assertThat(chat.getMessages().get("m-1").getMessage()).isEqualTo("changed");
        assertThat(chat.getMessages().get("m-1").getTime()).isEqualTo(T0);
    }

    @Test
    @DisplayName("a failed store edit leaves the cached text alone")
    void editMessage_storeFailure() {
        chat.getMessages().put("m-1", message("m-1", "original"));
        doThrow(new StorageException("down")).when(chatStore).updateMessageText("m-1", "changed");

        assertThat(chatMessageService.editMessage(CHAT_ID, new MessageEdit("m-1", "changed"))).isFalse();

        assertThat(chat.getMessages().get("m-1").getMessage()).isEqualTo("original");
    }

    @Test
    @DisplayName("removing a message twice succeeds both times")
    void removeMessage_idempotent() {
        chat.getMessages().put("m-1", message("m-1", "bye"));

        assertThat(chatMessageService.removeMessage(CHAT_ID, "m-1")).isTrue();
        assertThat(chatMessageService.removeMessage(CHAT_ID, "m-1")).isTrue();

        assertThat(chat.getMessages()).isEmpty();
    }

    @Test
    @DisplayName("removing from an unknown chat reports not found")
    void removeMessage_unknownChat() {
        assertThat(chatMessageService.removeMessage("missing", "m-1")).isFalse();

        verify(chatStore, never()).deleteMessage(any());
    }

    @Test
    @DisplayName("a failed store delete keeps the message cached")
    void removeMessage_storeFailure() {
        chat.getMessages().put("m-1", message("m-1", "bye"));
        doThrow(new StorageException("down")).when(chatStore).deleteMessage("m-1");

        assertThat(chatMessageService.removeMessage(CHAT_ID, "m-1")).isFalse();

        assertThat(chat.getMessages()).containsOnlyKeys("m-1");
    }

    private void activeUser(String loginId, String email, String storeId) {
        ChatUser user = sessions.addToWaitingList(loginId, email, new RecordingConnection("socket-" + loginId));
        user.setId(storeId);
        user.addChatId(CHAT_ID);
        user.setCurrentChatId(CHAT_ID);
        sessions.promoteToActive(user);
    }

    private static CachedMessage message(String id, String text) {
        return CachedMessage.builder()
                .id(id)
                .message(text)
                .senderId("anon-2")
                .time(T0)
                .type(MessageType.MESSAGE)
                .build();
    }
}
