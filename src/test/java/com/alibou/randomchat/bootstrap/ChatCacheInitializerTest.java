package com.alibou.randomchat.bootstrap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import java.time.Instant;
import java.util.List;

import com.alibou.randomchat.cache.CachedChat;
import com.alibou.randomchat.cache.CachedMessage;
import com.alibou.randomchat.cache.ChatCache;
import com.alibou.randomchat.chat.MessageType;
import com.alibou.randomchat.config.ChatProperties;
import com.alibou.randomchat.exception.InconsistentStateException;
import com.alibou.randomchat.store.StoredMessage;
import com.alibou.randomchat.store.StoredUser;
import com.alibou.randomchat.support.InMemoryChatStore;
import com.alibou.randomchat.user.ChatUser;
import com.alibou.randomchat.user.SessionRegistry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ChatCacheInitializerTest {

    private static final Instant T0 = Instant.parse("2025-01-01T10:00:00Z");

    private ChatCache cache;
    private InMemoryChatStore store;
    private SessionRegistry sessions;
    private ChatProperties properties;
    private ChatCacheInitializer initializer;

    private StoredUser ann;
    private StoredUser bob;

    @BeforeEach
    void setUp() {
        cache = new ChatCache();
        store = new InMemoryChatStore();
        sessions = new SessionRegistry(cache, store);
        properties = new ChatProperties();
        initializer = new ChatCacheInitializer(cache, store, sessions, properties);

        ann = store.createUser("ann@example.com", "anon-1", "chat-1", null);
        bob = store.createUser(null, "anon-2", "chat-1", null);
        store.createChat("chat-1", List.of(ann.id(), bob.id()));
    }

    @Test
    @DisplayName("a persisted chat comes back with its members and attributed messages")
    void init_restoresChatAndUsers() {
        String m1 = message("chat-1", "hello", ann, T0);
        String m2 = message("chat-1", "hi back", bob, T0.plusSeconds(5));

        BootstrapReport report = initializer.init();

        assertThat(report).isEqualTo(new BootstrapReport(1, 2, 0, 2, 0));
        CachedChat chat = cache.read(() -> cache.getChat("chat-1"));
        assertThat(chat.getUserIds()).containsExactly("ann@example.com", "anon-2");
        assertThat(chat.orderedMessages())
                .extracting(CachedMessage::getId, CachedMessage::getSenderId, CachedMessage::getMessage)
                .containsExactly(
                        tuple(m1, "ann@example.com", "hello"),
                        tuple(m2, "anon-2", "hi back"));

        ChatUser restored = sessions.getActiveUser("ann@example.com").orElseThrow();
        assertThat(restored.getId()).isEqualTo(ann.id());
        assertThat(restored.getChatIds()).containsExactly("chat-1");
        assertThat(restored.getCurrentChatId()).isEqualTo("chat-1");
        assertThat(restored.getConnectionIds()).isEmpty();
        assertThat(sessions.findActiveUser("anon-1")).containsSame(restored);
    }

    @Test
    @DisplayName("a stored current chat that no longer exists falls back to the latest chat")
    void init_repairsCurrentChat() {
        StoredUser cid = store.createUser(null, "anon-3", "gone", null);
        store.createChat("chat-2", List.of(ann.id(), cid.id()));

        initializer.init();

        assertThat(sessions.getActiveUser("anon-3").orElseThrow().getCurrentChatId()).isEqualTo("chat-2");
        assertThat(sessions.getActiveUser("ann@example.com").orElseThrow().getChatIds())
                .containsExactly("chat-1", "chat-2");
        assertThat(sessions.getActiveUser("ann@example.com").orElseThrow().getCurrentChatId())
                .isEqualTo("chat-1");
    }

    @Test
    @DisplayName("by default a message without sender is skipped and the rest of the chat loads")
    void init_skipsOrphanedMessage() {
        message("chat-1", "one", ann, T0);
        String orphan = message("chat-1", "two", bob, T0.plusSeconds(1));
        String last = message("chat-1", "three", ann, T0.plusSeconds(2));
        store.orphan(orphan);

        BootstrapReport report = initializer.init();

        assertThat(report.messages()).isEqualTo(2);
        assertThat(report.skippedMessages()).isEqualTo(1);
        assertThat(cache.read(() -> cache.getChat("chat-1")).getMessages()).doesNotContainKey(orphan).containsKey(last);
    }

    @Test
    @DisplayName("aborting a chat keeps the messages loaded before the orphan")
    void init_abortsChatOnOrphan() {
        properties.getBootstrap().setOrphanedSender(OrphanedSenderPolicy.ABORT_CHAT);
        String first = message("chat-1", "one", ann, T0);
        String orphan = message("chat-1", "two", bob, T0.plusSeconds(1));
        message("chat-1", "three", ann, T0.plusSeconds(2));
        store.orphan(orphan);

        BootstrapReport report = initializer.init();

        assertThat(report.chats()).isEqualTo(1);
        assertThat(report.messages()).isEqualTo(1);
        assertThat(report.skippedMessages()).isEqualTo(2);
        assertThat(cache.read(() -> cache.getChat("chat-1")).getMessages()).containsOnlyKeys(first);
        assertThat(report.users()).isEqualTo(2);
    }

    @Test
    @DisplayName("the strict policy refuses to start on an orphaned message")
    void init_failsOnOrphan() {
        properties.getBootstrap().setOrphanedSender(OrphanedSenderPolicy.FAIL);
        String orphan = message("chat-1", "lost", bob, T0);
        store.orphan(orphan);

        assertThatThrownBy(() -> initializer.init())
                .isInstanceOf(InconsistentStateException.class)
                .hasMessageContaining(orphan);
    }

    @Test
    @DisplayName("a user record without chats is dropped as stale")
    void init_dropsStaleUser() {
        StoredUser stale = store.createUser(null, "anon-9", null, null);

        BootstrapReport report = initializer.init();

        assertThat(report.staleUsers()).isEqualTo(1);
        assertThat(report.users()).isEqualTo(2);
        assertThat(sessions.isActive("anon-9")).isFalse();
        assertThat(store.hasUser(stale.id())).isFalse();
    }

    private String message(String chatId, String text, StoredUser sender, Instant at) {
        StoredMessage stored = store.createMessage(text, sender.id(), MessageType.MESSAGE, at);
        store.appendMessageRef(chatId, stored.id());
        return stored.id();
    }
}
