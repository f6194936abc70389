package com.alibou.randomchat.bootstrap;

import com.alibou.randomchat.cache.CachedChat;
import com.alibou.randomchat.cache.CachedMessage;
import com.alibou.randomchat.cache.ChatCache;
import com.alibou.randomchat.config.ChatProperties;
import com.alibou.randomchat.exception.InconsistentStateException;
import com.alibou.randomchat.exception.StorageException;
import com.alibou.randomchat.store.ChatStore;
import com.alibou.randomchat.store.StoredChat;
import com.alibou.randomchat.store.StoredMessage;
import com.alibou.randomchat.store.StoredUser;
import com.alibou.randomchat.user.ChatUser;
import com.alibou.randomchat.user.SessionRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Восстанавливает кэш из хранилища после рестарта: сначала чаты, затем
 * активные пользователи со списками чатов. У восстановленных пользователей
 * нет соединений, пока клиенты не переподключатся.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatCacheInitializer implements ApplicationListener<ApplicationReadyEvent> {

    private final ChatCache       cache;
    private final ChatStore       chatStore;
    private final SessionRegistry sessions;
    private final ChatProperties  properties;

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        if (properties.getBootstrap().isEnabled()) {
            init();
        }
    }

    public BootstrapReport init() {
        OrphanedSenderPolicy policy = properties.getBootstrap().getOrphanedSender();

        return cache.write(() -> {
            int chatCount = 0, messageCount = 0, skipped = 0, userCount = 0, stale = 0;

            for (StoredChat stored : chatStore.findChats()) {
                Map<String, CachedMessage> messages = new LinkedHashMap<>();
                List<StoredMessage> persisted = stored.messages();
                for (int i = 0; i < persisted.size(); i++) {
                    StoredMessage message = persisted.get(i);
                    if (message.sender() == null) {
                        if (policy == OrphanedSenderPolicy.FAIL) {
                            throw new InconsistentStateException(
                                    "У сообщения " + message.id() + " чата " + stored.id() + " нет отправителя");
                        }
                        if (policy == OrphanedSenderPolicy.ABORT_CHAT) {
                            int rest = persisted.size() - i;
                            log.warn("Чат {}: у сообщения {} нет отправителя, не загружено сообщений: {}",
                                    stored.id(), message.id(), rest);
                            skipped += rest;
                            break;
                        }
                        log.warn("Чат {}: пропущено сообщение {} без отправителя", stored.id(), message.id());
                        skipped++;
                        continue;
                    }
                    messages.put(message.id(), CachedMessage.builder()
                            .id(message.id())
                            .message(message.message())
                            .senderId(message.sender().emailOrLoginId())
                            .time(message.createdAt())
                            .type(message.type())
                            .build());
                }

                List<String> userIds = stored.members().stream().map(StoredUser::emailOrLoginId).toList();
                cache.putChat(new CachedChat(stored.id(), userIds, messages, stored.createdAt()));
                chatCount++;
                messageCount += messages.size();
            }

            for (StoredUser stored : chatStore.findUsers()) {
                List<String> chatIds = chatStore.findChatIdsByMember(stored.id());
                if (chatIds.isEmpty()) {
                    dropStale(stored);
                    stale++;
                    continue;
                }

                ChatUser user = new ChatUser(stored.loginId(), stored.email());
                user.setId(stored.id());
                user.setAttachToken(stored.attachToken());
                chatIds.forEach(user::addChatId);
                user.setCurrentChatId(chatIds.contains(stored.currentChatId())
                        ? stored.currentChatId()
                        : chatIds.get(chatIds.size() - 1));
                sessions.promoteToActive(user);
                userCount++;
            }

            BootstrapReport report = new BootstrapReport(chatCount, messageCount, skipped, userCount, stale);
            log.info("Кэш восстановлен: {}", report);
            return report;
        });
    }

    /* запись пользователя без чатов осталась от прерванного закрытия */
    private void dropStale(StoredUser stored) {
        try {
            chatStore.deleteUser(stored.id());
            log.info("Удалён пользователь {} без чатов", stored.emailOrLoginId());
        } catch (StorageException ex) {
            log.warn("Пользователя {} без чатов удалить не удалось: {}", stored.emailOrLoginId(), ex.getMessage());
        }
    }
}
