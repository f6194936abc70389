package com.alibou.randomchat.user;

/**
 * Живое соединение клиента. Что значит «подписать на канал», решает
 * транспорт; ядро лишь просит об этом при создании чата.
 */
public interface ChatConnection {

    String getId();

    void joinChannel(String channelId);
}
