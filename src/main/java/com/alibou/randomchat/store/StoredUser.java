package com.alibou.randomchat.store;

/**
 * Проекция сохранённого активного пользователя. {@code attachToken} знает
 * только клиент, получивший его при входе.
 */
public record StoredUser(String id, String email, String loginId, String currentChatId, String attachToken) {

    public String emailOrLoginId() {
        return email != null ? email : loginId;
    }
}
