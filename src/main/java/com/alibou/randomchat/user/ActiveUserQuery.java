package com.alibou.randomchat.user;

/** Пользователя определяет любое непустое поле. */
public record ActiveUserQuery(String socketId, String loginId, String email) {

    public static ActiveUserQuery bySocketId(String socketId) {
        return new ActiveUserQuery(socketId, null, null);
    }

    public static ActiveUserQuery byLoginId(String loginId) {
        return new ActiveUserQuery(null, loginId, null);
    }

    public static ActiveUserQuery byEmail(String email) {
        return new ActiveUserQuery(null, null, email);
    }
}
