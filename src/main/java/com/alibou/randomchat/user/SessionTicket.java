package com.alibou.randomchat.user;

/** Отправляется вошедшей сессии; нужен для {@code /app/user.attach}. */
public record SessionTicket(String emailOrLoginId, String attachToken) {
}
