package com.alibou.randomchat.user;

/** Новая вкладка: кого подключаем и токен, выданный при входе. */
public record AttachRequest(String emailOrLoginId, String attachToken) {
}
