package com.alibou.randomchat.chat;

public record MessageEdit(String id, String message) {
}
