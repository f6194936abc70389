package com.alibou.randomchat.user;

public record ErrorNotice(String error, String message) {
}
