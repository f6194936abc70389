package com.alibou.randomchat.bootstrap;

public record BootstrapReport(int chats, int messages, int skippedMessages, int users, int staleUsers) {
}
