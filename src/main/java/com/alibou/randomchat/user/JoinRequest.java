package com.alibou.randomchat.user;

public record JoinRequest(String loginId, String email) {
}
