package com.alibou.randomchat.cache;

import com.alibou.randomchat.chat.MessageType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder(toBuilder = true)
public class CachedMessage {

    private String      id;
    private String      message;
    private String      senderId;   // emailOrLoginId отправителя
    private Instant     time;
    private MessageType type;
}
