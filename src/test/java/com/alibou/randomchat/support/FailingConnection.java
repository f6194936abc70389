package com.alibou.randomchat.support;

import com.alibou.randomchat.user.ChatConnection;
import org.springframework.messaging.MessageDeliveryException;

/** Connection whose broker delivery always fails. */
public class FailingConnection implements ChatConnection {

    private final String id;
    private int attempts;

    public FailingConnection(String id) {
        this.id = id;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public void joinChannel(String channelId) {
        attempts++;
        throw new MessageDeliveryException("Session " + id + " is gone");
    }

    public int attempts() {
        return attempts;
    }
}
