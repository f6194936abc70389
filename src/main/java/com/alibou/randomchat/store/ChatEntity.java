package com.alibou.randomchat.store;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Getter @Setter
@NoArgsConstructor
@Entity
@Table(name = "chats")
public class ChatEntity {

    @Id
    @Column(length = 40)
    private String id;

    @ManyToMany
    @JoinTable(name = "chat_users",
            joinColumns = @JoinColumn(name = "chat_id"),
            inverseJoinColumns = @JoinColumn(name = "user_id"))
    @OrderColumn(name = "position")
    private List<ActiveUserEntity> users = new ArrayList<>();

    @OneToMany(mappedBy = "chat")
    @OrderBy("chatPosition ASC")
    private List<MessageEntity> messages = new ArrayList<>();

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    public ChatEntity(String id, List<ActiveUserEntity> users, Instant createdAt) {
        this.id        = id;
        this.users     = new ArrayList<>(users);
        this.createdAt = createdAt;
    }

    public StoredChat toStored() {
        return new StoredChat(
                id,
                users.stream().map(ActiveUserEntity::toStored).toList(),
                messages.stream().map(MessageEntity::toStored).toList(),
                createdAt);
    }
}
