package com.alibou.randomchat.store;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "active_users")
public class ActiveUserEntity {

    @Id
    @Column(length = 40)
    private String id;

    private String email;

    @Column(nullable = false, length = 120)
    private String loginId;

    /** Чат, открытый у пользователя; просто id, строка чата может появиться позже. */
    @Column(length = 40)
    private String currentChatId;

    @Column(length = 64)
    private String attachToken;

    @PrePersist
    void assignId() {
        if (id == null) id = UUID.randomUUID().toString();
    }

    public StoredUser toStored() {
        return new StoredUser(id, email, loginId, currentChatId, attachToken);
    }
}
