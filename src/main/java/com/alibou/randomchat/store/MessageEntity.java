package com.alibou.randomchat.store;

import com.alibou.randomchat.chat.MessageType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "messages")
public class MessageEntity {

    @Id
    @Column(length = 40)
    private String id;

    @Column(nullable = false, length = 4000)
    private String message;

    /** null, если запись отправителя удалена */
    @ManyToOne
    @JoinColumn(name = "sender_id")
    private ActiveUserEntity sender;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "chat_id")
    private ChatEntity chat;

    /** порядковый номер в чате: сообщения читаются в порядке добавления, а не по времени */
    @Column(name = "chat_position")
    private Long chatPosition;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 24)
    private MessageType type;

    @Column(nullable = false)
    private Instant createdAt;

    @PrePersist
    void assignId() {
        if (id == null) id = UUID.randomUUID().toString();
    }

    public StoredMessage toStored() {
        return new StoredMessage(id, message,
                sender == null ? null : sender.toStored(),
                type, createdAt);
    }
}
