package com.alibou.randomchat.store;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ChatRepository extends JpaRepository<ChatEntity, String> {

    @EntityGraph(attributePaths = "users")
    List<ChatEntity> findAllByOrderByCreatedAtAsc();

    List<ChatEntity> findAllByUsersIdOrderByCreatedAtAsc(String userId);
}
