package com.alibou.randomchat.store;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ActiveUserRepository extends JpaRepository<ActiveUserEntity, String> {
}
