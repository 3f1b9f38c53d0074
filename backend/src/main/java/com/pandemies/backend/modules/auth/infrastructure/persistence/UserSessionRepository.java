package com.pandemies.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;

import com.pandemies.backend.modules.auth.domain.UserSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSessionRepository extends JpaRepository<UserSession, Long> {

    @Query("select us from UserSession us join fetch us.user where us.token = :token")
    Optional<UserSession> findByTokenWithUser(@Param("token") String token);

    boolean existsByToken(String token);

    long countByUserId(Long userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from UserSession us where us.token = :token")
    int deleteByToken(@Param("token") String token);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from UserSession us where us.expiresAt <= :now")
    int deleteExpiredAsOf(@Param("now") OffsetDateTime now);
}
