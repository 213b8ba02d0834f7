package com.hydralog.backend.auth.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * Read-only view of tokens issued by the auth service. This backend never creates or revokes them.
 */
@Data
@Entity @Table(name="auth_tokens")
public class AuthToken {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;
    @Column(nullable=false, unique=true, length=64) private String token;
    @Column(name="user_id", nullable=false) private Long userId;
    @Enumerated(EnumType.STRING) @Column(nullable=false, length=16) private TokenType type;
    @Column(nullable=false) private Instant expiresAt;
    @Column(nullable=false) private boolean revoked = false;
    public enum TokenType { ACCESS, REFRESH }

    public boolean isActiveAccessToken(Instant now) {
        return type == TokenType.ACCESS && !revoked && expiresAt != null && expiresAt.isAfter(now);
    }
}
