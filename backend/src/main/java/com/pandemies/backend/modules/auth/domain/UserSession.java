package com.pandemies.backend.modules.auth.domain;

import java.time.OffsetDateTime;

import com.pandemies.backend.global.jpa.AbstractCreatedAtEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

@Entity
@Table(name = "sessions")
public class UserSession extends AbstractCreatedAtEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id_session", nullable = false, updatable = false)
    private Long id;

    @Column(name = "token", nullable = false, unique = true, updatable = false, length = 255)
    private String token;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private AppUser user;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "ip_address", length = 45)
    private String sourceAddress;

    @Column(name = "user_agent", length = 512)
    private String clientDescriptor;

    public Long getId() {
        return id;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public AppUser getUser() {
        return user;
    }

    public void setUser(AppUser user) {
        this.user = user;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(OffsetDateTime expiresAt) {
        this.expiresAt = expiresAt;
    }

    public String getSourceAddress() {
        return sourceAddress;
    }

    public void setSourceAddress(String sourceAddress) {
        this.sourceAddress = sourceAddress;
    }

    public String getClientDescriptor() {
        return clientDescriptor;
    }

    public void setClientDescriptor(String clientDescriptor) {
        this.clientDescriptor = clientDescriptor;
    }

    /**
     * Valid strictly before {@code expiresAt}; at the expiry instant the session is already expired.
     */
    public boolean isValidAt(OffsetDateTime now) {
        return now.isBefore(expiresAt);
    }

    public SessionState stateAt(OffsetDateTime now) {
        return isValidAt(now) ? SessionState.ACTIVE : SessionState.EXPIRED;
    }
}
