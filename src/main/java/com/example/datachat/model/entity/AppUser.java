package com.example.datachat.model.entity;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Usuario autenticado. Se gestiona fuera de este servicio; aquí solo se lee
 * para resolver la organización y el rol global del llamante.
 */
@Entity
@Table(name = "app_user")
public class AppUser {

    public enum GlobalRole { USER, TEAM_ADMIN, SUPERADMIN }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 80)
    private String username;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Column(nullable = false)
    private boolean enabled = true;

    @Column(name = "organization_id", length = 36)
    private String organizationId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private GlobalRole role = GlobalRole.USER;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public String getPasswordHash() { return passwordHash; }
    public void setPasswordHash(String passwordHash) { this.passwordHash = passwordHash; }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getOrganizationId() { return organizationId; }
    public void setOrganizationId(String organizationId) { this.organizationId = organizationId; }

    public GlobalRole getRole() { return role; }
    public void setRole(GlobalRole role) { this.role = role; }

    public Instant getCreatedAt() { return createdAt; }
}
