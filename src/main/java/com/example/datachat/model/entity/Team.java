package com.example.datachat.model.entity;

import jakarta.persistence.*;
import java.util.LinkedHashSet;
import java.util.Set;

@Entity
@Table(name = "team")
public class Team {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 120)
    private String name;

    @Column(name = "organization_id", nullable = false, length = 36)
    private String organizationId;

    // Solo ids: el perfil del miembro no hace falta para autorizar.
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "team_member", joinColumns = @JoinColumn(name = "team_id"))
    @Column(name = "user_id", nullable = false)
    private Set<Long> memberIds = new LinkedHashSet<>();

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getOrganizationId() { return organizationId; }
    public void setOrganizationId(String organizationId) { this.organizationId = organizationId; }

    public Set<Long> getMemberIds() { return memberIds; }

    public boolean hasMember(Long userId) {
        return userId != null && memberIds.contains(userId);
    }
}
