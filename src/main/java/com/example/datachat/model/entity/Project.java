package com.example.datachat.model.entity;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "project")
public class Project {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 160)
    private String name;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "team_id")
    private Team team;

    @Column(nullable = false)
    private Instant createdAt = Instant.now();

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public Team getTeam() { return team; }
    public void setTeam(Team team) { this.team = team; }

    public Instant getCreatedAt() { return createdAt; }
}
