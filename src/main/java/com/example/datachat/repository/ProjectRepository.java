package com.example.datachat.repository;

import com.example.datachat.model.entity.Project;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ProjectRepository extends JpaRepository<Project, String> {

    @EntityGraph(attributePaths = "team")
    Optional<Project> findWithTeamById(String id);
}
