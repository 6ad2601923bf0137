package com.example.datachat.repository;

import com.example.datachat.model.entity.Dataset;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface DatasetRepository extends JpaRepository<Dataset, String> {
    List<Dataset> findByProject_IdAndIdIn(String projectId, Collection<String> ids);
}
