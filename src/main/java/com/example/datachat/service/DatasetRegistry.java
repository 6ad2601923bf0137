package com.example.datachat.service;

import com.example.datachat.model.entity.Dataset;
import com.example.datachat.repository.DatasetRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Resuelve ids de dataset a {nombre, url} dentro de un proyecto.
 */
@Service
public class DatasetRegistry {

    private static final Logger log = LoggerFactory.getLogger(DatasetRegistry.class);

    private final DatasetRepository datasetRepo;

    public DatasetRegistry(DatasetRepository datasetRepo) {
        this.datasetRepo = datasetRepo;
    }

    /**
     * Devuelve los datasets en el mismo orden que {@code ids}.
     * Los ids que no existen o son de otro proyecto se descartan sin error
     * (pueden apuntar a datasets ya borrados).
     */
    @Transactional(readOnly = true)
    public List<AnalysisContext.DatasetRef> resolve(String projectId, Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }

        Map<String, Dataset> byId = datasetRepo.findByProject_IdAndIdIn(projectId, ids).stream()
                .collect(Collectors.toMap(Dataset::getId, Function.identity(), (a, b) -> a));

        List<AnalysisContext.DatasetRef> out = new ArrayList<>(byId.size());
        for (String id : ids) {
            Dataset d = byId.get(id);
            if (d != null) {
                out.add(new AnalysisContext.DatasetRef(d.getName(), d.getUrl()));
            }
        }

        if (out.size() < ids.size()) {
            log.debug("datasets sin resolver projectId={} requested={} resolved={}",
                    projectId, ids.size(), out.size());
        }
        return out;
    }
}
