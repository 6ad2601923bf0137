package com.example.datachat.service;

import com.example.datachat.exception.ChatAccessDeniedException;
import com.example.datachat.exception.ResourceNotFoundException;
import com.example.datachat.model.entity.Project;
import com.example.datachat.model.entity.Team;
import com.example.datachat.repository.ProjectRepository;
import com.example.datachat.security.CallerIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Comprueba que el llamante pertenece al equipo dueño del proyecto.
 * Solo lectura: se invoca antes de cualquier escritura en cada operación de chat.
 */
@Service
public class ProjectAccessGuard {

    private static final Logger log = LoggerFactory.getLogger(ProjectAccessGuard.class);

    private final ProjectRepository projectRepo;

    public ProjectAccessGuard(ProjectRepository projectRepo) {
        this.projectRepo = projectRepo;
    }

    /**
     * Resultado de autorizar: permitido, o denegado con su motivo.
     */
    public record AccessDecision(boolean allowed, ChatAccessDeniedException.Reason reason) {
        static AccessDecision allow() {
            return new AccessDecision(true, null);
        }

        static AccessDecision deny(ChatAccessDeniedException.Reason reason) {
            return new AccessDecision(false, reason);
        }
    }

    @Transactional(readOnly = true)
    public AccessDecision authorize(CallerIdentity caller, String projectId) {
        return evaluate(caller, loadProject(projectId));
    }

    /**
     * Igual que {@link #authorize} pero lanza {@link ChatAccessDeniedException} si se deniega.
     * Devuelve el proyecto ya cargado para no volver a leerlo.
     */
    @Transactional(readOnly = true)
    public Project requireAccess(CallerIdentity caller, String projectId) {
        Project project = loadProject(projectId);
        AccessDecision decision = evaluate(caller, project);
        if (!decision.allowed()) {
            log.warn("access denied userId={} projectId={} reason={}",
                    caller.userId(), projectId, decision.reason().code());
            throw new ChatAccessDeniedException(decision.reason());
        }
        return project;
    }

    private Project loadProject(String projectId) {
        Project project = projectRepo.findWithTeamById(projectId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceNotFoundException.Kind.PROJECT, projectId));
        if (project.getTeam() == null) {
            throw new ResourceNotFoundException(ResourceNotFoundException.Kind.TEAM, projectId);
        }
        return project;
    }

    private AccessDecision evaluate(CallerIdentity caller, Project project) {
        if (caller.isSuperadmin()) {
            return AccessDecision.allow();
        }
        Team team = project.getTeam();
        if (caller.organizationId() == null || !caller.organizationId().equals(team.getOrganizationId())) {
            return AccessDecision.deny(ChatAccessDeniedException.Reason.WRONG_ORGANIZATION);
        }
        if (!team.hasMember(caller.userId())) {
            return AccessDecision.deny(ChatAccessDeniedException.Reason.NOT_A_MEMBER);
        }
        return AccessDecision.allow();
    }
}
