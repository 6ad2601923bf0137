package com.example.datachat.service;

import com.example.datachat.exception.ChatAccessDeniedException;
import com.example.datachat.exception.ResourceNotFoundException;
import com.example.datachat.model.entity.AppUser;
import com.example.datachat.model.entity.Project;
import com.example.datachat.model.entity.Team;
import com.example.datachat.repository.ProjectRepository;
import com.example.datachat.security.CallerIdentity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProjectAccessGuardTest {

    @Mock
    private ProjectRepository projectRepo;

    @InjectMocks
    private ProjectAccessGuard guard;

    private Project project;

    @BeforeEach
    void setUp() {
        Team team = new Team();
        team.setId("t1");
        team.setOrganizationId("org-1");
        team.getMemberIds().add(7L);

        project = new Project();
        project.setId("p1");
        project.setTeam(team);
    }

    @Test
    void memberOfSameOrganizationIsAllowed() {
        when(projectRepo.findWithTeamById("p1")).thenReturn(Optional.of(project));

        Project loaded = guard.requireAccess(caller(7L, "org-1", AppUser.GlobalRole.USER), "p1");

        assertThat(loaded).isSameAs(project);
    }

    @Test
    void superadminBypassesTeamCheck() {
        when(projectRepo.findWithTeamById("p1")).thenReturn(Optional.of(project));

        ProjectAccessGuard.AccessDecision decision =
                guard.authorize(caller(99L, "other-org", AppUser.GlobalRole.SUPERADMIN), "p1");

        assertThat(decision.allowed()).isTrue();
    }

    @Test
    void otherOrganizationIsDenied() {
        when(projectRepo.findWithTeamById("p1")).thenReturn(Optional.of(project));

        ProjectAccessGuard.AccessDecision decision =
                guard.authorize(caller(7L, "org-2", AppUser.GlobalRole.TEAM_ADMIN), "p1");

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).isEqualTo(ChatAccessDeniedException.Reason.WRONG_ORGANIZATION);
    }

    @Test
    void sameOrganizationButNotMemberThrowsNotAMember() {
        when(projectRepo.findWithTeamById("p1")).thenReturn(Optional.of(project));

        assertThatThrownBy(() -> guard.requireAccess(caller(8L, "org-1", AppUser.GlobalRole.USER), "p1"))
                .isInstanceOfSatisfying(ChatAccessDeniedException.class,
                        ex -> assertThat(ex.getReason().code()).isEqualTo("not-a-member"));
    }

    @Test
    void missingProjectIsNotFound() {
        when(projectRepo.findWithTeamById("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> guard.requireAccess(caller(7L, "org-1", AppUser.GlobalRole.USER), "nope"))
                .isInstanceOfSatisfying(ResourceNotFoundException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(ResourceNotFoundException.Kind.PROJECT));
    }

    @Test
    void projectWithoutTeamIsNotFound() {
        project.setTeam(null);
        when(projectRepo.findWithTeamById("p1")).thenReturn(Optional.of(project));

        assertThatThrownBy(() -> guard.authorize(caller(7L, "org-1", AppUser.GlobalRole.SUPERADMIN), "p1"))
                .isInstanceOfSatisfying(ResourceNotFoundException.class,
                        ex -> assertThat(ex.getKind()).isEqualTo(ResourceNotFoundException.Kind.TEAM));
    }

    private static CallerIdentity caller(Long id, String org, AppUser.GlobalRole role) {
        return new CallerIdentity(id, org, role);
    }
}
