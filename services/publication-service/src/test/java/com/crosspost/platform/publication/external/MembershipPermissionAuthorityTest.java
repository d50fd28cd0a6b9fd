package com.crosspost.platform.publication.external;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.crosspost.platform.publication.entity.Project;
import com.crosspost.platform.publication.entity.ProjectMember;
import com.crosspost.platform.publication.exception.ForbiddenException;
import com.crosspost.platform.publication.model.Capability;
import com.crosspost.platform.publication.model.ProjectRole;
import com.crosspost.platform.publication.repository.ProjectMemberRepository;
import com.crosspost.platform.publication.repository.ProjectRepository;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MembershipPermissionAuthorityTest {

    private final UUID ownerId = UUID.randomUUID();
    private final UUID editorId = UUID.randomUUID();
    private final UUID viewerId = UUID.randomUUID();
    private final UUID strangerId = UUID.randomUUID();

    private ProjectRepository projectRepository;
    private ProjectMemberRepository memberRepository;
    private MembershipPermissionAuthority authority;
    private Project project;

    @BeforeEach
    void setUp() {
        projectRepository = mock(ProjectRepository.class);
        memberRepository = mock(ProjectMemberRepository.class);
        authority = new MembershipPermissionAuthority(projectRepository, memberRepository);

        project = Project.builder().id(UUID.randomUUID()).ownerId(ownerId).name("Newsroom").build();
        when(projectRepository.findById(project.getId())).thenReturn(Optional.of(project));
        member(editorId, ProjectRole.EDITOR);
        member(viewerId, ProjectRole.VIEWER);
    }

    @Test
    void owner_and_members_can_access() {
        assertDoesNotThrow(() -> authority.checkAccess(project.getId(), ownerId));
        assertDoesNotThrow(() -> authority.checkAccess(project.getId(), viewerId));
        assertThrows(ForbiddenException.class, () -> authority.checkAccess(project.getId(), strangerId));
        assertThrows(ForbiddenException.class, () -> authority.checkAccess(UUID.randomUUID(), ownerId));
    }

    @Test
    void editor_may_only_touch_own_publications() {
        assertDoesNotThrow(() -> authority.checkPermission(project.getId(), editorId, Capability.PUBLICATIONS_CREATE));
        assertDoesNotThrow(() -> authority.checkPermission(project.getId(), editorId, Capability.PUBLICATIONS_UPDATE_OWN));
        assertThrows(ForbiddenException.class,
                () -> authority.checkPermission(project.getId(), editorId, Capability.PUBLICATIONS_UPDATE_ALL));
        assertThrows(ForbiddenException.class,
                () -> authority.checkPermission(project.getId(), editorId, Capability.PUBLICATIONS_DELETE_ALL));
    }

    @Test
    void viewer_can_only_read() {
        assertDoesNotThrow(() -> authority.checkPermission(project.getId(), viewerId, Capability.PUBLICATIONS_READ));
        assertThrows(ForbiddenException.class,
                () -> authority.checkPermission(project.getId(), viewerId, Capability.PUBLICATIONS_CREATE));
    }

    @Test
    void archived_project_is_read_only_even_for_owner() {
        project.setArchivedAt(OffsetDateTime.now());

        assertDoesNotThrow(() -> authority.checkPermission(project.getId(), ownerId, Capability.PUBLICATIONS_READ));
        assertThrows(ForbiddenException.class,
                () -> authority.checkPermission(project.getId(), ownerId, Capability.PUBLICATIONS_UPDATE_OWN));
    }

    private void member(UUID userId, ProjectRole role) {
        when(memberRepository.findByProjectIdAndUserId(project.getId(), userId)).thenReturn(Optional.of(
                ProjectMember.builder().projectId(project.getId()).userId(userId).role(role).build()));
    }
}
