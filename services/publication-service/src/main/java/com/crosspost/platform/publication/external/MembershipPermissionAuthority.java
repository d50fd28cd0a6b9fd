package com.crosspost.platform.publication.external;

import com.crosspost.platform.publication.entity.Project;
import com.crosspost.platform.publication.entity.ProjectMember;
import com.crosspost.platform.publication.exception.ForbiddenException;
import com.crosspost.platform.publication.model.Capability;
import com.crosspost.platform.publication.repository.ProjectMemberRepository;
import com.crosspost.platform.publication.repository.ProjectRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * Project owner and ADMIN members hold every capability, other members
 * hold what their role grants. Archived projects are read-only.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MembershipPermissionAuthority implements PermissionAuthority {

    private final ProjectRepository projectRepository;
    private final ProjectMemberRepository memberRepository;

    @Override
    public void checkAccess(UUID projectId, UUID userId) {
        Project project = loadProject(projectId);
        if (project.getOwnerId().equals(userId)) {
            return;
        }
        if (memberRepository.findByProjectIdAndUserId(projectId, userId).isEmpty()) {
            throw new ForbiddenException("You do not have access to this project");
        }
    }

    @Override
    public void checkPermission(UUID projectId, UUID userId, Capability capability) {
        Project project = loadProject(projectId);

        if (capability.isMutation() && project.getArchivedAt() != null) {
            throw new ForbiddenException("Project is archived");
        }
        if (project.getOwnerId().equals(userId)) {
            return;
        }

        Optional<ProjectMember> member = memberRepository.findByProjectIdAndUserId(projectId, userId);
        if (member.isEmpty()) {
            throw new ForbiddenException("You do not have access to this project");
        }
        if (!member.get().getRole().grants(capability)) {
            log.debug("User {} with role {} lacks {} in project {}",
                    userId, member.get().getRole(), capability, projectId);
            throw new ForbiddenException("Missing permission: " + capability);
        }
    }

    private Project loadProject(UUID projectId) {
        return projectRepository.findById(projectId)
                .orElseThrow(() -> new ForbiddenException("You do not have access to this project"));
    }
}
