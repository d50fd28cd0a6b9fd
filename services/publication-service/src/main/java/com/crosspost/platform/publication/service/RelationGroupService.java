package com.crosspost.platform.publication.service;

import com.crosspost.platform.publication.dto.RelationGroupResponse;
import com.crosspost.platform.publication.entity.Publication;
import com.crosspost.platform.publication.entity.RelationGroup;
import com.crosspost.platform.publication.entity.RelationItem;
import com.crosspost.platform.publication.exception.BadRequestException;
import com.crosspost.platform.publication.exception.DuplicateLanguageException;
import com.crosspost.platform.publication.exception.IncompatibleLinkException;
import com.crosspost.platform.publication.exception.NotFoundException;
import com.crosspost.platform.publication.model.RelationGroupType;
import com.crosspost.platform.publication.repository.RelationGroupRepository;
import com.crosspost.platform.publication.repository.RelationItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Maintains relation groups between publications of one project, such as
 * the translations of a text. Callers are expected to have authorized the
 * user against the publications involved.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RelationGroupService {

    private final RelationGroupRepository groupRepository;
    private final RelationItemRepository itemRepository;

    /**
     * Adds the source to the target's group of the given type, creating the
     * group with the target as its origin when the target has none.
     *
     * @return id of the group both publications now belong to
     */
    @Transactional
    public UUID linkTogether(Publication source, Publication target, RelationGroupType type, UUID userId) {
        if (source.getId().equals(target.getId())) {
            throw new BadRequestException("Cannot link publication to itself");
        }
        if (!Objects.equals(source.getProjectId(), target.getProjectId())) {
            throw new IncompatibleLinkException("Cannot link publications from different projects");
        }
        if (source.getContentType() != target.getContentType()) {
            throw new IncompatibleLinkException(String.format(
                    "Cannot link publications with different content types: %s vs %s",
                    source.getContentType(), target.getContentType()));
        }

        Optional<RelationItem> sourceItem = findMembership(source.getId(), type);
        if (type.isExclusive() && sourceItem.isPresent()) {
            throw new BadRequestException("Publication already belongs to a " + type + " group");
        }

        Optional<RelationItem> targetItem = findMembership(target.getId(), type);
        RelationGroup group;
        if (targetItem.isPresent()) {
            group = targetItem.get().getGroup();
            boolean alreadyMember = group.getItems().stream()
                    .anyMatch(item -> source.getId().equals(item.getPublication().getId()));
            if (alreadyMember) {
                throw new BadRequestException("Publication is already a member of this group");
            }
            if (type == RelationGroupType.LOCALIZATION) {
                assertLanguageFree(group, source.getLanguage(), source.getId());
            }
        } else {
            if (type == RelationGroupType.LOCALIZATION && Objects.equals(source.getLanguage(), target.getLanguage())) {
                throw new DuplicateLanguageException(source.getLanguage());
            }
            group = RelationGroup.builder()
                    .projectId(target.getProjectId())
                    .type(type)
                    .createdBy(userId)
                    .build();
            group.addItem(RelationItem.builder().publication(target).build());
        }

        group.addItem(RelationItem.builder().publication(source).build());
        group = groupRepository.save(group);

        log.info("Linked publication {} to group {} (type={})", source.getId(), group.getId(), type);
        return group.getId();
    }

    @Transactional(readOnly = true)
    public void assertLanguageUnique(UUID groupId, String language, UUID excludingPublicationId) {
        assertLanguageFree(getGroup(groupId), language, excludingPublicationId);
    }

    /**
     * Rejects a language change that would clash inside any localization group
     * the publication belongs to.
     */
    @Transactional(readOnly = true)
    public void assertLanguageChangeAllowed(Publication publication, String newLanguage) {
        for (RelationItem item : itemRepository.findByPublicationAndGroupType(
                publication.getId(), RelationGroupType.LOCALIZATION)) {
            assertLanguageFree(item.getGroup(), newLanguage, publication.getId());
        }
    }

    /**
     * Removes the membership and compacts positions. The group is kept even when empty.
     */
    @Transactional
    public void unlink(UUID publicationId, UUID groupId) {
        RelationItem item = itemRepository.findByPublicationIdAndGroupId(publicationId, groupId)
                .orElseThrow(() -> new NotFoundException("Publication is not a member of this group"));
        detach(item);
        log.info("Unlinked publication {} from group {}", publicationId, groupId);
    }

    @Transactional
    public int unlinkAll(UUID publicationId) {
        List<RelationItem> items = itemRepository.findByPublicationId(publicationId);
        items.forEach(this::detach);
        if (!items.isEmpty()) {
            log.info("Removed publication {} from {} relation groups", publicationId, items.size());
        }
        return items.size();
    }

    /**
     * Reorders the group to follow the given publication ids, which must list
     * every member exactly once.
     */
    @Transactional
    public RelationGroup reorder(UUID groupId, List<UUID> publicationIds) {
        RelationGroup group = getGroup(groupId);
        Set<UUID> members = group.getItems().stream()
                .map(item -> item.getPublication().getId())
                .collect(Collectors.toSet());
        if (publicationIds == null
                || publicationIds.size() != members.size()
                || !members.equals(new HashSet<>(publicationIds))) {
            throw new BadRequestException("Reorder must list every group member exactly once");
        }

        group.getItems().sort(Comparator.comparingInt(item -> publicationIds.indexOf(item.getPublication().getId())));
        group.compactPositions();
        log.info("Reordered group {}", groupId);
        return groupRepository.save(group);
    }

    @Transactional(readOnly = true)
    public RelationGroup getGroup(UUID groupId) {
        return groupRepository.findById(groupId)
                .orElseThrow(() -> new NotFoundException("Relation group not found"));
    }

    @Transactional(readOnly = true)
    public List<RelationGroupResponse> groupsOf(UUID publicationId) {
        return itemRepository.findByPublicationId(publicationId).stream()
                .map(RelationItem::getGroup)
                .map(this::toResponse)
                .collect(Collectors.toList());
    }

    public RelationGroupResponse toResponse(RelationGroup group) {
        return RelationGroupResponse.builder()
                .id(group.getId())
                .projectId(group.getProjectId())
                .type(group.getType())
                .members(group.getItems().stream()
                        .sorted(Comparator.comparing(RelationItem::getPosition))
                        .map(item -> RelationGroupResponse.Member.builder()
                                .publicationId(item.getPublication().getId())
                                .title(item.getPublication().getTitle())
                                .language(item.getPublication().getLanguage())
                                .position(item.getPosition())
                                .build())
                        .collect(Collectors.toList()))
                .build();
    }

    private Optional<RelationItem> findMembership(UUID publicationId, RelationGroupType type) {
        return itemRepository.findByPublicationAndGroupType(publicationId, type).stream().findFirst();
    }

    private void assertLanguageFree(RelationGroup group, String language, UUID excludingPublicationId) {
        boolean taken = group.getItems().stream()
                .map(RelationItem::getPublication)
                .filter(member -> !member.getId().equals(excludingPublicationId))
                .anyMatch(member -> Objects.equals(member.getLanguage(), language));
        if (taken) {
            throw new DuplicateLanguageException(language);
        }
    }

    private void detach(RelationItem item) {
        RelationGroup group = item.getGroup();
        group.getItems().removeIf(existing -> existing == item);
        group.compactPositions();
        itemRepository.delete(item);
    }
}
