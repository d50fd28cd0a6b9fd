package com.crosspost.platform.publication.service;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.crosspost.platform.publication.Fixtures;
import com.crosspost.platform.publication.entity.Publication;
import com.crosspost.platform.publication.entity.RelationGroup;
import com.crosspost.platform.publication.entity.RelationItem;
import com.crosspost.platform.publication.exception.BadRequestException;
import com.crosspost.platform.publication.exception.DuplicateLanguageException;
import com.crosspost.platform.publication.exception.IncompatibleLinkException;
import com.crosspost.platform.publication.exception.NotFoundException;
import com.crosspost.platform.publication.model.ContentType;
import com.crosspost.platform.publication.model.RelationGroupType;
import com.crosspost.platform.publication.repository.RelationGroupRepository;
import com.crosspost.platform.publication.repository.RelationItemRepository;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class RelationGroupServiceTest {

    private final UUID projectId = UUID.randomUUID();
    private final UUID userId = UUID.randomUUID();

    private RelationGroupRepository groupRepository;
    private RelationItemRepository itemRepository;
    private RelationGroupService service;

    @BeforeEach
    void setUp() {
        groupRepository = mock(RelationGroupRepository.class);
        itemRepository = mock(RelationItemRepository.class);
        Fixtures.stubSaves(groupRepository);
        service = new RelationGroupService(groupRepository, itemRepository);
    }

    @Test
    void linking_same_language_is_rejected() {
        Publication x = publication("en");
        Publication y = publication("en");

        assertThrows(DuplicateLanguageException.class,
                () -> service.linkTogether(x, y, RelationGroupType.LOCALIZATION, userId));
        verify(groupRepository, never()).save(any());
    }

    @Test
    void linking_different_languages_creates_group_with_target_as_origin() {
        Publication x = publication("fr");
        Publication y = publication("en");

        UUID groupId = service.linkTogether(x, y, RelationGroupType.LOCALIZATION, userId);

        assertNotNull(groupId);
        RelationGroup group = savedGroup();
        assertEquals(RelationGroupType.LOCALIZATION, group.getType());
        assertEquals(projectId, group.getProjectId());
        assertSame(y, group.getItems().get(0).getPublication());
        assertSame(x, group.getItems().get(1).getPublication());
        assertEquals(0, group.getItems().get(0).getPosition());
        assertEquals(1, group.getItems().get(1).getPosition());
    }

    @Test
    void source_joins_the_existing_group_of_the_target() {
        Publication en = publication("en");
        Publication fr = publication("fr");
        RelationGroup group = group(RelationGroupType.LOCALIZATION, en, fr);
        Publication de = publication("de");
        when(itemRepository.findByPublicationAndGroupType(en.getId(), RelationGroupType.LOCALIZATION))
                .thenReturn(List.of(group.getItems().get(0)));

        UUID groupId = service.linkTogether(de, en, RelationGroupType.LOCALIZATION, userId);

        assertEquals(group.getId(), groupId);
        assertEquals(3, group.getItems().size());
        assertSame(de, group.getItems().get(2).getPublication());
        assertEquals(2, group.getItems().get(2).getPosition());
    }

    @Test
    void joining_group_with_taken_language_is_rejected() {
        Publication en = publication("en");
        Publication fr = publication("fr");
        RelationGroup group = group(RelationGroupType.LOCALIZATION, en, fr);
        when(itemRepository.findByPublicationAndGroupType(en.getId(), RelationGroupType.LOCALIZATION))
                .thenReturn(List.of(group.getItems().get(0)));

        assertThrows(DuplicateLanguageException.class,
                () -> service.linkTogether(publication("fr"), en, RelationGroupType.LOCALIZATION, userId));
        assertEquals(2, group.getItems().size());
    }

    @Test
    void self_link_is_rejected() {
        Publication x = publication("en");

        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> service.linkTogether(x, x, RelationGroupType.GENERIC, userId));
        assertEquals("Cannot link publication to itself", ex.getMessage());
    }

    @Test
    void cross_project_and_cross_type_links_are_incompatible() {
        Publication x = publication("fr");
        Publication otherProject = Fixtures.publication(UUID.randomUUID(), userId);
        Publication article = publication("en");
        article.setContentType(ContentType.ARTICLE);

        assertThrows(IncompatibleLinkException.class,
                () -> service.linkTogether(x, otherProject, RelationGroupType.LOCALIZATION, userId));
        assertThrows(IncompatibleLinkException.class,
                () -> service.linkTogether(x, article, RelationGroupType.LOCALIZATION, userId));
    }

    @Test
    void source_already_in_a_series_cannot_join_another() {
        Publication x = publication("en");
        Publication y = publication("en");
        RelationGroup series = group(RelationGroupType.SERIES, x, publication("en"));
        when(itemRepository.findByPublicationAndGroupType(x.getId(), RelationGroupType.SERIES))
                .thenReturn(List.of(series.getItems().get(0)));

        assertThrows(BadRequestException.class,
                () -> service.linkTogether(x, y, RelationGroupType.SERIES, userId));
    }

    @Test
    void language_change_is_checked_against_localization_groups() {
        Publication en = publication("en");
        Publication fr = publication("fr");
        RelationGroup group = group(RelationGroupType.LOCALIZATION, en, fr);
        when(itemRepository.findByPublicationAndGroupType(en.getId(), RelationGroupType.LOCALIZATION))
                .thenReturn(List.of(group.getItems().get(0)));

        assertThrows(DuplicateLanguageException.class, () -> service.assertLanguageChangeAllowed(en, "fr"));
        service.assertLanguageChangeAllowed(en, "de");
    }

    @Test
    void unlink_compacts_positions_and_keeps_empty_group() {
        Publication a = publication("en");
        Publication b = publication("fr");
        RelationGroup group = group(RelationGroupType.LOCALIZATION, a, b);
        RelationItem first = group.getItems().get(0);
        RelationItem second = group.getItems().get(1);
        when(itemRepository.findByPublicationIdAndGroupId(a.getId(), group.getId())).thenReturn(Optional.of(first));
        when(itemRepository.findByPublicationIdAndGroupId(b.getId(), group.getId())).thenReturn(Optional.of(second));

        service.unlink(a.getId(), group.getId());

        assertEquals(1, group.getItems().size());
        assertEquals(0, second.getPosition());
        verify(itemRepository).delete(first);

        service.unlink(b.getId(), group.getId());

        assertTrue(group.getItems().isEmpty());
        verify(groupRepository, never()).delete(any());
    }

    @Test
    void language_already_held_by_another_member_is_not_unique() {
        Publication en = publication("en");
        Publication fr = publication("fr");
        RelationGroup group = group(RelationGroupType.LOCALIZATION, en, fr);
        when(groupRepository.findById(group.getId())).thenReturn(Optional.of(group));

        assertThrows(DuplicateLanguageException.class,
                () -> service.assertLanguageUnique(group.getId(), "fr", en.getId()));
        assertDoesNotThrow(() -> service.assertLanguageUnique(group.getId(), "fr", fr.getId()));
        assertDoesNotThrow(() -> service.assertLanguageUnique(group.getId(), "de", null));
    }

    @Test
    void language_check_on_unknown_group_is_not_found() {
        UUID groupId = UUID.randomUUID();
        when(groupRepository.findById(groupId)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> service.assertLanguageUnique(groupId, "en", null));
    }

    @Test
    void reorder_requires_every_member_once() {
        Publication a = publication("en");
        Publication b = publication("fr");
        Publication c = publication("de");
        RelationGroup group = group(RelationGroupType.LOCALIZATION, a, b, c);
        when(groupRepository.findById(group.getId())).thenReturn(Optional.of(group));

        assertThrows(BadRequestException.class,
                () -> service.reorder(group.getId(), List.of(a.getId(), b.getId())));

        service.reorder(group.getId(), List.of(c.getId(), a.getId(), b.getId()));

        assertEquals(List.of(c.getId(), a.getId(), b.getId()), group.getItems().stream()
                .map(item -> item.getPublication().getId())
                .collect(Collectors.toList()));
        assertEquals(List.of(0, 1, 2), group.getItems().stream()
                .map(RelationItem::getPosition)
                .collect(Collectors.toList()));
    }

    private Publication publication(String language) {
        Publication publication = Fixtures.publication(projectId, userId);
        publication.setLanguage(language);
        return publication;
    }

    private RelationGroup group(RelationGroupType type, Publication... members) {
        RelationGroup group = RelationGroup.builder()
                .id(UUID.randomUUID())
                .projectId(projectId)
                .type(type)
                .build();
        for (Publication member : members) {
            group.addItem(RelationItem.builder().id(UUID.randomUUID()).publication(member).build());
        }
        return group;
    }

    private RelationGroup savedGroup() {
        ArgumentCaptor<RelationGroup> captor = ArgumentCaptor.forClass(RelationGroup.class);
        verify(groupRepository).save(captor.capture());
        return captor.getValue();
    }
}
