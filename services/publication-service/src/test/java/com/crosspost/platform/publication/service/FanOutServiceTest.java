package com.crosspost.platform.publication.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.crosspost.platform.publication.Fixtures;
import com.crosspost.platform.publication.dto.SignatureSelection;
import com.crosspost.platform.publication.entity.Channel;
import com.crosspost.platform.publication.entity.Post;
import com.crosspost.platform.publication.entity.Publication;
import com.crosspost.platform.publication.exception.BadRequestException;
import com.crosspost.platform.publication.exception.ChannelScopeMismatchException;
import com.crosspost.platform.publication.external.ChannelDirectory;
import com.crosspost.platform.publication.external.SignatureResolver;
import com.crosspost.platform.publication.model.Platform;
import com.crosspost.platform.publication.model.PostStatus;
import com.crosspost.platform.publication.repository.PostRepository;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FanOutServiceTest {

    private final UUID projectId = UUID.randomUUID();

    private ChannelDirectory channelDirectory;
    private SignatureResolver signatureResolver;
    private PostRepository postRepository;
    private FanOutService service;

    private Channel telegram;
    private Channel vk;

    @BeforeEach
    void setUp() {
        channelDirectory = mock(ChannelDirectory.class);
        signatureResolver = mock(SignatureResolver.class);
        postRepository = mock(PostRepository.class);
        Fixtures.stubSaves(postRepository);
        service = new FanOutService(channelDirectory, signatureResolver, postRepository);

        telegram = Fixtures.channel(projectId, Platform.TELEGRAM, "Telegram news");
        vk = Fixtures.channel(projectId, Platform.VK, "VK group");
        vk.setLanguage("ru");
    }

    @Test
    void creates_pending_post_per_channel_with_publication_schedule() {
        Publication publication = Fixtures.publication(projectId, UUID.randomUUID());
        OffsetDateTime scheduledAt = OffsetDateTime.now().plusHours(4);
        publication.setScheduledAt(scheduledAt);
        directoryReturns(telegram, vk);

        List<Post> posts = service.createPosts(publication, List.of(telegram.getId(), vk.getId()), null, null);

        assertEquals(2, posts.size());
        assertEquals(2, publication.getPosts().size());
        for (Post post : posts) {
            assertEquals(PostStatus.PENDING, post.getStatus());
            assertEquals(scheduledAt, post.getScheduledAt());
            assertSame(publication, post.getPublication());
        }
        assertEquals(Platform.TELEGRAM, posts.get(0).getPlatform());
        assertEquals(Platform.VK, posts.get(1).getPlatform());
        verify(postRepository).saveAll(posts);
    }

    @Test
    void explicit_schedule_wins_over_publication_schedule() {
        Publication publication = Fixtures.publication(projectId, UUID.randomUUID());
        publication.setScheduledAt(OffsetDateTime.now().plusHours(4));
        OffsetDateTime explicit = OffsetDateTime.now().plusDays(2);
        directoryReturns(telegram);

        List<Post> posts = service.createPosts(publication, List.of(telegram.getId()), explicit, null);

        assertEquals(explicit, posts.get(0).getScheduledAt());
    }

    @Test
    void empty_or_repeated_channel_ids_are_rejected() {
        Publication publication = Fixtures.publication(projectId, UUID.randomUUID());

        assertThrows(BadRequestException.class, () -> service.createPosts(publication, List.of(), null, null));
        assertThrows(BadRequestException.class, () -> service.createPosts(publication, null, null, null));
        assertThrows(BadRequestException.class,
                () -> service.createPosts(publication, List.of(telegram.getId(), telegram.getId()), null, null));
    }

    @Test
    void one_foreign_channel_rejects_the_whole_call() {
        Publication publication = Fixtures.publication(projectId, UUID.randomUUID());
        UUID foreign = UUID.randomUUID();
        directoryReturns(telegram);

        assertThrows(ChannelScopeMismatchException.class,
                () -> service.createPosts(publication, List.of(telegram.getId(), foreign), null, null));
        assertTrue(publication.getPosts().isEmpty());
        verify(postRepository, never()).saveAll(any());
    }

    @Test
    void channel_from_another_project_is_a_scope_mismatch() {
        Publication publication = Fixtures.publication(projectId, UUID.randomUUID());
        Channel other = Fixtures.channel(UUID.randomUUID(), Platform.SITE, "Blog");
        directoryReturns(other);

        assertThrows(ChannelScopeMismatchException.class,
                () -> service.createPosts(publication, List.of(other.getId()), null, null));
    }

    @Test
    void existing_unpublished_post_is_reset_instead_of_duplicated() {
        Publication publication = Fixtures.publication(projectId, UUID.randomUUID());
        Post existing = Fixtures.post(publication, telegram);
        existing.setStatus(PostStatus.FAILED);
        existing.setErrorMessage("Validation failed");
        directoryReturns(telegram);

        List<Post> posts = service.createPosts(publication, List.of(telegram.getId()), null, null);

        assertSame(existing, posts.get(0));
        assertEquals(1, publication.getPosts().size());
        assertEquals(PostStatus.PENDING, existing.getStatus());
        assertNull(existing.getErrorMessage());
    }

    @Test
    void published_post_is_left_alone() {
        Publication publication = Fixtures.publication(projectId, UUID.randomUUID());
        Post existing = Fixtures.post(publication, telegram);
        OffsetDateTime publishedAt = OffsetDateTime.now().minusHours(1);
        existing.setStatus(PostStatus.PUBLISHED);
        existing.setPublishedAt(publishedAt);
        directoryReturns(telegram);

        service.createPosts(publication, List.of(telegram.getId()), OffsetDateTime.now().plusDays(1), null);

        assertEquals(PostStatus.PUBLISHED, existing.getStatus());
        assertEquals(publishedAt, existing.getPublishedAt());
    }

    @Test
    void override_text_wins_over_named_signature() {
        Publication publication = Fixtures.publication(projectId, UUID.randomUUID());
        UUID signatureId = UUID.randomUUID();
        when(signatureResolver.resolveSignature(projectId, signatureId, "ru")).thenReturn(Optional.of("Редакция"));
        when(signatureResolver.resolveSignature(projectId, signatureId, "en")).thenReturn(Optional.of("The editors"));
        directoryReturns(telegram, vk);
        SignatureSelection selection = SignatureSelection.builder()
                .signatureId(signatureId)
                .overrides(Map.of(telegram.getId(), "Posted by Anna"))
                .build();

        List<Post> posts = service.createPosts(publication, List.of(telegram.getId(), vk.getId()), null, selection);

        assertEquals("Posted by Anna", posts.get(0).getAuthorSignature());
        assertEquals("Редакция", posts.get(1).getAuthorSignature());
        verify(signatureResolver, never()).resolveSignature(eq(projectId), eq(signatureId), eq("en"));
    }

    @Test
    void blank_override_means_no_signature() {
        UUID signatureId = UUID.randomUUID();
        SignatureSelection selection = SignatureSelection.builder()
                .signatureId(signatureId)
                .overrides(Map.of(telegram.getId(), " "))
                .build();

        assertNull(service.resolveSignature(projectId, telegram, selection));
        assertNull(service.resolveSignature(projectId, telegram, null));
    }

    private void directoryReturns(Channel... channels) {
        when(channelDirectory.channelsByIds(anyCollection(), eq(projectId))).thenReturn(List.of(channels));
    }
}
