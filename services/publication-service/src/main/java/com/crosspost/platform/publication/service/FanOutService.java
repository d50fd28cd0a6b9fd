package com.crosspost.platform.publication.service;

import com.crosspost.platform.publication.dto.SignatureSelection;
import com.crosspost.platform.publication.entity.Channel;
import com.crosspost.platform.publication.entity.Post;
import com.crosspost.platform.publication.entity.Publication;
import com.crosspost.platform.publication.exception.BadRequestException;
import com.crosspost.platform.publication.exception.ChannelScopeMismatchException;
import com.crosspost.platform.publication.external.ChannelDirectory;
import com.crosspost.platform.publication.external.SignatureResolver;
import com.crosspost.platform.publication.model.PostStatus;
import com.crosspost.platform.publication.repository.PostRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Creates one post per target channel. Content is not validated here; posts
 * inherit the publication content and are checked when it is scheduled.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FanOutService {

    private final ChannelDirectory channelDirectory;
    private final SignatureResolver signatureResolver;
    private final PostRepository postRepository;

    /**
     * Creates PENDING posts for the channels, or resets the existing unpublished
     * post of a channel. All channels must belong to the publication's project,
     * otherwise nothing is created.
     */
    @Transactional
    public List<Post> createPosts(Publication publication, List<UUID> channelIds,
                                  OffsetDateTime scheduledAt, SignatureSelection signature) {
        if (channelIds == null || channelIds.isEmpty()) {
            throw new BadRequestException("At least one channel is required");
        }
        Set<UUID> requested = new LinkedHashSet<>(channelIds);
        if (requested.size() != channelIds.size()) {
            throw new BadRequestException("Channel ids must not repeat");
        }

        Map<UUID, Channel> channels = channelDirectory.channelsByIds(requested, publication.getProjectId()).stream()
                .filter(channel -> Objects.equals(channel.getProjectId(), publication.getProjectId()))
                .collect(Collectors.toMap(Channel::getId, Function.identity(), (a, b) -> a));
        if (!channels.keySet().equals(requested)) {
            List<UUID> missing = requested.stream()
                    .filter(id -> !channels.containsKey(id))
                    .collect(Collectors.toList());
            log.warn("Rejected fan-out of publication {}: channels {} are outside project {}",
                    publication.getId(), missing, publication.getProjectId());
            throw new ChannelScopeMismatchException(missing);
        }

        OffsetDateTime postSchedule = scheduledAt != null ? scheduledAt : publication.getScheduledAt();
        List<Post> result = new ArrayList<>();

        for (UUID channelId : requested) {
            Channel channel = channels.get(channelId);
            String authorSignature = resolveSignature(publication.getProjectId(), channel, signature);
            Optional<Post> existing = publication.getPosts().stream()
                    .filter(post -> post.getChannel() != null && channelId.equals(post.getChannel().getId()))
                    .findFirst();

            Post post;
            if (existing.isPresent()) {
                post = existing.get();
                if (!post.isPublished()) {
                    post.resetToPending();
                    post.setScheduledAt(postSchedule);
                    if (authorSignature != null) {
                        post.setAuthorSignature(authorSignature);
                    }
                }
            } else {
                post = Post.builder()
                        .channel(channel)
                        .platform(channel.getPlatform())
                        .status(PostStatus.PENDING)
                        .scheduledAt(postSchedule)
                        .authorSignature(authorSignature)
                        .build();
                publication.addPost(post);
            }
            result.add(post);
        }

        postRepository.saveAll(result);
        log.info("Fanned out publication {} to {} channels", publication.getId(), result.size());
        return result;
    }

    /**
     * Explicit per-channel text first, then the named signature in the channel's language.
     */
    String resolveSignature(UUID projectId, Channel channel, SignatureSelection selection) {
        if (selection == null) {
            return null;
        }
        Map<UUID, String> overrides = selection.getOverrides();
        if (overrides != null && overrides.containsKey(channel.getId())) {
            String override = overrides.get(channel.getId());
            return override == null || override.isBlank() ? null : override;
        }
        if (selection.getSignatureId() == null) {
            return null;
        }
        return signatureResolver.resolveSignature(projectId, selection.getSignatureId(), channel.getLanguage())
                .orElse(null);
    }
}
