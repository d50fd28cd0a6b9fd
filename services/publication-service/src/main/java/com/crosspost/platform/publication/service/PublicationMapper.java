package com.crosspost.platform.publication.service;

import com.crosspost.platform.publication.dto.MediaLinkResponse;
import com.crosspost.platform.publication.dto.PostResponse;
import com.crosspost.platform.publication.dto.PublicationResponse;
import com.crosspost.platform.publication.entity.Media;
import com.crosspost.platform.publication.entity.Post;
import com.crosspost.platform.publication.entity.Publication;
import com.crosspost.platform.publication.entity.PublicationMedia;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.stream.Collectors;

@Component
public class PublicationMapper {

    public PublicationResponse toResponse(Publication publication) {
        return PublicationResponse.builder()
                .id(publication.getId())
                .projectId(publication.getProjectId())
                .createdBy(publication.getCreatedBy())
                .title(publication.getTitle())
                .description(publication.getDescription())
                .content(publication.getContent())
                .authorComment(publication.getAuthorComment())
                .tags(publication.getTags() != null ? new ArrayList<>(publication.getTags()) : new ArrayList<>())
                .status(publication.getStatus())
                .contentType(publication.getContentType())
                .language(publication.getLanguage())
                .scheduledAt(publication.getScheduledAt())
                .sourceNewsItemId(publication.getSourceNewsItemId())
                .meta(publication.getMeta())
                .archivedAt(publication.getArchivedAt())
                .archivedBy(publication.getArchivedBy())
                .effectiveAt(publication.getEffectiveAt())
                .posts(publication.getPosts().stream()
                        .map(this::toPostResponse)
                        .collect(Collectors.toList()))
                .media(publication.getMedia().stream()
                        .sorted(Comparator.comparing(PublicationMedia::getPosition))
                        .map(this::toMediaLinkResponse)
                        .collect(Collectors.toList()))
                .createdAt(publication.getCreatedAt())
                .updatedAt(publication.getUpdatedAt())
                .build();
    }

    public PostResponse toPostResponse(Post post) {
        return PostResponse.builder()
                .id(post.getId())
                .publicationId(post.getPublication() != null ? post.getPublication().getId() : null)
                .channelId(post.getChannel() != null ? post.getChannel().getId() : null)
                .channelName(post.getChannel() != null ? post.getChannel().getName() : null)
                .platform(post.getPlatform())
                .status(post.getStatus())
                .content(post.getContent())
                .scheduledAt(post.getScheduledAt())
                .authorSignature(post.getAuthorSignature())
                .errorMessage(post.getErrorMessage())
                .publishedAt(post.getPublishedAt())
                .createdAt(post.getCreatedAt())
                .build();
    }

    public MediaLinkResponse toMediaLinkResponse(PublicationMedia link) {
        Media media = link.getMedia();
        return MediaLinkResponse.builder()
                .id(link.getId())
                .mediaId(media.getId())
                .type(media.getType())
                .storageType(media.getStorageType())
                .storageRef(media.getStorageRef())
                .filename(media.getFilename())
                .mimeType(media.getMimeType())
                .sizeBytes(media.getSizeBytes())
                .position(link.getPosition())
                .hasSpoiler(link.getHasSpoiler())
                .build();
    }
}
