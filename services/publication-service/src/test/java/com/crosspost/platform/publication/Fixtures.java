package com.crosspost.platform.publication;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

import com.crosspost.platform.publication.entity.Channel;
import com.crosspost.platform.publication.entity.Media;
import com.crosspost.platform.publication.entity.Post;
import com.crosspost.platform.publication.entity.Publication;
import com.crosspost.platform.publication.entity.PublicationMedia;
import com.crosspost.platform.publication.entity.RelationGroup;
import com.crosspost.platform.publication.model.ContentType;
import com.crosspost.platform.publication.model.MediaType;
import com.crosspost.platform.publication.model.Platform;
import com.crosspost.platform.publication.model.PostStatus;
import com.crosspost.platform.publication.model.PublicationStatus;
import com.crosspost.platform.publication.model.StorageType;
import com.crosspost.platform.publication.repository.PostRepository;
import com.crosspost.platform.publication.repository.PublicationRepository;
import com.crosspost.platform.publication.repository.RelationGroupRepository;
import java.time.OffsetDateTime;
import java.util.UUID;

/** Entity builders and repository stubs shared by the unit tests. */
public final class Fixtures {

    private Fixtures() {}

    public static Publication publication(UUID projectId, UUID createdBy) {
        return Publication.builder()
                .id(UUID.randomUUID())
                .projectId(projectId)
                .createdBy(createdBy)
                .title("Launch notes")
                .content("Hello world")
                .status(PublicationStatus.DRAFT)
                .contentType(ContentType.POST)
                .language("en")
                .createdAt(OffsetDateTime.now().minusDays(1))
                .build();
    }

    public static Channel channel(UUID projectId, Platform platform, String name) {
        return Channel.builder()
                .id(UUID.randomUUID())
                .projectId(projectId)
                .name(name)
                .platform(platform)
                .language("en")
                .build();
    }

    public static Post post(Publication publication, Channel channel) {
        Post post = Post.builder()
                .id(UUID.randomUUID())
                .channel(channel)
                .platform(channel.getPlatform())
                .status(PostStatus.PENDING)
                .build();
        publication.addPost(post);
        return post;
    }

    public static Media media(MediaType type) {
        return Media.builder()
                .id(UUID.randomUUID())
                .type(type)
                .storageType(StorageType.FS)
                .storageRef("files/" + UUID.randomUUID())
                .build();
    }

    public static PublicationMedia attach(Publication publication, MediaType type) {
        PublicationMedia link = PublicationMedia.builder()
                .id(UUID.randomUUID())
                .publication(publication)
                .media(media(type))
                .position(publication.getMedia().size())
                .build();
        publication.getMedia().add(link);
        return link;
    }

    public static void stubSaves(PublicationRepository repository) {
        when(repository.save(any(Publication.class))).thenAnswer(inv -> {
            Publication publication = inv.getArgument(0);
            if (publication.getId() == null) {
                publication.setId(UUID.randomUUID());
            }
            return publication;
        });
    }

    public static void stubSaves(PostRepository repository) {
        when(repository.save(any(Post.class))).thenAnswer(inv -> inv.getArgument(0));
        when(repository.saveAll(anyList())).thenAnswer(inv -> inv.getArgument(0));
    }

    public static void stubSaves(RelationGroupRepository repository) {
        when(repository.save(any(RelationGroup.class))).thenAnswer(inv -> {
            RelationGroup group = inv.getArgument(0);
            if (group.getId() == null) {
                group.setId(UUID.randomUUID());
            }
            return group;
        });
    }
}
