package com.crosspost.platform.publication.repository;

import com.crosspost.platform.publication.entity.AuthorSignatureVariant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import java.util.Optional;
import java.util.UUID;

public interface AuthorSignatureVariantRepository extends JpaRepository<AuthorSignatureVariant, UUID> {

    @Query("SELECT v FROM AuthorSignatureVariant v WHERE v.signature.id = :signatureId " +
           "AND v.signature.projectId = :projectId AND v.language = :language")
    Optional<AuthorSignatureVariant> findVariant(@Param("projectId") UUID projectId,
                                                 @Param("signatureId") UUID signatureId,
                                                 @Param("language") String language);
}
