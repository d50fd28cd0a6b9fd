package com.crosspost.platform.publication.external;

import com.crosspost.platform.publication.entity.AuthorSignatureVariant;
import com.crosspost.platform.publication.repository.AuthorSignatureVariantRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class JpaSignatureResolver implements SignatureResolver {

    private final AuthorSignatureVariantRepository variantRepository;

    @Override
    public Optional<String> resolveSignature(UUID projectId, UUID signatureId, String language) {
        if (signatureId == null || language == null) {
            return Optional.empty();
        }
        return variantRepository.findVariant(projectId, signatureId, language)
                .map(AuthorSignatureVariant::getContent);
    }
}
