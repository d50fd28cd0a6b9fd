package com.crosspost.platform.publication.dto;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateMediaLinkRequest {
    private Boolean hasSpoiler;
}
