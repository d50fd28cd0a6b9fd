package com.crosspost.platform.publication.dto;

import lombok.*;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublicationPageResponse {
    private List<PublicationResponse> items;
    private long total;
    private int page;
    private int size;
}
