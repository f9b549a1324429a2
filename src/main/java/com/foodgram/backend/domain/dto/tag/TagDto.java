package com.foodgram.backend.domain.dto.tag;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TagDto {
    private Long id;
    private String name;    // e.g. "Breakfast"
    private String slug;    // e.g. "breakfast"
}
