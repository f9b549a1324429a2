package com.foodgram.backend.mapper;

import com.foodgram.backend.domain.dto.tag.TagDto;
import com.foodgram.backend.domain.dto.tag.TagRequestDto;
import com.foodgram.backend.domain.entity.Tag;

import java.util.Collection;
import java.util.List;

public class TagMapper {

    public static Tag toEntity(TagRequestDto dto) {
        return Tag.builder()
                .name(dto.getName())
                .slug(dto.getSlug())
                .build();
    }

    public static TagDto toDto(Tag tag) {
        return new TagDto(tag.getId(), tag.getName(), tag.getSlug());
    }

    public static List<TagDto> toDtoList(Collection<Tag> tags) {
        return tags.stream().map(TagMapper::toDto).toList();
    }
}
