package com.foodgram.backend.service;

import com.foodgram.backend.domain.dto.tag.TagDto;
import com.foodgram.backend.domain.dto.tag.TagRequestDto;
import com.foodgram.backend.domain.entity.Tag;
import com.foodgram.backend.domain.repository.RecipeRepository;
import com.foodgram.backend.domain.repository.TagRepository;
import com.foodgram.backend.exception.CustomException;
import com.foodgram.backend.exception.ErrorCode;
import com.foodgram.backend.mapper.TagMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class TagService {

    private final TagRepository tagRepository;
    private final RecipeRepository recipeRepository;

    public List<TagDto> getAllTags() {
        return TagMapper.toDtoList(tagRepository.findAllByOrderByNameAsc());
    }

    public TagDto getTag(Long tagId) {
        return TagMapper.toDto(findTag(tagId));
    }

    @Transactional
    public TagDto createTag(TagRequestDto dto) {
        if (tagRepository.existsByNameOrSlug(dto.getName(), dto.getSlug())) {
            throw new CustomException(ErrorCode.DUPLICATE_TAG);
        }
        Tag saved = tagRepository.save(TagMapper.toEntity(dto));
        log.info("Tag created: id={}, slug={}", saved.getId(), saved.getSlug());
        return TagMapper.toDto(saved);
    }

    @Transactional
    public TagDto updateTag(Long tagId, TagRequestDto dto) {
        Tag tag = findTag(tagId);
        if (tagRepository.existsByNameAndIdNot(dto.getName(), tagId)
                || tagRepository.existsBySlugAndIdNot(dto.getSlug(), tagId)) {
            throw new CustomException(ErrorCode.DUPLICATE_TAG);
        }
        tag.update(dto.getName(), dto.getSlug());
        return TagMapper.toDto(tag);
    }

    @Transactional
    public void deleteTag(Long tagId) {
        Tag tag = findTag(tagId);
        if (recipeRepository.existsByTagsId(tagId)) {
            throw new CustomException(ErrorCode.TAG_IN_USE);
        }
        tagRepository.delete(tag);
        log.info("Tag deleted: id={}", tagId);
    }

    private Tag findTag(Long tagId) {
        return tagRepository.findById(tagId)
                .orElseThrow(() -> new CustomException(ErrorCode.TAG_NOT_FOUND));
    }
}
