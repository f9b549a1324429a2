package com.foodgram.backend.service;

import com.foodgram.backend.domain.dto.tag.TagDto;
import com.foodgram.backend.domain.dto.tag.TagRequestDto;
import com.foodgram.backend.domain.entity.Tag;
import com.foodgram.backend.domain.repository.RecipeRepository;
import com.foodgram.backend.domain.repository.TagRepository;
import com.foodgram.backend.exception.CustomException;
import com.foodgram.backend.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TagServiceTest {

    @Mock
    private TagRepository tagRepository;
    @Mock
    private RecipeRepository recipeRepository;

    @InjectMocks
    private TagService tagService;

    @Test
    @DisplayName("createTag: a taken name or slug is rejected")
    void createTag_duplicate_throws() {
        when(tagRepository.existsByNameOrSlug("Lunch", "lunch")).thenReturn(true);

        CustomException ex = assertThrows(CustomException.class,
                () -> tagService.createTag(new TagRequestDto("Lunch", "lunch")));

        assertEquals(ErrorCode.DUPLICATE_TAG, ex.getErrorCode());
        verify(tagRepository, never()).save(any());
    }

    @Test
    @DisplayName("createTag: saves and returns the new tag")
    void createTag_success() {
        when(tagRepository.existsByNameOrSlug("Lunch", "lunch")).thenReturn(false);
        when(tagRepository.save(any(Tag.class))).thenAnswer(inv -> {
            Tag t = inv.getArgument(0);
            return Tag.builder().id(5L).name(t.getName()).slug(t.getSlug()).build();
        });

        TagDto dto = tagService.createTag(new TagRequestDto("Lunch", "lunch"));

        assertEquals(5L, dto.getId());
        assertEquals("lunch", dto.getSlug());
    }

    @Test
    @DisplayName("updateTag: a slug used by another tag is rejected")
    void updateTag_slugTaken_throws() {
        when(tagRepository.findById(1L)).thenReturn(Optional.of(Tag.builder().id(1L).name("Dinner").slug("dinner").build()));
        when(tagRepository.existsByNameAndIdNot("Dinner", 1L)).thenReturn(false);
        when(tagRepository.existsBySlugAndIdNot("lunch", 1L)).thenReturn(true);

        CustomException ex = assertThrows(CustomException.class,
                () -> tagService.updateTag(1L, new TagRequestDto("Dinner", "lunch")));

        assertEquals(ErrorCode.DUPLICATE_TAG, ex.getErrorCode());
    }

    @Test
    @DisplayName("getTag: unknown id gives TAG_NOT_FOUND")
    void getTag_missing_throws() {
        when(tagRepository.findById(9L)).thenReturn(Optional.empty());

        CustomException ex = assertThrows(CustomException.class, () -> tagService.getTag(9L));

        assertEquals(ErrorCode.TAG_NOT_FOUND, ex.getErrorCode());
    }

    @Test
    @DisplayName("deleteTag: a tag used by a recipe is kept and TAG_IN_USE is raised")
    void deleteTag_inUse_throws() {
        Tag lunch = Tag.builder().id(1L).name("Lunch").slug("lunch").build();
        when(tagRepository.findById(1L)).thenReturn(Optional.of(lunch));
        when(recipeRepository.existsByTagsId(1L)).thenReturn(true);

        CustomException ex = assertThrows(CustomException.class, () -> tagService.deleteTag(1L));

        assertEquals(ErrorCode.TAG_IN_USE, ex.getErrorCode());
        verify(tagRepository, never()).delete(any());
    }

    @Test
    @DisplayName("deleteTag: an unused tag is removed")
    void deleteTag_unused_deletes() {
        Tag lunch = Tag.builder().id(1L).name("Lunch").slug("lunch").build();
        when(tagRepository.findById(1L)).thenReturn(Optional.of(lunch));
        when(recipeRepository.existsByTagsId(1L)).thenReturn(false);

        tagService.deleteTag(1L);

        verify(tagRepository).delete(lunch);
    }
}
