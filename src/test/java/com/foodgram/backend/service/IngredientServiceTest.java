package com.foodgram.backend.service;

import com.foodgram.backend.domain.dto.ingredient.IngredientDto;
import com.foodgram.backend.domain.dto.ingredient.IngredientRequestDto;
import com.foodgram.backend.domain.entity.Ingredient;
import com.foodgram.backend.domain.repository.IngredientRepository;
import com.foodgram.backend.domain.repository.RecipeIngredientRepository;
import com.foodgram.backend.exception.CustomException;
import com.foodgram.backend.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IngredientServiceTest {

    @Mock
    private IngredientRepository ingredientRepository;
    @Mock
    private RecipeIngredientRepository recipeIngredientRepository;

    @InjectMocks
    private IngredientService ingredientService;

    @Test
    @DisplayName("search: a name narrows the list by trimmed prefix")
    void search_withName_usesPrefixQuery() {
        when(ingredientRepository.findByNameStartingWithIgnoreCaseOrderByNameAsc("sug"))
                .thenReturn(List.of(Ingredient.builder().id(1L).name("sugar").measurementUnit("g").build()));

        List<IngredientDto> result = ingredientService.search("  sug ");

        assertThat(result).extracting(IngredientDto::getName).containsExactly("sugar");
        verify(ingredientRepository, never()).findAllByOrderByNameAsc();
    }

    @Test
    @DisplayName("search: no name lists everything")
    void search_withoutName_listsAll() {
        when(ingredientRepository.findAllByOrderByNameAsc()).thenReturn(List.of());

        assertThat(ingredientService.search(null)).isEmpty();
        verify(ingredientRepository).findAllByOrderByNameAsc();
    }

    @Test
    @DisplayName("createIngredient: a duplicate name and unit pair is rejected")
    void createIngredient_duplicate_throws() {
        when(ingredientRepository.existsByNameAndMeasurementUnit("salt", "g")).thenReturn(true);

        CustomException ex = assertThrows(CustomException.class,
                () -> ingredientService.createIngredient(new IngredientRequestDto("salt", "g")));

        assertEquals(ErrorCode.DUPLICATE_INGREDIENT, ex.getErrorCode());
        verify(ingredientRepository, never()).save(any());
    }

    @Test
    @DisplayName("updateIngredient: keeping the same pair skips the duplicate check")
    void updateIngredient_unchanged_skipsDuplicateCheck() {
        Ingredient salt = Ingredient.builder().id(3L).name("salt").measurementUnit("g").build();
        when(ingredientRepository.findById(3L)).thenReturn(Optional.of(salt));

        IngredientDto dto = ingredientService.updateIngredient(3L, new IngredientRequestDto("salt", "g"));

        assertEquals("salt", dto.getName());
        verify(ingredientRepository, never()).existsByNameAndMeasurementUnit(any(), any());
    }

    @Test
    @DisplayName("deleteIngredient: an ingredient used by a recipe is kept and INGREDIENT_IN_USE is raised")
    void deleteIngredient_inUse_throws() {
        Ingredient salt = Ingredient.builder().id(3L).name("salt").measurementUnit("g").build();
        when(ingredientRepository.findById(3L)).thenReturn(Optional.of(salt));
        when(recipeIngredientRepository.existsByIngredientId(3L)).thenReturn(true);

        CustomException ex = assertThrows(CustomException.class, () -> ingredientService.deleteIngredient(3L));

        assertEquals(ErrorCode.INGREDIENT_IN_USE, ex.getErrorCode());
        verify(ingredientRepository, never()).delete(any());
    }
}
