package com.foodgram.backend.service;

import com.foodgram.backend.domain.dto.ingredient.IngredientDto;
import com.foodgram.backend.domain.dto.ingredient.IngredientRequestDto;
import com.foodgram.backend.domain.entity.Ingredient;
import com.foodgram.backend.domain.repository.IngredientRepository;
import com.foodgram.backend.domain.repository.RecipeIngredientRepository;
import com.foodgram.backend.exception.CustomException;
import com.foodgram.backend.exception.ErrorCode;
import com.foodgram.backend.mapper.IngredientMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class IngredientService {

    private final IngredientRepository ingredientRepository;
    private final RecipeIngredientRepository recipeIngredientRepository;

    /**
     * Lists ingredients ordered by name. A non-blank {@code name} narrows the result to
     * ingredients whose name starts with it, ignoring case.
     */
    public List<IngredientDto> search(String name) {
        List<Ingredient> ingredients = StringUtils.hasText(name)
                ? ingredientRepository.findByNameStartingWithIgnoreCaseOrderByNameAsc(name.trim())
                : ingredientRepository.findAllByOrderByNameAsc();
        return ingredients.stream().map(IngredientMapper::toDto).toList();
    }

    public IngredientDto getIngredient(Long ingredientId) {
        return IngredientMapper.toDto(findIngredient(ingredientId));
    }

    @Transactional
    public IngredientDto createIngredient(IngredientRequestDto dto) {
        if (ingredientRepository.existsByNameAndMeasurementUnit(dto.getName(), dto.getMeasurementUnit())) {
            throw new CustomException(ErrorCode.DUPLICATE_INGREDIENT);
        }
        Ingredient saved = ingredientRepository.save(IngredientMapper.toEntity(dto));
        log.info("Ingredient created: id={}, name={}", saved.getId(), saved.getName());
        return IngredientMapper.toDto(saved);
    }

    @Transactional
    public IngredientDto updateIngredient(Long ingredientId, IngredientRequestDto dto) {
        Ingredient ingredient = findIngredient(ingredientId);
        boolean changed = !ingredient.getName().equals(dto.getName())
                || !ingredient.getMeasurementUnit().equals(dto.getMeasurementUnit());
        if (changed && ingredientRepository.existsByNameAndMeasurementUnit(dto.getName(), dto.getMeasurementUnit())) {
            throw new CustomException(ErrorCode.DUPLICATE_INGREDIENT);
        }
        ingredient.update(dto.getName(), dto.getMeasurementUnit());
        return IngredientMapper.toDto(ingredient);
    }

    @Transactional
    public void deleteIngredient(Long ingredientId) {
        Ingredient ingredient = findIngredient(ingredientId);
        if (recipeIngredientRepository.existsByIngredientId(ingredientId)) {
            throw new CustomException(ErrorCode.INGREDIENT_IN_USE);
        }
        ingredientRepository.delete(ingredient);
        log.info("Ingredient deleted: id={}", ingredientId);
    }

    private Ingredient findIngredient(Long ingredientId) {
        return ingredientRepository.findById(ingredientId)
                .orElseThrow(() -> new CustomException(ErrorCode.INGREDIENT_NOT_FOUND));
    }
}
