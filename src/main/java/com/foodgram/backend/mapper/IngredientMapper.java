package com.foodgram.backend.mapper;

import com.foodgram.backend.domain.dto.ingredient.IngredientDto;
import com.foodgram.backend.domain.dto.ingredient.IngredientRequestDto;
import com.foodgram.backend.domain.entity.Ingredient;

public class IngredientMapper {

    public static Ingredient toEntity(IngredientRequestDto dto) {
        return Ingredient.builder()
                .name(dto.getName())
                .measurementUnit(dto.getMeasurementUnit())
                .build();
    }

    public static IngredientDto toDto(Ingredient ingredient) {
        return IngredientDto.builder()
                .id(ingredient.getId())
                .name(ingredient.getName())
                .measurementUnit(ingredient.getMeasurementUnit())
                .build();
    }
}
