package com.foodgram.backend.mapper;

import com.foodgram.backend.domain.dto.recipe.RecipeIngredientDto;
import com.foodgram.backend.domain.entity.Ingredient;
import com.foodgram.backend.domain.entity.Recipe;
import com.foodgram.backend.domain.entity.RecipeIngredient;

import java.util.Comparator;
import java.util.List;

public class RecipeIngredientMapper {

    public static RecipeIngredient toEntity(Recipe recipe, Ingredient ingredient, Integer amount) {
        return RecipeIngredient.builder()
                .recipe(recipe)
                .ingredient(ingredient)
                .amount(amount)
                .build();
    }

    // id is the ingredient's id, not the join row's
    public static RecipeIngredientDto toDto(RecipeIngredient entity) {
        Ingredient ingredient = entity.getIngredient();
        return RecipeIngredientDto.builder()
                .id(ingredient.getId())
                .name(ingredient.getName())
                .measurementUnit(ingredient.getMeasurementUnit())
                .amount(entity.getAmount())
                .build();
    }

    public static List<RecipeIngredientDto> toDtoList(List<RecipeIngredient> entities) {
        return entities.stream()
                .sorted(Comparator.comparing(RecipeIngredient::getId, Comparator.nullsLast(Comparator.naturalOrder())))
                .map(RecipeIngredientMapper::toDto)
                .toList();
    }
}
