package com.foodgram.backend.mapper;

import com.foodgram.backend.domain.dto.recipe.RecipeCreateRequestDto;
import com.foodgram.backend.domain.dto.recipe.RecipeDetailDto;
import com.foodgram.backend.domain.dto.recipe.RecipeShortDto;
import com.foodgram.backend.domain.dto.user.UserDto;
import com.foodgram.backend.domain.entity.Recipe;
import com.foodgram.backend.domain.entity.User;

public class RecipeMapper {

    public static Recipe toEntity(RecipeCreateRequestDto dto, User author, String imageKey) {
        return Recipe.builder()
                .author(author)
                .name(dto.getName())
                .text(dto.getText())
                .cookingTime(dto.getCookingTime())
                .imageKey(imageKey)
                .build();
    }

    public static RecipeShortDto toShortDto(Recipe recipe, String imageUrl) {
        return RecipeShortDto.builder()
                .id(recipe.getId())
                .name(recipe.getName())
                .image(imageUrl)
                .cookingTime(recipe.getCookingTime())
                .build();
    }

    public static RecipeDetailDto toDetailDto(Recipe recipe, UserDto author, String imageUrl,
                                              boolean favorited, boolean inShoppingCart) {
        return RecipeDetailDto.builder()
                .id(recipe.getId())
                .tags(TagMapper.toDtoList(recipe.getTags()))
                .author(author)
                .ingredients(RecipeIngredientMapper.toDtoList(recipe.getIngredients()))
                .favorited(favorited)
                .inShoppingCart(inShoppingCart)
                .name(recipe.getName())
                .image(imageUrl)
                .text(recipe.getText())
                .cookingTime(recipe.getCookingTime())
                .build();
    }
}
