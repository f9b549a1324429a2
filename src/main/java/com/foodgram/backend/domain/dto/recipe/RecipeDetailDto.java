package com.foodgram.backend.domain.dto.recipe;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.foodgram.backend.domain.dto.tag.TagDto;
import com.foodgram.backend.domain.dto.user.UserDto;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Schema(description = "Full recipe representation")
public class RecipeDetailDto {

    private Long id;

    private List<TagDto> tags;

    private UserDto author;

    private List<RecipeIngredientDto> ingredients;

    @JsonProperty("is_favorited")
    @Schema(description = "Whether the caller has the recipe in favorites")
    private boolean favorited;

    @JsonProperty("is_in_shopping_cart")
    @Schema(description = "Whether the caller has the recipe in the shopping cart")
    private boolean inShoppingCart;

    private String name;

    @Schema(description = "Image URL")
    private String image;

    private String text;

    @Schema(description = "Cooking time in minutes")
    private Integer cookingTime;
}
