package com.foodgram.backend.domain.dto.recipe;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Schema(description = "Short recipe card used by favorites, cart and subscriptions")
public class RecipeShortDto {

    @Schema(description = "Recipe id")
    private Long id;

    @Schema(description = "Recipe name")
    private String name;

    @Schema(description = "Image URL")
    private String image;

    @Schema(description = "Cooking time in minutes")
    private Integer cookingTime;
}
