package com.foodgram.backend.domain.dto.recipe;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Recipe list filter")
public class RecipeSearchCondition {

    @Schema(description = "Author id")
    private Long authorId;

    @Schema(description = "Tag slugs; a recipe matches when it carries any of them")
    private List<String> tags;

    @Schema(description = "Only recipes in the caller's favorites")
    private boolean favorited;

    @Schema(description = "Only recipes in the caller's shopping cart")
    private boolean inShoppingCart;

    @Schema(description = "Substring of the author's username or of a tag slug")
    private String search;
}
