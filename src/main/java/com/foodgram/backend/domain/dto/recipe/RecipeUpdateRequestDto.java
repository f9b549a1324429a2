package com.foodgram.backend.domain.dto.recipe;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.util.List;

/**
 * Partial recipe update. Scalar fields keep their value when absent;
 * tags and ingredients are always required and replace the current sets.
 * Validated by {@code RecipeService} after the ownership check.
 */
@Getter @Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RecipeUpdateRequestDto {

    private static final String NOT_BLANK = "(?s).*\\S.*";

    @NotEmpty(message = "Add at least one ingredient.")
    @Valid
    private List<RecipeIngredientRequestDto> ingredients;

    @NotEmpty(message = "Choose at least one tag.")
    private List<Long> tags;

    private String image;

    @Size(min = 1, max = 256, message = "Recipe name must be 1 to 256 characters.")
    @Pattern(regexp = NOT_BLANK, message = "Recipe name must not be blank.")
    private String name;

    @Pattern(regexp = NOT_BLANK, message = "Recipe text must not be blank.")
    private String text;

    @Min(value = 1, message = "Cooking time must be at least 1 minute.")
    private Integer cookingTime;
}
