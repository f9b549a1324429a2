package com.foodgram.backend.domain.dto.recipe;

import com.foodgram.backend.domain.entity.RecipeIngredient;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.*;

/**
 * One ingredient line of a recipe write request.
 */
@Getter @Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RecipeIngredientRequestDto {

    @NotNull(message = "Ingredient id is required.")
    private Long id;

    @NotNull(message = "Amount is required.")
    @Min(value = RecipeIngredient.MIN_AMOUNT, message = "Amount must be at least 1.")
    @Max(value = RecipeIngredient.MAX_AMOUNT, message = "Amount must be at most 32000.")
    private Integer amount;
}
