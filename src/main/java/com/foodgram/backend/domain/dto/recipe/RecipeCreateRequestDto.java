package com.foodgram.backend.domain.dto.recipe;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.util.List;

/**
 * Recipe creation body. {@code image} is a base64 data URI; the multipart variant sends the file
 * separately and leaves it empty.
 */
@Getter @Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RecipeCreateRequestDto {

    @NotEmpty(message = "Add at least one ingredient.")
    @Valid
    private List<RecipeIngredientRequestDto> ingredients;

    @NotEmpty(message = "Choose at least one tag.")
    private List<Long> tags;

    private String image;

    @NotBlank(message = "Recipe name is required.")
    @Size(max = 256, message = "Recipe name must be at most 256 characters.")
    private String name;

    @NotBlank(message = "Recipe text is required.")
    private String text;

    @NotNull(message = "Cooking time is required.")
    @Min(value = 1, message = "Cooking time must be at least 1 minute.")
    private Integer cookingTime;
}
