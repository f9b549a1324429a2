package com.foodgram.backend.domain.dto.ingredient;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter @Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class IngredientRequestDto {

    @NotBlank(message = "Ingredient name is required.")
    @Size(max = 128, message = "Ingredient name must be at most 128 characters.")
    private String name;

    @NotBlank(message = "Measurement unit is required.")
    @Size(max = 64, message = "Measurement unit must be at most 64 characters.")
    private String measurementUnit;
}
