package com.foodgram.backend.domain.dto.user;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.foodgram.backend.domain.dto.recipe.RecipeShortDto;
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
@Schema(description = "A followed author with their latest recipes")
public class SubscriptionDto {

    private String email;

    private Long id;

    private String username;

    private String firstName;

    private String lastName;

    @JsonProperty("is_subscribed")
    private boolean subscribed;

    private String avatar;

    @Schema(description = "Author's recipes, newest first, cut to recipes_limit when given")
    private List<RecipeShortDto> recipes;

    @Schema(description = "Total number of the author's recipes")
    private long recipesCount;
}
