package com.foodgram.backend.service;

import com.foodgram.backend.domain.dto.recipe.RecipeIngredientRequestDto;
import com.foodgram.backend.domain.entity.Ingredient;
import com.foodgram.backend.domain.entity.Recipe;
import com.foodgram.backend.domain.entity.RecipeIngredient;
import com.foodgram.backend.domain.repository.IngredientRepository;
import com.foodgram.backend.domain.repository.RecipeIngredientRepository;
import com.foodgram.backend.exception.RequestValidationException;
import com.foodgram.backend.mapper.RecipeIngredientMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class RecipeIngredientService {

    private static final String FIELD = "ingredients";

    private final IngredientRepository ingredientRepository;
    private final RecipeIngredientRepository recipeIngredientRepository;

    /**
     * Checks the submitted lines and builds unsaved rows for {@code recipe}.
     * Nothing is written, so callers can validate before touching existing data.
     */
    public List<RecipeIngredient> buildRows(Recipe recipe, List<RecipeIngredientRequestDto> dtos) {
        if (dtos == null || dtos.isEmpty()) {
            throw new RequestValidationException(FIELD, "Add at least one ingredient.");
        }

        Set<Long> ids = new HashSet<>();
        for (RecipeIngredientRequestDto dto : dtos) {
            if (dto.getId() == null) {
                throw new RequestValidationException(FIELD, "Ingredient id is required.");
            }
            Integer amount = dto.getAmount();
            if (amount == null || amount < RecipeIngredient.MIN_AMOUNT || amount > RecipeIngredient.MAX_AMOUNT) {
                throw new RequestValidationException(FIELD, "Amount must be between "
                        + RecipeIngredient.MIN_AMOUNT + " and " + RecipeIngredient.MAX_AMOUNT + ".");
            }
            if (!ids.add(dto.getId())) {
                throw new RequestValidationException(FIELD, "Ingredients must not repeat.");
            }
        }

        Map<Long, Ingredient> ingredientMap = ingredientRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(Ingredient::getId, Function.identity()));

        List<RecipeIngredient> rows = new ArrayList<>();
        for (RecipeIngredientRequestDto dto : dtos) {
            Ingredient ingredient = ingredientMap.get(dto.getId());
            if (ingredient == null) {
                throw new RequestValidationException(FIELD, "Ingredient with id " + dto.getId() + " does not exist.");
            }
            rows.add(RecipeIngredientMapper.toEntity(recipe, ingredient, dto.getAmount()));
        }
        return rows;
    }

    @Transactional
    public void saveAll(List<RecipeIngredient> rows) {
        recipeIngredientRepository.saveAll(rows);
    }

    // bulk delete first so the unique (recipe, ingredient) pair never collides with the new rows
    @Transactional
    public void replaceAll(Long recipeId, List<RecipeIngredient> rows) {
        recipeIngredientRepository.deleteByRecipeId(recipeId);
        recipeIngredientRepository.saveAll(rows);
    }

    @Transactional
    public void deleteByRecipeId(Long recipeId) {
        recipeIngredientRepository.deleteByRecipeId(recipeId);
    }
}
