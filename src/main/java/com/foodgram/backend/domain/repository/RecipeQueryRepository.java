package com.foodgram.backend.domain.repository;

import com.foodgram.backend.domain.dto.recipe.RecipeSearchCondition;
import com.foodgram.backend.domain.entity.Recipe;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

public interface RecipeQueryRepository {
    Page<Recipe> search(RecipeSearchCondition condition, Pageable pageable, Long currentUserId);
}
