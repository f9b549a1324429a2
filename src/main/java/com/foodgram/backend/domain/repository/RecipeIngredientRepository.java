package com.foodgram.backend.domain.repository;

import com.foodgram.backend.domain.dto.recipe.ShoppingListItemDto;
import com.foodgram.backend.domain.entity.RecipeIngredient;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RecipeIngredientRepository extends JpaRepository<RecipeIngredient, Long> {

    boolean existsByIngredientId(Long ingredientId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM RecipeIngredient ri WHERE ri.recipe.id = :recipeId")
    void deleteByRecipeId(@Param("recipeId") Long recipeId);

    @Query("""
            SELECT new com.foodgram.backend.domain.dto.recipe.ShoppingListItemDto(
                i.name, i.measurementUnit, SUM(ri.amount))
            FROM RecipeIngredient ri
            JOIN ri.ingredient i
            WHERE ri.recipe.id IN (
                SELECT sc.recipe.id FROM ShoppingCart sc WHERE sc.user.id = :userId
            )
            GROUP BY i.name, i.measurementUnit
            ORDER BY i.name ASC, i.measurementUnit ASC
            """)
    List<ShoppingListItemDto> sumShoppingCartIngredients(@Param("userId") Long userId);
}
