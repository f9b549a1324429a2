package com.foodgram.backend.domain.repository;

import com.foodgram.backend.domain.entity.ShoppingCart;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Set;

@Repository
public interface ShoppingCartRepository extends JpaRepository<ShoppingCart, Long> {

    boolean existsByUserIdAndRecipeId(Long userId, Long recipeId);

    long deleteByUserIdAndRecipeId(Long userId, Long recipeId);

    @Query("SELECT sc.recipe.id FROM ShoppingCart sc WHERE sc.user.id = :userId AND sc.recipe.id IN :recipeIds")
    Set<Long> findRecipeIdsByUserIdAndRecipeIdIn(@Param("userId") Long userId,
                                                 @Param("recipeIds") Collection<Long> recipeIds);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ShoppingCart sc WHERE sc.recipe.id = :recipeId")
    void deleteByRecipeId(@Param("recipeId") Long recipeId);
}
