package com.foodgram.backend.domain.repository;

import com.foodgram.backend.domain.entity.Favorite;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Set;

@Repository
public interface FavoriteRepository extends JpaRepository<Favorite, Long> {

    boolean existsByUserIdAndRecipeId(Long userId, Long recipeId);

    long deleteByUserIdAndRecipeId(Long userId, Long recipeId);

    @Query("SELECT f.recipe.id FROM Favorite f WHERE f.user.id = :userId AND f.recipe.id IN :recipeIds")
    Set<Long> findRecipeIdsByUserIdAndRecipeIdIn(@Param("userId") Long userId,
                                                 @Param("recipeIds") Collection<Long> recipeIds);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Favorite f WHERE f.recipe.id = :recipeId")
    void deleteByRecipeId(@Param("recipeId") Long recipeId);
}
