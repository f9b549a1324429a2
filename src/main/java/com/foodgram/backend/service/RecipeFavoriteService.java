package com.foodgram.backend.service;

import com.foodgram.backend.domain.dto.recipe.RecipeShortDto;
import com.foodgram.backend.domain.entity.Favorite;
import com.foodgram.backend.domain.entity.Recipe;
import com.foodgram.backend.domain.entity.User;
import com.foodgram.backend.domain.repository.FavoriteRepository;
import com.foodgram.backend.domain.repository.RecipeRepository;
import com.foodgram.backend.domain.repository.UserRepository;
import com.foodgram.backend.exception.CustomException;
import com.foodgram.backend.exception.ErrorCode;
import com.foodgram.backend.mapper.RecipeMapper;
import com.foodgram.backend.service.image.ImageService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class RecipeFavoriteService {

    private final FavoriteRepository favoriteRepository;
    private final RecipeRepository recipeRepository;
    private final UserRepository userRepository;
    private final ImageService imageService;

    @Transactional
    public RecipeShortDto addFavorite(Long userId, Long recipeId) {
        Recipe recipe = recipeRepository.findById(recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));
        if (favoriteRepository.existsByUserIdAndRecipeId(userId, recipeId)) {
            throw new CustomException(ErrorCode.ALREADY_FAVORITED_RECIPE);
        }

        User user = userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));
        favoriteRepository.save(Favorite.builder().user(user).recipe(recipe).build());

        return RecipeMapper.toShortDto(recipe, imageService.toUrl(recipe.getImageKey()));
    }

    @Transactional
    public void removeFavorite(Long userId, Long recipeId) {
        if (!recipeRepository.existsById(recipeId)) {
            throw new CustomException(ErrorCode.RECIPE_NOT_FOUND);
        }
        if (favoriteRepository.deleteByUserIdAndRecipeId(userId, recipeId) == 0) {
            throw new CustomException(ErrorCode.FAVORITE_NOT_FOUND);
        }
    }

    @Transactional
    public void deleteByRecipeId(Long recipeId) {
        favoriteRepository.deleteByRecipeId(recipeId);
    }
}
