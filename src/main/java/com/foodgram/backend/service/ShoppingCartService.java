package com.foodgram.backend.service;

import com.foodgram.backend.domain.dto.recipe.RecipeShortDto;
import com.foodgram.backend.domain.dto.recipe.ShoppingListItemDto;
import com.foodgram.backend.domain.entity.Recipe;
import com.foodgram.backend.domain.entity.ShoppingCart;
import com.foodgram.backend.domain.entity.User;
import com.foodgram.backend.domain.repository.RecipeIngredientRepository;
import com.foodgram.backend.domain.repository.RecipeRepository;
import com.foodgram.backend.domain.repository.ShoppingCartRepository;
import com.foodgram.backend.domain.repository.UserRepository;
import com.foodgram.backend.exception.CustomException;
import com.foodgram.backend.exception.ErrorCode;
import com.foodgram.backend.mapper.RecipeMapper;
import com.foodgram.backend.service.image.ImageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class ShoppingCartService {

    private final ShoppingCartRepository shoppingCartRepository;
    private final RecipeIngredientRepository recipeIngredientRepository;
    private final RecipeRepository recipeRepository;
    private final UserRepository userRepository;
    private final ImageService imageService;

    @Transactional
    public RecipeShortDto addToCart(Long userId, Long recipeId) {
        Recipe recipe = recipeRepository.findById(recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));
        if (shoppingCartRepository.existsByUserIdAndRecipeId(userId, recipeId)) {
            throw new CustomException(ErrorCode.ALREADY_IN_SHOPPING_CART);
        }

        User user = userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));
        shoppingCartRepository.save(ShoppingCart.builder().user(user).recipe(recipe).build());

        return RecipeMapper.toShortDto(recipe, imageService.toUrl(recipe.getImageKey()));
    }

    @Transactional
    public void removeFromCart(Long userId, Long recipeId) {
        if (!recipeRepository.existsById(recipeId)) {
            throw new CustomException(ErrorCode.RECIPE_NOT_FOUND);
        }
        if (shoppingCartRepository.deleteByUserIdAndRecipeId(userId, recipeId) == 0) {
            throw new CustomException(ErrorCode.SHOPPING_CART_ITEM_NOT_FOUND);
        }
    }

    /**
     * Renders the cart as one {@code "name - total unit"} line per ingredient and unit,
     * amounts summed across recipes, ordered by ingredient name.
     */
    @Transactional(readOnly = true)
    public String buildShoppingList(Long userId) {
        List<ShoppingListItemDto> items = recipeIngredientRepository.sumShoppingCartIngredients(userId);
        if (items.isEmpty()) {
            throw new CustomException(ErrorCode.EMPTY_SHOPPING_CART);
        }
        log.debug("Shopping list for userId={} has {} lines", userId, items.size());
        return items.stream()
                .map(ShoppingListItemDto::toLine)
                .collect(Collectors.joining("\n"));
    }

    @Transactional
    public void deleteByRecipeId(Long recipeId) {
        shoppingCartRepository.deleteByRecipeId(recipeId);
    }
}
