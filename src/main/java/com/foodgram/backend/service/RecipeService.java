package com.foodgram.backend.service;

import com.foodgram.backend.domain.dto.recipe.RecipeCreateRequestDto;
import com.foodgram.backend.domain.dto.recipe.RecipeDetailDto;
import com.foodgram.backend.domain.dto.recipe.RecipeSearchCondition;
import com.foodgram.backend.domain.dto.recipe.RecipeUpdateRequestDto;
import com.foodgram.backend.domain.entity.Recipe;
import com.foodgram.backend.domain.entity.RecipeIngredient;
import com.foodgram.backend.domain.entity.Tag;
import com.foodgram.backend.domain.entity.User;
import com.foodgram.backend.domain.repository.FavoriteRepository;
import com.foodgram.backend.domain.repository.RecipeRepository;
import com.foodgram.backend.domain.repository.ShoppingCartRepository;
import com.foodgram.backend.exception.CustomException;
import com.foodgram.backend.exception.ErrorCode;
import com.foodgram.backend.exception.RequestValidationException;
import com.foodgram.backend.mapper.RecipeMapper;
import com.foodgram.backend.service.image.ImageService;
import jakarta.persistence.EntityManager;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.util.Collections;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class RecipeService {

    private static final String IMAGE_FIELD = "image";

    private final RecipeRepository recipeRepository;
    private final FavoriteRepository favoriteRepository;
    private final ShoppingCartRepository shoppingCartRepository;

    private final UserService userService;
    private final RecipeIngredientService recipeIngredientService;
    private final RecipeTagService recipeTagService;
    private final RecipeFavoriteService recipeFavoriteService;
    private final ShoppingCartService shoppingCartService;
    private final ImageService imageService;
    private final EntityManager em;
    private final Validator validator;

    @Transactional(readOnly = true)
    public Page<RecipeDetailDto> getRecipes(RecipeSearchCondition condition, Pageable pageable, Long currentUserId) {
        Page<Recipe> recipes = recipeRepository.search(condition, pageable, currentUserId);

        List<Long> recipeIds = recipes.getContent().stream().map(Recipe::getId).toList();
        List<Long> authorIds = recipes.getContent().stream().map(r -> r.getAuthor().getId()).distinct().toList();

        Set<Long> favorited = Collections.emptySet();
        Set<Long> inCart = Collections.emptySet();
        if (currentUserId != null && !recipeIds.isEmpty()) {
            favorited = favoriteRepository.findRecipeIdsByUserIdAndRecipeIdIn(currentUserId, recipeIds);
            inCart = shoppingCartRepository.findRecipeIdsByUserIdAndRecipeIdIn(currentUserId, recipeIds);
        }
        Set<Long> subscribed = userService.findSubscribedAuthorIds(currentUserId, authorIds);

        Set<Long> favoritedIds = favorited;
        Set<Long> inCartIds = inCart;
        return recipes.map(recipe -> toDetailDto(recipe,
                subscribed.contains(recipe.getAuthor().getId()),
                favoritedIds.contains(recipe.getId()),
                inCartIds.contains(recipe.getId())));
    }

    @Transactional(readOnly = true)
    public RecipeDetailDto getRecipe(Long recipeId, Long currentUserId) {
        Recipe recipe = recipeRepository.findDetailById(recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));

        if (currentUserId == null) {
            return toDetailDto(recipe, false, false, false);
        }
        Long authorId = recipe.getAuthor().getId();
        return toDetailDto(recipe,
                !userService.findSubscribedAuthorIds(currentUserId, List.of(authorId)).isEmpty(),
                favoriteRepository.existsByUserIdAndRecipeId(currentUserId, recipeId),
                shoppingCartRepository.existsByUserIdAndRecipeId(currentUserId, recipeId));
    }

    /**
     * @param imageFile multipart image; when absent the data URI in {@code dto.image} is used
     */
    @Transactional
    public RecipeDetailDto createRecipe(RecipeCreateRequestDto dto, MultipartFile imageFile, Long userId) {
        User author = userService.findUser(userId);
        Set<Tag> tags = recipeTagService.resolveTags(dto.getTags());

        Recipe recipe = RecipeMapper.toEntity(dto, author, null);
        List<RecipeIngredient> rows = recipeIngredientService.buildRows(recipe, dto.getIngredients());

        String imageKey = storeImage(dto.getImage(), imageFile);
        if (imageKey == null) {
            throw new RequestValidationException(ErrorCode.RECIPE_IMAGE_REQUIRED, IMAGE_FIELD);
        }
        imageService.discardOnRollback(imageKey);
        recipe.update(null, null, null, imageKey);
        recipe.replaceTags(tags);

        recipeRepository.save(recipe);
        recipeIngredientService.saveAll(rows);
        log.info("Recipe created: id={}, authorId={}", recipe.getId(), userId);

        em.flush();
        em.clear();

        return getRecipe(recipe.getId(), userId);
    }

    /**
     * Ownership is checked before the body is validated, so a caller who may not edit the recipe
     * gets 403 whatever the body holds.
     */
    @Transactional
    public RecipeDetailDto updateRecipe(Long recipeId, RecipeUpdateRequestDto dto, MultipartFile imageFile, Long userId) {
        Recipe recipe = recipeRepository.findWithAuthorById(recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));
        validateOwnership(recipe, userId);
        validateBody(dto);

        Set<Tag> tags = recipeTagService.resolveTags(dto.getTags());
        List<RecipeIngredient> rows = recipeIngredientService.buildRows(recipe, dto.getIngredients());

        String oldImageKey = recipe.getImageKey();
        String newImageKey = storeImage(dto.getImage(), imageFile);
        imageService.discardOnRollback(newImageKey);

        recipe.update(dto.getName(), dto.getText(), dto.getCookingTime(), newImageKey);
        recipe.replaceTags(tags);
        recipeIngredientService.replaceAll(recipeId, rows);

        em.flush();
        em.clear();

        if (newImageKey != null) {
            imageService.deleteAfterCommit(oldImageKey);
        }
        log.info("Recipe updated: id={}, by userId={}", recipeId, userId);
        return getRecipe(recipeId, userId);
    }

    @Transactional
    public void deleteRecipe(Long recipeId, Long userId) {
        Recipe recipe = recipeRepository.findWithAuthorById(recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));
        validateOwnership(recipe, userId);

        String imageKey = recipe.getImageKey();

        recipeFavoriteService.deleteByRecipeId(recipeId);
        shoppingCartService.deleteByRecipeId(recipeId);
        recipeIngredientService.deleteByRecipeId(recipeId);
        // the bulk deletes above clear the persistence context
        recipeRepository.deleteById(recipeId);

        em.flush();
        imageService.deleteAfterCommit(imageKey);
        log.info("Recipe deleted: id={}, by userId={}", recipeId, userId);
    }

    /**
     * Verifies the recipe exists so a short link is never issued for a missing one.
     */
    @Transactional(readOnly = true)
    public Long requireRecipeId(Long recipeId) {
        if (!recipeRepository.existsById(recipeId)) {
            throw new CustomException(ErrorCode.RECIPE_NOT_FOUND);
        }
        return recipeId;
    }

    private void validateOwnership(Recipe recipe, Long userId) {
        if (recipe.isAuthoredBy(userId)) {
            return;
        }
        User user = userService.findUser(userId);
        if (!user.isStaff()) {
            throw new CustomException(ErrorCode.RECIPE_ACCESS_DENIED);
        }
    }

    private void validateBody(RecipeUpdateRequestDto dto) {
        Set<ConstraintViolation<RecipeUpdateRequestDto>> violations = validator.validate(dto);
        if (!violations.isEmpty()) {
            throw RequestValidationException.of(violations);
        }
    }

    // null when the request carries no image
    private String storeImage(String dataUri, MultipartFile imageFile) {
        if (imageFile != null && !imageFile.isEmpty()) {
            return imageService.storeMultipart(imageFile, ImageService.RECIPE_DIRECTORY, IMAGE_FIELD);
        }
        if (StringUtils.hasText(dataUri)) {
            return imageService.storeDataUri(dataUri, ImageService.RECIPE_DIRECTORY, IMAGE_FIELD);
        }
        return null;
    }

    private RecipeDetailDto toDetailDto(Recipe recipe, boolean authorSubscribed, boolean favorited, boolean inCart) {
        return RecipeMapper.toDetailDto(recipe,
                userService.toUserDto(recipe.getAuthor(), authorSubscribed),
                imageService.toUrl(recipe.getImageKey()),
                favorited, inCart);
    }
}
