package com.foodgram.backend.service;

import com.foodgram.backend.domain.dto.recipe.RecipeShortDto;
import com.foodgram.backend.domain.dto.user.SubscriptionDto;
import com.foodgram.backend.domain.entity.Recipe;
import com.foodgram.backend.domain.entity.Subscription;
import com.foodgram.backend.domain.entity.User;
import com.foodgram.backend.domain.repository.RecipeRepository;
import com.foodgram.backend.domain.repository.SubscriptionRepository;
import com.foodgram.backend.domain.repository.UserRepository;
import com.foodgram.backend.exception.CustomException;
import com.foodgram.backend.exception.ErrorCode;
import com.foodgram.backend.mapper.RecipeMapper;
import com.foodgram.backend.mapper.UserMapper;
import com.foodgram.backend.service.image.ImageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionService {

    private final SubscriptionRepository subscriptionRepository;
    private final UserRepository userRepository;
    private final RecipeRepository recipeRepository;
    private final ImageService imageService;

    @Transactional
    public SubscriptionDto subscribe(Long subscriberId, Long authorId, Integer recipesLimit) {
        User author = userRepository.findById(authorId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));
        if (subscriberId.equals(authorId)) {
            throw new CustomException(ErrorCode.SELF_SUBSCRIPTION);
        }
        if (subscriptionRepository.existsBySubscriberIdAndAuthorId(subscriberId, authorId)) {
            throw new CustomException(ErrorCode.ALREADY_SUBSCRIBED);
        }

        User subscriber = userRepository.getReferenceById(subscriberId);
        subscriptionRepository.save(Subscription.builder().subscriber(subscriber).author(author).build());
        log.info("Subscribed: subscriberId={}, authorId={}", subscriberId, authorId);

        long recipesCount = recipeRepository.countMapByAuthorIds(List.of(authorId)).getOrDefault(authorId, 0L);
        return toSubscriptionDto(author, recipesLimit, recipesCount);
    }

    @Transactional
    public void unsubscribe(Long subscriberId, Long authorId) {
        if (!userRepository.existsById(authorId)) {
            throw new CustomException(ErrorCode.USER_NOT_FOUND);
        }
        if (subscriptionRepository.deleteBySubscriberIdAndAuthorId(subscriberId, authorId) == 0) {
            throw new CustomException(ErrorCode.SUBSCRIPTION_NOT_FOUND);
        }
        log.info("Unsubscribed: subscriberId={}, authorId={}", subscriberId, authorId);
    }

    /**
     * Authors the user follows, ordered by username, each with their newest recipes.
     */
    @Transactional(readOnly = true)
    public Page<SubscriptionDto> getSubscriptions(Long subscriberId, Pageable pageable, Integer recipesLimit) {
        Page<User> authors = subscriptionRepository.findAuthorsBySubscriberId(
                subscriberId, PageRequest.of(pageable.getPageNumber(), pageable.getPageSize()));

        List<Long> authorIds = authors.getContent().stream().map(User::getId).toList();
        Map<Long, Long> counts = authorIds.isEmpty() ? Map.of() : recipeRepository.countMapByAuthorIds(authorIds);

        return authors.map(author -> toSubscriptionDto(author, recipesLimit, counts.getOrDefault(author.getId(), 0L)));
    }

    private SubscriptionDto toSubscriptionDto(User author, Integer recipesLimit, long recipesCount) {
        Pageable recipePage = recipesLimit != null && recipesLimit >= 0
                ? PageRequest.of(0, Math.max(recipesLimit, 1))
                : Pageable.unpaged();

        List<RecipeShortDto> recipes = recipesLimit != null && recipesLimit == 0
                ? List.of()
                : recipeRepository.findByAuthorIdOrderByCreatedAtDesc(author.getId(), recipePage).stream()
                        .map(this::toShortDto)
                        .toList();

        return UserMapper.toSubscriptionDto(author, true, imageService.toUrl(author.getAvatarKey()),
                recipes, recipesCount);
    }

    private RecipeShortDto toShortDto(Recipe recipe) {
        return RecipeMapper.toShortDto(recipe, imageService.toUrl(recipe.getImageKey()));
    }
}
