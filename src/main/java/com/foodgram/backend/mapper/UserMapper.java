package com.foodgram.backend.mapper;

import com.foodgram.backend.domain.dto.recipe.RecipeShortDto;
import com.foodgram.backend.domain.dto.user.SubscriptionDto;
import com.foodgram.backend.domain.dto.user.UserCreateRequestDto;
import com.foodgram.backend.domain.dto.user.UserCreatedDto;
import com.foodgram.backend.domain.dto.user.UserDto;
import com.foodgram.backend.domain.entity.User;

import java.util.List;

public class UserMapper {

    // password must already be encoded
    public static User toEntity(UserCreateRequestDto dto, String encodedPassword) {
        return User.builder()
                .email(dto.getEmail())
                .username(dto.getUsername())
                .firstName(dto.getFirstName())
                .lastName(dto.getLastName())
                .password(encodedPassword)
                .build();
    }

    public static UserCreatedDto toCreatedDto(User user) {
        return UserCreatedDto.builder()
                .email(user.getEmail())
                .id(user.getId())
                .username(user.getUsername())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .build();
    }

    public static UserDto toDto(User user, boolean subscribed, String avatarUrl) {
        if (user == null) return null;
        return UserDto.builder()
                .email(user.getEmail())
                .id(user.getId())
                .username(user.getUsername())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .subscribed(subscribed)
                .avatar(avatarUrl)
                .build();
    }

    public static SubscriptionDto toSubscriptionDto(User author, boolean subscribed, String avatarUrl,
                                                    List<RecipeShortDto> recipes, long recipesCount) {
        return SubscriptionDto.builder()
                .email(author.getEmail())
                .id(author.getId())
                .username(author.getUsername())
                .firstName(author.getFirstName())
                .lastName(author.getLastName())
                .subscribed(subscribed)
                .avatar(avatarUrl)
                .recipes(recipes)
                .recipesCount(recipesCount)
                .build();
    }
}
