package com.foodgram.backend.service;

import com.foodgram.backend.domain.dto.user.AvatarDto;
import com.foodgram.backend.domain.dto.user.SetPasswordRequestDto;
import com.foodgram.backend.domain.dto.user.UserCreateRequestDto;
import com.foodgram.backend.domain.dto.user.UserCreatedDto;
import com.foodgram.backend.domain.dto.user.UserDto;
import com.foodgram.backend.domain.entity.User;
import com.foodgram.backend.domain.repository.SubscriptionRepository;
import com.foodgram.backend.domain.repository.UserRepository;
import com.foodgram.backend.exception.CustomException;
import com.foodgram.backend.exception.ErrorCode;
import com.foodgram.backend.exception.RequestValidationException;
import com.foodgram.backend.mapper.UserMapper;
import com.foodgram.backend.service.image.ImageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class UserService {

    static final String RESERVED_USERNAME = "me";

    private final UserRepository userRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final PasswordEncoder passwordEncoder;
    private final ImageService imageService;

    @Transactional
    public UserCreatedDto register(UserCreateRequestDto dto) {
        if (RESERVED_USERNAME.equalsIgnoreCase(dto.getUsername())) {
            throw new RequestValidationException("username", "The username '" + RESERVED_USERNAME + "' is reserved.");
        }
        if (userRepository.existsByEmail(dto.getEmail())) {
            throw new RequestValidationException(ErrorCode.DUPLICATE_EMAIL, "email");
        }
        if (userRepository.existsByUsername(dto.getUsername())) {
            throw new RequestValidationException(ErrorCode.DUPLICATE_USERNAME, "username");
        }

        User user = userRepository.save(UserMapper.toEntity(dto, passwordEncoder.encode(dto.getPassword())));
        log.info("User registered: id={}, username={}", user.getId(), user.getUsername());
        return UserMapper.toCreatedDto(user);
    }

    public Page<UserDto> getUsers(Pageable pageable, Long currentUserId) {
        Pageable byId = PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(), Sort.by("id"));
        Page<User> users = userRepository.findAll(byId);

        List<Long> ids = users.getContent().stream().map(User::getId).toList();
        Set<Long> subscribed = findSubscribedAuthorIds(currentUserId, ids);

        return users.map(user -> toUserDto(user, subscribed.contains(user.getId())));
    }

    public UserDto getUser(Long userId, Long currentUserId) {
        User user = findUser(userId);
        boolean subscribed = currentUserId != null
                && subscriptionRepository.existsBySubscriberIdAndAuthorId(currentUserId, userId);
        return toUserDto(user, subscribed);
    }

    public UserDto getMe(Long userId) {
        return toUserDto(findUser(userId), false);
    }

    @Transactional
    public void setPassword(Long userId, SetPasswordRequestDto dto) {
        User user = findUser(userId);
        if (!passwordEncoder.matches(dto.getCurrentPassword(), user.getPassword())) {
            throw new RequestValidationException(ErrorCode.INVALID_CURRENT_PASSWORD, "current_password");
        }
        user.changePassword(passwordEncoder.encode(dto.getNewPassword()));
        log.info("Password changed: userId={}", userId);
    }

    /**
     * Replaces the avatar with either the multipart file or the data URI, the file winning
     * when both are present.
     */
    @Transactional
    public AvatarDto updateAvatar(Long userId, String dataUri, MultipartFile file) {
        User user = findUser(userId);

        String newKey;
        if (file != null && !file.isEmpty()) {
            newKey = imageService.storeMultipart(file, ImageService.AVATAR_DIRECTORY, "avatar");
        } else if (StringUtils.hasText(dataUri)) {
            newKey = imageService.storeDataUri(dataUri, ImageService.AVATAR_DIRECTORY, "avatar");
        } else {
            throw new RequestValidationException(ErrorCode.AVATAR_REQUIRED, "avatar");
        }

        imageService.discardOnRollback(newKey);

        String oldKey = user.getAvatarKey();
        user.updateAvatarKey(newKey);
        imageService.deleteAfterCommit(oldKey);

        return new AvatarDto(imageService.toUrl(newKey));
    }

    @Transactional
    public void deleteAvatar(Long userId) {
        User user = findUser(userId);
        String oldKey = user.getAvatarKey();
        user.updateAvatarKey(null);
        imageService.deleteAfterCommit(oldKey);
    }

    public UserDto toUserDto(User user, boolean subscribed) {
        return UserMapper.toDto(user, subscribed, imageService.toUrl(user.getAvatarKey()));
    }

    /**
     * Ids among {@code authorIds} that {@code subscriberId} follows; empty for anonymous callers.
     */
    public Set<Long> findSubscribedAuthorIds(Long subscriberId, Collection<Long> authorIds) {
        if (subscriberId == null || authorIds.isEmpty()) {
            return Collections.emptySet();
        }
        return subscriptionRepository.findAuthorIdsBySubscriberIdAndAuthorIdIn(subscriberId, authorIds);
    }

    public User findUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));
    }
}
