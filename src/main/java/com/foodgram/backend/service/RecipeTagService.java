package com.foodgram.backend.service;

import com.foodgram.backend.domain.entity.Tag;
import com.foodgram.backend.domain.repository.TagRepository;
import com.foodgram.backend.exception.RequestValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class RecipeTagService {

    private static final String FIELD = "tags";

    private final TagRepository tagRepository;

    /**
     * Resolves the submitted tag ids, keeping submission order.
     */
    public Set<Tag> resolveTags(List<Long> tagIds) {
        if (tagIds == null || tagIds.isEmpty()) {
            throw new RequestValidationException(FIELD, "Choose at least one tag.");
        }
        if (new HashSet<>(tagIds).size() != tagIds.size()) {
            throw new RequestValidationException(FIELD, "Tags must not repeat.");
        }

        Map<Long, Tag> tagMap = tagRepository.findAllById(tagIds).stream()
                .collect(Collectors.toMap(Tag::getId, Function.identity()));

        Set<Tag> tags = new LinkedHashSet<>();
        for (Long tagId : tagIds) {
            Tag tag = tagMap.get(tagId);
            if (tag == null) {
                throw new RequestValidationException(FIELD, "Tag with id " + tagId + " does not exist.");
            }
            tags.add(tag);
        }
        return tags;
    }
}
