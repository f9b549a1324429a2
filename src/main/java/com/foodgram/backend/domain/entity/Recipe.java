package com.foodgram.backend.domain.entity;

import com.foodgram.backend.domain.entity.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.BatchSize;
import org.hibernate.annotations.Fetch;
import org.hibernate.annotations.FetchMode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Entity
@Table(
        name = "recipes",
        indexes = {
                @Index(name = "idx_author_id", columnList = "author_id"),
                @Index(name = "idx_created_at", columnList = "created_at")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Recipe extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "author_id", nullable = false)
    private User author;

    @Column(length = 256, nullable = false)
    private String name;

    @Column(name = "image_key", nullable = false)
    private String imageKey;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String text;

    @Column(name = "cooking_time", nullable = false)
    private Integer cookingTime;

    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "recipe_tags",
            joinColumns = @JoinColumn(name = "recipe_id"),
            inverseJoinColumns = @JoinColumn(name = "tag_id"),
            uniqueConstraints = @UniqueConstraint(columnNames = {"recipe_id", "tag_id"})
    )
    @BatchSize(size = 20)
    @OrderBy("name ASC")
    @Builder.Default
    private Set<Tag> tags = new LinkedHashSet<>();

    @OneToMany(mappedBy = "recipe", fetch = FetchType.LAZY)
    @BatchSize(size = 20)
    @Fetch(FetchMode.SUBSELECT)
    @Builder.Default
    private List<RecipeIngredient> ingredients = new ArrayList<>();

    public void update(String name, String text, Integer cookingTime, String imageKey) {
        if (name != null) this.name = name;
        if (text != null) this.text = text;
        if (cookingTime != null) this.cookingTime = cookingTime;
        if (imageKey != null) this.imageKey = imageKey;
    }

    public void replaceTags(Set<Tag> tags) {
        this.tags.clear();
        this.tags.addAll(tags);
    }

    public boolean isAuthoredBy(Long userId) {
        return author != null && author.getId() != null && author.getId().equals(userId);
    }
}
