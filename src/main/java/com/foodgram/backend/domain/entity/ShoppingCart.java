package com.foodgram.backend.domain.entity;

import com.foodgram.backend.domain.entity.common.BaseCreateTimeEntity;
import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "shopping_carts", uniqueConstraints = {
        @UniqueConstraint(name = "unique_shopping_cart", columnNames = {"user_id", "recipe_id"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class ShoppingCart extends BaseCreateTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "recipe_id", nullable = false)
    private Recipe recipe;
}
