package com.foodgram.backend.domain.entity;

import com.foodgram.backend.domain.entity.common.BaseCreateTimeEntity;
import jakarta.persistence.*;
import lombok.*;

/**
 * Follow relation: {@code subscriber} follows the recipes of {@code author}.
 * Self-subscription is rejected in {@code SubscriptionService}, not by the schema.
 */
@Entity
@Table(name = "subscriptions", uniqueConstraints = {
        @UniqueConstraint(name = "unique_subscription", columnNames = {"subscriber_id", "author_id"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Subscription extends BaseCreateTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "subscriber_id", nullable = false)
    private User subscriber;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "author_id", nullable = false)
    private User author;
}
