package com.foodgram.backend.domain.repository;

import com.foodgram.backend.domain.entity.Subscription;
import com.foodgram.backend.domain.entity.User;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Set;

@Repository
public interface SubscriptionRepository extends JpaRepository<Subscription, Long> {

    boolean existsBySubscriberIdAndAuthorId(Long subscriberId, Long authorId);

    long deleteBySubscriberIdAndAuthorId(Long subscriberId, Long authorId);

    @Query("SELECT s.author.id FROM Subscription s WHERE s.subscriber.id = :subscriberId AND s.author.id IN :authorIds")
    Set<Long> findAuthorIdsBySubscriberIdAndAuthorIdIn(@Param("subscriberId") Long subscriberId,
                                                       @Param("authorIds") Collection<Long> authorIds);

    @Query(value = """
            SELECT a FROM Subscription s
            JOIN s.author a
            WHERE s.subscriber.id = :subscriberId
            ORDER BY a.username ASC
            """,
            countQuery = "SELECT COUNT(s) FROM Subscription s WHERE s.subscriber.id = :subscriberId")
    Page<User> findAuthorsBySubscriberId(@Param("subscriberId") Long subscriberId, Pageable pageable);
}
