package com.foodgram.backend.domain.repository;

import com.foodgram.backend.domain.entity.Recipe;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
public interface RecipeRepository extends JpaRepository<Recipe, Long>, RecipeQueryRepository {

    @EntityGraph(attributePaths = {"author", "tags"})
    @Query("""
            SELECT r FROM Recipe r
            WHERE r.id = :recipeId
        """)
    Optional<Recipe> findDetailById(@Param("recipeId") Long recipeId);

    @Query("""
                SELECT r FROM Recipe r
                JOIN FETCH r.author
                WHERE r.id = :recipeId
            """)
    Optional<Recipe> findWithAuthorById(@Param("recipeId") Long recipeId);

    boolean existsByTagsId(Long tagId);

    List<Recipe> findByAuthorIdOrderByCreatedAtDesc(Long authorId, Pageable pageable);

    @Query("""
            SELECT r.author.id, COUNT(r.id)
            FROM Recipe r
            WHERE r.author.id IN :authorIds
            GROUP BY r.author.id
            """)
    List<Object[]> countByAuthorIdsRaw(@Param("authorIds") List<Long> authorIds);

    default Map<Long, Long> countMapByAuthorIds(List<Long> authorIds) {
        return countByAuthorIdsRaw(authorIds).stream()
                .collect(Collectors.toMap(
                        a -> (Long) a[0],
                        a -> a[1] != null ? (Long) a[1] : 0L
                ));
    }
}
