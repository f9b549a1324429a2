package com.foodgram.backend.domain.repository;

import com.foodgram.backend.domain.dto.recipe.RecipeSearchCondition;
import com.foodgram.backend.domain.entity.QFavorite;
import com.foodgram.backend.domain.entity.QRecipe;
import com.foodgram.backend.domain.entity.QShoppingCart;
import com.foodgram.backend.domain.entity.QTag;
import com.foodgram.backend.domain.entity.Recipe;
import com.querydsl.core.types.dsl.BooleanExpression;
import com.querydsl.jpa.JPAExpressions;
import com.querydsl.jpa.impl.JPAQueryFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

import java.util.List;

@RequiredArgsConstructor
public class RecipeQueryRepositoryImpl implements RecipeQueryRepository {

    private final JPAQueryFactory queryFactory;

    private static final QRecipe recipe = QRecipe.recipe;

    @Override
    public Page<Recipe> search(RecipeSearchCondition cond, Pageable pageable, Long currentUserId) {
        BooleanExpression[] where = {
                authorEq(cond.getAuthorId()),
                anyTagIn(cond.getTags()),
                favoritedBy(cond.isFavorited(), currentUserId),
                inShoppingCartOf(cond.isInShoppingCart(), currentUserId),
                searchContains(cond.getSearch())
        };

        List<Recipe> content = queryFactory
                .selectFrom(recipe)
                .join(recipe.author).fetchJoin()
                .where(where)
                .orderBy(recipe.createdAt.desc(), recipe.id.desc())
                .offset(pageable.getOffset())
                .limit(pageable.getPageSize())
                .fetch();

        Long total = queryFactory
                .select(recipe.count())
                .from(recipe)
                .where(where)
                .fetchOne();

        return new PageImpl<>(content, pageable, total != null ? total : 0);
    }

    private BooleanExpression authorEq(Long authorId) {
        return authorId != null ? recipe.author.id.eq(authorId) : null;
    }

    // OR semantics: a subquery keeps the outer query free of duplicate rows
    private BooleanExpression anyTagIn(List<String> slugs) {
        if (CollectionUtils.isEmpty(slugs)) {
            return null;
        }
        QRecipe tagged = new QRecipe("tagged");
        QTag tag = QTag.tag;
        return recipe.id.in(
                JPAExpressions.select(tagged.id)
                        .from(tagged)
                        .join(tagged.tags, tag)
                        .where(tag.slug.in(slugs))
        );
    }

    private BooleanExpression favoritedBy(boolean enabled, Long userId) {
        if (!enabled || userId == null) {
            return null;
        }
        QFavorite favorite = QFavorite.favorite;
        return recipe.id.in(
                JPAExpressions.select(favorite.recipe.id)
                        .from(favorite)
                        .where(favorite.user.id.eq(userId))
        );
    }

    private BooleanExpression inShoppingCartOf(boolean enabled, Long userId) {
        if (!enabled || userId == null) {
            return null;
        }
        QShoppingCart cart = QShoppingCart.shoppingCart;
        return recipe.id.in(
                JPAExpressions.select(cart.recipe.id)
                        .from(cart)
                        .where(cart.user.id.eq(userId))
        );
    }

    private BooleanExpression searchContains(String search) {
        if (!StringUtils.hasText(search)) {
            return null;
        }
        String keyword = search.trim();
        QRecipe tagged = new QRecipe("searchTagged");
        QTag tag = new QTag("searchTag");
        return recipe.author.username.containsIgnoreCase(keyword)
                .or(recipe.id.in(
                        JPAExpressions.select(tagged.id)
                                .from(tagged)
                                .join(tagged.tags, tag)
                                .where(tag.slug.containsIgnoreCase(keyword))
                ));
    }
}
