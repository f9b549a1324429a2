package com.foodgram.backend.domain.dto.recipe;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * One aggregated line of the shopping list: an ingredient and its summed amount.
 */
@Getter
@AllArgsConstructor
public class ShoppingListItemDto {
    private String name;
    private String measurementUnit;
    private Long totalAmount;

    public String toLine() {
        return name + " - " + totalAmount + " " + measurementUnit;
    }
}
