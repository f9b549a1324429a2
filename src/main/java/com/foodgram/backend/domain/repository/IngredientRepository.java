package com.foodgram.backend.domain.repository;

import com.foodgram.backend.domain.entity.Ingredient;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface IngredientRepository extends JpaRepository<Ingredient, Long> {

    List<Ingredient> findAllByOrderByNameAsc();

    List<Ingredient> findByNameStartingWithIgnoreCaseOrderByNameAsc(String prefix);

    boolean existsByNameAndMeasurementUnit(String name, String measurementUnit);
}
