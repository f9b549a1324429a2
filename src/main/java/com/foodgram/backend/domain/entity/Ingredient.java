package com.foodgram.backend.domain.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.BatchSize;

@Entity
@Table(name = "ingredients", uniqueConstraints = {
        @UniqueConstraint(name = "unique_ingredient", columnNames = {"name", "measurement_unit"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@BatchSize(size = 50)
public class Ingredient {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 128)
    private String name;

    @Column(name = "measurement_unit", nullable = false, length = 64)
    private String measurementUnit;

    public void update(String name, String measurementUnit) {
        if (name != null) this.name = name;
        if (measurementUnit != null) this.measurementUnit = measurementUnit;
    }
}
