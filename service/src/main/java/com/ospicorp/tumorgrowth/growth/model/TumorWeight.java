package com.ospicorp.tumorgrowth.growth.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/** Tumor weight recorded at sacrifice; a null {@code day} means the animal's last measured day. */
public record TumorWeight(@NotBlank String animalId, String group, @NotNull @Positive Double weight, Double day) {}
