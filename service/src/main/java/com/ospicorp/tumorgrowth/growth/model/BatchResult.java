package com.ospicorp.tumorgrowth.growth.model;

import java.util.List;

public record BatchResult(List<FittedAnimal> animals, BatchStats stats) {}
