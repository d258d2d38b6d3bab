package com.ospicorp.tumorgrowth.outlier.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.ospicorp.tumorgrowth.model.AnimalRecord;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/** Named sensitivity profiles. {@link #AUTO} picks one of the others from the study size. */
public enum ProfilePreset {
  ULTRA_CONSERVATIVE("ultraConservative", new SensitivityProfile(
      "Ultra-Conservative (pilot studies, n=5-8)", Math.log(50), Math.log(10), 4.0, true, 8, Math.log(20))),
  CONSERVATIVE("conservative", new SensitivityProfile(
      "Conservative (standard studies, n=8-12)", Math.log(20), Math.log(5), 3.0, true, 5, Math.log(10))),
  MODERATE("moderate", new SensitivityProfile(
      "Moderate (large studies, n>12)", Math.log(10), Math.log(3), 2.0, false, 4, Math.log(5))),
  AUTO("auto", null);

  static final int PILOT_MAX_GROUP_SIZE = 8;
  static final int STANDARD_MAX_GROUP_SIZE = 12;

  private final String code;
  private final SensitivityProfile profile;

  ProfilePreset(String code, SensitivityProfile profile) {
    this.code = code;
    this.profile = profile;
  }

  @JsonValue
  public String code() {
    return code;
  }

  /** Fixed thresholds of this preset; empty for {@link #AUTO}. */
  public Optional<SensitivityProfile> profile() {
    return Optional.ofNullable(profile);
  }

  /** Thresholds to use for the given animals, resolving {@link #AUTO} from the largest group. */
  public SensitivityProfile resolve(Collection<AnimalRecord> animals) {
    if (profile != null) {
      return profile;
    }
    return forLargestGroup(largestGroupSize(animals)).profile;
  }

  public static ProfilePreset forLargestGroup(int size) {
    if (size <= PILOT_MAX_GROUP_SIZE) {
      return ULTRA_CONSERVATIVE;
    }
    return size <= STANDARD_MAX_GROUP_SIZE ? CONSERVATIVE : MODERATE;
  }

  /** Looks a preset up by code; unknown or missing names fall back to {@link #CONSERVATIVE}. */
  public static ProfilePreset fromCode(String code) {
    return find(code).orElse(CONSERVATIVE);
  }

  public static Optional<ProfilePreset> find(String code) {
    if (code == null) {
      return Optional.empty();
    }
    return Arrays.stream(values())
        .filter(p -> p.code.equalsIgnoreCase(code) || p.name().equalsIgnoreCase(code))
        .findFirst();
  }

  static int largestGroupSize(Collection<AnimalRecord> animals) {
    if (animals == null || animals.isEmpty()) {
      return 0;
    }
    Map<String, Integer> sizes = new HashMap<>();
    for (AnimalRecord a : animals) {
      if (a != null) {
        sizes.merge(a.groupKey(), 1, Integer::sum);
      }
    }
    return sizes.values().stream().mapToInt(Integer::intValue).max().orElse(0);
  }
}
