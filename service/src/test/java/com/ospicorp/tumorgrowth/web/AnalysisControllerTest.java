package com.ospicorp.tumorgrowth.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class AnalysisControllerTest {

  private static final List<Map<String, Object>> ANIMALS = List.of(
      animal("A1", "Control", List.of(0, 3, 7), List.of(100, 120, 150)),
      animal("A2", "Control", List.of(0, 3, 7), List.of(100, 125, 155)),
      animal("A3", "Control", List.of(0, 3, 7), List.of(100, -5, 160)));

  @Autowired
  private TestRestTemplate restTemplate;

  @Test
  void pingRespondsWithPong() {
    ResponseEntity<Map<String, Object>> response = exchange("/v1/ping", HttpMethod.GET, null);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("pong", true);
  }

  @Test
  void profilesListsPresetsAndDefaults() {
    ResponseEntity<Map<String, Object>> response = exchange("/v1/profiles", HttpMethod.GET, null);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, Object> body = response.getBody();
    assertThat(body).isNotNull();
    assertThat(body.get("defaultProfile")).isEqualTo("conservative");
    assertThat(body.get("defaultFilteringStrictness")).isEqualTo("criticalAndHigh");
    @SuppressWarnings("unchecked")
    List<Map<String, Object>> profiles = (List<Map<String, Object>>) body.get("profiles");
    assertThat(profiles).extracting(p -> p.get("code"))
        .containsExactly("ultraConservative", "conservative", "moderate", "auto");
    @SuppressWarnings("unchecked")
    Map<String, Object> flagTypes = (Map<String, Object>) body.get("flagTypes");
    assertThat(flagTypes).containsKeys("IMPOSSIBLE_VALUE", "GROUP_OUTLIER", "LAST_DAY_DROP");
  }

  @Test
  void analyzeFlagsImpossibleValueAndExcludesAnimal() {
    Map<String, Object> request = Map.of(
        "animals", ANIMALS,
        "profile", "conservative",
        "filteringStrictness", "criticalAndHigh");

    ResponseEntity<Map<String, Object>> response = exchange("/v1/outliers", HttpMethod.POST, request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, Object> body = response.getBody();
    assertThat(body).isNotNull();
    @SuppressWarnings("unchecked")
    List<Map<String, Object>> flags = (List<Map<String, Object>>) body.get("flags");
    assertThat(flags).hasSize(1);
    assertThat(flags.get(0)).containsEntry("type", "IMPOSSIBLE_VALUE")
        .containsEntry("severity", "critical")
        .containsEntry("animalId", "A3");

    @SuppressWarnings("unchecked")
    List<Map<String, Object>> decisions = (List<Map<String, Object>>) body.get("decisions");
    assertThat(decisions).hasSize(1);
    assertThat(decisions.get(0)).containsEntry("decision", "EXCLUDE");

    @SuppressWarnings("unchecked")
    Map<String, Object> dual = (Map<String, Object>) body.get("dualAnalysis");
    @SuppressWarnings("unchecked")
    Map<String, Object> impact = (Map<String, Object>) dual.get("impact");
    assertThat(impact).containsEntry("animalsExcluded", 1)
        .containsEntry("excludedAnimalIds", List.of("A3"));
    assertThat(body.get("dataType")).isEqualTo("volume");
  }

  @Test
  void analyzeExportsFlagsAsCsv() {
    Map<String, Object> request = Map.of("animals", ANIMALS, "profile", "conservative");

    ResponseEntity<String> response = restTemplate.postForEntity("/v1/outliers?format=csv", request, String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getHeaders().getContentType()).isNotNull();
    assertThat(response.getHeaders().getContentType().toString()).startsWith("text/csv");
    assertThat(response.getBody()).startsWith("animalId,group,day,value,type,severity,message");
    assertThat(response.getBody()).contains("A3").contains("IMPOSSIBLE_VALUE").contains("critical");
  }

  @Test
  void unknownProfileReturnsErrorCode() {
    Map<String, Object> request = Map.of("animals", ANIMALS, "profile", "reckless");

    ResponseEntity<Map<String, Object>> response = exchange("/v1/outliers", HttpMethod.POST, request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("errorCode", 2001)
        .containsEntry("path", "/v1/outliers");
  }

  @Test
  void redecideAppliesNewStrictness() {
    Map<String, Object> flag = Map.of("type", "GROUP_OUTLIER", "animalId", "A1", "group", "Control",
        "day", 7, "value", 150);
    Map<String, Object> request = Map.of("flags", List.of(flag), "filteringStrictness", "all");

    ResponseEntity<Map<String, Object>> response = exchange("/v1/outliers/decisions", HttpMethod.POST, request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("filteringStrictness", "all")
        .containsEntry("excluded", 1)
        .containsEntry("included", 0);
  }

  @Test
  void growthModelRecoversRate() {
    List<Double> days = List.of(0d, 2d, 4d, 6d);
    List<Double> values = days.stream().map(t -> 50 * Math.exp(0.2 * t)).toList();

    ResponseEntity<Map<String, Object>> response = exchange("/v1/growth-models", HttpMethod.POST,
        Map.of("timePoints", days, "measurements", values));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, Object> body = response.getBody();
    assertThat(body).isNotNull();
    assertThat(((Number) body.get("r")).doubleValue()).isCloseTo(0.2, within(1e-6));
    assertThat(((Number) body.get("a")).doubleValue()).isCloseTo(50, within(1e-4));
    assertThat(((Number) body.get("r2")).doubleValue()).isCloseTo(1.0, within(1e-9));
  }

  @Test
  void batchFitReturnsOneEntryPerAnimal() {
    ResponseEntity<Map<String, Object>> response = exchange("/v1/growth-models/batch", HttpMethod.POST,
        Map.of("animals", ANIMALS));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    @SuppressWarnings("unchecked")
    List<Map<String, Object>> fitted = (List<Map<String, Object>>) response.getBody().get("animals");
    assertThat(fitted).extracting(a -> a.get("id")).containsExactly("A1", "A2", "A3");
    assertThat(response.getBody()).containsKey("stats");
  }

  @Test
  void predictionExtrapolatesAndScalesToWeight() {
    List<Double> days = List.of(0d, 7d, 14d, 21d);
    List<Double> values = days.stream().map(t -> 50 * Math.exp(0.1 * t)).toList();
    Map<String, Object> animal = Map.of("id", "M1", "group", "G", "timePoints", days, "measurements", values);

    ResponseEntity<Map<String, Object>> response = exchange("/v1/growth-models/predictions", HttpMethod.POST,
        Map.of("animal", animal, "targetDay", 28, "lastWeight", 0.4, "lastWeightDay", 21));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, Object> body = response.getBody();
    assertThat(body).containsEntry("fitQuality", "excellent").doesNotContainKey("error");
    assertThat(((Number) body.get("predictedMeasurement")).doubleValue())
        .isCloseTo(50 * Math.exp(2.8), within(1e-4));
    assertThat(((Number) body.get("predictedWeight")).doubleValue())
        .isCloseTo(0.4 * Math.exp(0.7), within(1e-6));
  }

  @Test
  void weightPredictionsCompareGroups() {
    List<Double> days = List.of(0d, 7d, 14d, 21d);
    List<Map<String, Object>> animals = List.of(
        Map.of("id", "C1", "group", "Control", "timePoints", days,
            "measurements", days.stream().map(t -> 50 * Math.exp(0.1 * t)).toList()),
        Map.of("id", "T1", "group", "Treated", "timePoints", days,
            "measurements", days.stream().map(t -> 50 * Math.exp(0.05 * t)).toList()));
    List<Map<String, Object>> weights = List.of(
        Map.of("animalId", "C1", "group", "Control", "weight", 0.4),
        Map.of("animalId", "T1", "group", "Treated", "weight", 0.2));

    ResponseEntity<Map<String, Object>> response = exchange("/v1/growth-models/weight-predictions",
        HttpMethod.POST, Map.of("animals", animals, "weights", weights, "targetDay", 28));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, Object> body = response.getBody();
    @SuppressWarnings("unchecked")
    List<Map<String, Object>> predictions = (List<Map<String, Object>>) body.get("predictions");
    assertThat(predictions).extracting(p -> p.get("animalId")).containsExactly("C1", "T1");
    @SuppressWarnings("unchecked")
    List<Map<String, Object>> comparisons = (List<Map<String, Object>>) body.get("comparisons");
    assertThat(comparisons).hasSize(1);
    assertThat(comparisons.get(0)).containsEntry("label1", "Control").containsEntry("label2", "Treated");
  }

  @Test
  void weightPredictionsRejectNonPositiveTargetDay() {
    ResponseEntity<Map<String, Object>> response = exchange("/v1/growth-models/weight-predictions",
        HttpMethod.POST, Map.of("animals", List.of(), "weights", List.of(), "targetDay", 0));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
  }

  @Test
  void homogeneityReportsGroupsAndConfig() {
    ResponseEntity<Map<String, Object>> response = exchange("/v1/homogeneity", HttpMethod.POST,
        Map.of("animals", ANIMALS));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, Object> body = response.getBody();
    assertThat(body).containsEntry("totalAnimals", 3).containsEntry("totalGroups", 1);
    @SuppressWarnings("unchecked")
    Map<String, Object> groups = (Map<String, Object>) body.get("groupAnalysis");
    @SuppressWarnings("unchecked")
    Map<String, Object> control = (Map<String, Object>) groups.get("Control");
    assertThat(control).containsEntry("quality", "excellent").containsEntry("n", 3);

    ResponseEntity<Map<String, Object>> config = exchange("/v1/homogeneity/config", HttpMethod.GET, null);
    assertThat(config.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(config.getBody()).containsEntry("goodCv", 25.0);
  }

  private ResponseEntity<Map<String, Object>> exchange(String url, HttpMethod method, Object body) {
    return restTemplate.exchange(url, method, body == null ? null : new HttpEntity<>(body),
        new ParameterizedTypeReference<>() {});
  }

  private static Map<String, Object> animal(String id, String group, List<Integer> days, List<Integer> values) {
    return Map.of("id", id, "group", group, "timePoints", days, "measurements", values);
  }
}
