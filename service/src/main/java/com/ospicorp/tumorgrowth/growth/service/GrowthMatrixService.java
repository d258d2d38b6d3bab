package com.ospicorp.tumorgrowth.growth.service;

import com.ospicorp.tumorgrowth.growth.model.GrowthMatrix;
import com.ospicorp.tumorgrowth.growth.model.IntervalComparison;
import com.ospicorp.tumorgrowth.growth.model.IntervalRef;
import com.ospicorp.tumorgrowth.model.AnimalRecord;
import com.ospicorp.tumorgrowth.stats.EffectSize;
import com.ospicorp.tumorgrowth.stats.MannWhitneyResult;
import com.ospicorp.tumorgrowth.stats.Statistics;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.TreeSet;
import org.springframework.stereotype.Service;

@Service
public class GrowthMatrixService {

  public Map<String, GrowthMatrix> matrices(List<AnimalRecord> animals) {
    Map<String, GrowthMatrix> out = new LinkedHashMap<>();
    Statistics.groupBy(nonNull(animals), AnimalRecord::groupKey)
        .forEach((group, members) -> out.put(group, matrix(group, members)));
    return out;
  }

  public GrowthMatrix matrix(String group, List<AnimalRecord> members) {
    TreeSet<Double> daySet = new TreeSet<>();
    for (AnimalRecord animal : members) {
      for (int i = 0; i < animal.pairCount(); i++) {
        Double day = animal.timePoints().get(i);
        if (AnimalRecord.isFinite(day)) {
          daySet.add(day);
        }
      }
    }
    List<Double> days = new ArrayList<>(daySet);
    int size = days.size();
    double[][] values = new double[size][size];
    Map<String, List<Double>> individual = new LinkedHashMap<>();

    for (int i = 0; i < size; i++) {
      for (int j = i + 1; j < size; j++) {
        double dayX = days.get(i);
        double dayY = days.get(j);
        List<Double> rates = individualRates(members, dayX, dayY);
        double average = rates.isEmpty() ? 0d : Statistics.mean(rates);
        values[i][j] = average;
        values[j][i] = average;
        individual.put(GrowthMatrix.intervalKey(dayX, dayY), rates);
      }
    }

    List<List<Double>> rows = new ArrayList<>(size);
    for (double[] row : values) {
      List<Double> r = new ArrayList<>(size);
      for (double v : row) {
        r.add(v);
      }
      rows.add(r);
    }
    return new GrowthMatrix(group, days, rows, individual);
  }

  /**
   * Compares the individual growth rates of two day intervals.
   *
   * @throws NoSuchElementException if a referenced group is absent
   * @throws IllegalArgumentException if an interval has no individual rates
   */
  public IntervalComparison compare(List<AnimalRecord> animals, IntervalRef first, IntervalRef second) {
    Map<String, List<AnimalRecord>> groups = Statistics.groupBy(nonNull(animals), AnimalRecord::groupKey);
    List<Double> data1 = ratesFor(groups, first);
    List<Double> data2 = ratesFor(groups, second);
    return compare(first.label(), data1, second.label(), data2);
  }

  public IntervalComparison compare(String label1, List<Double> data1, String label2, List<Double> data2) {
    MannWhitneyResult mw = Statistics.mannWhitneyU(data1, data2);
    EffectSize d = Statistics.cohensD(data1, data2);
    return new IntervalComparison(label1, label2, data1.size(), data2.size(), mw, d,
        Statistics.median(data1), Statistics.median(data2), mw.p() < 0.05,
        Statistics.asteriskNotation(mw.p()));
  }

  private List<Double> ratesFor(Map<String, List<AnimalRecord>> groups, IntervalRef ref) {
    List<AnimalRecord> members = groups.get(ref.group());
    if (members == null) {
      throw new NoSuchElementException("Group not found: " + ref.group());
    }
    double from = Math.min(ref.fromDay(), ref.toDay());
    double to = Math.max(ref.fromDay(), ref.toDay());
    List<Double> rates = individualRates(members, from, to);
    if (rates.isEmpty()) {
      throw new IllegalArgumentException("No growth rates available for " + ref.label());
    }
    return rates;
  }

  private static List<Double> individualRates(List<AnimalRecord> members, double dayX, double dayY) {
    List<Double> rates = new ArrayList<>();
    for (AnimalRecord animal : members) {
      int x = animal.indexOfDay(dayX);
      int y = animal.indexOfDay(dayY);
      if (x == -1 || y == -1) continue;
      Double vx = animal.measurements().get(x);
      Double vy = animal.measurements().get(y);
      if (AnimalRecord.isPositive(vx) && AnimalRecord.isPositive(vy)) {
        rates.add(Statistics.tumorGrowthRate(vx, vy, dayX, dayY));
      }
    }
    return rates;
  }

  private static List<AnimalRecord> nonNull(List<AnimalRecord> animals) {
    List<AnimalRecord> out = new ArrayList<>();
    if (animals != null) {
      for (AnimalRecord a : animals) {
        if (a != null) out.add(a);
      }
    }
    return out;
  }
}
