package com.remindme.backend.guard.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.Arrays;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.springframework.util.StringUtils;

/** Stores fired alert thresholds as a comma separated list, e.g. {@code 50,80}. */
@Converter
public class ThresholdSetConverter implements AttributeConverter<SortedSet<Integer>, String> {

  @Override
  public String convertToDatabaseColumn(SortedSet<Integer> attribute) {
    if (attribute == null || attribute.isEmpty()) {
      return "";
    }
    return attribute.stream().map(String::valueOf).collect(Collectors.joining(","));
  }

  @Override
  public SortedSet<Integer> convertToEntityAttribute(String dbData) {
    SortedSet<Integer> thresholds = new TreeSet<>();
    if (!StringUtils.hasText(dbData)) {
      return thresholds;
    }
    Arrays.stream(dbData.split(","))
        .map(String::trim)
        .filter(StringUtils::hasText)
        .map(Integer::valueOf)
        .forEach(thresholds::add);
    return thresholds;
  }
}
