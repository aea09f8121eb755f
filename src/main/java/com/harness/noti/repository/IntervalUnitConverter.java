package com.harness.noti.repository;

import com.harness.noti.interval.IntervalUnit;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class IntervalUnitConverter implements AttributeConverter<IntervalUnit, String> {

  @Override
  public String convertToDatabaseColumn(IntervalUnit attribute) {
    return attribute != null ? String.valueOf(attribute.code()) : null;
  }

  @Override
  public IntervalUnit convertToEntityAttribute(String dbData) {
    if (dbData == null) {
      return null;
    }
    return IntervalUnit.fromCode(dbData)
        .orElseThrow(() -> new IllegalStateException("Unknown interval unit in database: " + dbData));
  }
}
