package com.ospicorp.tumorgrowth.web;

import com.ospicorp.tumorgrowth.config.CsvHttpMessageConverter;
import com.ospicorp.tumorgrowth.config.InvalidParameterException;
import com.ospicorp.tumorgrowth.outlier.model.DataType;
import com.ospicorp.tumorgrowth.outlier.model.FilteringStrictness;
import com.ospicorp.tumorgrowth.outlier.model.ProfilePreset;
import java.util.Comparator;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;

/** Parses the string codes accepted by the API into their enums. Blank codes map to {@code null}. */
final class RequestCodes {
  static final String ERROR_DOCS_BASE = "https://docs.tumor-growth-api.dev/errors/";

  private RequestCodes() {}

  static ProfilePreset profile(String value) {
    if (!StringUtils.hasText(value)) {
      return null;
    }
    return ProfilePreset.find(value.trim()).orElseThrow(() -> invalidParameter(
        "Invalid profile. Supported values: ultraConservative,conservative,moderate,auto.", 2001));
  }

  static FilteringStrictness strictness(String value) {
    if (!StringUtils.hasText(value)) {
      return null;
    }
    try {
      return FilteringStrictness.fromCode(value.trim());
    } catch (IllegalArgumentException ex) {
      throw invalidParameter("Invalid filteringStrictness. Supported values: critical,criticalAndHigh,all.", 2002);
    }
  }

  static DataType dataType(String value) {
    if (!StringUtils.hasText(value)) {
      return DataType.VOLUME;
    }
    try {
      return DataType.fromCode(value.trim());
    } catch (IllegalArgumentException ex) {
      throw invalidParameter("Invalid dataType. Supported values: volume,bli.", 2003);
    }
  }

  static MediaType mediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw invalidParameter("Invalid format value. Supported values: json,csv.", 2004);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
    }
    return MediaType.APPLICATION_JSON;
  }

  static InvalidParameterException invalidParameter(String message, int errorCode) {
    return new InvalidParameterException(message, errorCode, ERROR_DOCS_BASE + errorCode);
  }
}
