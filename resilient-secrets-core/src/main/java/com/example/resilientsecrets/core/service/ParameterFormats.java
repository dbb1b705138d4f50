package com.example.resilientsecrets.core.service;

import com.example.resilientsecrets.core.error.ErrorKind;
import com.example.resilientsecrets.core.error.StoreAccessException;
import com.example.resilientsecrets.core.model.ParameterFormat;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.nio.charset.StandardCharsets;

/** Validation and conversion of parameter data in its declared {@link ParameterFormat}. */
public final class ParameterFormats {

  /** Largest parameter payload in bytes, once encoded as UTF-8. */
  public static final int MAX_DATA_BYTES = 1024 * 1024;

  private static final ObjectMapper JSON =
      new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

  private ParameterFormats() {}

  /**
   * Checks that {@code data} is well formed for {@code format} and within the size limit.
   *
   * @param format declared format
   * @param data parameter data
   * @throws StoreAccessException {@code INVALID_ARGUMENT} if the data is rejected
   */
  public static void validate(final ParameterFormat format, final String data) {
    if (format == null) throw StoreAccessException.invalidArgument("format is required");
    if (data == null) throw StoreAccessException.invalidArgument("data is required");
    final var size = data.getBytes(StandardCharsets.UTF_8).length;
    if (size > MAX_DATA_BYTES)
      throw StoreAccessException.invalidArgument(
          "Parameter data is %d bytes, limit is %d".formatted(size, MAX_DATA_BYTES));
    if (format != ParameterFormat.UNFORMATTED) parse(format, data);
  }

  /**
   * Parses data into a tree. Unformatted data becomes a single text node.
   *
   * @param format declared format
   * @param data parameter data
   * @return parsed tree
   */
  public static JsonNode readTree(final ParameterFormat format, final String data) {
    if (format == ParameterFormat.UNFORMATTED) return TextNode.valueOf(data);
    return parse(format, data);
  }

  /**
   * Binds data to {@code type}.
   *
   * @param format declared format
   * @param data parameter data
   * @param type target type
   * @param <T> target type
   * @return bound value
   */
  public static <T> T convert(
      final ParameterFormat format, final String data, final Class<T> type) {
    try {
      return JSON.treeToValue(readTree(format, data), type);
    } catch (final JsonProcessingException | IllegalArgumentException e) {
      throw new StoreAccessException(
          ErrorKind.INVALID_ARGUMENT,
          "Cannot bind %s parameter data to %s".formatted(format, type.getName()),
          e);
    }
  }

  /**
   * Serializes a structured value in {@code format}. Unformatted parameters take the value's
   * string form.
   *
   * @param format target format
   * @param value value to serialize
   * @return serialized data
   */
  public static String write(final ParameterFormat format, final Object value) {
    if (value == null) throw StoreAccessException.invalidArgument("value is required");
    try {
      return switch (format) {
        case JSON -> JSON.writeValueAsString(value);
        case YAML -> YAML.writeValueAsString(value);
        case UNFORMATTED -> String.valueOf(value);
      };
    } catch (final JsonProcessingException e) {
      throw new StoreAccessException(
          ErrorKind.INVALID_ARGUMENT, "Cannot write value as " + format, e);
    }
  }

  private static JsonNode parse(final ParameterFormat format, final String data) {
    final var mapper = format == ParameterFormat.YAML ? YAML : JSON;
    final JsonNode tree;
    try {
      tree = mapper.readTree(data);
    } catch (final JsonProcessingException e) {
      throw new StoreAccessException(
          ErrorKind.INVALID_ARGUMENT,
          "Parameter data is not valid %s: %s".formatted(format, e.getOriginalMessage()),
          e);
    }
    if (tree == null || tree.isMissingNode())
      throw StoreAccessException.invalidArgument("Parameter data is empty, expected " + format);
    return tree;
  }
}
