package com.example.resilientsecrets.core.service;

import com.example.resilientsecrets.core.model.EntityPath;
import com.example.resilientsecrets.core.model.ParameterFormat;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * Data of one parameter version together with its declared format.
 *
 * @param path owning parameter
 * @param versionId version the data was read from
 * @param format declared format of the parameter
 * @param data UTF-8 text as stored
 * @param createTime creation time of the version
 */
public record ParameterValue(
    EntityPath path, String versionId, ParameterFormat format, String data, Instant createTime) {

  public JsonNode asTree() {
    return ParameterFormats.readTree(format, data);
  }

  public <T> T as(final Class<T> type) {
    return ParameterFormats.convert(format, data, type);
  }
}
