package com.example.resilientsecrets.core.model;

/** Declared value format of a parameter. */
public enum ParameterFormat {
  UNFORMATTED,
  JSON,
  YAML
}
