package org.servekit.utils;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.File;
import java.io.IOException;

/**
 * Utilities for serializing and deserializing objects to and from the persistence formats used by
 * the model store and the artifact codec (JSON and YAML)
 */
public class SerializationUtils {
  private static final ObjectMapper jsonMapper =
      new ObjectMapper(new JsonFactory()).enable(SerializationFeature.INDENT_OUTPUT);
  private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

  /**
   * Produces a JSON string representation of a Java object
   *
   * @return A string in valid JSON format
   */
  public static String toJson(Object object) throws JsonProcessingException {
    return jsonMapper.writeValueAsString(object);
  }

  /**
   * Produces a Java object representation of a JSON-formatted string
   *
   * @param json A string in valid JSON format
   * @param objectClass The class of the Java object that should be produced
   */
  public static <T> T fromJson(String json, Class<T> objectClass) throws IOException {
    return jsonMapper.readValue(json, objectClass);
  }

  /** Writes the JSON representation of a Java object to the specified file */
  public static void writeJsonToFile(File jsonFile, Object object) throws IOException {
    jsonMapper.writeValue(jsonFile, object);
  }

  /** Writes the YAML representation of a Java object to the specified file */
  public static void writeYamlToFile(File yamlFile, Object object) throws IOException {
    yamlMapper.writeValue(yamlFile, object);
  }

  /**
   * Produces a Java object representation of a JSON-formatted file
   *
   * @param jsonFile A reference to a JSON-formatted file
   * @param objectClass The class of the Java object that should be produced
   */
  public static <T> T parseJsonFromFile(File jsonFile, Class<T> objectClass) throws IOException {
    return parseFromFile(jsonFile, objectClass, jsonMapper);
  }

  /**
   * Produces a Java object representation of a YAML-formatted file
   *
   * @param yamlFile A reference to a YAML-formatted file
   * @param objectClass The class of the Java object that should be produced
   */
  public static <T> T parseYamlFromFile(File yamlFile, Class<T> objectClass) throws IOException {
    return parseFromFile(yamlFile, objectClass, yamlMapper);
  }

  /** Converts an untyped structure (maps, lists, scalars) into an instance of the given class */
  public static <T> T convertValue(Object value, Class<T> objectClass) {
    return jsonMapper.convertValue(value, objectClass);
  }

  private static <T> T parseFromFile(File file, Class<T> objectClass, ObjectMapper mapper)
      throws IOException {
    return mapper.readValue(file, objectClass);
  }
}
