package com.github.statechart;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import com.github.statechart.StateChartException.Code;

/**
 * Reads state chart documents written in YAML or JSON into the generic value tree. Anything that
 * isn't well formed or uses values outside of the tree's cases fails with
 * {@link Code#VALIDATION_ERROR}.
 */
public final class ChartDocumentReader {
  private static final Logger logger =
      LogManager.getLogger(ChartDocumentReader.class.getSimpleName());

  public ValidatedValue read(final String document) throws StateChartException {
    final Object data;
    try {
      data = newYaml().load(document);
    } catch (YAMLException problem) {
      throw new StateChartException(Code.VALIDATION_ERROR,
          "Malformed state chart document: " + problem.getMessage(), problem);
    }
    return toValidatedValue(data, "");
  }

  public ValidatedValue read(final InputStream document) throws StateChartException {
    if (document == null) {
      throw new StateChartException(Code.VALIDATION_ERROR, "State chart document is missing");
    }
    final Object data;
    try (Reader reader = new InputStreamReader(document, StandardCharsets.UTF_8)) {
      data = newYaml().load(reader);
    } catch (YAMLException | IOException problem) {
      throw new StateChartException(Code.VALIDATION_ERROR,
          "Malformed state chart document: " + problem.getMessage(), problem);
    }
    return toValidatedValue(data, "");
  }

  // Yaml instances are not thread-safe
  private static Yaml newYaml() {
    return new Yaml(new SafeConstructor(new LoaderOptions()));
  }

  private static ValidatedValue toValidatedValue(final Object data, final String location)
      throws StateChartException {
    if (data == null) {
      return ValidatedValue.none();
    }
    if (data instanceof String) {
      return ValidatedValue.ofString((String) data);
    }
    if (data instanceof Boolean) {
      return ValidatedValue.ofBool((Boolean) data);
    }
    if (data instanceof Integer || data instanceof Long) {
      return ValidatedValue.ofInteger(((Number) data).longValue());
    }
    if (data instanceof BigInteger) {
      try {
        return ValidatedValue.ofInteger(((BigInteger) data).longValueExact());
      } catch (ArithmeticException problem) {
        throw new StateChartException(Code.VALIDATION_ERROR,
            "Integer out of range at '" + location + "': " + data, problem);
      }
    }
    if (data instanceof Double || data instanceof Float) {
      return ValidatedValue.ofNumber(((Number) data).doubleValue());
    }
    if (data instanceof List) {
      final List<ValidatedValue> elements = new ArrayList<>();
      int index = 0;
      for (final Object element : (List<?>) data) {
        elements.add(toValidatedValue(element, location + "[" + index++ + "]"));
      }
      return ValidatedValue.ofArray(elements);
    }
    if (data instanceof Map) {
      final Map<String, ValidatedValue> attributes = new LinkedHashMap<>();
      for (final Map.Entry<?, ?> entry : ((Map<?, ?>) data).entrySet()) {
        if (!(entry.getKey() instanceof String)) {
          throw new StateChartException(Code.VALIDATION_ERROR,
              "Object keys must be strings at '" + location + "': " + entry.getKey());
        }
        final String key = (String) entry.getKey();
        attributes.put(key, toValidatedValue(entry.getValue(), location + "/" + key));
      }
      return ValidatedValue.ofObject(attributes);
    }
    logger.warn("Rejecting value of type " + data.getClass().getName() + " at '" + location + "'");
    throw new StateChartException(Code.VALIDATION_ERROR,
        "Unsupported value at '" + location + "': " + data);
  }
}
