package io.pocwatchdog.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pocwatchdog.WatchdogException;
import io.pocwatchdog.ast.MappingKey;
import io.pocwatchdog.ast.ScheduleValue;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a schedule value from JSON text.
 *
 * <p>Integral numbers map to {@link ScheduleValue.Seconds}, strings to {@link
 * ScheduleValue.Text}, arrays to {@link ScheduleValue.Items} and objects to {@link
 * ScheduleValue.Mapping}. Object keys made only of ASCII digits are calendar days; all other keys
 * are weekday aliases. JSON object keys are always strings, so {@code {"1": ...}} means the 1st of
 * the month here, while {@code {"mon": ...}} means Monday.
 */
public final class JsonScheduleReader {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private JsonScheduleReader() {}

  /**
   * Reads a schedule value.
   *
   * @param json the JSON text, e.g. {@code {"1": "08:00", "fri": [3600]}}
   * @return the schedule value
   * @throws WatchdogException if the text is not valid JSON
   */
  public static ScheduleValue read(String json) throws WatchdogException {
    if (json == null || json.isBlank()) {
      throw WatchdogException.invalidSchedule("empty schedule", json);
    }
    JsonNode root;
    try {
      root = MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw WatchdogException.invalidSchedule(
          "malformed schedule JSON: " + e.getOriginalMessage(), json);
    }
    return toValue(root);
  }

  /**
   * Converts an already parsed JSON node.
   *
   * @param node the JSON node
   * @return the schedule value
   */
  public static ScheduleValue toValue(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return new ScheduleValue.Unsupported(null);
    }
    if (node.isIntegralNumber() && node.canConvertToLong()) {
      return new ScheduleValue.Seconds(node.longValue());
    }
    if (node.isNumber()) {
      return new ScheduleValue.Unsupported(node.numberValue());
    }
    if (node.isBoolean()) {
      return new ScheduleValue.Unsupported(node.booleanValue());
    }
    if (node.isTextual()) {
      return new ScheduleValue.Text(node.textValue());
    }
    if (node.isArray()) {
      List<ScheduleValue> items = new ArrayList<>(node.size());
      for (JsonNode item : node) {
        items.add(toValue(item));
      }
      return new ScheduleValue.Items(items);
    }
    if (node.isObject()) {
      Map<MappingKey, ScheduleValue> entries = new LinkedHashMap<>();
      Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        entries.put(toKey(field.getKey()), toValue(field.getValue()));
      }
      return new ScheduleValue.Mapping(entries);
    }
    return new ScheduleValue.Unsupported(node.toString());
  }

  private static MappingKey toKey(String name) {
    if (!name.isEmpty() && name.length() <= 9 && name.chars().allMatch(c -> c >= '0' && c <= '9')) {
      return new MappingKey.CalendarDayKey(Integer.parseInt(name));
    }
    return new MappingKey.NamedKey(name);
  }
}
