package ca.gc.cra.qaops.config;

import ca.gc.cra.qaops.application.rules.IgnoreRule;
import ca.gc.cra.qaops.application.rules.IgnoreRuleSets;
import ca.gc.cra.qaops.application.rules.RulePath;
import ca.gc.cra.qaops.domain.time.DateTimePeriod;
import ca.gc.cra.qaops.domain.time.TimeConstraint;
import ca.gc.cra.qaops.domain.time.TimeRange;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.Tag;

/**
 * <strong>What:</strong> Loads the analyzer YAML configuration into {@link AnalyzerConfig}.
 * <p><strong>Why:</strong> Rule sets are edited by operators; every malformed entry must fail at load time,
 * before any event is analyzed.</p>
 * <p><strong>Format:</strong>
 * <pre>{@code
 * timezone: Europe/Rome
 * business_hours: { start: "09:00", end: "18:00" }
 * products:
 *   SEND:
 *     envs:
 *       prod: { slack_channel_id: C01 }
 *     oncall: { slack_channel_id: C02, pattern: "^ONCALL" }
 *     alarms:
 *       ignore:
 *         - name: "Synthetic [#env#]"
 *           path: attachments.title.alarm_name
 *           environments: [prod]
 *           reason: Synthetic probe
 *           validity: { weekdays: [sat, sun], hours: [{ start: "22:00", end: "02:00" }] }
 *           exclusions: { periods: [{ start: "2025-12-24", end: "2025-12-26" }] }
 * }</pre>
 * <p>Products without an {@code alarms.ignore} list receive {@link IgnoreRuleSets#DEFAULTS}.</p>
 * <p><strong>Thread-safety:</strong> Stateless; a new SnakeYAML instance is created per load.</p>
 *
 * @since 0.1.0
 */
public final class ProductConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(ProductConfigLoader.class);

  /**
   * Reads configuration from a file.
   *
   * @param path YAML file
   * @return parsed configuration
   * @throws IOException when the file is missing or unreadable
   * @throws ConfigurationException when the content is invalid
   */
  public AnalyzerConfig load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      throw new IOException("Configuration file not found: " + path);
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      AnalyzerConfig config = load(reader, path.toString());
      log.info("Loaded configuration for products {} from {}", config.productNames(), path);
      return config;
    }
  }

  /**
   * Reads configuration from a reader.
   *
   * @param reader YAML source; not closed
   * @param sourceName name used in error messages
   * @return parsed configuration
   * @throws ConfigurationException when the content is invalid
   */
  public AnalyzerConfig load(Reader reader, String sourceName) {
    Object rootObj;
    try {
      rootObj = new Yaml(new StringTimestampConstructor()).load(reader);
    } catch (YAMLException ex) {
      throw new ConfigurationException("Invalid YAML in configuration " + sourceName + ": " + ex.getMessage(), ex);
    }
    if (rootObj == null) {
      throw new ConfigurationException("Configuration " + sourceName + " is empty");
    }
    Map<String, Object> root = asMap(rootObj, "root");
    if (root.get("products") == null) {
      throw new ConfigurationException("Configuration file must contain a 'products' section");
    }

    ZoneId zone = parseZone(root.get("timezone"));
    BusinessHours businessHours = parseBusinessHours(root.get("business_hours"));

    Map<String, ProductConfig> products = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : asMap(root.get("products"), "products").entrySet()) {
      String productName = entry.getKey();
      Map<String, Object> productNode = asMapOrEmpty(entry.getValue(), "products." + productName);
      products.put(productName, parseProduct(productName, productNode));
    }
    return new AnalyzerConfig(zone, businessHours, products);
  }

  private ProductConfig parseProduct(String name, Map<String, Object> node) {
    String context = "products." + name;
    Map<String, EnvironmentConfig> environments = new LinkedHashMap<>();
    for (Map.Entry<String, Object> env : asMapOrEmpty(node.get("envs"), context + ".envs").entrySet()) {
      Map<String, Object> envNode = asMapOrEmpty(env.getValue(), context + ".envs." + env.getKey());
      environments.put(env.getKey(), new EnvironmentConfig(env.getKey(), toString(envNode.get("slack_channel_id"))));
    }

    OnCallConfig onCall = null;
    Object onCallNode = node.get("oncall");
    if (onCallNode != null) {
      onCall = parseOnCall(asMap(onCallNode, context + ".oncall"), context + ".oncall");
    }

    List<IgnoreRule> rules;
    Map<String, Object> alarms = asMapOrEmpty(node.get("alarms"), context + ".alarms");
    Object ignoreNode = alarms.get("ignore");
    if (ignoreNode == null) {
      rules = IgnoreRuleSets.DEFAULTS;
      log.debug("Product {} defines no ignore rules; using defaults", name);
    } else {
      rules = parseRules(ignoreNode, context + ".alarms.ignore");
    }
    return new ProductConfig(name, environments, rules, onCall);
  }

  private OnCallConfig parseOnCall(Map<String, Object> map, String context) {
    String channel = requireString(map, "slack_channel_id", context);
    String pattern = requireString(map, "pattern", context);
    try {
      return new OnCallConfig(channel, pattern);
    } catch (PatternSyntaxException ex) {
      throw new ConfigurationException(context + ".pattern is not a valid regular expression: " + ex.getMessage(), ex);
    }
  }

  private List<IgnoreRule> parseRules(Object node, String context) {
    if (!(node instanceof Iterable<?> iterable)) {
      throw new ConfigurationException(context + " must be a list");
    }
    List<IgnoreRule> rules = new ArrayList<>();
    int index = 0;
    for (Object ruleNode : iterable) {
      String ruleContext = context + "[" + index++ + "]";
      rules.add(parseRule(asMap(ruleNode, ruleContext), ruleContext));
    }
    return List.copyOf(rules);
  }

  private IgnoreRule parseRule(Map<String, Object> map, String context) {
    String pattern = requireString(map, "name", context);
    try {
      return new IgnoreRule(
          pattern,
          RulePath.parse(toOptionalString(map.get("path"))),
          toStringList(map.get("environments"), context + ".environments"),
          toOptionalString(map.get("reason")),
          parseConstraint(map.get("validity"), context + ".validity"),
          parseConstraint(map.get("exclusions"), context + ".exclusions"));
    } catch (ConfigurationException ex) {
      throw ex;
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException(context + ": " + ex.getMessage(), ex);
    }
  }

  private TimeConstraint parseConstraint(Object node, String context) {
    if (node == null) {
      return TimeConstraint.empty();
    }
    Map<String, Object> map = asMap(node, context);

    List<DateTimePeriod> periods = new ArrayList<>();
    for (Object periodNode : toList(map.get("periods"), context + ".periods")) {
      Map<String, Object> period = asMap(periodNode, context + ".periods[]");
      periods.add(DateTimePeriod.parse(toOptionalString(period.get("start")), toOptionalString(period.get("end"))));
    }

    List<Integer> weekdays = new ArrayList<>();
    for (Object day : toList(map.get("weekdays"), context + ".weekdays")) {
      weekdays.add(TimeConstraint.weekdayNumber(day));
    }

    List<TimeRange> hours = new ArrayList<>();
    for (Object rangeNode : toList(map.get("hours"), context + ".hours")) {
      Map<String, Object> range = asMap(rangeNode, context + ".hours[]");
      hours.add(TimeRange.parse(
          requireTime(range, "start", context + ".hours[]"), requireTime(range, "end", context + ".hours[]")));
    }
    return new TimeConstraint(periods, weekdays, hours);
  }

  private ZoneId parseZone(Object node) {
    String zone = toOptionalString(node);
    if (zone == null) {
      return AnalyzerConfig.DEFAULT_ZONE;
    }
    try {
      return ZoneId.of(zone.trim());
    } catch (DateTimeException ex) {
      throw new ConfigurationException("Unknown timezone: " + zone, ex);
    }
  }

  private BusinessHours parseBusinessHours(Object node) {
    if (node == null) {
      return BusinessHours.DEFAULT;
    }
    Map<String, Object> map = asMap(node, "business_hours");
    try {
      TimeRange range = TimeRange.parse(
          requireTime(map, "start", "business_hours"), requireTime(map, "end", "business_hours"));
      return new BusinessHours(range.start(), range.end());
    } catch (ConfigurationException ex) {
      throw ex;
    } catch (IllegalArgumentException ex) {
      throw new ConfigurationException("business_hours: " + ex.getMessage(), ex);
    }
  }

  private String requireTime(Map<String, Object> map, String key, String context) {
    Object value = map.get(key);
    if (value instanceof Number) {
      throw new ConfigurationException(context + "." + key + " was read as a number (" + value
          + "); quote times as \"HH:mm\"");
    }
    return requireString(map, key, context);
  }

  private Map<String, Object> asMap(Object node, String context) {
    if (node == null) {
      throw new ConfigurationException(context + " section is missing");
    }
    if (!(node instanceof Map<?, ?> raw)) {
      throw new ConfigurationException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      Object keyObj = entry.getKey();
      if (keyObj == null) {
        throw new ConfigurationException(context + " contains an empty key");
      }
      map.put(keyObj.toString(), entry.getValue());
    }
    return map;
  }

  private Map<String, Object> asMapOrEmpty(Object node, String context) {
    return node == null ? Map.of() : asMap(node, context);
  }

  private List<Object> toList(Object node, String context) {
    if (node == null) {
      return List.of();
    }
    if (!(node instanceof Iterable<?> iterable)) {
      throw new ConfigurationException(context + " must be a list");
    }
    List<Object> values = new ArrayList<>();
    iterable.forEach(values::add);
    return values;
  }

  private List<String> toStringList(Object node, String context) {
    if (node instanceof String single) {
      return single.isBlank() ? List.of() : List.of(single.trim());
    }
    List<String> values = new ArrayList<>();
    for (Object value : toList(node, context)) {
      String str = toOptionalString(value);
      if (str != null) {
        values.add(str.trim());
      }
    }
    return List.copyOf(values);
  }

  private String requireString(Map<String, Object> map, String key, String context) {
    String value = toOptionalString(map.get(key));
    if (value == null) {
      throw new ConfigurationException("Missing required field: " + context + "." + key);
    }
    return value;
  }

  private String toOptionalString(Object value) {
    if (value == null) {
      return null;
    }
    String str = toString(value);
    return str.isBlank() ? null : str;
  }

  private String toString(Object value) {
    return value == null ? "" : value.toString();
  }

  /** Keeps YAML timestamps such as {@code 2025-01-01} as strings so period bounds retain their precision. */
  private static final class StringTimestampConstructor extends SafeConstructor {
    StringTimestampConstructor() {
      super(new LoaderOptions());
      this.yamlConstructors.put(Tag.TIMESTAMP, new ConstructYamlStr());
    }
  }
}
