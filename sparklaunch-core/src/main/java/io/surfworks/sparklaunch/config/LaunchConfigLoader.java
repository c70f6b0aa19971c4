package io.surfworks.sparklaunch.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.sparklaunch.request.EmrConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads and saves LaunchConfig.
 *
 * <p>Configuration sources (in order of precedence):
 * <ol>
 *   <li>Config file ({@code ~/.config/sparklaunch/launch.json})</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <p>Keys missing from the file keep their default value. CLI arguments are
 * handled by the caller and merged into the config. The monitor timeout is
 * written as an ISO-8601 {@code timeout}; a {@code timeoutMinutes} number is
 * still read when no {@code timeout} key is present.
 */
public final class LaunchConfigLoader {

    private static final ObjectMapper JSON = new ObjectMapper();

    private LaunchConfigLoader() {
    }

    /**
     * Loads configuration from the default config file.
     *
     * <p>If the config file doesn't exist, returns defaults.
     *
     * @return the loaded configuration
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public static LaunchConfig load() throws IOException {
        return load(LaunchConfig.configFile());
    }

    /**
     * Loads configuration from a specific file.
     *
     * @param configFile path to the config file
     * @return the loaded configuration
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public static LaunchConfig load(Path configFile) throws IOException {
        if (!Files.exists(configFile)) {
            return LaunchConfig.defaults();
        }
        return fromJson(JSON.readTree(configFile.toFile()), LaunchConfig.defaults());
    }

    /**
     * Saves configuration to the default config file.
     *
     * @param config the configuration to save
     * @throws IOException if saving fails
     */
    public static void save(LaunchConfig config) throws IOException {
        save(config, LaunchConfig.configFile());
    }

    /**
     * Saves configuration to a specific file.
     *
     * @param config     the configuration to save
     * @param configFile path to write the config
     * @throws IOException if saving fails
     */
    public static void save(LaunchConfig config, Path configFile) throws IOException {
        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        JSON.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), toJson(config));
    }

    /**
     * Converts a configuration to its JSON document.
     */
    public static ObjectNode toJson(LaunchConfig config) {
        ObjectNode root = JSON.createObjectNode();
        root.put("clusterName", config.clusterName());
        putIfPresent(root, "awsRegion", config.awsRegion());
        root.put("emrRelease", config.emrRelease());
        root.put("emrServiceRole", config.emrServiceRole());
        ArrayNode apps = root.putArray("emrApplications");
        config.emrApplications().forEach(apps::add);

        if (!config.emrConfigs().isEmpty()) {
            ArrayNode configs = root.putArray("emrConfigs");
            config.emrConfigs().forEach(c -> configs.add(emrConfigToJson(c)));
        }

        putIfPresent(root, "subnetId", config.subnetId());
        if (!config.securityGroupIds().isEmpty()) {
            ArrayNode groups = root.putArray("securityGroupIds");
            config.securityGroupIds().forEach(groups::add);
        }

        root.put("instanceCount", config.instanceCount());
        root.put("instanceType", config.instanceType());
        if (config.instanceBidPrice() != null) {
            root.put("instanceBidPrice", config.instanceBidPrice());
        }
        root.put("instanceRole", config.instanceRole());
        putIfPresent(root, "instanceKeyName", config.instanceKeyName());
        putIfPresent(root, "s3JarFolder", config.s3JarFolder());
        putIfPresent(root, "s3LogUri", config.s3LogUri());
        root.put("s3ServerSideEncryption", config.s3ServerSideEncryption());
        root.put("timeout", config.timeout().toString());

        if (!config.submitConfs().isEmpty()) {
            ObjectNode confs = root.putObject("submitConfs");
            config.submitConfs().forEach(confs::put);
        }
        return root;
    }

    /**
     * Reads a configuration from a JSON document, falling back to {@code base} for missing keys.
     *
     * @throws IllegalArgumentException if a value is invalid
     */
    public static LaunchConfig fromJson(JsonNode root, LaunchConfig base) {
        if (!root.isObject()) {
            throw new IllegalArgumentException("config root must be a JSON object");
        }

        LaunchConfig.Builder builder = base.toBuilder()
                .clusterName(getStringOrDefault(root, "clusterName", base.clusterName()))
                .awsRegion(getStringOrDefault(root, "awsRegion", base.awsRegion()))
                .emrRelease(getStringOrDefault(root, "emrRelease", base.emrRelease()))
                .emrServiceRole(getStringOrDefault(root, "emrServiceRole", base.emrServiceRole()))
                .subnetId(getStringOrDefault(root, "subnetId", base.subnetId()))
                .instanceType(getStringOrDefault(root, "instanceType", base.instanceType()))
                .instanceRole(getStringOrDefault(root, "instanceRole", base.instanceRole()))
                .instanceKeyName(getStringOrDefault(root, "instanceKeyName", base.instanceKeyName()))
                .s3JarFolder(getStringOrDefault(root, "s3JarFolder", base.s3JarFolder()))
                .s3LogUri(getStringOrDefault(root, "s3LogUri", base.s3LogUri()));

        if (root.has("emrApplications")) {
            builder.emrApplications(stringList(root.get("emrApplications")));
        }
        if (root.has("securityGroupIds")) {
            builder.securityGroupIds(stringList(root.get("securityGroupIds")));
        }
        if (root.has("emrConfigs")) {
            List<EmrConfig> configs = new ArrayList<>();
            for (JsonNode node : root.get("emrConfigs")) {
                configs.add(emrConfigFromJson(node));
            }
            builder.emrConfigs(configs);
        }
        if (root.has("instanceCount")) {
            JsonNode count = root.get("instanceCount");
            if (!count.canConvertToInt()) {
                throw new IllegalArgumentException("instanceCount must be an integer, got " + count);
            }
            builder.instanceCount(count.asInt());
        }
        if (root.has("instanceBidPrice")) {
            JsonNode bid = root.get("instanceBidPrice");
            builder.instanceBidPrice(bid.isNull() ? null : bid.asDouble());
        }
        if (root.has("s3ServerSideEncryption")) {
            builder.s3ServerSideEncryption(root.get("s3ServerSideEncryption").asBoolean());
        }
        if (root.has("timeout")) {
            builder.timeout(parseTimeout(root.get("timeout").asText()));
        } else if (root.has("timeoutMinutes")) {
            builder.timeout(Duration.ofMinutes(root.get("timeoutMinutes").asLong()));
        }
        if (root.has("submitConfs")) {
            builder.submitConfs(stringMap(root.get("submitConfs")));
        }
        return builder.build();
    }

    // ISO-8601, e.g. PT90M or PT30S
    private static Duration parseTimeout(String value) {
        try {
            return Duration.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("timeout must be an ISO-8601 duration such as PT90M, got " + value, e);
        }
    }

    private static ObjectNode emrConfigToJson(EmrConfig config) {
        ObjectNode node = JSON.createObjectNode();
        node.put("classification", config.classification());
        if (!config.properties().isEmpty()) {
            ObjectNode props = node.putObject("properties");
            config.properties().forEach(props::put);
        }
        if (!config.configurations().isEmpty()) {
            ArrayNode nested = node.putArray("configurations");
            config.configurations().forEach(c -> nested.add(emrConfigToJson(c)));
        }
        return node;
    }

    private static EmrConfig emrConfigFromJson(JsonNode node) {
        if (!node.has("classification")) {
            throw new IllegalArgumentException("emrConfigs entry is missing 'classification': " + node);
        }
        Map<String, String> properties = node.has("properties") ?
                stringMap(node.get("properties")) : Map.of();
        List<EmrConfig> nested = new ArrayList<>();
        if (node.has("configurations")) {
            for (JsonNode child : node.get("configurations")) {
                nested.add(emrConfigFromJson(child));
            }
        }
        return new EmrConfig(node.get("classification").asText(), properties, nested);
    }

    private static List<String> stringList(JsonNode node) {
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            values.add(element.asText());
        }
        return values;
    }

    private static Map<String, String> stringMap(JsonNode node) {
        Map<String, String> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            values.put(field.getKey(), field.getValue().asText());
        }
        return values;
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    private static String getStringOrDefault(JsonNode node, String field, String defaultValue) {
        if (node.has(field) && !node.get(field).isNull()) {
            return node.get(field).asText();
        }
        return defaultValue;
    }
}
