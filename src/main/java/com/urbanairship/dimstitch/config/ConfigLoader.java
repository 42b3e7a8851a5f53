package com.urbanairship.dimstitch.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.urbanairship.dimstitch.BatchPlanner;
import com.urbanairship.dimstitch.ConfigException;
import com.urbanairship.dimstitch.Dimension;
import com.urbanairship.dimstitch.DimensionGroup;
import com.urbanairship.dimstitch.DimensionSchema;
import com.urbanairship.dimstitch.FetchFailurePolicy;
import com.urbanairship.dimstitch.GroupRole;
import com.urbanairship.dimstitch.JoinPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a {@link DownloadConfiguration} from a YAML file with these sections:
 * <ul>
 * <li>common: credentials, view and tuning options</li>
 * <li>custom-dimensions: dimension name to display label</li>
 * <li>user-dimensions, results-dimensions, stitch-dimensions</li>
 * <li>batch-dimensions-1, batch-dimensions-2, ...: additional groups, requested in order of N</li>
 * </ul>
 * A dimension section is either a list of names or a map whose values are the names, in order. Names
 * may leave off the "ga:" prefix.
 * <p>
 * The dimension groups are checked with {@link BatchPlanner} while loading, so a configuration that
 * loads can always be planned.
 */
public class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_CONFIG_FILE = "download.yml";

    private static final String COMMON = "common";
    private static final String CUSTOM_DIMENSIONS = "custom-dimensions";
    private static final String USER_DIMENSIONS = "user-dimensions";
    private static final String RESULTS_DIMENSIONS = "results-dimensions";
    private static final String STITCH_DIMENSIONS = "stitch-dimensions";
    private static final Pattern BATCH_DIMENSIONS = Pattern.compile("^batch-dimensions-([0-9]{1,9})$");

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public DownloadConfiguration load(Path path) throws ConfigException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (NoSuchFileException e) {
            throw new ConfigException("Configuration file not found: " + path, e);
        } catch (IOException e) {
            throw new ConfigException("Could not read configuration file " + path, e);
        }
    }

    public DownloadConfiguration load(InputStream in, String sourceName) throws ConfigException {
        JsonNode root;
        try {
            root = mapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Invalid YAML in " + sourceName + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigException("Could not read configuration " + sourceName, e);
        }
        if (root == null || !root.isObject()) {
            throw new ConfigException("Configuration " + sourceName + " is empty or not a map of sections");
        }

        DimensionSchema schema = readSchema(root);
        // Fail now rather than after credentials are loaded
        new BatchPlanner().plan(schema);

        JsonNode common = requireSection(root, COMMON);
        DownloadConfiguration.Builder builder = DownloadConfiguration.newBuilder()
                .setSchema(schema)
                .setServiceAccountEmail(requireOption(common, "service-account-email"))
                .setKeyFileLocation(requireOption(common, "key-file-location"))
                .setViewId(requireOption(common, "view-id"));

        if (common.hasNonNull("scopes")) {
            builder.setScopes(readScopes(common.get("scopes")));
        }
        if (common.hasNonNull("discovery-uri")) {
            builder.setRootUrl(common.get("discovery-uri").asText());
        }
        if (common.hasNonNull("max-results")) {
            builder.setMaxResults(readPositiveInt(common, "max-results"));
        }
        if (common.has("invalid-value")) {
            builder.setInvalidValue(common.get("invalid-value").isNull() ? "" : common.get("invalid-value").asText());
        }
        if (common.hasNonNull("strip-non-ascii")) {
            builder.setStripNonAscii(readBoolean(common, "strip-non-ascii"));
        }
        if (common.hasNonNull("fetch-threads")) {
            builder.setFetchThreads(readPositiveInt(common, "fetch-threads"));
        }
        if (common.hasNonNull("retries")) {
            builder.setNumTries(readPositiveInt(common, "retries"));
        }
        if (common.hasNonNull("join-policy")) {
            builder.setJoinPolicy(readEnum(common, "join-policy", JoinPolicy.class));
        }
        if (common.hasNonNull("fetch-failure-policy")) {
            builder.setFetchFailurePolicy(readEnum(common, "fetch-failure-policy", FetchFailurePolicy.class));
        }

        DownloadConfiguration config = builder.build();
        if (log.isDebugEnabled()) {
            log.debug("Loaded configuration from " + sourceName + " for view " + config.viewId + " with " +
                    schema.getAdditionalDimensions().size() + " additional dimension batches");
        }
        return config;
    }

    private DimensionSchema readSchema(JsonNode root) throws ConfigException {
        Map<String, String> translations = Maps.newLinkedHashMap();
        JsonNode customDimensions = root.get(CUSTOM_DIMENSIONS);
        if (customDimensions != null && !customDimensions.isNull()) {
            if (!customDimensions.isObject()) {
                throw new ConfigException("Section " + CUSTOM_DIMENSIONS + " must map dimension names to labels");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = customDimensions.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String id = Dimension.qualify(field.getKey());
                if (translations.containsKey(id)) {
                    throw new ConfigException("Section " + CUSTOM_DIMENSIONS + " labels " + id + " more than once");
                }
                translations.put(id, field.getValue().asText());
            }
        }

        // Batch sections are requested in numeric order, whatever order they appear in the file
        SortedMap<Integer, DimensionGroup> additional = Maps.newTreeMap();
        Iterator<String> sectionNames = root.fieldNames();
        while (sectionNames.hasNext()) {
            String sectionName = sectionNames.next();
            Matcher matcher = BATCH_DIMENSIONS.matcher(sectionName);
            if (matcher.matches()) {
                int ordinal = Integer.parseInt(matcher.group(1));
                if (additional.containsKey(ordinal)) {
                    throw new ConfigException("Section " + sectionName + " repeats batch number " + ordinal);
                }
                additional.put(ordinal, new DimensionGroup(GroupRole.ADDITIONAL, ordinal,
                        readDimensions(root, sectionName)));
            }
        }

        return new DimensionSchema(
                new DimensionGroup(GroupRole.USER, readDimensions(root, USER_DIMENSIONS)),
                new DimensionGroup(GroupRole.RESULTS, readDimensions(root, RESULTS_DIMENSIONS)),
                new ArrayList<>(additional.values()),
                new DimensionGroup(GroupRole.STITCH, readDimensions(root, STITCH_DIMENSIONS)),
                translations);
    }

    private static List<String> readDimensions(JsonNode root, String section) throws ConfigException {
        JsonNode node = requireSection(root, section);
        ImmutableList.Builder<String> dimensions = ImmutableList.builder();
        // In the key = value layout the keys don't matter, iterating an object node gives its values
        if (node.isArray() || node.isObject()) {
            for (JsonNode element : node) {
                dimensions.add(readDimensionName(element, section));
            }
        } else {
            throw new ConfigException("Section " + section + " must be a list of dimension names");
        }
        return dimensions.build();
    }

    private static String readDimensionName(JsonNode element, String section) throws ConfigException {
        if (!element.isValueNode() || element.isNull() || element.asText().trim().isEmpty()) {
            throw new ConfigException("Section " + section + " has an invalid dimension name: " + element);
        }
        return element.asText().trim();
    }

    private static JsonNode requireSection(JsonNode root, String section) throws ConfigException {
        JsonNode node = root.get(section);
        if (node == null || node.isNull()) {
            throw new ConfigException("Missing configuration section: " + section);
        }
        return node;
    }

    private static String requireOption(JsonNode section, String option) throws ConfigException {
        JsonNode node = section.get(option);
        if (node == null || node.isNull() || node.asText().isEmpty()) {
            throw new ConfigException("Missing configuration option: " + COMMON + ":" + option);
        }
        return node.asText();
    }

    private static List<String> readScopes(JsonNode node) {
        List<String> scopes = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode scope : node) {
                scopes.add(scope.asText());
            }
        } else {
            for (String scope : node.asText().split("[,\\s]+")) {
                if (!scope.isEmpty()) {
                    scopes.add(scope);
                }
            }
        }
        return scopes;
    }

    private static int readPositiveInt(JsonNode section, String option) throws ConfigException {
        JsonNode node = section.get(option);
        if (!node.canConvertToInt() || node.asInt() <= 0) {
            throw new ConfigException("Configuration option " + COMMON + ":" + option +
                    " must be a positive integer, got " + node);
        }
        return node.asInt();
    }

    private static boolean readBoolean(JsonNode section, String option) throws ConfigException {
        JsonNode node = section.get(option);
        if (!node.isBoolean()) {
            throw new ConfigException("Configuration option " + COMMON + ":" + option +
                    " must be true or false, got " + node);
        }
        return node.asBoolean();
    }

    private static <E extends Enum<E>> E readEnum(JsonNode section, String option, Class<E> enumClass)
            throws ConfigException {
        String value = section.get(option).asText();
        try {
            return Enum.valueOf(enumClass, value.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new ConfigException("Configuration option " + COMMON + ":" + option + " has unknown value " +
                    value, e);
        }
    }
}
