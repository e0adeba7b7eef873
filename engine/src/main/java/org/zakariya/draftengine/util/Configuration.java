package org.zakariya.draftengine.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON backed configuration.
 * Values are addressed by slash separated paths into the JSON tree, e.g. "relay/redis/host".
 * Several sources can be layered; a value in a later source overrides the same path in an
 * earlier one, so a packaged default file can be followed by a deployment specific one.
 */
public class Configuration {

	private static final Logger logger = LoggerFactory.getLogger(Configuration.class);

	private final ObjectMapper mapper = new ObjectMapper();
	private final List<JsonNode> layers = new ArrayList<>();

	public Configuration() {
	}

	/**
	 * Layer a JSON file from the filesystem on top of what is already loaded. A missing or
	 * unreadable file is logged and skipped.
	 *
	 * @param configurationJsonFile path to a JSON file
	 * @return true if the file was loaded
	 */
	public boolean addConfigJsonFilePath(String configurationJsonFile) {
		try (InputStream is = new BufferedInputStream(new FileInputStream(configurationJsonFile))) {
			return addLayer(is, configurationJsonFile);
		} catch (IOException e) {
			logger.error("Unable to read configuration file {}", configurationJsonFile, e);
			return false;
		}
	}

	/**
	 * Layer a JSON classpath resource on top of what is already loaded.
	 *
	 * @param resourceName name of the resource, e.g. "draft-engine.json"
	 * @return true if the resource was found and loaded
	 */
	public boolean addConfigJsonResource(String resourceName) {
		ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
		if (classLoader == null) {
			classLoader = Configuration.class.getClassLoader();
		}

		try (InputStream is = classLoader.getResourceAsStream(resourceName)) {
			if (is == null) {
				logger.warn("Configuration resource {} not found on classpath", resourceName);
				return false;
			}
			return addLayer(is, resourceName);
		} catch (IOException e) {
			logger.error("Unable to read configuration resource {}", resourceName, e);
			return false;
		}
	}

	/**
	 * Layer an already parsed JSON tree on top of what is already loaded.
	 */
	public void addConfigJson(JsonNode root) {
		layers.add(root);
	}

	private boolean addLayer(InputStream is, String source) throws IOException {
		JsonNode root = mapper.readTree(is);
		if (root == null || !root.isObject()) {
			logger.error("Configuration source {} is not a JSON object, ignoring it", source);
			return false;
		}
		layers.add(root);
		logger.info("Loaded configuration from {}", source);
		return true;
	}

	/**
	 * @return true if the value exists and is non-empty when read as a string
	 */
	public boolean has(String path) {
		String value = get(path);
		return value != null && !value.isEmpty();
	}

	@Nullable
	JsonNode getNode(String path) {
		String[] parts = path.split("/");

		// newest layer wins
		for (int i = layers.size() - 1; i >= 0; i--) {
			JsonNode node = layers.get(i);
			for (String part : parts) {
				node = node.get(part);
				if (node == null) {
					break;
				}
			}

			if (node != null && !node.isNull()) {
				return node;
			}
		}

		return null;
	}

	/**
	 * @param path deep path into configuration, e.g. "a/b/c/leaf"
	 * @return the string value at the path, or null
	 */
	@Nullable
	public String get(String path) {
		JsonNode node = getNode(path);
		return node != null ? node.asText() : null;
	}

	public String get(String path, String fallback) {
		String v = get(path);
		return v != null ? v : fallback;
	}

	/**
	 * @return the value at path as an int, or defaultValue if missing or not a number
	 */
	public int getInt(String path, int defaultValue) {
		String v = get(path);
		if (v == null) {
			return defaultValue;
		}

		try {
			return Integer.parseInt(v);
		} catch (NumberFormatException e) {
			logger.warn("Configuration value {}=\"{}\" is not an int, using {}", path, v, defaultValue);
			return defaultValue;
		}
	}

	/**
	 * @return the value at path as a long, or defaultValue if missing or not a number
	 */
	public long getLong(String path, long defaultValue) {
		String v = get(path);
		if (v == null) {
			return defaultValue;
		}

		try {
			return Long.parseLong(v);
		} catch (NumberFormatException e) {
			logger.warn("Configuration value {}=\"{}\" is not a long, using {}", path, v, defaultValue);
			return defaultValue;
		}
	}

	public double getDouble(String path, double defaultValue) {
		String v = get(path);
		if (v == null) {
			return defaultValue;
		}

		try {
			return Double.parseDouble(v);
		} catch (NumberFormatException e) {
			return defaultValue;
		}
	}

	public boolean getBoolean(String path, boolean defaultValue) {
		String v = get(path);
		return v != null ? Boolean.parseBoolean(v) : defaultValue;
	}

	/**
	 * Get an object in the configuration as a simple map
	 *
	 * @return the item at path as a String->Object map, or null
	 */
	@Nullable
	public Map<String, Object> getMap(String path) {
		JsonNode node = getNode(path);
		if (node == null || !node.isObject()) {
			return null;
		}

		//noinspection unchecked
		return mapper.convertValue(node, Map.class);
	}
}
