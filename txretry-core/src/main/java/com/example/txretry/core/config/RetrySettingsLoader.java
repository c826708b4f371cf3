package com.example.txretry.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Resolves {@link RetrySettings} from JSON and system properties.
 *
 * <p>Resolution order:
 *
 * <ol>
 *   <li>JSON file named by txretry.config / TXRETRY_CONFIG
 *   <li>classpath resource {@value #DEFAULT_RESOURCE}
 *   <li>{@link RetrySettings#defaults()}
 * </ol>
 *
 * <p>Individual system properties then override single values: txretry.maxAttempts,
 * txretry.baseDelayMillis, txretry.maxDelayMillis, txretry.jitterFactor, txretry.maxElapsedMillis.
 */
public final class RetrySettingsLoader {

  public static final String CONFIG_PROPERTY = "txretry.config";
  public static final String CONFIG_ENV = "TXRETRY_CONFIG";
  public static final String DEFAULT_RESOURCE = "txretry.json";

  private static final String PREFIX = "txretry.";

  private static Supplier<ObjectMapper> mapperSupplier = ObjectMapper::new;

  private RetrySettingsLoader() {}

  /**
   * Sets the supplier of the {@link ObjectMapper} to use for deserialization.
   *
   * @param supplier the supplier of the {@link ObjectMapper} to use
   */
  public static void setMapperSupplier(final Supplier<ObjectMapper> supplier) {
    mapperSupplier = supplier;
  }

  /**
   * Loads settings from the process environment. Values are not range-checked here; {@link
   * RetrySettings#toBudget()} rejects out-of-range values with an {@link
   * IllegalArgumentException}.
   *
   * @return resolved settings
   * @throws IllegalStateException if a configured source cannot be read or is malformed
   */
  public static RetrySettings load() {
    return load(System::getProperty, System::getenv);
  }

  static RetrySettings load(
      final Function<String, String> properties, final Function<String, String> environment) {
    final var base =
        Optional.ofNullable(properties.apply(CONFIG_PROPERTY))
            .or(() -> Optional.ofNullable(environment.apply(CONFIG_ENV)))
            .filter(val -> !val.isBlank())
            .map(String::trim)
            .map(Path::of)
            .map(RetrySettingsLoader::fromFile)
            .or(() -> fromClasspath(DEFAULT_RESOURCE))
            .orElseGet(RetrySettings::defaults);
    return withOverrides(base, properties);
  }

  /**
   * Parses settings from a JSON string.
   *
   * @param json the JSON document
   * @return parsed settings
   * @throws IllegalStateException if the JSON is malformed
   */
  public static RetrySettings fromJson(final String json) {
    try {
      return mapperSupplier.get().readValue(json, RetrySettings.class);
    } catch (final IOException exception) {
      throw new IllegalStateException("Failed to parse retry settings", exception);
    }
  }

  /**
   * Parses settings from a JSON file.
   *
   * @param path the file
   * @return parsed settings
   * @throws IllegalStateException if the file cannot be read or parsed
   */
  public static RetrySettings fromFile(final Path path) {
    try (final var in = Files.newInputStream(path)) {
      return fromStream(in);
    } catch (final IOException exception) {
      throw new IllegalStateException("Failed to read retry settings from " + path, exception);
    }
  }

  static Optional<RetrySettings> fromClasspath(final String resource) {
    final var loader =
        Optional.ofNullable(Thread.currentThread().getContextClassLoader())
            .orElse(RetrySettingsLoader.class.getClassLoader());
    try (final var in = loader.getResourceAsStream(resource)) {
      return in == null ? Optional.empty() : Optional.of(fromStream(in));
    } catch (final IOException exception) {
      throw new IllegalStateException("Failed to read retry settings from " + resource, exception);
    }
  }

  private static RetrySettings fromStream(final InputStream in) throws IOException {
    return mapperSupplier.get().readValue(in, RetrySettings.class);
  }

  static RetrySettings withOverrides(
      final RetrySettings base, final Function<String, String> properties) {
    return new RetrySettings(
        override(properties, "maxAttempts", Integer::valueOf).orElse(base.maxAttempts()),
        override(properties, "baseDelayMillis", Long::valueOf).orElse(base.baseDelayMillis()),
        override(properties, "maxDelayMillis", Long::valueOf).orElse(base.maxDelayMillis()),
        override(properties, "jitterFactor", Double::valueOf).orElse(base.jitterFactor()),
        override(properties, "maxElapsedMillis", Long::valueOf).orElse(base.maxElapsedMillis()));
  }

  private static <T> Optional<T> override(
      final Function<String, String> properties,
      final String name,
      final Function<String, T> parser) {
    return Optional.ofNullable(properties.apply(PREFIX + name))
        .filter(val -> !val.isBlank())
        .map(String::trim)
        .map(
            val -> {
              try {
                return parser.apply(val);
              } catch (final NumberFormatException e) {
                throw new IllegalStateException(
                    "Invalid value for " + PREFIX + name + ": " + val, e);
              }
            });
  }
}
