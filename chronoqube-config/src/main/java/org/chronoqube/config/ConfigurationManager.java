/**
 * chronoqube: Time-aligned table views over heterogeneous data streams.
 *
 * Copyright (C) 2026 The chronoqube authors
 *
 * This file is part of chronoqube.
 *
 * chronoqube is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.chronoqube.config;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import javax.annotation.PostConstruct;

import org.chronoqube.context.AutoInstatiate;
import org.chronoqube.context.Profiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;

/**
 * Provides the active configuration values.
 * 
 * <p>
 * Values are resolved in this order: a user supplied properties file (see {@link #CUSTOM_PROPERTIES_SYSTEM_PROPERTY}),
 * then the test defaults on the classpath (if available) and finally the defaults shipped in chronoqube-config.
 *
 * @author The chronoqube authors
 */
@AutoInstatiate
@Profile(Profiles.CONFIG)
public class ConfigurationManager {
  private static final Logger logger = LoggerFactory.getLogger(ConfigurationManager.class);

  public static final String TEST_CONFIG_CLASSPATH_FILENAME = "/chronoqube-test.properties";

  public static final String DEFAULT_CONFIG_CLASSPATH_FILENAME = "/chronoqube.properties";

  public static final String CUSTOM_PROPERTIES_SYSTEM_PROPERTY = "chronoqube.config";

  private Properties defaultProperties;
  private Properties customProperties;

  @PostConstruct
  private void initialize() {
    String customFileName = System.getProperty(CUSTOM_PROPERTIES_SYSTEM_PROPERTY);
    if (customFileName != null) {
      customProperties = new Properties();
      try (Reader reader = new InputStreamReader(new FileInputStream(customFileName), StandardCharsets.UTF_8)) {
        customProperties.load(reader);
        logger.info("Loaded custom properties from {}", customFileName);
      } catch (IOException e) {
        throw new RuntimeException("Could not load custom properties from " + customFileName, e);
      }
    } else {
      customProperties = null;
      logger.debug("No custom properties. Use system property '{}' to point to a file containing custom properties.",
          CUSTOM_PROPERTIES_SYSTEM_PROPERTY);
    }

    defaultProperties = new Properties();
    // defaults are always loaded, test properties only override what they contain.
    loadClasspathProperties(DEFAULT_CONFIG_CLASSPATH_FILENAME, defaultProperties, true);
    loadClasspathProperties(TEST_CONFIG_CLASSPATH_FILENAME, defaultProperties, false);
  }

  private void loadClasspathProperties(String classpathFile, Properties target, boolean required) {
    try (InputStream classpathStream = this.getClass().getResourceAsStream(classpathFile)) {
      if (classpathStream == null) {
        if (required)
          throw new RuntimeException("Could not find default config " + classpathFile + " on classpath.");
        return;
      }
      logger.info("Loading config from classpath {}", classpathFile);
      target.load(new InputStreamReader(classpathStream, StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new RuntimeException("Could not load config " + classpathFile, e);
    }
  }

  /**
   * @return The value of the given config key (see {@link ConfigKey}), either the one provided by the user or the
   *         default one. <code>null</code> if there is no value.
   */
  public String getValue(String configKey) {
    if (customProperties != null && customProperties.getProperty(configKey) != null)
      return customProperties.getProperty(configKey);

    return getDefaultValue(configKey);
  }

  /**
   * @return The default value for the given config key.
   */
  public String getDefaultValue(String configKey) {
    return defaultProperties.getProperty(configKey);
  }
}
