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

/**
 * Configuration keys which can be used to resolve configuration values.
 * 
 * <p>
 * It's easiest to use these constants with the {@link Config} annotation.
 *
 * @author The chronoqube authors
 */
public class ConfigKey {
  /**
   * Key of the TimeFrame that is used by row selectors which do not name a timeframe themselves.
   */
  public static final String DEFAULT_TIME_FRAME_KEY = "defaultTimeFrameKey";

  /**
   * If <code>true</code>, a failing post-build transform of a table fails the table (and therefore the pipeline run).
   * If <code>false</code>, the failure is logged and the table itself is kept.
   */
  public static final String TRANSFORM_FAIL_ON_ERROR = "transformFailOnError";

  /**
   * Default for the "center" parameter of PCA transforms.
   */
  public static final String PCA_CENTER = "pcaCenter";

  /**
   * Default for the "standardize" parameter of PCA transforms.
   */
  public static final String PCA_STANDARDIZE = "pcaStandardize";
}
