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
package org.chronoqube.pipeline;

/**
 * Settings of a {@link TablePipeline}, usually filled from the configuration by {@link TablePipelineFactory}.
 *
 * @author The chronoqube authors
 */
public final class PipelineSettings {
  private final String defaultTimeFrameKey;
  private final boolean transformFailOnError;
  private final boolean pcaCenter;
  private final boolean pcaStandardize;

  public PipelineSettings(String defaultTimeFrameKey, boolean transformFailOnError, boolean pcaCenter,
      boolean pcaStandardize) {
    this.defaultTimeFrameKey = defaultTimeFrameKey;
    this.transformFailOnError = transformFailOnError;
    this.pcaCenter = pcaCenter;
    this.pcaStandardize = pcaStandardize;
  }

  public String getDefaultTimeFrameKey() {
    return defaultTimeFrameKey;
  }

  public boolean isTransformFailOnError() {
    return transformFailOnError;
  }

  public boolean isPcaCenter() {
    return pcaCenter;
  }

  public boolean isPcaStandardize() {
    return pcaStandardize;
  }
}
