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
package org.chronoqube.pipeline.config;

/**
 * The <code>data_source</code> of a column: either a plain key of a source, or a key of raw data together with the
 * name of the adapter that turns it into a source.
 *
 * @author The chronoqube authors
 */
public final class DataSourceReference {
  private final String key;
  private final String adapter;

  private DataSourceReference(String key, String adapter) {
    this.key = key;
    this.adapter = adapter;
  }

  public static DataSourceReference ofKey(String key) {
    return new DataSourceReference(key, null);
  }

  public static DataSourceReference ofAdapter(String key, String adapter) {
    return new DataSourceReference(key, adapter);
  }

  public String getKey() {
    return key;
  }

  /**
   * @return <code>null</code> if the key names a source directly.
   */
  public String getAdapter() {
    return adapter;
  }

  public boolean isAdapted() {
    return adapter != null;
  }

  @Override
  public String toString() {
    return adapter == null ? key : key + " (" + adapter + ")";
  }
}
