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
package org.chronoqube.data.source;

import org.chronoqube.data.time.TimeFrame;

/**
 * Common base of the source capabilities.
 * 
 * <p>
 * All range queries of sources take indices relative to a caller supplied {@link TimeFrame}, which the source converts
 * into its own TimeFrame before querying.
 *
 * @author The chronoqube authors
 */
public interface DataSource {
  /**
   * @return Name of the source. Used for naming columns and in error messages.
   */
  String getName();

  /**
   * @return The TimeFrame the data of this source is recorded against. Never <code>null</code>.
   */
  TimeFrame getTimeFrame();

  SourceKind getKind();
}
