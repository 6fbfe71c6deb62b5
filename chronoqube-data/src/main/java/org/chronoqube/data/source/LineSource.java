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

import java.util.List;

import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameIndex;

/**
 * Polylines. At each index of the source's {@link TimeFrame} there may be any number of lines (entities).
 *
 * @author The chronoqube authors
 */
public interface LineSource extends DataSource {
  /**
   * @return The lines at the given index (relative to <code>callerFrame</code>), in entity order. Empty if there are
   *         none or if the index lies outside of <code>callerFrame</code>.
   */
  List<LineWithId> getLinesAt(TimeFrameIndex index, TimeFrame callerFrame);

  /**
   * @return Number of lines at the given index.
   */
  default int getEntityCountAt(TimeFrameIndex index, TimeFrame callerFrame) {
    return getLinesAt(index, callerFrame).size();
  }

  @Override
  default SourceKind getKind() {
    return SourceKind.LINE;
  }
}
