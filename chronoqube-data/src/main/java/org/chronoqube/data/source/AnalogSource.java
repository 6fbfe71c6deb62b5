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
import org.chronoqube.data.time.TimeFrameIndex;

/**
 * A continuous signal, one float value per sample. Samples are located at indices of the source's {@link TimeFrame},
 * not every index needs to have a sample.
 *
 * @author The chronoqube authors
 */
public interface AnalogSource extends DataSource {
  int getSampleCount();

  /**
   * @param start
   *          inclusive, relative to <code>callerFrame</code>.
   * @param end
   *          inclusive, relative to <code>callerFrame</code>.
   * @return values of all samples in the range, in order. Empty if there are none.
   */
  float[] getDataInRange(TimeFrameIndex start, TimeFrameIndex end, TimeFrame callerFrame);

  /**
   * @return The value of the sample at the given index (relative to <code>callerFrame</code>) or {@link Double#NaN} if
   *         there is no sample at that position. An index outside of <code>callerFrame</code> has no sample.
   */
  double getValueAt(TimeFrameIndex index, TimeFrame callerFrame);

  @Override
  default SourceKind getKind() {
    return SourceKind.ANALOG;
  }
}
