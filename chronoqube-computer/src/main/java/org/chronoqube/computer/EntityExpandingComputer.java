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
package org.chronoqube.computer;

import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.data.time.TimeFrameIndex;

/**
 * A computer whose source can have a variable number of entities per timestamp. Tables consisting only of such
 * computers get one row per (timestamp, entity) pair instead of one row per timestamp.
 * 
 * <p>
 * Entity-expanding computers accept both index plans (using the first entity at each timestamp) and entity-row plans.
 *
 * @author The chronoqube authors
 */
public interface EntityExpandingComputer {
  /**
   * @return Number of entities the source has at the given timestamp.
   */
  int getEntityCountAt(TimeFrameIndex index, TimeFrame callerFrame);
}
