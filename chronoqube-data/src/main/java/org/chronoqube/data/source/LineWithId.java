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

import com.google.common.base.Preconditions;

/**
 * A {@link Line} of a {@link LineSource} together with the entity id of its raw record.
 *
 * @author The chronoqube authors
 */
public final class LineWithId {
  private final Line line;
  private final long entityId;

  public LineWithId(Line line, long entityId) {
    this.line = Preconditions.checkNotNull(line);
    this.entityId = entityId;
  }

  public Line getLine() {
    return line;
  }

  public long getEntityId() {
    return entityId;
  }
}
