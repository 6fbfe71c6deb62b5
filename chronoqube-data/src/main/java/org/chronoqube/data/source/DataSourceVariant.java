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
 * Holds exactly one source of one of the four {@link SourceKind}s. This is the uniform type sources are passed around
 * with when constructing computers, so callers do not need to know the concrete capability.
 *
 * @author The chronoqube authors
 */
public final class DataSourceVariant {
  /**
   * Dispatches on the kind of source held by a {@link DataSourceVariant}.
   */
  public interface Visitor<R> {
    R visitAnalog(AnalogSource source);

    R visitEvent(EventSource source);

    R visitInterval(IntervalSource source);

    R visitLine(LineSource source);
  }

  private final SourceKind kind;
  private final DataSource source;

  private DataSourceVariant(SourceKind kind, DataSource source) {
    Preconditions.checkNotNull(source, "Source must not be null");
    Preconditions.checkNotNull(source.getTimeFrame(), "Source %s has no TimeFrame", source.getName());
    this.kind = kind;
    this.source = source;
  }

  public static DataSourceVariant of(AnalogSource source) {
    return new DataSourceVariant(SourceKind.ANALOG, source);
  }

  public static DataSourceVariant of(EventSource source) {
    return new DataSourceVariant(SourceKind.EVENT, source);
  }

  public static DataSourceVariant of(IntervalSource source) {
    return new DataSourceVariant(SourceKind.INTERVAL, source);
  }

  public static DataSourceVariant of(LineSource source) {
    return new DataSourceVariant(SourceKind.LINE, source);
  }

  public SourceKind getKind() {
    return kind;
  }

  public DataSource getSource() {
    return source;
  }

  public String getName() {
    return source.getName();
  }

  public AnalogSource getAnalogSource() {
    return (AnalogSource) checkKind(SourceKind.ANALOG);
  }

  public EventSource getEventSource() {
    return (EventSource) checkKind(SourceKind.EVENT);
  }

  public IntervalSource getIntervalSource() {
    return (IntervalSource) checkKind(SourceKind.INTERVAL);
  }

  public LineSource getLineSource() {
    return (LineSource) checkKind(SourceKind.LINE);
  }

  public <R> R accept(Visitor<R> visitor) {
    switch (kind) {
    case ANALOG:
      return visitor.visitAnalog((AnalogSource) source);
    case EVENT:
      return visitor.visitEvent((EventSource) source);
    case INTERVAL:
      return visitor.visitInterval((IntervalSource) source);
    default:
      return visitor.visitLine((LineSource) source);
    }
  }

  private DataSource checkKind(SourceKind expected) {
    if (kind != expected)
      throw new IllegalStateException("Source '" + source.getName() + "' is a " + kind + " source, not " + expected);
    return source;
  }

  @Override
  public String toString() {
    return kind + ":" + source.getName();
  }
}
