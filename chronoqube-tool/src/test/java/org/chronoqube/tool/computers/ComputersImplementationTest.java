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
package org.chronoqube.tool.computers;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.chronoqube.computer.registry.BuiltInComputers;
import org.chronoqube.data.selector.RowSelectorType;
import org.chronoqube.data.source.SourceKind;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link ComputersImplementation}.
 *
 * @author The chronoqube authors
 */
public class ComputersImplementationTest {
  private String print(RowSelectorType selectorType, SourceKind sourceKind) {
    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    try (PrintStream out = new PrintStream(baos, true, StandardCharsets.UTF_8)) {
      new ComputersImplementation(BuiltInComputers.buildRegistry(), out).printComputers(selectorType, sourceKind);
    }
    return new String(baos.toByteArray(), StandardCharsets.UTF_8);
  }

  @Test
  public void allComputersAndAdapters() {
    // WHEN
    String res = print(null, null);

    // THEN
    Assert.assertTrue(res.contains("  Interval Mean\tdouble\tinterval\tanalog"), "Expected Interval Mean: " + res);
    Assert.assertTrue(res.contains("  Line Sample XY\t"), "Expected Line Sample XY: " + res);
    Assert.assertTrue(res.contains("Adapters (3):"), "Expected adapters: " + res);
    Assert.assertTrue(res.contains("  Line Data\t"), "Expected Line Data adapter: " + res);
  }

  @Test
  public void filterBySelectorAndSource() {
    // WHEN
    String res = print(RowSelectorType.INDEX, SourceKind.ANALOG);

    // THEN
    Assert.assertTrue(res.contains("  Timestamp Value\t"), "Expected timestamp computer for index rows: " + res);
    Assert.assertTrue(res.contains("  Analog Timestamp Offsets\t"), "Expected offsets computer: " + res);
    Assert.assertFalse(res.contains("Interval Mean"), "Expected interval computers to be filtered: " + res);
    Assert.assertFalse(res.contains("Line Timestamp"), "Expected line computers to be filtered: " + res);
    Assert.assertFalse(res.contains("Adapters"), "Expected no adapters when filtering: " + res);
  }
}
