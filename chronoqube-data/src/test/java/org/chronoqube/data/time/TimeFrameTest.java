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
package org.chronoqube.data.time;

import java.util.Random;

import org.chronoqube.data.time.TimeFrame.Rounding;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 * Tests {@link TimeFrame}.
 *
 * @author The chronoqube authors
 */
public class TimeFrameTest {

  @Test
  public void roundTripOnRandomFrames() {
    Random random = new Random(42);
    for (int frameNo = 0; frameNo < 20; frameNo++) {
      // GIVEN
      int[] times = new int[1 + random.nextInt(500)];
      times[0] = random.nextInt(1000) - 500;
      for (int i = 1; i < times.length; i++)
        times[i] = times[i - 1] + 1 + random.nextInt(10);
      TimeFrame frame = new TimeFrame(times);

      for (int i = 0; i < times.length; i++) {
        // WHEN
        TimeFrameIndex res = frame.getIndexAtTime(frame.getTimeAtIndex(TimeFrameIndex.of(i)));

        // THEN
        Assert.assertEquals(res, TimeFrameIndex.of(i), "Expected exact round trip for index " + i);
      }
    }
  }

  @Test
  public void tieResolvesToEarlierSample() {
    // GIVEN
    TimeFrame frame = new TimeFrame(new int[] { 0, 2, 4 });

    // WHEN/THEN
    Assert.assertEquals(frame.getIndexAtTime(1), TimeFrameIndex.of(0), "Expected tie to resolve to earlier index");
    Assert.assertEquals(frame.getIndexAtTime(3), TimeFrameIndex.of(1), "Expected tie to resolve to earlier index");
    Assert.assertEquals(frame.getIndexAtTime(3.1), TimeFrameIndex.of(2), "Expected nearest index");
    Assert.assertEquals(frame.getIndexAtTime(0.9), TimeFrameIndex.of(0), "Expected nearest index");
  }

  @Test
  public void roundingModes() {
    // GIVEN
    TimeFrame frame = new TimeFrame(new int[] { 0, 10, 20 });

    // WHEN/THEN
    Assert.assertEquals(frame.getIndexAtTime(11, Rounding.PRECEDING), TimeFrameIndex.of(1), "Wrong preceding index");
    Assert.assertEquals(frame.getIndexAtTime(11, Rounding.FOLLOWING), TimeFrameIndex.of(2), "Wrong following index");
    Assert.assertEquals(frame.getIndexAtTime(19, Rounding.NEAREST), TimeFrameIndex.of(2), "Wrong nearest index");
    Assert.assertEquals(frame.getIndexAtTime(20, Rounding.PRECEDING), TimeFrameIndex.of(2), "Exact match expected");
  }

  @Test
  public void outOfRangeClamps() {
    // GIVEN
    TimeFrame frame = TimeFrame.ofRange(10, 20, 5);

    // WHEN/THEN
    Assert.assertEquals(frame.getIndexAtTime(-100), TimeFrameIndex.of(0), "Expected first index");
    Assert.assertEquals(frame.getIndexAtTime(100), TimeFrameIndex.of(2), "Expected last index");
    Assert.assertEquals(frame.getTimeAtIndex(TimeFrameIndex.of(17)), 20, "Expected last time");
    Assert.assertEquals(frame.getTimeAtIndex(TimeFrameIndex.of(-1)), 10, "Expected first time");
  }

  @Test
  public void duplicateTimesResolveToFirstIndex() {
    // GIVEN
    TimeFrame frame = new TimeFrame(new int[] { 0, 5, 5, 5, 10 });

    // WHEN/THEN
    Assert.assertEquals(frame.getIndexAtTime(5), TimeFrameIndex.of(1), "Expected first index of run");
    Assert.assertEquals(frame.getIndexAtTime(6), TimeFrameIndex.of(1), "Expected first index of run");
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void decreasingTimesFail() {
    new TimeFrame(new int[] { 0, 2, 1 });
  }

  @Test(expectedExceptions = NullPointerException.class)
  public void conversionFromNullFrameFails() {
    TimeFrame.ofRange(0, 10, 1).convertIndex(TimeFrameIndex.of(3), null);
  }

  @Test
  public void crossFrameConversionMovesBoundaryByAtMostOneCoarseSample() {
    // GIVEN
    TimeFrame fine = TimeFrame.ofRange(0, 100, 1);
    TimeFrame coarse = TimeFrame.ofRange(0, 100, 2);

    TimeFrameIndex lastCoarse = null;
    for (int i = 0; i < fine.getTotalFrameCount(); i++) {
      TimeFrameIndex fineIdx = TimeFrameIndex.of(i);

      // WHEN
      TimeFrameIndex coarseIdx = coarse.convertIndex(fineIdx, fine);
      TimeFrameIndex back = fine.convertIndex(coarseIdx, coarse);

      // THEN
      int moved = Math.abs(fine.getTimeAtIndex(back) - fine.getTimeAtIndex(fineIdx));
      Assert.assertTrue(moved <= 2, "Boundary " + i + " moved by " + moved);
      if (lastCoarse != null)
        Assert.assertTrue(lastCoarse.compareTo(coarseIdx) <= 0, "Expected monotonic conversion at " + i);
      lastCoarse = coarseIdx;
    }
  }

  @Test
  public void sameFrameConversionIsIdentity() {
    // GIVEN
    TimeFrame frame = new TimeFrame(new int[] { 0, 5, 5, 10 });

    // WHEN/THEN
    Assert.assertEquals(frame.convertIndex(TimeFrameIndex.of(2), frame), TimeFrameIndex.of(2), "Expected identity");
  }

  @Test
  public void containsOnlyIndicesOfTheFrame() {
    // GIVEN
    TimeFrame frame = new TimeFrame(new int[] { 0, 2, 4 });

    // WHEN / THEN
    Assert.assertTrue(frame.contains(TimeFrameIndex.of(0)), "Expected first index to be contained");
    Assert.assertTrue(frame.contains(TimeFrameIndex.of(2)), "Expected last index to be contained");
    Assert.assertFalse(frame.contains(TimeFrameIndex.of(3)), "Expected index past the end not to be contained");
    Assert.assertFalse(frame.contains(TimeFrameIndex.of(-1)), "Expected negative index not to be contained");
  }
}
