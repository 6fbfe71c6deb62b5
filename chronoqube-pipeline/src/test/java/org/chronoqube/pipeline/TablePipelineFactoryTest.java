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

import java.util.Arrays;

import org.chronoqube.context.Profiles;
import org.chronoqube.data.source.memory.ArrayAnalogSource;
import org.chronoqube.data.time.TimeFrame;
import org.chronoqube.execution.TableRegistry;
import org.chronoqube.pipeline.catalog.InMemoryDataSourceCatalog;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * Tests {@link TablePipelineFactory} wired in a context.
 *
 * @author The chronoqube authors
 */
public class TablePipelineFactoryTest {
  private AnnotationConfigApplicationContext dataContext;

  @BeforeMethod
  public void setUp() {
    dataContext = new AnnotationConfigApplicationContext();
    dataContext.getEnvironment().setActiveProfiles(Profiles.UNIT_TEST);
    dataContext.scan("org.chronoqube");
    dataContext.refresh();
  }

  @AfterMethod
  public void cleanup() {
    dataContext.close();
  }

  @Test
  public void settingsFromConfiguration() {
    // WHEN
    PipelineSettings settings = dataContext.getBean(TablePipelineFactory.class).getSettings();

    // THEN
    Assert.assertEquals(settings.getDefaultTimeFrameKey(), "time", "Wrong default TimeFrame key");
    Assert.assertFalse(settings.isTransformFailOnError(), "Expected transforms not to fail tables by default");
    Assert.assertTrue(settings.isPcaCenter(), "Expected PCA to center by default");
    Assert.assertFalse(settings.isPcaStandardize(), "Expected PCA not to standardize by default");
  }

  @Test
  public void pipelineStoresInContextRegistry() throws Exception {
    // GIVEN
    TimeFrame time = TimeFrame.ofRange(0, 9, 1);
    InMemoryDataSourceCatalog catalog = new InMemoryDataSourceCatalog().addTimeFrame("time", time)
        .addSource(new ArrayAnalogSource("v", time, new float[] { 0, 1, 2, 3, 4, 5, 6, 7, 8, 9 }));
    TablePipeline pipeline = dataContext.getBean(TablePipelineFactory.class).createTablePipeline(catalog);
    pipeline.loadFromJson("{\"tables\":[{\"table_id\":\"t\",\"name\":\"T\","
        + "\"row_selector\":{\"type\":\"timestamp\",\"timestamps\":[2,4]},"
        + "\"columns\":[{\"name\":\"v\",\"computer\":\"Timestamp Value\",\"data_source\":\"v\"}]}]}");

    // WHEN
    PipelineResult res = pipeline.execute(null);

    // THEN
    Assert.assertTrue(res.isSuccess(), "Expected success, but: " + res.getErrorMessage());
    Assert.assertEquals(dataContext.getBean(TableRegistry.class).getAllTableIds(), Arrays.asList("t"),
        "Expected table in registry of context");
  }
}
