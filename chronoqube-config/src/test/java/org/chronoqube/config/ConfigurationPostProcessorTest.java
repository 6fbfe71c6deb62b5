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
package org.chronoqube.config;

import org.chronoqube.context.Profiles;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * Tests {@link ConfigurationPostProcessor} and {@link ConfigurationManager}.
 *
 * @author The chronoqube authors
 */
public class ConfigurationPostProcessorTest {
  private AnnotationConfigApplicationContext dataContext;

  @BeforeMethod
  public void setUp() {
    dataContext = new AnnotationConfigApplicationContext();
    dataContext.getEnvironment().setActiveProfiles(Profiles.UNIT_TEST);
    dataContext.scan("org.chronoqube.config");
    dataContext.refresh();
  }

  @AfterMethod
  public void cleanup() {
    dataContext.close();
  }

  @Test
  public void defaultValuesAreWired() {
    // WHEN
    ConfiguredTestBean bean = dataContext.getBean(ConfiguredTestBean.class);

    // THEN
    Assert.assertEquals(bean.getDefaultTimeFrameKey(), "time", "Expected default from chronoqube.properties");
    Assert.assertEquals(bean.getPcaCenter(), Boolean.TRUE, "Expected boolean default to be wired");
  }

  @Test
  public void testPropertiesOverrideDefaults() {
    // WHEN
    ConfiguredTestBean bean = dataContext.getBean(ConfiguredTestBean.class);

    // THEN
    Assert.assertTrue(bean.isTransformFailOnError(), "Expected value of chronoqube-test.properties to win");
    Assert.assertEquals(bean.getTestLong(), 5_000_000_000L, "Expected long to be parsed");
    Assert.assertEquals(bean.getTestDouble(), 0.25, 1e-9, "Expected double to be parsed");
    Assert.assertEquals(bean.getTestInteger(), Integer.valueOf(42), "Expected integer to be parsed");
  }

  @Test
  public void valueLookupFallsBackToDefault() {
    // WHEN
    ConfigurationManager mgr = dataContext.getBean(ConfigurationManager.class);

    // THEN
    Assert.assertEquals(mgr.getValue(ConfigKey.PCA_STANDARDIZE), "false", "Expected default value");
    Assert.assertNull(mgr.getValue("doesNotExist"), "Expected no value for unknown key");
  }
}
