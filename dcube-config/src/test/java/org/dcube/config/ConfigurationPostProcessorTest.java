/**
 * dcube: In-memory data cubes.
 *
 * Copyright (C) 2015 Bastian Gloeckle
 *
 * This file is part of dcube.
 *
 * dcube is free software: you can redistribute it and/or modify
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
package org.dcube.config;

import org.dcube.context.AutoInstatiate;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * Tests that {@link ConfigurationPostProcessor} wires the values of {@link ConfigurationManager}.
 *
 * @author Bastian Gloeckle
 */
public class ConfigurationPostProcessorTest {
  private AnnotationConfigApplicationContext ctx;

  @BeforeMethod
  public void before() {
    ctx = new AnnotationConfigApplicationContext();
    ctx.scan("org.dcube.config");
    ctx.refresh();
  }

  @AfterMethod
  public void after() {
    ctx.close();
  }

  @Test
  public void testConfigIsWired() {
    // WHEN
    ConfiguredBean bean = ctx.getBean(ConfiguredBean.class);

    // THEN
    Assert.assertEquals(bean.pageCapacity, 16, "Expected value of test properties");
    Assert.assertEquals(bean.ingestProgressInterval, Long.valueOf(2L));
    Assert.assertTrue(bean.compressOutput);
  }

  @Test
  public void defaultValueTest() {
    // WHEN
    ConfigurationManager configManager = ctx.getBean(ConfigurationManager.class);

    // THEN
    Assert.assertEquals(configManager.getValue(ConfigKey.PAGE_CAPACITY), "16");
    Assert.assertNull(configManager.getValue("unknownKey"));
  }

  @AutoInstatiate
  public static class ConfiguredBean {
    @Config(ConfigKey.PAGE_CAPACITY)
    private int pageCapacity;

    @Config(ConfigKey.INGEST_PROGRESS_INTERVAL)
    private Long ingestProgressInterval;

    @Config(ConfigKey.COMPRESS_OUTPUT)
    private boolean compressOutput;
  }
}
