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
package org.dcube.tool.select;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.dcube.context.ContextUtil;
import org.dcube.data.cube.CubeRow;
import org.dcube.data.cube.DataCube;
import org.dcube.data.cube.UnknownDimensionException;
import org.dcube.file.CubeFileFactory;
import org.dcube.file.DeserializationException;
import org.dcube.tool.ToolTestUtil;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * Tests {@link SelectImplementation}.
 *
 * @author Bastian Gloeckle
 */
public class SelectImplementationTest {
  private Path tempDir;
  private String inputPrefix;

  @BeforeMethod
  public void before() throws IOException {
    tempDir = Files.createTempDirectory("dcube-select-test");
    inputPrefix = tempDir.resolve("input").toString();

    DataCube cube = DataCube.fromRows(Arrays.asList("country", "year"), Arrays.asList("spend"), Arrays.asList( //
        CubeRow.of("country", "us", "year", 2015, "spend", 1).asMap(), //
        CubeRow.of("country", "us", "year", 2016, "spend", 2).asMap(), //
        CubeRow.of("country", "jp", "year", 2015, "spend", 4).asMap(), //
        CubeRow.of("country", "de", "year", 2016, "spend", 8).asMap()));
    try (AnnotationConfigApplicationContext ctx = ContextUtil.createContext()) {
      ctx.getBean(CubeFileFactory.class).createCubeFileWriter().write(cube, inputPrefix, false);
    }
  }

  @AfterMethod
  public void after() throws IOException {
    ToolTestUtil.deleteRecursively(tempDir);
  }

  @Test
  public void printGroupedRowsTest() throws IOException, DeserializationException {
    // GIVEN
    ByteArrayOutputStream baos = new ByteArrayOutputStream();

    // WHEN
    try (PrintStream out = new PrintStream(baos, true, "UTF-8")) {
      new SelectImplementation(inputPrefix, Arrays.asList("year"), Collections.emptyMap(), null, null, out).select();
    }

    // THEN
    String[] lines = new String(baos.toByteArray(), StandardCharsets.UTF_8).trim().split("\n");
    Assert.assertEquals(lines, new String[] { "{\"year\":2015,\"spend\":5.0}", "{\"year\":2016,\"spend\":10.0}" });
  }

  @Test
  public void filterAndWriteTest() throws IOException, DeserializationException {
    // GIVEN
    Map<String, Set<String>> filters = new HashMap<>();
    filters.put("country", new HashSet<>(Arrays.asList("us", "jp")));
    filters.put("year", new HashSet<>(Arrays.asList("2015")));
    String outputPrefix = tempDir.resolve("output").toString();

    // WHEN
    DataCube res = new SelectImplementation(inputPrefix, Arrays.asList("country"), filters, outputPrefix, false,
        new PrintStream(new ByteArrayOutputStream())).select();

    // THEN
    Assert.assertEquals(res.getRows(), Arrays.asList(CubeRow.of("country", "us", "spend", 1),
        CubeRow.of("country", "jp", "spend", 4)));
    Assert.assertTrue(new File(outputPrefix + ".json").isFile());
    Assert.assertTrue(new File(outputPrefix + ".dimens.bin").isFile());
    Assert.assertTrue(new File(outputPrefix + ".metrics.bin").isFile());
  }

  @Test
  public void grandTotalTest() throws IOException, DeserializationException {
    // WHEN
    DataCube res = new SelectImplementation(inputPrefix, Collections.emptyList(), Collections.emptyMap(), null, null,
        new PrintStream(new ByteArrayOutputStream())).select();

    // THEN
    Assert.assertEquals(res.getRows(), Arrays.asList(CubeRow.of("spend", 15)));
  }

  @Test(expectedExceptions = UnknownDimensionException.class)
  public void unknownDimensionTest() throws IOException, DeserializationException {
    // WHEN THEN
    new SelectImplementation(inputPrefix, Arrays.asList("city"), Collections.emptyMap(), null, null,
        new PrintStream(new ByteArrayOutputStream())).select();
  }
}
