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
package org.dcube.tool.importer;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.zip.GZIPOutputStream;

import org.dcube.context.ContextUtil;
import org.dcube.data.cube.CubeRow;
import org.dcube.data.cube.DataCube;
import org.dcube.data.cube.MissingFieldException;
import org.dcube.file.CubeFileFactory;
import org.dcube.file.DeserializationException;
import org.dcube.tool.ToolTestUtil;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

/**
 * Tests {@link ImportImplementation}.
 *
 * @author Bastian Gloeckle
 */
public class ImportImplementationTest {
  private static final String ROWS_JSON = "[ {\"d1\": \"a\", \"d2\": 1, \"m1\": 2}, {\"d1\": \"a\", \"d2\": 1, \"m1\": 3}, "
      + "{\"d1\": \"b\", \"d2\": 2, \"m1\": 1.5} ]";

  private Path tempDir;

  @BeforeMethod
  public void before() throws IOException {
    tempDir = Files.createTempDirectory("dcube-import-test");
  }

  @AfterMethod
  public void after() throws IOException {
    ToolTestUtil.deleteRecursively(tempDir);
  }

  @Test
  public void importTest() throws IOException, DeserializationException {
    // GIVEN
    File input = tempDir.resolve("rows.json").toFile();
    Files.write(input.toPath(), ROWS_JSON.getBytes(StandardCharsets.UTF_8));
    String outputPrefix = tempDir.resolve("cube").toString();

    // WHEN
    DataCube res =
        new ImportImplementation(input, Arrays.asList("d1", "d2"), Arrays.asList("m1"), outputPrefix, false)
            .importCube();

    // THEN
    Assert.assertEquals(res.count(), 2, "Expected rows with equal dimensions to be aggregated");
    Assert.assertTrue(new File(outputPrefix + ".json").isFile());
    Assert.assertEquals(readCube(outputPrefix).getRows(),
        Arrays.asList(CubeRow.of("d1", "a", "d2", 1L, "m1", 5.), CubeRow.of("d1", "b", "d2", 2L, "m1", 1.5)));
  }

  @Test
  public void compressedByConfigTest() throws IOException, DeserializationException {
    // GIVEN
    File input = tempDir.resolve("rows.json").toFile();
    Files.write(input.toPath(), ROWS_JSON.getBytes(StandardCharsets.UTF_8));
    String outputPrefix = tempDir.resolve("cube").toString();

    // WHEN
    new ImportImplementation(input, Arrays.asList("d1"), Arrays.asList("m1"), outputPrefix, null).importCube();

    // THEN
    Assert.assertTrue(new File(outputPrefix + ".json.gz").isFile(), "Expected test config to enable compression");
    Assert.assertTrue(new File(outputPrefix + ".dimens.bin.gz").isFile());
    Assert.assertTrue(new File(outputPrefix + ".metrics.bin.gz").isFile());
    Assert.assertEquals(readCube(outputPrefix).totals().get("m1"), Double.valueOf(6.5));
  }

  @Test
  public void gzipObjectSequenceInputTest() throws IOException, DeserializationException {
    // GIVEN
    File input = tempDir.resolve("rows.json.gz").toFile();
    try (OutputStream os = new GZIPOutputStream(Files.newOutputStream(input.toPath()))) {
      os.write("{\"d1\": \"a\", \"m1\": 1}\n{\"d1\": \"b\", \"m1\": 2}\n{\"d1\": \"a\", \"m1\": 4}\n"
          .getBytes(StandardCharsets.UTF_8));
    }
    String outputPrefix = tempDir.resolve("cube").toString();

    // WHEN
    new ImportImplementation(input, Arrays.asList("d1"), Arrays.asList("m1"), outputPrefix, false).importCube();

    // THEN
    Assert.assertEquals(readCube(outputPrefix).getRows(),
        Arrays.asList(CubeRow.of("d1", "a", "m1", 5), CubeRow.of("d1", "b", "m1", 2)));
  }

  @Test
  public void missingFieldTest() throws IOException {
    // GIVEN
    File input = tempDir.resolve("rows.json").toFile();
    Files.write(input.toPath(), "[{\"d1\": \"a\", \"m1\": 1}, {\"m1\": 2}]".getBytes(StandardCharsets.UTF_8));
    String outputPrefix = tempDir.resolve("cube").toString();

    // WHEN
    try {
      new ImportImplementation(input, Arrays.asList("d1"), Arrays.asList("m1"), outputPrefix, false).importCube();
      Assert.fail("Expected exception");
    } catch (MissingFieldException e) {
      // THEN
      Assert.assertEquals(e.getFieldName(), "d1");
    }
    Assert.assertFalse(new File(outputPrefix + ".json").exists(), "Expected no output to be written");
  }

  private DataCube readCube(String prefix) throws IOException, DeserializationException {
    try (AnnotationConfigApplicationContext ctx = ContextUtil.createContext()) {
      return ctx.getBean(CubeFileFactory.class).createCubeFileReader().read(prefix);
    }
  }
}
