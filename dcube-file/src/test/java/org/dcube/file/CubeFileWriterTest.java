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
package org.dcube.file;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

import org.dcube.data.cube.CubeRow;
import org.dcube.data.cube.DataCube;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Tests {@link CubeFileWriter}.
 *
 * @author Bastian Gloeckle
 */
public class CubeFileWriterTest {
  private ObjectMapper mapper;
  private CubeFileWriter writer;

  @BeforeMethod
  public void before() {
    mapper = new ObjectMapper();
    writer = new CubeFileWriter(mapper);
  }

  @Test
  public void layoutTest() throws IOException {
    // GIVEN
    DataCube cube = DataCube.fromRows(Arrays.asList("d1", "d2"), Arrays.asList("m1"), Arrays.asList( //
        CubeRow.of("d1", "a", "d2", "b", "m1", 2).asMap(), //
        CubeRow.of("d1", "b", "d2", "a", "m1", 3.5).asMap()));
    ByteArrayOutputStream manifest = new ByteArrayOutputStream();
    ByteArrayOutputStream dimensions = new ByteArrayOutputStream();
    ByteArrayOutputStream metrics = new ByteArrayOutputStream();

    // WHEN
    writer.write(cube, manifest, dimensions, metrics);

    // THEN
    JsonNode manifestNode = mapper.readTree(manifest.toByteArray());
    Assert.assertEquals(manifestNode.get("dimens").toString(), "[\"d1\",\"d2\"]");
    Assert.assertEquals(manifestNode.get("metrics").toString(), "[\"m1\"]");
    Assert.assertEquals(manifestNode.get("count").asInt(), 2);
    Assert.assertEquals(manifestNode.get("dimenIndexToValue").toString(), "[\"a\",\"b\"]",
        "Expected dictionary to be shared across dimensions");

    ByteBuffer dimensionBuf = ByteBuffer.wrap(dimensions.toByteArray()).order(ByteOrder.LITTLE_ENDIAN);
    Assert.assertEquals(dimensionBuf.remaining(), 4 * 4);
    Assert.assertEquals(dimensionBuf.getInt(), 0);
    Assert.assertEquals(dimensionBuf.getInt(), 1);
    Assert.assertEquals(dimensionBuf.getInt(), 1);
    Assert.assertEquals(dimensionBuf.getInt(), 0);

    ByteBuffer metricBuf = ByteBuffer.wrap(metrics.toByteArray()).order(ByteOrder.LITTLE_ENDIAN);
    Assert.assertEquals(metricBuf.remaining(), 2 * 4);
    Assert.assertEquals(metricBuf.getFloat(), 2.f, 0.f);
    Assert.assertEquals(metricBuf.getFloat(), 3.5f, 0.f);
  }

  @Test
  public void lastPageTruncatedTest() throws IOException {
    // GIVEN
    // 5 rows with a page capacity of 4 elements.
    DataCube cube = new DataCube(Arrays.asList("d1"), Arrays.asList("m1"), 4);
    for (int i = 0; i < 5; i++)
      cube.addRow(CubeRow.of("d1", "v" + i, "m1", i));
    ByteArrayOutputStream dimensions = new ByteArrayOutputStream();
    ByteArrayOutputStream metrics = new ByteArrayOutputStream();

    // WHEN
    writer.write(cube, new ByteArrayOutputStream(), dimensions, metrics);

    // THEN
    Assert.assertEquals(dimensions.size(), 5 * 4, "Expected only the assigned elements to be written");
    Assert.assertEquals(metrics.size(), 5 * 4, "Expected only the assigned elements to be written");
    ByteBuffer metricBuf = ByteBuffer.wrap(metrics.toByteArray()).order(ByteOrder.LITTLE_ENDIAN);
    metricBuf.position(4 * 4);
    Assert.assertEquals(metricBuf.getFloat(), 4.f, 0.f);
  }

  @Test
  public void emptyCubeTest() throws IOException {
    // GIVEN
    DataCube cube = new DataCube(Arrays.asList("d1"), Arrays.asList("m1"));
    ByteArrayOutputStream manifest = new ByteArrayOutputStream();
    ByteArrayOutputStream dimensions = new ByteArrayOutputStream();
    ByteArrayOutputStream metrics = new ByteArrayOutputStream();

    // WHEN
    writer.write(cube, manifest, dimensions, metrics);

    // THEN
    Assert.assertEquals(mapper.readTree(manifest.toByteArray()).get("count").asInt(), 0);
    Assert.assertEquals(dimensions.size(), 0);
    Assert.assertEquals(metrics.size(), 0);
  }
}
