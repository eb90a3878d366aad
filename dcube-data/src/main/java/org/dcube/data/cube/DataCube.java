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
package org.dcube.data.cube;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

import org.dcube.data.dictionary.ValueDictionary;
import org.dcube.util.AbstractPagedBuffer;
import org.dcube.util.FloatPagedBuffer;
import org.dcube.util.IntPagedBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

/**
 * A collection of cells, each identified by a unique set of dimension values and holding a value for each metric.
 *
 * <p>
 * For example, a cube with the dimensions [genre, author, day] and the metrics [sales, revenue] could contain a row
 * <code>{genre: "Fiction", author: "Jane Austen", day: "2023-01-01", sales: 100, revenue: 2130.05}</code>.
 *
 * <p>
 * Data is held in a columnar layout: All dimension values are interned in a single {@link ValueDictionary} that is
 * shared across all dimensions. For each row, the IDs of its dimension values are stored in an {@link IntPagedBuffer}
 * (row-major, one element per dimension) and the metric values are stored in a {@link FloatPagedBuffer} (row-major,
 * one element per metric). Row r therefore owns the dimension elements [r * D, (r + 1) * D) and the metric elements [r
 * * M, (r + 1) * M).
 *
 * <p>
 * Adding a row whose dimension values are already contained in the cube does not add a new row, but adds the metric
 * values to the existing row. Each row therefore holds the sums of all metric values added for its dimension values.
 *
 * <p>
 * Query methods ({@link #select(List)}, {@link #where(Map)}, {@link #explodeDimenIntoColumns(String, BiFunction)},
 * {@link #aggregateTailValues(String, Comparator, int, Object)}) do not change this cube but return new cubes. They
 * can be called concurrently with each other, but not concurrently with {@link #addRow(Map)}.
 *
 * @author Bastian Gloeckle
 */
public class DataCube {
  private static final Logger logger = LoggerFactory.getLogger(DataCube.class);

  /** Byte order of the binary representation written by {@link #writeDimensionIndices(OutputStream)} etc. */
  public static final ByteOrder BYTE_ORDER = ByteOrder.LITTLE_ENDIAN;

  private final List<String> dimensions;
  private final List<String> metrics;
  private final int pageCapacity;

  private ValueDictionary dictionary;
  private IntPagedBuffer dimensionIndices;
  private FloatPagedBuffer metricValues;
  private int rowCount;

  /**
   * Maps the dimension IDs of each row to the index of the row. It is only needed when adding rows and is built
   * lazily: It is <code>null</code> for cubes that have been loaded, filtered or copied and has not been needed yet.
   */
  private Map<DimensionKey, Integer> keyIndex;

  public DataCube(List<String> dimensions, List<String> metrics) throws IllegalArgumentException {
    this(dimensions, metrics, AbstractPagedBuffer.DEFAULT_PAGE_CAPACITY);
  }

  /**
   * @param pageCapacity
   *          Number of elements in the pages of the buffers of this cube and the cubes derived from it.
   * @throws IllegalArgumentException
   *           If the names of the dimensions and metrics are not unique.
   */
  public DataCube(List<String> dimensions, List<String> metrics, int pageCapacity) throws IllegalArgumentException {
    this(dimensions, metrics, pageCapacity, new ValueDictionary(), new IntPagedBuffer(pageCapacity),
        new FloatPagedBuffer(pageCapacity), 0);
    keyIndex = new HashMap<>();
  }

  private DataCube(List<String> dimensions, List<String> metrics, int pageCapacity, ValueDictionary dictionary,
      IntPagedBuffer dimensionIndices, FloatPagedBuffer metricValues, int rowCount) throws IllegalArgumentException {
    this.dimensions = ImmutableList.copyOf(dimensions);
    this.metrics = ImmutableList.copyOf(metrics);
    Set<String> allFields = new HashSet<>(dimensions);
    allFields.addAll(metrics);
    if (allFields.size() != dimensions.size() + metrics.size())
      throw new IllegalArgumentException(
          "Names of dimensions and metrics must be unique, but got " + dimensions + " and " + metrics);

    this.pageCapacity = pageCapacity;
    this.dictionary = dictionary;
    this.dimensionIndices = dimensionIndices;
    this.metricValues = metricValues;
    this.rowCount = rowCount;
  }

  /**
   * Creates a cube on the basis of already encoded columnar data. The cube takes ownership of the given objects.
   *
   * @param rowCount
   *          Number of rows contained in the buffers.
   * @throws IllegalArgumentException
   *           If the length of the buffers does not match the row count and the schema or the dimension buffer
   *           contains IDs that are not contained in the dictionary.
   */
  public static DataCube fromColumnarData(List<String> dimensions, List<String> metrics, int pageCapacity,
      ValueDictionary dictionary, IntPagedBuffer dimensionIndices, FloatPagedBuffer metricValues, int rowCount)
      throws IllegalArgumentException {
    if (dimensionIndices.length() != (long) rowCount * dimensions.size())
      throw new IllegalArgumentException("Expected " + ((long) rowCount * dimensions.size())
          + " dimension IDs for " + rowCount + " rows, but got " + dimensionIndices.length());
    if (metricValues.length() != (long) rowCount * metrics.size())
      throw new IllegalArgumentException("Expected " + ((long) rowCount * metrics.size()) + " metric values for "
          + rowCount + " rows, but got " + metricValues.length());
    for (long i = 0; i < dimensionIndices.length(); i++) {
      long id = Integer.toUnsignedLong(dimensionIndices.getInt(i));
      if (id >= dictionary.size())
        throw new IllegalArgumentException(
            "Dimension ID " + id + " at index " + i + " is not contained in dictionary of size " + dictionary.size());
    }

    return new DataCube(dimensions, metrics, pageCapacity, dictionary, dimensionIndices, metricValues, rowCount);
  }

  /**
   * Creates a new cube and adds all the given rows.
   *
   * @throws MissingFieldException
   *           If a row does not contain one of the dimensions or metrics.
   */
  public static DataCube fromRows(List<String> dimensions, List<String> metrics, Iterable<? extends Map<String, ?>> rows)
      throws MissingFieldException {
    DataCube res = new DataCube(dimensions, metrics);
    for (Map<String, ?> row : rows)
      res.addRow(row);
    return res;
  }

  public List<String> getDimensions() {
    return dimensions;
  }

  public List<String> getMetrics() {
    return metrics;
  }

  public int getPageCapacity() {
    return pageCapacity;
  }

  /**
   * @return Unmodifiable view on the values of the dictionary, the index in the list being the ID of the value.
   */
  public List<Object> getDictionaryValues() {
    return dictionary.getValues();
  }

  /**
   * @return Number of rows.
   */
  public int count() {
    return rowCount;
  }

  /**
   * Add a row to the cube, or - if the cube contains a row with the same dimension values already - add the metric
   * values of the row to the existing row.
   *
   * <p>
   * Fields of the row which are neither dimensions nor metrics are ignored. The row is validated completely before
   * the cube is changed.
   *
   * @throws MissingFieldException
   *           If the row does not contain a non-null value for each dimension and metric.
   * @throws IllegalArgumentException
   *           If the value of a metric is not a number.
   */
  public void addRow(Map<String, ?> row) throws MissingFieldException, IllegalArgumentException {
    Object[] dimensionValues = new Object[dimensions.size()];
    for (int i = 0; i < dimensionValues.length; i++) {
      dimensionValues[i] = row.get(dimensions.get(i));
      if (dimensionValues[i] == null)
        throw new MissingFieldException(dimensions.get(i),
            "Row " + row + " does not contain a value for dimension '" + dimensions.get(i) + "'.");
    }

    double[] values = new double[metrics.size()];
    for (int m = 0; m < values.length; m++) {
      Object value = row.get(metrics.get(m));
      if (value == null)
        throw new MissingFieldException(metrics.get(m),
            "Row " + row + " does not contain a value for metric '" + metrics.get(m) + "'.");
      if (!(value instanceof Number))
        throw new IllegalArgumentException(
            "Value '" + value + "' of metric '" + metrics.get(m) + "' in row " + row + " is not a number.");
      values[m] = ((Number) value).doubleValue();
    }

    int[] ids = new int[dimensionValues.length];
    for (int i = 0; i < ids.length; i++)
      ids[i] = dictionary.intern(dimensionValues[i]);

    int rowIdx = findOrCreateRow(ids);
    long metricOffset = (long) rowIdx * metrics.size();
    for (int m = 0; m < values.length; m++)
      metricValues.set(metricOffset + m, (float) (metricValues.getFloat(metricOffset + m) + values[m]));
  }

  /**
   * See {@link #addRow(Map)}.
   */
  public void addRow(CubeRow row) throws MissingFieldException, IllegalArgumentException {
    addRow(row.asMap());
  }

  /**
   * @return The sum of all values of each metric, keyed by metric name, ordered like {@link #getMetrics()}.
   */
  public Map<String, Double> totals() {
    double[] sums = new double[metrics.size()];
    long offset = 0;
    for (int rowIdx = 0; rowIdx < rowCount; rowIdx++) {
      for (int m = 0; m < sums.length; m++)
        sums[m] += metricValues.getFloat(offset++);
    }

    Map<String, Double> res = new LinkedHashMap<>();
    for (int m = 0; m < sums.length; m++)
      res.put(metrics.get(m), sums[m]);
    return res;
  }

  /**
   * @return The distinct values of the given dimension, in the order in which they first appear in the rows.
   * @throws UnknownDimensionException
   *           If the dimension is not part of this cube.
   */
  public List<Object> getDimensionValues(String dimension) throws UnknownDimensionException {
    assertValidDimensions(ImmutableList.of(dimension));
    int dimensionOffset = dimensions.indexOf(dimension);

    Set<Integer> ids = new LinkedHashSet<>();
    for (int rowIdx = 0; rowIdx < rowCount; rowIdx++)
      ids.add(dimensionIndices.getInt((long) rowIdx * dimensions.size() + dimensionOffset));

    return ids.stream().map(id -> dictionary.valueAt(id)).collect(Collectors.toList());
  }

  /**
   * Group-by: Create a new cube that contains only the given dimensions. All rows that have the same values in these
   * dimensions are merged into a single row by summing up their metric values.
   *
   * <p>
   * If no dimensions are given, the resulting cube contains a single row holding the {@link #totals()} (or no row at
   * all if this cube is empty).
   *
   * @param selectedDimensions
   *          The dimensions of the new cube, in the order they should have in the new cube.
   * @throws UnknownDimensionException
   *           If any of the dimensions is not part of this cube.
   */
  public DataCube select(List<String> selectedDimensions) throws UnknownDimensionException {
    assertValidDimensions(selectedDimensions);

    DataCube res = new DataCube(selectedDimensions, metrics, pageCapacity, dictionary.copy(),
        new IntPagedBuffer(pageCapacity), new FloatPagedBuffer(pageCapacity), 0);
    res.keyIndex = new HashMap<>();

    int[] srcDimensionOffsets = new int[selectedDimensions.size()];
    for (int i = 0; i < srcDimensionOffsets.length; i++)
      srcDimensionOffsets[i] = dimensions.indexOf(selectedDimensions.get(i));

    for (int rowIdx = 0; rowIdx < rowCount; rowIdx++) {
      long dimensionOffset = (long) rowIdx * dimensions.size();
      int[] ids = new int[srcDimensionOffsets.length];
      for (int i = 0; i < ids.length; i++)
        ids[i] = dimensionIndices.getInt(dimensionOffset + srcDimensionOffsets[i]);

      int destRowIdx = res.findOrCreateRow(ids);

      long srcMetricOffset = (long) rowIdx * metrics.size();
      long destMetricOffset = (long) destRowIdx * metrics.size();
      for (int m = 0; m < metrics.size(); m++) {
        float srcValue = metricValues.getFloat(srcMetricOffset + m);
        float destValue = res.metricValues.getFloat(destMetricOffset + m);
        res.metricValues.set(destMetricOffset + m, (float) ((double) destValue + srcValue));
      }
    }

    logger.trace("Selected {} out of {}: Grouped {} rows into {} rows.", selectedDimensions, dimensions, rowCount,
        res.rowCount);
    return res;
  }

  /**
   * See {@link #select(List)}.
   */
  public DataCube select(String... selectedDimensions) throws UnknownDimensionException {
    return select(Arrays.asList(selectedDimensions));
  }

  /**
   * Create a new cube that contains only those rows whose dimension values are accepted by the given filters. The rows
   * are copied unchanged and in their original order.
   *
   * <p>
   * Each filter is evaluated at most once per distinct value of its dimension.
   *
   * @param filters
   *          Map from dimension name to the filter that needs to accept the value of the dimension. Dimensions that are
   *          not contained in the map or mapped to <code>null</code> are not filtered.
   * @return The new cube. If no filters are given, this cube itself is returned.
   * @throws UnknownDimensionException
   *           If a filter is specified for a dimension that is not part of this cube.
   */
  public DataCube where(Map<String, DimensionFilter> filters) throws UnknownDimensionException {
    if (filters == null)
      return this;
    // a null filter leaves its dimension unconstrained.
    Map<String, DimensionFilter> activeFilters = new LinkedHashMap<>();
    for (Entry<String, DimensionFilter> e : filters.entrySet())
      if (e.getValue() != null)
        activeFilters.put(e.getKey(), e.getValue());
    if (activeFilters.isEmpty())
      return this;
    assertValidDimensions(new ArrayList<>(activeFilters.keySet()));

    int[] filteredOffsets = new int[activeFilters.size()];
    DimensionFilter[] filterArray = new DimensionFilter[activeFilters.size()];
    List<Map<Integer, Boolean>> acceptedCache = new ArrayList<>();
    int f = 0;
    for (Entry<String, DimensionFilter> e : activeFilters.entrySet()) {
      filteredOffsets[f] = dimensions.indexOf(e.getKey());
      filterArray[f] = e.getValue();
      acceptedCache.add(new HashMap<>());
      f++;
    }

    DataCube res = new DataCube(dimensions, metrics, pageCapacity, dictionary.copy(),
        new IntPagedBuffer(pageCapacity), new FloatPagedBuffer(pageCapacity), 0);

    for (int rowIdx = 0; rowIdx < rowCount; rowIdx++) {
      long dimensionOffset = (long) rowIdx * dimensions.size();
      boolean include = true;
      for (int i = 0; i < filteredOffsets.length && include; i++) {
        int id = dimensionIndices.getInt(dimensionOffset + filteredOffsets[i]);
        DimensionFilter filter = filterArray[i];
        include = acceptedCache.get(i).computeIfAbsent(id, ignored -> filter.accepts(dictionary.valueAt(id)));
      }

      if (include) {
        dimensionIndices.copyRange(dimensionOffset, res.dimensionIndices, (long) res.rowCount * dimensions.size(),
            dimensions.size());
        metricValues.copyRange((long) rowIdx * metrics.size(), res.metricValues,
            (long) res.rowCount * metrics.size(), metrics.size());
        res.rowCount++;
      }
    }

    logger.trace("Filtered {} rows by {}, {} rows remain.", rowCount, activeFilters, res.rowCount);
    return res;
  }

  /**
   * Materialize all rows of the cube.
   *
   * @return A new list containing a new {@link CubeRow} for each row, in the order of the rows in the cube. Each row
   *         contains all dimensions and all metrics, the metric values being {@link Double}s.
   */
  public List<CubeRow> getRows() {
    List<CubeRow> res = new ArrayList<>(rowCount);
    long dimensionOffset = 0;
    long metricOffset = 0;
    for (int rowIdx = 0; rowIdx < rowCount; rowIdx++) {
      CubeRow row = new CubeRow();
      for (String dimension : dimensions)
        row.set(dimension, dictionary.valueAt(dimensionIndices.getInt(dimensionOffset++)));
      for (String metric : metrics)
        row.set(metric, (double) metricValues.getFloat(metricOffset++));
      res.add(row);
    }
    return res;
  }

  /**
   * Create a new cube where the given dimension is removed and, instead, its values are added as separate metrics.
   *
   * <p>
   * For example, take a cube with the dimensions [country, customer] and the metric [spend]. Exploding "country"
   * results in a cube with the dimension [customer] and the metrics [us-spend, jp-spend, ...]. This is useful e.g.
   * when analyzing AB tests, where each row should contain the metrics of both, the control and the experiment group.
   *
   * <p>
   * The new metrics are ordered by their first occurrence. A row that does not have a value for a new metric holds 0
   * for it.
   *
   * @param dimension
   *          The dimension to explode.
   * @param metricNameFn
   *          Receives a value of the dimension and the name of an original metric and returns the name of the new
   *          metric. If <code>null</code>, new metrics are named "value-metric".
   * @throws UnknownDimensionException
   *           If the dimension is not part of this cube.
   */
  public DataCube explodeDimenIntoColumns(String dimension, BiFunction<Object, String, String> metricNameFn)
      throws UnknownDimensionException {
    assertValidDimensions(ImmutableList.of(dimension));

    List<CubeRow> rows = getRows();
    Set<String> newMetrics = new LinkedHashSet<>();
    for (CubeRow row : rows) {
      Object value = row.get(dimension);
      for (String metric : metrics) {
        String newMetric = (metricNameFn != null) ? metricNameFn.apply(value, metric) : value + "-" + metric;
        newMetrics.add(newMetric);
        // the original metric stays in the row, it is simply ignored when the row is added to the new cube.
        row.set(newMetric, row.get(metric));
      }
    }

    List<String> reducedDimensions = new ArrayList<>(dimensions);
    reducedDimensions.remove(dimension);

    DataCube res = new DataCube(reducedDimensions, new ArrayList<>(newMetrics), pageCapacity);
    for (CubeRow row : rows) {
      for (String newMetric : newMetrics) {
        if (!row.contains(newMetric))
          row.set(newMetric, 0.);
      }
      res.addRow(row);
    }
    return res;
  }

  /**
   * See {@link #explodeDimenIntoColumns(String, BiFunction)}, using the default metric names.
   */
  public DataCube explodeDimenIntoColumns(String dimension) throws UnknownDimensionException {
    return explodeDimenIntoColumns(dimension, null);
  }

  /**
   * Collapse all rows whose value of the given dimension is not one of the "top n" values into rows with a placeholder
   * value.
   *
   * <p>
   * The top values are identified by grouping the cube by the dimension (see {@link #select(List)}), sorting the
   * resulting rows with the given comparator and taking the first n. If the comparator does not define a strict order,
   * it is undefined which of the equal rows at position n are kept.
   *
   * @param dimension
   *          The dimension whose values should be aggregated.
   * @param comparator
   *          Sort order of the grouped rows, the first n rows are kept.
   * @param n
   *          Number of values to keep.
   * @param placeholderValue
   *          The value that replaces all values that are not kept.
   * @return A new cube with the same dimensions and metrics as this one.
   * @throws UnknownDimensionException
   *           If the dimension is not part of this cube.
   */
  public DataCube aggregateTailValues(String dimension, Comparator<CubeRow> comparator, int n,
      Object placeholderValue) throws UnknownDimensionException {
    assertValidDimensions(ImmutableList.of(dimension));
    if (placeholderValue == null)
      throw new IllegalArgumentException("Placeholder value must not be null.");

    List<CubeRow> groupedRows = select(ImmutableList.of(dimension)).getRows();
    groupedRows.sort(comparator);
    Set<Object> keptValues = new HashSet<>();
    for (CubeRow row : groupedRows.subList(0, Math.max(0, Math.min(n, groupedRows.size()))))
      keptValues.add(row.get(dimension));

    DataCube res = new DataCube(dimensions, metrics, pageCapacity);
    for (CubeRow row : getRows()) {
      if (!keptValues.contains(row.get(dimension)))
        row.set(dimension, placeholderValue);
      res.addRow(row);
    }
    return res;
  }

  /**
   * @return A deep copy of this cube which does not share any mutable data with this cube.
   */
  @Override
  public DataCube clone() {
    DataCube res = new DataCube(dimensions, metrics, pageCapacity, dictionary.copy(), dimensionIndices.clone(),
        metricValues.clone(), rowCount);
    if (keyIndex != null)
      res.keyIndex = new HashMap<>(keyIndex);
    return res;
  }

  /**
   * Write the dimension IDs of all rows (row-major, unsigned 32 bit integers, {@link #BYTE_ORDER}).
   */
  public void writeDimensionIndices(OutputStream outputStream) throws IOException {
    dimensionIndices.writeTo(outputStream, BYTE_ORDER);
  }

  /**
   * Write the metric values of all rows (row-major, 32 bit floats, {@link #BYTE_ORDER}).
   */
  public void writeMetricValues(OutputStream outputStream) throws IOException {
    metricValues.writeTo(outputStream, BYTE_ORDER);
  }

  /**
   * @return Index of the row with the given dimension IDs. If there is no such row yet, a new row is appended whose
   *         metrics are all 0.
   */
  private int findOrCreateRow(int[] ids) {
    if (keyIndex == null)
      rebuildKeyIndex();

    DimensionKey key = new DimensionKey(ids);
    Integer rowIdx = keyIndex.get(key);
    if (rowIdx != null)
      return rowIdx;

    rowIdx = rowCount;
    for (int id : ids)
      dimensionIndices.add(id);
    long metricOffset = (long) rowIdx * metrics.size();
    for (int m = 0; m < metrics.size(); m++)
      metricValues.set(metricOffset + m, 0f);
    keyIndex.put(key, rowIdx);
    rowCount++;
    return rowIdx;
  }

  private void rebuildKeyIndex() {
    logger.debug("Building key index for {} rows.", rowCount);
    keyIndex = new HashMap<>();
    for (int rowIdx = 0; rowIdx < rowCount; rowIdx++) {
      int[] ids = dimensionIndices.slice((long) rowIdx * dimensions.size(), (long) (rowIdx + 1) * dimensions.size());
      keyIndex.put(new DimensionKey(ids), rowIdx);
    }
  }

  private void assertValidDimensions(List<String> dimensionsToCheck) throws UnknownDimensionException {
    List<String> unknown =
        dimensionsToCheck.stream().filter(d -> !dimensions.contains(d)).collect(Collectors.toList());
    if (!unknown.isEmpty())
      throw new UnknownDimensionException(unknown, dimensions);
  }

  @Override
  public String toString() {
    return "DataCube[dimensions=" + dimensions + ",metrics=" + metrics + ",rows=" + rowCount + "]";
  }
}
