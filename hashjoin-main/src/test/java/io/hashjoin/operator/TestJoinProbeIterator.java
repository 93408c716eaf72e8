/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.hashjoin.operator;

import com.google.common.collect.ImmutableList;
import io.airlift.units.DataSize;
import io.hashjoin.spi.row.PackedRow;
import io.hashjoin.spi.row.Row;
import io.hashjoin.spi.type.Type;
import io.hashjoin.testing.RowsBuilder;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.List;
import java.util.NoSuchElementException;

import static com.google.common.collect.Iterables.concat;
import static io.airlift.units.DataSize.Unit.MEGABYTE;
import static io.hashjoin.operator.BuildSide.BUILD_LEFT;
import static io.hashjoin.operator.BuildSide.BUILD_RIGHT;
import static io.hashjoin.operator.HashedRelationBuilder.buildHashedRelation;
import static io.hashjoin.operator.RowEncoding.GENERIC;
import static io.hashjoin.operator.RowEncoding.PACKED;
import static io.hashjoin.spi.type.BigintType.BIGINT;
import static io.hashjoin.spi.type.VarcharType.VARCHAR;
import static io.hashjoin.sql.relational.InputReferenceExpression.field;
import static io.hashjoin.testing.MaterializedRows.materialize;
import static io.hashjoin.testing.MaterializedRows.toValues;
import static io.hashjoin.testing.MaterializedRows.values;
import static io.hashjoin.testing.RowsBuilder.rowsBuilder;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;

public class TestJoinProbeIterator
{
    private static final List<Type> BUILD_TYPES = ImmutableList.of(BIGINT, VARCHAR);
    private static final List<Type> STREAM_TYPES = ImmutableList.of(BIGINT, VARCHAR);

    @DataProvider
    public static Object[][] encodings()
    {
        return new Object[][] {{PACKED}, {GENERIC}};
    }

    @DataProvider
    public static Object[][] encodingsAndBuildSides()
    {
        return new Object[][] {
                {PACKED, BUILD_LEFT},
                {PACKED, BUILD_RIGHT},
                {GENERIC, BUILD_LEFT},
                {GENERIC, BUILD_RIGHT}};
    }

    @Test(dataProvider = "encodings")
    public void testFanOutBuildRight(RowEncoding encoding)
    {
        JoinProbeIterator iterator = probe(
                encoding,
                BUILD_RIGHT,
                rowsBuilder(encoding, BUILD_TYPES).row(1L, "a").row(1L, "b").row(2L, "c").build(),
                rowsBuilder(encoding, STREAM_TYPES).row(1L, "x").build());

        assertEquals(materialize(iterator, outputTypes()), ImmutableList.of(
                values(1L, "x", 1L, "a"),
                values(1L, "x", 1L, "b")));
    }

    @Test(dataProvider = "encodings")
    public void testFanOutBuildLeft(RowEncoding encoding)
    {
        JoinProbeIterator iterator = probe(
                encoding,
                BUILD_LEFT,
                rowsBuilder(encoding, BUILD_TYPES).row(1L, "a").row(1L, "b").row(2L, "c").build(),
                rowsBuilder(encoding, STREAM_TYPES).row(1L, "x").build());

        assertEquals(materialize(iterator, outputTypes()), ImmutableList.of(
                values(1L, "a", 1L, "x"),
                values(1L, "b", 1L, "x")));
    }

    @Test(dataProvider = "encodingsAndBuildSides")
    public void testManyToMany(RowEncoding encoding, BuildSide buildSide)
    {
        JoinProbeIterator iterator = probe(
                encoding,
                buildSide,
                rowsBuilder(encoding, BUILD_TYPES).row(1L, "a").row(2L, "b").row(1L, "c").build(),
                rowsBuilder(encoding, STREAM_TYPES).row(1L, "x").row(3L, "y").row(1L, "z").row(2L, "w").build());

        List<List<Object>> expected;
        if (buildSide == BUILD_RIGHT) {
            expected = ImmutableList.of(
                    values(1L, "x", 1L, "a"),
                    values(1L, "x", 1L, "c"),
                    values(1L, "z", 1L, "a"),
                    values(1L, "z", 1L, "c"),
                    values(2L, "w", 2L, "b"));
        }
        else {
            expected = ImmutableList.of(
                    values(1L, "a", 1L, "x"),
                    values(1L, "c", 1L, "x"),
                    values(1L, "a", 1L, "z"),
                    values(1L, "c", 1L, "z"),
                    values(2L, "b", 2L, "w"));
        }
        assertEquals(materialize(iterator, outputTypes()), expected);
    }

    @Test(dataProvider = "encodings")
    public void testHasNextIsIdempotent(RowEncoding encoding)
    {
        JoinProbeIterator iterator = probe(
                encoding,
                BUILD_RIGHT,
                rowsBuilder(encoding, BUILD_TYPES).row(1L, "a").row(1L, "b").build(),
                rowsBuilder(encoding, STREAM_TYPES).row(2L, "miss").row(1L, "x").row(3L, "miss").build());

        assertTrue(iterator.hasNext());
        assertTrue(iterator.hasNext());
        assertEquals(toValues(iterator.next(), outputTypes()), values(1L, "x", 1L, "a"));
        assertTrue(iterator.hasNext());
        assertTrue(iterator.hasNext());
        assertEquals(toValues(iterator.next(), outputTypes()), values(1L, "x", 1L, "b"));
        assertFalse(iterator.hasNext());
        assertFalse(iterator.hasNext());
    }

    @Test(dataProvider = "encodings")
    public void testNextWithoutHasNext(RowEncoding encoding)
    {
        JoinProbeIterator iterator = probe(
                encoding,
                BUILD_RIGHT,
                rowsBuilder(encoding, BUILD_TYPES).row(1L, "a").build(),
                rowsBuilder(encoding, STREAM_TYPES).row(2L, "miss").row(1L, "x").build());

        assertEquals(toValues(iterator.next(), outputTypes()), values(1L, "x", 1L, "a"));
        assertFalse(iterator.hasNext());
    }

    @Test(dataProvider = "encodings", expectedExceptions = NoSuchElementException.class)
    public void testNextWhenExhausted(RowEncoding encoding)
    {
        JoinProbeIterator iterator = probe(
                encoding,
                BUILD_RIGHT,
                rowsBuilder(encoding, BUILD_TYPES).row(1L, "a").build(),
                rowsBuilder(encoding, STREAM_TYPES).row(1L, "x").build());

        iterator.next();
        iterator.next();
    }

    @Test(dataProvider = "encodings")
    public void testNullKeysNeverMatch(RowEncoding encoding)
    {
        JoinProbeIterator iterator = probe(
                encoding,
                BUILD_RIGHT,
                rowsBuilder(encoding, BUILD_TYPES).row(null, "a").row(1L, "b").build(),
                rowsBuilder(encoding, STREAM_TYPES).row(null, "x").row(1L, "y").row(null, "z").build());

        assertEquals(materialize(iterator, outputTypes()), ImmutableList.of(values(1L, "y", 1L, "b")));

        JoinOperatorInfo info = iterator.getOperatorInfo();
        assertEquals(info.getNullKeyProbes(), 2);
        assertEquals(info.getProbeCount(), 3);
        assertEquals(info.getOutputRowCount(), 1);
    }

    @Test(dataProvider = "encodings")
    public void testEmptyStream(RowEncoding encoding)
    {
        JoinProbeIterator iterator = probe(
                encoding,
                BUILD_RIGHT,
                rowsBuilder(encoding, BUILD_TYPES).row(1L, "a").build(),
                ImmutableList.of());

        assertFalse(iterator.hasNext());
        assertEquals(iterator.getOperatorInfo().getProbeCount(), 0);
    }

    @Test(dataProvider = "encodings")
    public void testEmptyBuild(RowEncoding encoding)
    {
        JoinProbeIterator iterator = probe(
                encoding,
                BUILD_RIGHT,
                ImmutableList.of(),
                rowsBuilder(encoding, STREAM_TYPES).row(1L, "x").row(2L, "y").build());

        assertTrue(iterator.getHashedRelation().isEmpty());
        assertFalse(iterator.hasNext());
    }

    @Test(dataProvider = "encodings")
    public void testNoMatches(RowEncoding encoding)
    {
        JoinProbeIterator iterator = probe(
                encoding,
                BUILD_LEFT,
                rowsBuilder(encoding, BUILD_TYPES).row(1L, "a").build(),
                rowsBuilder(encoding, STREAM_TYPES).row(2L, "x").row(3L, "y").build());

        assertFalse(iterator.hasNext());
        assertEquals(iterator.getOperatorInfo().getLogHistogramProbes()[0], 2);
    }

    @Test
    public void testPackedOutputRowIsReused()
    {
        JoinProbeIterator iterator = probe(
                PACKED,
                BUILD_RIGHT,
                rowsBuilder(PACKED, BUILD_TYPES).row(1L, "a").row(1L, "b").build(),
                rowsBuilder(PACKED, STREAM_TYPES).row(1L, "x").build());

        Row first = iterator.next();
        assertTrue(first instanceof PackedRow);
        Row retained = first.copy();
        Row second = iterator.next();

        assertSame(first, second);
        assertEquals(toValues(second, outputTypes()), values(1L, "x", 1L, "b"));
        assertEquals(toValues(retained, outputTypes()), values(1L, "x", 1L, "a"));
    }

    @Test
    public void testGenericOutputRowsAreJoinedRows()
    {
        JoinProbeIterator iterator = probe(
                GENERIC,
                BUILD_LEFT,
                rowsBuilder(GENERIC, BUILD_TYPES).row(1L, "a").build(),
                rowsBuilder(GENERIC, STREAM_TYPES).row(1L, "x").build());

        Row row = iterator.next();
        assertTrue(row instanceof JoinedRow);
        assertEquals(toValues(((JoinedRow) row).getLeft(), BUILD_TYPES), values(1L, "a"));
        assertEquals(toValues(((JoinedRow) row).getRight(), STREAM_TYPES), values(1L, "x"));
        assertEquals(toValues(row.copy(), outputTypes()), values(1L, "a", 1L, "x"));
    }

    @Test
    public void testStatistics()
    {
        RowsBuilder buildRows = rowsBuilder(GENERIC, BUILD_TYPES).row(1L, "one");
        for (int i = 0; i < 5; i++) {
            buildRows.row(5L, "five");
        }
        for (int i = 0; i < 11; i++) {
            buildRows.row(11L, "eleven");
        }
        List<Row> streamRows = rowsBuilder(GENERIC, STREAM_TYPES)
                .row(0L, "none")
                .row(1L, "one")
                .row(5L, "five")
                .row(11L, "eleven")
                .build();
        JoinProbeIterator iterator = probe(GENERIC, BUILD_RIGHT, buildRows.build(), streamRows);

        assertEquals(materialize(iterator, outputTypes()).size(), 1 + 5 + 11);

        JoinOperatorInfo info = iterator.getOperatorInfo();
        assertEquals(info.getBuildSide(), BUILD_RIGHT);
        assertEquals(info.getRowEncoding(), GENERIC);
        assertEquals(info.getBuildRowCount(), 17);
        assertEquals(info.getLogHistogramProbes(), new long[] {1, 1, 0, 0, 0, 1, 1, 0});
        assertEquals(info.getLogHistogramOutput(), new long[] {0, 1, 0, 0, 0, 5, 11, 0});
        assertEquals(info.getProbeCount(), 4);
        assertEquals(info.getOutputRowCount(), 17);
    }

    private static List<Type> outputTypes()
    {
        return ImmutableList.copyOf(concat(BUILD_TYPES, STREAM_TYPES));
    }

    private static JoinProbeIterator probe(RowEncoding encoding, BuildSide buildSide, List<Row> buildRows, List<Row> streamRows)
    {
        HashedRelation relation = buildHashedRelation(
                buildRows.iterator(),
                KeyExtractor.create(ImmutableList.of(field(0, BIGINT)), BUILD_TYPES, encoding),
                encoding.createMaterializer(BUILD_TYPES),
                new DataSize(16, MEGABYTE));
        return new JoinProbeIterator(
                streamRows.iterator(),
                encoding.createInputProjection(STREAM_TYPES),
                relation,
                KeyExtractor.create(ImmutableList.of(field(0, BIGINT)), STREAM_TYPES, encoding),
                buildSide,
                encoding.createOutputProjection(outputTypes()),
                new JoinStatisticsCounter(buildSide, encoding, relation.getRowCount()));
    }
}
