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
package io.hashjoin.spi.row;

import com.google.common.collect.ImmutableList;
import io.hashjoin.spi.HashJoinException;
import io.hashjoin.spi.type.ArrayType;
import io.hashjoin.spi.type.Type;
import org.testng.annotations.Test;

import java.util.List;

import static io.airlift.slice.Slices.utf8Slice;
import static io.hashjoin.spi.StandardErrorCode.NOT_SUPPORTED;
import static io.hashjoin.spi.type.BigintType.BIGINT;
import static io.hashjoin.spi.type.BooleanType.BOOLEAN;
import static io.hashjoin.spi.type.DoubleType.DOUBLE;
import static io.hashjoin.spi.type.IntegerType.INTEGER;
import static io.hashjoin.spi.type.VarcharType.VARCHAR;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNotEquals;
import static org.testng.Assert.assertNotSame;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

public class TestPackedRow
{
    private static final List<Type> TYPES = ImmutableList.of(BIGINT, VARCHAR, DOUBLE, BOOLEAN, INTEGER);

    @Test
    public void testReadValues()
    {
        PackedRowBuilder builder = new PackedRowBuilder(TYPES);
        PackedRow row = builder.appendLong(42)
                .appendSlice(utf8Slice("hello"))
                .appendDouble(1.5)
                .appendBoolean(true)
                .appendInt(-7)
                .build();

        assertEquals(row.getFieldCount(), 5);
        assertFalse(row.anyNull());
        assertEquals(row.getLong(0), 42);
        assertEquals(row.getSlice(1).toStringUtf8(), "hello");
        assertEquals(row.getDouble(2), 1.5);
        assertTrue(row.getBoolean(3));
        assertEquals(row.getInt(4), -7);
        assertEquals(VARCHAR.getObjectValue(row, 1), "hello");
    }

    @Test
    public void testNulls()
    {
        PackedRowBuilder builder = new PackedRowBuilder(TYPES);
        PackedRow row = builder.appendLong(1)
                .appendNull()
                .appendDouble(2)
                .appendNull()
                .appendInt(3)
                .build();

        assertTrue(row.anyNull());
        assertFalse(row.isNull(0));
        assertTrue(row.isNull(1));
        assertFalse(row.isNull(2));
        assertTrue(row.isNull(3));
        assertEquals(BIGINT.getObjectValue(row, 0), 1L);
        assertEquals(VARCHAR.getObjectValue(row, 1), null);
    }

    @Test
    public void testNullBitsBeyondFirstWord()
    {
        ImmutableList.Builder<Type> types = ImmutableList.builder();
        for (int i = 0; i < 70; i++) {
            types.add(BIGINT);
        }
        PackedRowBuilder builder = new PackedRowBuilder(types.build());
        for (int i = 0; i < 70; i++) {
            if (i == 67) {
                builder.appendNull();
            }
            else {
                builder.appendLong(i);
            }
        }
        PackedRow row = builder.build();

        assertTrue(row.anyNull());
        assertTrue(row.isNull(67));
        assertFalse(row.isNull(3));
        assertEquals(row.getLong(69), 69);
    }

    @Test
    public void testStructuralEquality()
    {
        PackedRow first = new PackedRowBuilder(TYPES)
                .appendLong(7).appendSlice(utf8Slice("abc")).appendNull().appendBoolean(false).appendInt(1)
                .build()
                .copy();
        PackedRow second = new PackedRowBuilder(TYPES)
                .appendLong(7).appendSlice(utf8Slice("abc")).appendNull().appendBoolean(false).appendInt(1)
                .build()
                .copy();
        PackedRow different = new PackedRowBuilder(TYPES)
                .appendLong(7).appendSlice(utf8Slice("abd")).appendNull().appendBoolean(false).appendInt(1)
                .build()
                .copy();

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, different);
    }

    @Test
    public void testNaNHasSingleRepresentation()
    {
        PackedRowBuilder builder = new PackedRowBuilder(ImmutableList.of(DOUBLE));
        PackedRow first = builder.appendDouble(Double.NaN).build().copy();
        PackedRow second = builder.appendDouble(Double.longBitsToDouble(0x7ff8000000000001L)).build().copy();
        assertEquals(first, second);
    }

    @Test
    public void testBuilderReusesRow()
    {
        PackedRowBuilder builder = new PackedRowBuilder(ImmutableList.of(BIGINT, VARCHAR));
        PackedRow first = builder.appendLong(1).appendSlice(utf8Slice("a long value that grows the buffer beyond its initial size")).build();
        PackedRow retained = first.copy();

        PackedRow second = builder.appendLong(2).appendSlice(utf8Slice("b")).build();

        assertSame(second, first);
        assertEquals(first.getLong(0), 2);
        assertEquals(first.getSlice(1).toStringUtf8(), "b");
        assertNotSame(retained, first);
        assertEquals(retained.getLong(0), 1);
        assertEquals(retained.getSlice(1).toStringUtf8(), "a long value that grows the buffer beyond its initial size");
    }

    @Test
    public void testUnsupportedType()
    {
        try {
            new PackedRowBuilder(ImmutableList.of(BIGINT, new ArrayType(BIGINT)));
            fail("expected exception");
        }
        catch (HashJoinException e) {
            assertEquals(e.getErrorCode(), NOT_SUPPORTED.toErrorCode());
            assertEquals(e.getMessage(), "Packed row encoding does not support type array(bigint)");
        }
    }

    @Test(expectedExceptions = IllegalStateException.class, expectedExceptionsMessageRegExp = "Expected 5 fields, but 1 were appended")
    public void testIncompleteRow()
    {
        new PackedRowBuilder(TYPES).appendLong(1).build();
    }
}
