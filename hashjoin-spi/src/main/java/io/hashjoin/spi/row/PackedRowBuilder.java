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
import io.airlift.slice.Slice;
import io.airlift.slice.Slices;
import io.hashjoin.spi.HashJoinException;
import io.hashjoin.spi.type.Type;

import java.util.List;

import static com.google.common.base.Preconditions.checkState;
import static io.hashjoin.spi.StandardErrorCode.NOT_SUPPORTED;
import static io.hashjoin.spi.row.PackedRow.calculateBitSetWidthInBytes;
import static io.hashjoin.spi.row.PackedRow.calculateFixedRegionSize;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Writes rows in the packed layout into a single reusable buffer. Every row returned by
 * {@link #build()} is the same {@link PackedRow} instance re-pointed at the buffer, so its
 * contents are only valid until the next row is written.
 */
public class PackedRowBuilder
        implements RowBuilder
{
    private static final int INITIAL_VARIABLE_REGION_SIZE = 64;

    private final List<Type> types;
    private final int bitSetWidthInBytes;
    private final int fixedRegionSize;
    private final PackedRow row;

    private Slice buffer;
    private int field;
    private int variableRegionEnd;
    private boolean dirty;

    public PackedRowBuilder(List<Type> types)
    {
        this.types = ImmutableList.copyOf(requireNonNull(types, "types is null"));
        for (Type type : this.types) {
            if (!type.isPackable()) {
                throw new HashJoinException(NOT_SUPPORTED, format("Packed row encoding does not support type %s", type));
            }
        }
        this.bitSetWidthInBytes = calculateBitSetWidthInBytes(this.types.size());
        this.fixedRegionSize = calculateFixedRegionSize(this.types.size());
        this.row = new PackedRow(this.types.size());
        this.buffer = Slices.allocate(fixedRegionSize + INITIAL_VARIABLE_REGION_SIZE);
        this.variableRegionEnd = fixedRegionSize;
    }

    public List<Type> getTypes()
    {
        return types;
    }

    @Override
    public PackedRowBuilder appendNull()
    {
        beginField();
        int wordOffset = (field >> 6) * Long.BYTES;
        buffer.setLong(wordOffset, buffer.getLong(wordOffset) | (1L << (field & 63)));
        return endField();
    }

    @Override
    public PackedRowBuilder appendBoolean(boolean value)
    {
        return appendLong(value ? 1 : 0);
    }

    @Override
    public PackedRowBuilder appendInt(int value)
    {
        return appendLong(value);
    }

    @Override
    public PackedRowBuilder appendLong(long value)
    {
        int offset = beginField();
        buffer.setLong(offset, value);
        return endField();
    }

    @Override
    public PackedRowBuilder appendDouble(double value)
    {
        // doubleToLongBits collapses all NaN values into one bit pattern
        return appendLong(Double.doubleToLongBits(value));
    }

    @Override
    public PackedRowBuilder appendSlice(Slice value)
    {
        requireNonNull(value, "value is null");
        int offset = beginField();
        int length = value.length();
        buffer = Slices.ensureSize(buffer, variableRegionEnd + length);
        buffer.setBytes(variableRegionEnd, value);
        buffer.setLong(offset, ((long) variableRegionEnd << 32) | length);
        variableRegionEnd += length;
        return endField();
    }

    @Override
    public PackedRowBuilder appendObject(Object value)
    {
        throw new UnsupportedOperationException("Packed rows cannot hold object values");
    }

    @Override
    public void reset()
    {
        buffer.clear(0, fixedRegionSize);
        field = 0;
        variableRegionEnd = fixedRegionSize;
        dirty = false;
    }

    @Override
    public PackedRow build()
    {
        checkState(field == types.size(), "Expected %s fields, but %s were appended", types.size(), field);
        row.pointTo(buffer, variableRegionEnd);
        field = 0;
        dirty = true;
        return row;
    }

    private int beginField()
    {
        if (dirty && field == 0) {
            // the previous row is still readable until the first field of this one is written
            reset();
        }
        checkState(field < types.size(), "Row already has %s fields", types.size());
        return bitSetWidthInBytes + field * Long.BYTES;
    }

    private PackedRowBuilder endField()
    {
        field++;
        return this;
    }
}
