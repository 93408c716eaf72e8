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

import io.airlift.slice.Slice;
import io.airlift.slice.Slices;
import io.airlift.slice.XxHash64;
import org.openjdk.jol.info.ClassLayout;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static java.util.Objects.requireNonNull;

/**
 * Row stored in a contiguous binary layout:
 * <pre>
 * [null bit set: one bit per field, padded to 64-bit words]
 * [fixed region: 8 bytes per field]
 * [variable region]
 * </pre>
 * Fixed-width values live in their field's slot. For variable-width values the slot holds
 * the offset of the data (upper 32 bits) and its length (lower 32 bits). Slots of null fields
 * are zero, so two rows holding equal values have identical bytes; equality and hash code are
 * computed over the bytes.
 * <p>
 * A row is a view over a slice it does not own. A builder may re-point the same row at new
 * data for every row it writes; use {@link #copy()} to keep the current values.
 */
public final class PackedRow
        implements Row
{
    private static final int INSTANCE_SIZE = ClassLayout.parseClass(PackedRow.class).instanceSize();

    private final int fieldCount;
    private final int bitSetWidthInBytes;

    private Slice slice;
    private int sizeInBytes;

    public static int calculateBitSetWidthInBytes(int fieldCount)
    {
        return ((fieldCount + 63) / 64) * Long.BYTES;
    }

    public static int calculateFixedRegionSize(int fieldCount)
    {
        return calculateBitSetWidthInBytes(fieldCount) + fieldCount * Long.BYTES;
    }

    public PackedRow(int fieldCount)
    {
        checkArgument(fieldCount >= 0, "fieldCount is negative");
        this.fieldCount = fieldCount;
        this.bitSetWidthInBytes = calculateBitSetWidthInBytes(fieldCount);
    }

    public void pointTo(Slice slice, int sizeInBytes)
    {
        requireNonNull(slice, "slice is null");
        checkArgument(sizeInBytes >= calculateFixedRegionSize(fieldCount), "sizeInBytes is smaller than the fixed region");
        checkArgument(sizeInBytes <= slice.length(), "sizeInBytes exceeds slice length");
        this.slice = slice;
        this.sizeInBytes = sizeInBytes;
    }

    public int getSizeInBytes()
    {
        return sizeInBytes;
    }

    @Override
    public int getFieldCount()
    {
        return fieldCount;
    }

    @Override
    public boolean isNull(int field)
    {
        checkElementIndex(field, fieldCount, "field");
        long word = slice.getLong((field >> 6) * Long.BYTES);
        return (word & (1L << (field & 63))) != 0;
    }

    @Override
    public boolean anyNull()
    {
        for (int offset = 0; offset < bitSetWidthInBytes; offset += Long.BYTES) {
            if (slice.getLong(offset) != 0) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean getBoolean(int field)
    {
        return getLong(field) != 0;
    }

    @Override
    public int getInt(int field)
    {
        return (int) getLong(field);
    }

    @Override
    public long getLong(int field)
    {
        return slice.getLong(getFieldOffset(field));
    }

    @Override
    public double getDouble(int field)
    {
        return Double.longBitsToDouble(getLong(field));
    }

    @Override
    public Slice getSlice(int field)
    {
        long offsetAndLength = getLong(field);
        int offset = (int) (offsetAndLength >>> 32);
        int length = (int) offsetAndLength;
        return slice.slice(offset, length);
    }

    @Override
    public Object getObject(int field)
    {
        throw new UnsupportedOperationException("Packed rows do not hold object values");
    }

    @Override
    public PackedRow copy()
    {
        PackedRow copy = new PackedRow(fieldCount);
        copy.pointTo(Slices.copyOf(slice, 0, sizeInBytes), sizeInBytes);
        return copy;
    }

    @Override
    public long getRetainedSizeInBytes()
    {
        return INSTANCE_SIZE + slice.getRetainedSize();
    }

    private int getFieldOffset(int field)
    {
        checkElementIndex(field, fieldCount, "field");
        return bitSetWidthInBytes + field * Long.BYTES;
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        PackedRow other = (PackedRow) obj;
        return fieldCount == other.fieldCount &&
                slice.equals(0, sizeInBytes, other.slice, 0, other.sizeInBytes);
    }

    @Override
    public int hashCode()
    {
        return Long.hashCode(XxHash64.hash(slice, 0, sizeInBytes));
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("fieldCount", fieldCount)
                .add("sizeInBytes", sizeInBytes)
                .toString();
    }
}
