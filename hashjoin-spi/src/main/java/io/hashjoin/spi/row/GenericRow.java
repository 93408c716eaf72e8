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
import org.openjdk.jol.info.ClassLayout;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkElementIndex;
import static io.airlift.slice.SizeOf.sizeOfObjectArray;

/**
 * Row holding boxed field values. Instances are immutable, so {@link #copy()} returns this row.
 */
public final class GenericRow
        implements Row
{
    private static final int INSTANCE_SIZE = ClassLayout.parseClass(GenericRow.class).instanceSize();
    // rough per-value cost of a boxed primitive
    private static final int BOXED_VALUE_SIZE = 16;

    private final Object[] values;

    public static GenericRow of(Object... values)
    {
        return new GenericRow(values.clone());
    }

    GenericRow(Object[] values)
    {
        this.values = values;
    }

    @Override
    public int getFieldCount()
    {
        return values.length;
    }

    @Override
    public boolean isNull(int field)
    {
        return value(field) == null;
    }

    @Override
    public boolean getBoolean(int field)
    {
        return (Boolean) value(field);
    }

    @Override
    public int getInt(int field)
    {
        return (Integer) value(field);
    }

    @Override
    public long getLong(int field)
    {
        return (Long) value(field);
    }

    @Override
    public double getDouble(int field)
    {
        return (Double) value(field);
    }

    @Override
    public Slice getSlice(int field)
    {
        return (Slice) value(field);
    }

    @Override
    public Object getObject(int field)
    {
        return value(field);
    }

    @Override
    public GenericRow copy()
    {
        return this;
    }

    @Override
    public long getRetainedSizeInBytes()
    {
        long size = INSTANCE_SIZE + sizeOfObjectArray(values.length);
        for (Object value : values) {
            if (value instanceof Slice) {
                size += ((Slice) value).getRetainedSize();
            }
            else if (value != null) {
                size += BOXED_VALUE_SIZE;
            }
        }
        return size;
    }

    private Object value(int field)
    {
        checkElementIndex(field, values.length, "field");
        return values[field];
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
        return Arrays.equals(values, ((GenericRow) obj).values);
    }

    @Override
    public int hashCode()
    {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString()
    {
        return Arrays.toString(values);
    }
}
