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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

public class GenericRowBuilder
        implements RowBuilder
{
    private final int fieldCount;
    private Object[] values;
    private int field;

    public GenericRowBuilder(int fieldCount)
    {
        checkArgument(fieldCount >= 0, "fieldCount is negative");
        this.fieldCount = fieldCount;
        this.values = new Object[fieldCount];
    }

    @Override
    public GenericRowBuilder appendNull()
    {
        return append(null);
    }

    @Override
    public GenericRowBuilder appendBoolean(boolean value)
    {
        return append(value);
    }

    @Override
    public GenericRowBuilder appendInt(int value)
    {
        return append(value);
    }

    @Override
    public GenericRowBuilder appendLong(long value)
    {
        return append(value);
    }

    @Override
    public GenericRowBuilder appendDouble(double value)
    {
        return append(value);
    }

    @Override
    public GenericRowBuilder appendSlice(Slice value)
    {
        // the slice may be a view of a reused packed row buffer
        return append(Slices.copyOf(value));
    }

    @Override
    public GenericRowBuilder appendObject(Object value)
    {
        return append(value);
    }

    @Override
    public void reset()
    {
        field = 0;
    }

    @Override
    public GenericRow build()
    {
        checkState(field == fieldCount, "Expected %s fields, but %s were appended", fieldCount, field);
        // the built row owns the array
        GenericRow row = new GenericRow(values);
        values = new Object[fieldCount];
        field = 0;
        return row;
    }

    private GenericRowBuilder append(Object value)
    {
        checkState(field < fieldCount, "Row already has %s fields", fieldCount);
        values[field] = value;
        field++;
        return this;
    }
}
