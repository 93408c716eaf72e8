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
package io.hashjoin.spi.type;

import io.airlift.slice.Slice;
import io.hashjoin.spi.row.Row;
import io.hashjoin.spi.row.RowBuilder;

import static io.airlift.slice.Slices.utf8Slice;

public final class VarcharType
        extends AbstractType
{
    public static final VarcharType VARCHAR = new VarcharType();

    private VarcharType()
    {
        super("varchar", Slice.class);
    }

    @Override
    protected Object getNonNullObjectValue(Row row, int field)
    {
        return row.getSlice(field).toStringUtf8();
    }

    @Override
    protected void appendNonNullTo(Row row, int field, RowBuilder rowBuilder)
    {
        rowBuilder.appendSlice(row.getSlice(field));
    }

    @Override
    protected void writeNonNullObject(RowBuilder rowBuilder, Object value)
    {
        if (value instanceof Slice) {
            rowBuilder.appendSlice((Slice) value);
        }
        else if (value instanceof String) {
            rowBuilder.appendSlice(utf8Slice((String) value));
        }
        else {
            throw new IllegalArgumentException("Expected String or Slice for varchar, but got " + value.getClass().getName());
        }
    }
}
