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

import io.hashjoin.spi.row.Row;
import io.hashjoin.spi.row.RowBuilder;

public final class DoubleType
        extends AbstractType
{
    public static final DoubleType DOUBLE = new DoubleType();

    private DoubleType()
    {
        super("double", double.class);
    }

    @Override
    protected Object getNonNullObjectValue(Row row, int field)
    {
        return row.getDouble(field);
    }

    @Override
    protected void appendNonNullTo(Row row, int field, RowBuilder rowBuilder)
    {
        rowBuilder.appendDouble(row.getDouble(field));
    }

    @Override
    protected void writeNonNullObject(RowBuilder rowBuilder, Object value)
    {
        rowBuilder.appendDouble(((Number) value).doubleValue());
    }
}
