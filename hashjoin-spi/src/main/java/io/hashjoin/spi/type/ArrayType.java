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

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

/**
 * Arrays are kept as boxed lists and have no packed representation.
 */
public final class ArrayType
        extends AbstractType
{
    private final Type elementType;

    public ArrayType(Type elementType)
    {
        super("array(" + requireNonNull(elementType, "elementType is null").getDisplayName() + ")", List.class);
        this.elementType = elementType;
    }

    public Type getElementType()
    {
        return elementType;
    }

    @Override
    public boolean isPackable()
    {
        return false;
    }

    @Override
    protected Object getNonNullObjectValue(Row row, int field)
    {
        return row.getObject(field);
    }

    @Override
    protected void appendNonNullTo(Row row, int field, RowBuilder rowBuilder)
    {
        rowBuilder.appendObject(row.getObject(field));
    }

    @Override
    protected void writeNonNullObject(RowBuilder rowBuilder, Object value)
    {
        checkArgument(value instanceof List, "Expected List for %s, but got %s", this, value.getClass().getName());
        // elements may be null, so no ImmutableList here
        rowBuilder.appendObject(unmodifiableList(new ArrayList<>((List<?>) value)));
    }
}
