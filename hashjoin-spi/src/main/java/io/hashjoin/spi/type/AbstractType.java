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

import javax.annotation.Nullable;

import static java.util.Objects.requireNonNull;

public abstract class AbstractType
        implements Type
{
    private final String displayName;
    private final Class<?> javaType;

    protected AbstractType(String displayName, Class<?> javaType)
    {
        this.displayName = requireNonNull(displayName, "displayName is null");
        this.javaType = requireNonNull(javaType, "javaType is null");
    }

    @Override
    public String getDisplayName()
    {
        return displayName;
    }

    @Override
    public final Class<?> getJavaType()
    {
        return javaType;
    }

    @Override
    public boolean isPackable()
    {
        return true;
    }

    @Override
    public final Object getObjectValue(Row row, int field)
    {
        if (row.isNull(field)) {
            return null;
        }
        return getNonNullObjectValue(row, field);
    }

    @Override
    public final void appendTo(Row row, int field, RowBuilder rowBuilder)
    {
        if (row.isNull(field)) {
            rowBuilder.appendNull();
        }
        else {
            appendNonNullTo(row, field, rowBuilder);
        }
    }

    @Override
    public final void writeObject(RowBuilder rowBuilder, @Nullable Object value)
    {
        if (value == null) {
            rowBuilder.appendNull();
        }
        else {
            writeNonNullObject(rowBuilder, value);
        }
    }

    protected abstract Object getNonNullObjectValue(Row row, int field);

    protected abstract void appendNonNullTo(Row row, int field, RowBuilder rowBuilder);

    protected abstract void writeNonNullObject(RowBuilder rowBuilder, Object value);

    @Override
    public String toString()
    {
        return getDisplayName();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        return this.getDisplayName().equals(((Type) o).getDisplayName());
    }

    @Override
    public int hashCode()
    {
        return getDisplayName().hashCode();
    }
}
