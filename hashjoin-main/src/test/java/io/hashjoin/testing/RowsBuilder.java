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
package io.hashjoin.testing;

import com.google.common.collect.ImmutableList;
import io.hashjoin.operator.RowEncoding;
import io.hashjoin.spi.row.Row;
import io.hashjoin.spi.row.RowBuilder;
import io.hashjoin.spi.type.Type;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

public class RowsBuilder
{
    public static RowsBuilder rowsBuilder(RowEncoding encoding, Type... types)
    {
        return rowsBuilder(encoding, ImmutableList.copyOf(types));
    }

    public static RowsBuilder rowsBuilder(RowEncoding encoding, List<Type> types)
    {
        return new RowsBuilder(encoding, types);
    }

    private final List<Type> types;
    private final RowBuilder rowBuilder;
    private final ImmutableList.Builder<Row> rows = ImmutableList.builder();

    private RowsBuilder(RowEncoding encoding, List<Type> types)
    {
        this.types = ImmutableList.copyOf(requireNonNull(types, "types is null"));
        this.rowBuilder = requireNonNull(encoding, "encoding is null").createRowBuilder(this.types);
    }

    public RowsBuilder row(Object... values)
    {
        checkArgument(values.length == types.size(), "Expected %s values, but got %s", types.size(), values.length);
        for (int i = 0; i < values.length; i++) {
            types.get(i).writeObject(rowBuilder, values[i]);
        }
        // packed builders reuse their buffer
        rows.add(rowBuilder.build().copy());
        return this;
    }

    public List<Type> getTypes()
    {
        return types;
    }

    public List<Row> build()
    {
        return rows.build();
    }
}
