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
package io.hashjoin.sql.relational;

import com.google.common.collect.ImmutableList;
import io.hashjoin.spi.row.Row;
import io.hashjoin.spi.row.RowBuilder;
import io.hashjoin.spi.type.Type;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

public final class InputReferenceExpression
        implements KeyExpression
{
    private final int field;
    private final Type type;

    public static InputReferenceExpression field(int field, Type type)
    {
        return new InputReferenceExpression(field, type);
    }

    /**
     * Returns one reference per input field, in order.
     */
    public static List<KeyExpression> inputReferences(List<Type> types)
    {
        ImmutableList.Builder<KeyExpression> references = ImmutableList.builder();
        for (int field = 0; field < types.size(); field++) {
            references.add(new InputReferenceExpression(field, types.get(field)));
        }
        return references.build();
    }

    public InputReferenceExpression(int field, Type type)
    {
        checkArgument(field >= 0, "field is negative");
        this.field = field;
        this.type = requireNonNull(type, "type is null");
    }

    public int getField()
    {
        return field;
    }

    @Override
    public Type getType()
    {
        return type;
    }

    @Override
    public void evaluate(Row row, RowBuilder output)
    {
        type.appendTo(row, field, output);
    }

    @Override
    public void validate(List<Type> inputTypes)
    {
        checkArgument(field < inputTypes.size(), "Input field %s does not exist in %s", field, inputTypes);
        checkArgument(inputTypes.get(field).equals(type), "Input field %s is %s, not %s", field, inputTypes.get(field), type);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(field, type);
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
        InputReferenceExpression other = (InputReferenceExpression) obj;
        return this.field == other.field && Objects.equals(this.type, other.type);
    }

    @Override
    public String toString()
    {
        return "#" + field;
    }
}
