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
package io.hashjoin.operator;

import io.hashjoin.operator.project.ExpressionProjection;
import io.hashjoin.operator.project.RowProjection;
import io.hashjoin.spi.row.GenericRow;
import io.hashjoin.spi.row.GenericRowBuilder;
import io.hashjoin.spi.row.PackedRowBuilder;
import io.hashjoin.spi.row.RowBuilder;
import io.hashjoin.spi.type.Type;
import io.hashjoin.sql.relational.KeyExpression;

import java.util.List;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static io.hashjoin.sql.relational.InputReferenceExpression.inputReferences;

/**
 * Physical representation of the rows that flow through one join operator. The encoding is
 * chosen once per operator and every build row, key and output row it creates uses it.
 */
public enum RowEncoding
{
    /**
     * Rows in a contiguous binary layout, compared and hashed by their bytes.
     */
    PACKED {
        @Override
        public boolean isSupported(List<Type> types)
        {
            return types.stream().allMatch(Type::isPackable);
        }

        @Override
        public RowBuilder createRowBuilder(List<Type> types)
        {
            return new PackedRowBuilder(types);
        }

        @Override
        public RowProjection createOutputProjection(List<Type> types)
        {
            return new ExpressionProjection(inputReferences(types), createRowBuilder(types));
        }

        @Override
        public RowProjection createInputProjection(List<Type> types)
        {
            // every joined row is re-encoded by the output projection
            return row -> row;
        }
    },
    /**
     * Rows of boxed values. Supports every type.
     */
    GENERIC {
        @Override
        public boolean isSupported(List<Type> types)
        {
            return true;
        }

        @Override
        public RowBuilder createRowBuilder(List<Type> types)
        {
            return new GenericRowBuilder(types.size());
        }

        @Override
        public RowProjection createOutputProjection(List<Type> types)
        {
            // a joined row only references its inputs, so it is returned as is
            return row -> row;
        }

        @Override
        public RowProjection createInputProjection(List<Type> types)
        {
            RowProjection projection = new ExpressionProjection(inputReferences(types), createRowBuilder(types));
            return row -> row instanceof GenericRow ? row : projection.project(row);
        }
    };

    public abstract boolean isSupported(List<Type> types);

    /**
     * @throws io.hashjoin.spi.HashJoinException with {@code NOT_SUPPORTED} if a type cannot be encoded
     */
    public abstract RowBuilder createRowBuilder(List<Type> types);

    /**
     * Creates the projection applied to every joined row before it is returned. The
     * projection may return the same scratch row for every call.
     */
    public abstract RowProjection createOutputProjection(List<Type> types);

    /**
     * Creates the projection applied to every stream row before it is joined, so that rows
     * a child produced in another encoding are represented in this one.
     */
    public abstract RowProjection createInputProjection(List<Type> types);

    /**
     * Creates a projection that returns an independent copy of a row in this encoding.
     * Build rows go through it before they are stored.
     */
    public RowProjection createMaterializer(List<Type> types)
    {
        RowProjection projection = new ExpressionProjection(inputReferences(types), createRowBuilder(types));
        return row -> projection.project(row).copy();
    }

    public static RowEncoding selectEncoding(List<? extends KeyExpression> keys, List<Type> outputTypes, boolean packedEncodingEnabled)
    {
        List<Type> keyTypes = keys.stream()
                .map(KeyExpression::getType)
                .collect(toImmutableList());
        if (packedEncodingEnabled && PACKED.isSupported(keyTypes) && PACKED.isSupported(outputTypes)) {
            return PACKED;
        }
        return GENERIC;
    }
}
