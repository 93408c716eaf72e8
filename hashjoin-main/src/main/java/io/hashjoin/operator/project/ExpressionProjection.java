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
package io.hashjoin.operator.project;

import com.google.common.collect.ImmutableList;
import io.hashjoin.spi.row.Row;
import io.hashjoin.spi.row.RowBuilder;
import io.hashjoin.sql.relational.KeyExpression;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Evaluates a list of expressions into a row of whatever encoding the builder writes.
 * Not thread safe: the builder is reused for every projected row.
 */
public class ExpressionProjection
        implements RowProjection
{
    private final List<KeyExpression> expressions;
    private final RowBuilder rowBuilder;

    public ExpressionProjection(List<? extends KeyExpression> expressions, RowBuilder rowBuilder)
    {
        this.expressions = ImmutableList.copyOf(requireNonNull(expressions, "expressions is null"));
        this.rowBuilder = requireNonNull(rowBuilder, "rowBuilder is null");
    }

    @Override
    public Row project(Row row)
    {
        rowBuilder.reset();
        for (KeyExpression expression : expressions) {
            expression.evaluate(row, rowBuilder);
        }
        return rowBuilder.build();
    }
}
