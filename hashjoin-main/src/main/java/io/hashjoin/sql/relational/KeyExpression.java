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

import io.hashjoin.spi.row.Row;
import io.hashjoin.spi.row.RowBuilder;
import io.hashjoin.spi.type.Type;

import java.util.List;

/**
 * An evaluator that computes one join key field from an input row.
 */
public interface KeyExpression
{
    Type getType();

    /**
     * Appends the value of this expression for {@code row} as the next field of {@code output}.
     * The input row is not modified.
     */
    void evaluate(Row row, RowBuilder output);

    /**
     * Checks that this expression can be evaluated against rows of the given types.
     *
     * @throws IllegalArgumentException if it cannot
     */
    default void validate(List<Type> inputTypes) {}
}
