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

import com.google.common.collect.ImmutableList;
import io.hashjoin.operator.project.ExpressionProjection;
import io.hashjoin.spi.row.Row;
import io.hashjoin.spi.type.Type;
import io.hashjoin.sql.relational.KeyExpression;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Objects.requireNonNull;

/**
 * Computes the join key of input rows. The key is a row of the extractor's encoding, so its
 * equality follows that encoding, and {@link Row#anyNull()} tells whether it can match at all.
 * <p>
 * A packed extractor writes every key into the same buffer: a key is valid until the next
 * call to {@link #extractKey} and must be copied to be kept.
 */
public final class KeyExtractor
{
    private final List<Type> keyTypes;
    private final RowEncoding encoding;
    private final ExpressionProjection projection;

    public static KeyExtractor create(List<? extends KeyExpression> keys, List<Type> inputTypes, RowEncoding encoding)
    {
        return new KeyExtractor(keys, inputTypes, encoding);
    }

    private KeyExtractor(List<? extends KeyExpression> keys, List<Type> inputTypes, RowEncoding encoding)
    {
        requireNonNull(keys, "keys is null");
        requireNonNull(inputTypes, "inputTypes is null");
        checkArgument(!keys.isEmpty(), "keys is empty");
        for (KeyExpression key : keys) {
            key.validate(inputTypes);
        }
        this.encoding = requireNonNull(encoding, "encoding is null");
        this.keyTypes = keys.stream()
                .map(KeyExpression::getType)
                .collect(toImmutableList());
        this.projection = new ExpressionProjection(ImmutableList.copyOf(keys), encoding.createRowBuilder(keyTypes));
    }

    public Row extractKey(Row row)
    {
        return projection.project(row);
    }

    public List<Type> getKeyTypes()
    {
        return keyTypes;
    }

    public RowEncoding getEncoding()
    {
        return encoding;
    }
}
