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

import io.airlift.slice.Slice;
import io.hashjoin.spi.row.Row;
import org.openjdk.jol.info.ClassLayout;

import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * Presents two rows as one: the fields of {@code left} followed by the fields of
 * {@code right}. A probe iterator owns a single instance and re-points it for every output row.
 */
public final class JoinedRow
        implements Row
{
    private static final int INSTANCE_SIZE = ClassLayout.parseClass(JoinedRow.class).instanceSize();

    private Row left;
    private Row right;
    private int leftFieldCount;

    public JoinedRow withRows(Row left, Row right)
    {
        this.left = requireNonNull(left, "left is null");
        this.right = requireNonNull(right, "right is null");
        this.leftFieldCount = left.getFieldCount();
        return this;
    }

    public Row getLeft()
    {
        return left;
    }

    public Row getRight()
    {
        return right;
    }

    @Override
    public int getFieldCount()
    {
        return leftFieldCount + right.getFieldCount();
    }

    @Override
    public boolean isNull(int field)
    {
        if (field < leftFieldCount) {
            return left.isNull(field);
        }
        return right.isNull(field - leftFieldCount);
    }

    @Override
    public boolean anyNull()
    {
        return left.anyNull() || right.anyNull();
    }

    @Override
    public boolean getBoolean(int field)
    {
        if (field < leftFieldCount) {
            return left.getBoolean(field);
        }
        return right.getBoolean(field - leftFieldCount);
    }

    @Override
    public int getInt(int field)
    {
        if (field < leftFieldCount) {
            return left.getInt(field);
        }
        return right.getInt(field - leftFieldCount);
    }

    @Override
    public long getLong(int field)
    {
        if (field < leftFieldCount) {
            return left.getLong(field);
        }
        return right.getLong(field - leftFieldCount);
    }

    @Override
    public double getDouble(int field)
    {
        if (field < leftFieldCount) {
            return left.getDouble(field);
        }
        return right.getDouble(field - leftFieldCount);
    }

    @Override
    public Slice getSlice(int field)
    {
        if (field < leftFieldCount) {
            return left.getSlice(field);
        }
        return right.getSlice(field - leftFieldCount);
    }

    @Override
    public Object getObject(int field)
    {
        if (field < leftFieldCount) {
            return left.getObject(field);
        }
        return right.getObject(field - leftFieldCount);
    }

    @Override
    public JoinedRow copy()
    {
        return new JoinedRow().withRows(left.copy(), right.copy());
    }

    @Override
    public long getRetainedSizeInBytes()
    {
        return INSTANCE_SIZE + left.getRetainedSizeInBytes() + right.getRetainedSizeInBytes();
    }

    /**
     * Joined rows are equal when both halves are equal and split at the same field.
     */
    @Override
    public boolean equals(Object obj)
    {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        JoinedRow other = (JoinedRow) obj;
        return leftFieldCount == other.leftFieldCount &&
                Objects.equals(left, other.left) &&
                Objects.equals(right, other.right);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(left, right);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("left", left)
                .add("right", right)
                .toString();
    }
}
