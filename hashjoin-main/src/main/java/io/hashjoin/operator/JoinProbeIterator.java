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

import io.hashjoin.operator.project.RowProjection;
import io.hashjoin.spi.row.Row;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static java.util.Objects.requireNonNull;

/**
 * Lazily joins stream rows against a built {@link HashedRelation}. For every stream row with
 * a non-null key, one output row is produced per build row sharing that key: output follows
 * stream order, then bucket order. Stream rows without a match produce nothing.
 * <p>
 * The row returned by {@link #next()} is scratch space reused by this iterator. It is only valid
 * until the next call to {@link #hasNext()} or {@link #next()}; call {@link Row#copy()} to keep it.
 */
public class JoinProbeIterator
        implements Iterator<Row>
{
    private final Iterator<Row> streamRows;
    private final RowProjection streamProjection;
    private final HashedRelation hashedRelation;
    private final KeyExtractor streamKeyExtractor;
    private final BuildSide buildSide;
    private final RowProjection outputProjection;
    private final JoinStatisticsCounter statisticsCounter;

    private final JoinedRow joinedRow = new JoinedRow();

    private Row currentStreamRow;
    private List<Row> currentMatches;
    private int currentMatchPosition = -1;

    public JoinProbeIterator(
            Iterator<Row> streamRows,
            RowProjection streamProjection,
            HashedRelation hashedRelation,
            KeyExtractor streamKeyExtractor,
            BuildSide buildSide,
            RowProjection outputProjection,
            JoinStatisticsCounter statisticsCounter)
    {
        this.streamRows = requireNonNull(streamRows, "streamRows is null");
        this.streamProjection = requireNonNull(streamProjection, "streamProjection is null");
        this.hashedRelation = requireNonNull(hashedRelation, "hashedRelation is null");
        this.streamKeyExtractor = requireNonNull(streamKeyExtractor, "streamKeyExtractor is null");
        this.buildSide = requireNonNull(buildSide, "buildSide is null");
        this.outputProjection = requireNonNull(outputProjection, "outputProjection is null");
        this.statisticsCounter = requireNonNull(statisticsCounter, "statisticsCounter is null");
    }

    @Override
    public boolean hasNext()
    {
        return hasPendingMatch() || fetchNext();
    }

    @Override
    public Row next()
    {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }

        Row buildRow = currentMatches.get(currentMatchPosition);
        // output columns are always left then right
        if (buildSide == BuildSide.BUILD_RIGHT) {
            joinedRow.withRows(currentStreamRow, buildRow);
        }
        else {
            joinedRow.withRows(buildRow, currentStreamRow);
        }

        currentMatchPosition++;
        if (currentMatchPosition >= currentMatches.size()) {
            currentMatches = null;
            currentMatchPosition = -1;
        }
        return outputProjection.project(joinedRow);
    }

    public JoinOperatorInfo getOperatorInfo()
    {
        return statisticsCounter.get();
    }

    public HashedRelation getHashedRelation()
    {
        return hashedRelation;
    }

    private boolean hasPendingMatch()
    {
        return currentMatchPosition != -1 && currentMatchPosition < currentMatches.size();
    }

    /**
     * Advances the stream to the next row that has at least one match.
     *
     * @return false if the stream ran out of rows
     */
    private boolean fetchNext()
    {
        currentMatches = null;
        currentMatchPosition = -1;

        if (hashedRelation.isEmpty()) {
            // an inner join with an empty build side produces nothing
            return false;
        }

        while (currentMatches == null && streamRows.hasNext()) {
            currentStreamRow = streamProjection.project(streamRows.next());
            Row key = streamKeyExtractor.extractKey(currentStreamRow);
            if (key.anyNull()) {
                statisticsCounter.recordNullKeyProbe();
                continue;
            }
            List<Row> matches = hashedRelation.get(key);
            statisticsCounter.recordProbe(matches.size());
            if (!matches.isEmpty()) {
                currentMatches = matches;
            }
        }

        if (currentMatches == null) {
            currentStreamRow = null;
            return false;
        }
        currentMatchPosition = 0;
        return true;
    }
}
