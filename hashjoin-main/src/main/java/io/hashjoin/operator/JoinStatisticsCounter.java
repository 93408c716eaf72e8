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

import java.util.function.Supplier;

import static io.hashjoin.operator.JoinOperatorInfo.createJoinOperatorInfo;
import static java.util.Objects.requireNonNull;

public class JoinStatisticsCounter
        implements Supplier<JoinOperatorInfo>
{
    public static final int HISTOGRAM_BUCKETS = 8;

    private static final int INDIVIDUAL_BUCKETS = 4;

    private final BuildSide buildSide;
    private final RowEncoding rowEncoding;
    private final long buildRowCount;

    // Logarithmic histogram of matches per probed stream row, packed in one array:
    //      [2*bucket]      count of stream rows that matched "bucket" build rows,
    //      [2*bucket + 1]  total count of rows produced by stream rows in this bucket.
    private final long[] logHistogramCounters = new long[HISTOGRAM_BUCKETS * 2];
    private long nullKeyProbes;

    public JoinStatisticsCounter(BuildSide buildSide, RowEncoding rowEncoding, long buildRowCount)
    {
        this.buildSide = requireNonNull(buildSide, "buildSide is null");
        this.rowEncoding = requireNonNull(rowEncoding, "rowEncoding is null");
        this.buildRowCount = buildRowCount;
    }

    public void recordProbe(int matchCount)
    {
        int bucket;
        if (matchCount <= INDIVIDUAL_BUCKETS) {
            bucket = matchCount;
        }
        else if (matchCount <= 10) {
            bucket = INDIVIDUAL_BUCKETS + 1;
        }
        else if (matchCount <= 100) {
            bucket = INDIVIDUAL_BUCKETS + 2;
        }
        else {
            bucket = INDIVIDUAL_BUCKETS + 3;
        }
        logHistogramCounters[2 * bucket]++;
        logHistogramCounters[2 * bucket + 1] += matchCount;
    }

    /**
     * Records a stream row that was skipped because its key has a null field.
     */
    public void recordNullKeyProbe()
    {
        nullKeyProbes++;
    }

    @Override
    public JoinOperatorInfo get()
    {
        return createJoinOperatorInfo(buildSide, rowEncoding, logHistogramCounters, nullKeyProbes, buildRowCount);
    }
}
