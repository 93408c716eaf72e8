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

import com.google.common.collect.ImmutableMap;
import io.airlift.units.DataSize;
import org.testng.annotations.Test;

import java.util.Map;

import static io.airlift.configuration.testing.ConfigAssertions.assertFullMapping;
import static io.airlift.configuration.testing.ConfigAssertions.assertRecordedDefaults;
import static io.airlift.configuration.testing.ConfigAssertions.recordDefaults;
import static io.airlift.units.DataSize.Unit;

public class TestJoinConfig
{
    @Test
    public void testDefaults()
    {
        assertRecordedDefaults(recordDefaults(JoinConfig.class)
                .setPackedRowEncodingEnabled(true)
                .setMaxBuildMemory(new DataSize(1, Unit.GIGABYTE)));
    }

    @Test
    public void testExplicitPropertyMappings()
    {
        Map<String, String> properties = new ImmutableMap.Builder<String, String>()
                .put("join.packed-row-encoding-enabled", "false")
                .put("join.max-build-memory", "512MB")
                .build();

        JoinConfig expected = new JoinConfig()
                .setPackedRowEncodingEnabled(false)
                .setMaxBuildMemory(new DataSize(512, Unit.MEGABYTE));

        assertFullMapping(properties, expected);
    }
}
