/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.cellindex.index;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Stopwatch;
import com.google.common.geometry.S2CellId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.cellindex.geo.CoveringPolicy;
import org.cellindex.source.SpatialObject;
import org.cellindex.source.SpatialObjectSource;

/**
 * Covers every object of a source with the index covering policy and posts the object under each covering cell.
 * Objects the policy cannot cover within its budget are skipped. Postings can also be written as {@code id,cellToken}
 * lines, for loading into a relational posting table.
 */
public class PostingIndexBuilder
{
    private static final Logger logger = LoggerFactory.getLogger(PostingIndexBuilder.class);

    private final CoveringPolicy policy;
    private final long maxObjects;

    public PostingIndexBuilder(CoveringPolicy policy)
    {
        this(policy, Long.MAX_VALUE);
    }

    public PostingIndexBuilder(CoveringPolicy policy, long maxObjects)
    {
        this.policy = policy;
        this.maxObjects = maxObjects;
    }

    public Summary build(SpatialObjectSource source, SortedPostingIndexWriter index, @Nullable Writer csv) throws IOException
    {
        Stopwatch stopwatch = Stopwatch.createStarted();
        long indexed = 0, uncovered = 0;
        while (indexed < maxObjects && source.hasNext())
        {
            SpatialObject object = source.next();
            List<S2CellId> covering = policy.covering(object.region());
            if (covering == null)
            {
                uncovered++;
                continue;
            }

            for (S2CellId cell : covering)
            {
                index.add(cell, object.id);
                if (csv != null)
                    csv.write(object.id + "," + cell.toToken() + '\n');
            }
            indexed++;
        }

        long postings = index.finish();
        if (csv != null)
            csv.flush();

        Summary summary = new Summary(indexed, uncovered, source.skipped(), postings);
        logger.info("Indexed {} in {}", summary, stopwatch);
        return summary;
    }

    public static final class Summary
    {
        public final long objects;
        public final long uncovered;
        public final long skippedRecords;
        public final long postings;

        Summary(long objects, long uncovered, long skippedRecords, long postings)
        {
            this.objects = objects;
            this.uncovered = uncovered;
            this.skippedRecords = skippedRecords;
            this.postings = postings;
        }

        @Override
        public String toString()
        {
            return MoreObjects.toStringHelper(this)
                              .add("objects", objects)
                              .add("uncovered", uncovered)
                              .add("skippedRecords", skippedRecords)
                              .add("postings", postings)
                              .toString();
        }
    }
}
