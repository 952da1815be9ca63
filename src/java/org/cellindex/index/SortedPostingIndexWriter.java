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

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.geometry.S2CellId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.cellindex.io.SortedTableWriter;
import org.cellindex.io.VIntCoding;

/**
 * Builds a sorted posting file from postings added in any order. Postings are buffered in memory until
 * {@link #finish()}, which sorts them by token then id, drops exact duplicates and writes them out: key is the
 * token, value the unsigned vint encoded object id.
 */
public class SortedPostingIndexWriter implements Closeable
{
    private static final Logger logger = LoggerFactory.getLogger(SortedPostingIndexWriter.class);

    private final Path path;
    private final SortedTableWriter writer;
    private final List<PostingEntry> postings = new ArrayList<>();
    private boolean finished;

    public SortedPostingIndexWriter(Path path) throws IOException
    {
        this(path, SortedTableWriter.DEFAULT_BLOCK_SIZE);
    }

    public SortedPostingIndexWriter(Path path, int blockSize) throws IOException
    {
        this.path = path;
        this.writer = new SortedTableWriter(path, blockSize);
    }

    public void add(String token, long id)
    {
        Preconditions.checkState(!finished, "Index %s is already finished", path);
        postings.add(new PostingEntry(token, id));
    }

    public void add(S2CellId cell, long id)
    {
        add(cell.toToken(), id);
    }

    public int buffered()
    {
        return postings.size();
    }

    /**
     * Writes the buffered postings and syncs the file.
     *
     * @return the number of postings written, duplicates excluded
     */
    public long finish() throws IOException
    {
        Preconditions.checkState(!finished, "Index %s is already finished", path);
        Collections.sort(postings);

        PostingEntry previous = null;
        byte[] previousKey = null;
        for (PostingEntry posting : postings)
        {
            if (posting.equals(previous))
                continue;

            byte[] key = previous != null && posting.token.equals(previous.token)
                         ? previousKey
                         : posting.token.getBytes(StandardCharsets.UTF_8);
            writer.append(key, VIntCoding.encodeUnsignedVInt(posting.id));
            previous = posting;
            previousKey = key;
        }

        long written = writer.finish();
        finished = true;
        if (written < postings.size())
            logger.debug("Dropped {} duplicate postings from {}", postings.size() - written, path);
        postings.clear();
        return written;
    }

    public void close() throws IOException
    {
        postings.clear();
        writer.close();
    }
}
