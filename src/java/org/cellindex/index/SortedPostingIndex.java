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
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import com.google.common.annotations.VisibleForTesting;
import org.agrona.collections.LongHashSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.cellindex.exceptions.CorruptIndexException;
import org.cellindex.io.BlockCache;
import org.cellindex.io.SortedTableReader;
import org.cellindex.io.VIntCoding;
import org.cellindex.query.QueryResult;
import org.cellindex.query.TokenRange;
import org.cellindex.utils.CloseableIterator;

/**
 * Read side of a posting file written by {@link SortedPostingIndexWriter}. Safe for use by a single thread.
 */
public class SortedPostingIndex implements Closeable
{
    private static final Logger logger = LoggerFactory.getLogger(SortedPostingIndex.class);

    private final SortedTableReader reader;

    private SortedPostingIndex(SortedTableReader reader)
    {
        this.reader = reader;
    }

    public static SortedPostingIndex open(Path path, long cacheBytes) throws IOException
    {
        SortedTableReader reader = SortedTableReader.open(path, cacheBytes);
        logger.info("Opened posting index {} with {} postings", path, reader.entryCount());
        return new SortedPostingIndex(reader);
    }

    public long size()
    {
        return reader.entryCount();
    }

    public BlockCache cache()
    {
        return reader.cache();
    }

    @VisibleForTesting
    int openCursors()
    {
        return reader.openCursors();
    }

    /**
     * Iterates the postings under the tokens in {@code [low, high]}, both inclusive, in token then id order. The
     * iterator holds a cursor on the file until it is closed. Read failures surface as
     * {@link UncheckedIOException}, damaged postings as {@link CorruptIndexException}.
     */
    public CloseableIterator<PostingEntry> readRange(String low, String high)
    {
        return new PostingIterator().seek(low, high);
    }

    /**
     * Counts the postings under any of {@code ranges}. A posting is counted once per range it falls in; ranges
     * produced for one covering never overlap.
     *
     * @param distinct whether to count distinct ids too; otherwise the result assumes every row is a distinct id
     */
    public QueryResult count(List<TokenRange> ranges, boolean distinct) throws IOException
    {
        long rows = 0;
        LongHashSet ids = distinct ? new LongHashSet() : null;
        try (PostingIterator postings = new PostingIterator())
        {
            for (TokenRange range : ranges)
            {
                postings.seek(range.low, range.high);
                while (postings.hasNext())
                {
                    long id = postings.next().id;
                    rows++;
                    if (ids != null)
                        ids.add(id);
                }
            }
        }
        catch (UncheckedIOException e)
        {
            throw e.getCause();
        }
        return ids != null ? QueryResult.of(rows, ids.size()) : QueryResult.rows(rows);
    }

    public QueryResult count(List<TokenRange> ranges) throws IOException
    {
        return count(ranges, true);
    }

    private PostingEntry decode(SortedTableReader.Entry entry)
    {
        String token = new String(entry.key, StandardCharsets.UTF_8);
        ByteBuffer value = entry.value;
        try
        {
            long id = VIntCoding.readUnsignedVInt(value);
            if (value.hasRemaining())
                throw new CorruptIndexException(String.format("%d trailing bytes after the id posted under %s",
                                                              value.remaining(), token),
                                                reader.path().toString());
            if (id < 0)
                throw new CorruptIndexException(String.format("Id %s posted under %s is out of range",
                                                              Long.toUnsignedString(id), token),
                                                reader.path().toString());
            return new PostingEntry(token, id);
        }
        catch (VIntCoding.MalformedVIntException e)
        {
            throw new CorruptIndexException(e, reader.path().toString());
        }
    }

    private static byte[] bytes(String token)
    {
        return token.getBytes(StandardCharsets.UTF_8);
    }

    public void close() throws IOException
    {
        reader.close();
    }

    /**
     * Decodes postings one entry at a time from a single cursor, which may be re-positioned between ranges.
     */
    private final class PostingIterator implements CloseableIterator<PostingEntry>
    {
        private final SortedTableReader.Cursor cursor = reader.cursor();

        PostingIterator seek(String low, String high)
        {
            cursor.seek(bytes(low), bytes(high));
            return this;
        }

        public boolean hasNext()
        {
            return cursor.hasNext();
        }

        public PostingEntry next()
        {
            return decode(cursor.next());
        }

        public void close()
        {
            cursor.close();
        }
    }
}
