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
package org.cellindex.io;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.cellindex.exceptions.CorruptIndexException;
import org.cellindex.utils.CloseableIterator;

/**
 * Read side of {@link SortedTableWriter}. The block index is held in memory, data blocks are read on demand through
 * a {@link BlockCache} owned by the reader.
 */
public class SortedTableReader implements Closeable
{
    private static final Logger logger = LoggerFactory.getLogger(SortedTableReader.class);

    private final Path path;
    private final FileChannel channel;
    private final long entryCount;
    private final byte[][] firstKeys;
    private final long[] offsets;
    private final int[] lengths;
    private final BlockCache cache;
    private final AtomicInteger openCursors = new AtomicInteger();

    private SortedTableReader(Path path, FileChannel channel, long entryCount, byte[][] firstKeys, long[] offsets, int[] lengths, long cacheBytes)
    {
        this.path = path;
        this.channel = channel;
        this.entryCount = entryCount;
        this.firstKeys = firstKeys;
        this.offsets = offsets;
        this.lengths = lengths;
        this.cache = new BlockCache(cacheBytes, this::readBlock);
    }

    public static SortedTableReader open(Path path, long cacheBytes) throws IOException
    {
        Preconditions.checkArgument(cacheBytes >= 0, "Negative cache size %s", cacheBytes);
        FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
        try
        {
            return load(path, channel, cacheBytes);
        }
        catch (IOException | RuntimeException e)
        {
            channel.close();
            throw e;
        }
    }

    private static SortedTableReader load(Path path, FileChannel channel, long cacheBytes) throws IOException
    {
        long size = channel.size();
        if (size < SortedTableWriter.FOOTER_SIZE)
            throw new CorruptIndexException(String.format("File too short for a footer: %d bytes", size), path.toString());

        ByteBuffer footer = readFully(channel, size - SortedTableWriter.FOOTER_SIZE, SortedTableWriter.FOOTER_SIZE);
        long indexOffset = footer.getLong();
        long entryCount = footer.getLong();
        int magic = footer.getInt();
        if (magic != SortedTableWriter.MAGIC)
            throw new CorruptIndexException(String.format("Bad magic 0x%08X", magic), path.toString());
        long indexLength = size - SortedTableWriter.FOOTER_SIZE - indexOffset;
        if (indexOffset < 0 || indexLength <= 0 || indexLength > Integer.MAX_VALUE || entryCount < 0)
            throw new CorruptIndexException(String.format("Invalid footer: index offset %d, %d entries", indexOffset, entryCount), path.toString());

        ByteBuffer index = readFully(channel, indexOffset, (int) indexLength);
        try
        {
            long blockCount = VIntCoding.readUnsignedVInt(index);
            if (blockCount > index.remaining())
                throw new CorruptIndexException("Block count " + blockCount + " exceeds index size", path.toString());

            int blocks = (int) blockCount;
            byte[][] firstKeys = new byte[blocks][];
            long[] offsets = new long[blocks];
            int[] lengths = new int[blocks];
            long expectedOffset = 0;
            for (int i = 0; i < blocks; i++)
            {
                firstKeys[i] = readBytes(index, path);
                offsets[i] = VIntCoding.readUnsignedVInt(index);
                long length = VIntCoding.readUnsignedVInt(index);
                if (offsets[i] != expectedOffset || length <= 0 || length > Integer.MAX_VALUE || offsets[i] + length > indexOffset)
                    throw new CorruptIndexException(String.format("Block %d has invalid bounds: offset %d, length %d", i, offsets[i], length), path.toString());
                lengths[i] = (int) length;
                expectedOffset += length;
            }
            if (expectedOffset != indexOffset)
                throw new CorruptIndexException(String.format("Blocks end at %d but the index starts at %d", expectedOffset, indexOffset), path.toString());

            logger.debug("Opened {}: {} entries in {} blocks", path, entryCount, blocks);
            return new SortedTableReader(path, channel, entryCount, firstKeys, offsets, lengths, cacheBytes);
        }
        catch (VIntCoding.MalformedVIntException e)
        {
            throw new CorruptIndexException(e, path.toString());
        }
    }

    private static ByteBuffer readFully(FileChannel channel, long position, int length) throws IOException
    {
        ByteBuffer buffer = ByteBuffer.allocate(length);
        while (buffer.hasRemaining())
        {
            int read = channel.read(buffer, position + buffer.position());
            if (read < 0)
                throw new IOException(String.format("Unexpected end of file reading %d bytes at %d", length, position));
        }
        buffer.flip();
        return buffer;
    }

    private static byte[] readBytes(ByteBuffer buffer, Path path)
    {
        long length = VIntCoding.readUnsignedVInt(buffer);
        if (length > buffer.remaining())
            throw new CorruptIndexException(String.format("Length %d overruns the %d remaining bytes", length, buffer.remaining()), path.toString());
        byte[] bytes = new byte[(int) length];
        buffer.get(bytes);
        return bytes;
    }

    private ByteBuffer readBlock(int block) throws IOException
    {
        return readFully(channel, offsets[block], lengths[block]);
    }

    public Path path()
    {
        return path;
    }

    public long entryCount()
    {
        return entryCount;
    }

    public int blockCount()
    {
        return firstKeys.length;
    }

    public BlockCache cache()
    {
        return cache;
    }

    @VisibleForTesting
    public int openCursors()
    {
        return openCursors.get();
    }

    public Cursor cursor()
    {
        return new Cursor();
    }

    /**
     * The block to start a scan for {@code low} from: the last block whose first key is strictly less than
     * {@code low}, so that equal keys spilling over from the previous block are not missed.
     */
    private int startBlock(byte[] low)
    {
        int lo = 0, hi = firstKeys.length - 1, found = 0;
        while (lo <= hi)
        {
            int mid = (lo + hi) >>> 1;
            if (SortedTableWriter.KEY_ORDER.compare(firstKeys[mid], low) < 0)
            {
                found = mid;
                lo = mid + 1;
            }
            else
            {
                hi = mid - 1;
            }
        }
        return found;
    }

    @Override
    public void close() throws IOException
    {
        if (openCursors.get() > 0)
            logger.warn("Closing {} with {} open cursors", path, openCursors.get());
        cache.invalidateAll();
        channel.close();
    }

    public static final class Entry
    {
        public final byte[] key;
        public final ByteBuffer value;

        Entry(byte[] key, ByteBuffer value)
        {
            this.key = key;
            this.value = value;
        }
    }

    /**
     * Scans entries in key order over inclusive key ranges. Read failures surface as {@link UncheckedIOException},
     * damaged blocks as {@link CorruptIndexException}. One cursor may be re-positioned with
     * {@link #seek(byte[], byte[])} any number of times.
     */
    public final class Cursor implements CloseableIterator<Entry>
    {
        private int block = -1;
        private ByteBuffer current;
        private byte[] low;
        private byte[] high;
        private Entry next;
        private boolean closed;

        private Cursor()
        {
            openCursors.incrementAndGet();
        }

        public Cursor seek(byte[] low, byte[] high)
        {
            Preconditions.checkState(!closed, "Cursor is closed");
            this.low = low;
            this.high = high;
            this.next = null;
            this.current = null;
            this.block = SortedTableWriter.KEY_ORDER.compare(low, high) > 0 || firstKeys.length == 0
                         ? firstKeys.length
                         : startBlock(low) - 1;
            return this;
        }

        public boolean hasNext()
        {
            Preconditions.checkState(!closed, "Cursor is closed");
            if (next != null)
                return true;
            if (low == null)
                return false;

            while (true)
            {
                if (current == null || !current.hasRemaining())
                {
                    if (++block >= firstKeys.length)
                    {
                        low = null;
                        return false;
                    }
                    current = load(block);
                }

                Entry entry = readEntry(current);
                if (SortedTableWriter.KEY_ORDER.compare(entry.key, high) > 0)
                {
                    low = null;
                    return false;
                }
                if (SortedTableWriter.KEY_ORDER.compare(entry.key, low) >= 0)
                {
                    next = entry;
                    return true;
                }
            }
        }

        public Entry next()
        {
            if (!hasNext())
                throw new NoSuchElementException();
            Entry entry = next;
            next = null;
            return entry;
        }

        private ByteBuffer load(int block)
        {
            try
            {
                return cache.get(block);
            }
            catch (IOException e)
            {
                throw new UncheckedIOException(e);
            }
        }

        private Entry readEntry(ByteBuffer buffer)
        {
            try
            {
                byte[] key = readBytes(buffer, path);
                long length = VIntCoding.readUnsignedVInt(buffer);
                if (length > buffer.remaining())
                    throw new CorruptIndexException(String.format("Value of %d bytes overruns block %d", length, block), path.toString());
                ByteBuffer value = buffer.slice();
                value.limit((int) length);
                buffer.position(buffer.position() + (int) length);
                return new Entry(key, value);
            }
            catch (VIntCoding.MalformedVIntException e)
            {
                throw new CorruptIndexException(e, path.toString());
            }
        }

        public void close()
        {
            if (closed)
                return;
            closed = true;
            openCursors.decrementAndGet();
        }
    }
}
