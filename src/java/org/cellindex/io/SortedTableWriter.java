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

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.DataOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.primitives.UnsignedBytes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes an immutable table of byte[] keys to byte[] values, appended in non-decreasing unsigned key order.
 *
 * Layout:
 * <pre>
 *   data blocks   entries of [vint keyLength][key][vint valueLength][value]
 *   block index   [vint blockCount] then per block [vint firstKeyLength][firstKey][vint offset][vint length]
 *   footer        [long indexOffset][long entryCount][int magic]
 * </pre>
 * A block is closed once it reaches the configured block size, so blocks hold at least one entry and may exceed the
 * block size by at most one entry. Equal keys may span blocks.
 */
public class SortedTableWriter implements Closeable
{
    private static final Logger logger = LoggerFactory.getLogger(SortedTableWriter.class);

    public static final int MAGIC = 0x43454C4C;
    public static final int FOOTER_SIZE = 8 + 8 + 4;
    public static final int DEFAULT_BLOCK_SIZE = 16 * 1024;

    static final Comparator<byte[]> KEY_ORDER = UnsignedBytes.lexicographicalComparator();

    private final Path path;
    private final int blockSize;
    private final FileOutputStream fileOut;
    private final DataOutputStream out;

    private final ByteArrayOutputStream blockBuffer = new ByteArrayOutputStream();
    private final DataOutputStream block = new DataOutputStream(blockBuffer);
    private final List<byte[]> firstKeys = new ArrayList<>();
    private final List<long[]> blockPositions = new ArrayList<>();

    private byte[] blockFirstKey;
    private byte[] lastKey;
    private long position;
    private long entryCount;
    private boolean finished;
    private boolean closed;

    public SortedTableWriter(Path path, int blockSize) throws IOException
    {
        Preconditions.checkArgument(blockSize > 0, "Block size must be positive, got %s", blockSize);
        this.path = path;
        this.blockSize = blockSize;
        this.fileOut = new FileOutputStream(path.toFile());
        this.out = new DataOutputStream(new BufferedOutputStream(fileOut, Math.max(blockSize, 8192)));
    }

    public void append(byte[] key, byte[] value) throws IOException
    {
        Preconditions.checkState(!finished, "Table %s is already finished", path);
        if (lastKey != null && KEY_ORDER.compare(lastKey, key) > 0)
            throw new IllegalArgumentException(String.format("Keys must be appended in order in %s: %s after %s",
                                                             path, new String(key, StandardCharsets.UTF_8),
                                                             new String(lastKey, StandardCharsets.UTF_8)));

        if (blockFirstKey == null)
            blockFirstKey = key;

        VIntCoding.writeUnsignedVInt(key.length, block);
        block.write(key);
        VIntCoding.writeUnsignedVInt(value.length, block);
        block.write(value);

        lastKey = key;
        entryCount++;

        if (blockBuffer.size() >= blockSize)
            flushBlock();
    }

    private void flushBlock() throws IOException
    {
        if (blockFirstKey == null)
            return;

        int length = blockBuffer.size();
        blockBuffer.writeTo(out);
        firstKeys.add(blockFirstKey);
        blockPositions.add(new long[]{ position, length });
        position += length;

        blockBuffer.reset();
        blockFirstKey = null;
    }

    public long entryCount()
    {
        return entryCount;
    }

    /**
     * Writes the last block, the block index and the footer, then syncs the file to disk.
     *
     * @return the number of entries written
     */
    public long finish() throws IOException
    {
        Preconditions.checkState(!finished, "Table %s is already finished", path);
        flushBlock();

        long indexOffset = position;
        VIntCoding.writeUnsignedVInt(firstKeys.size(), out);
        for (int i = 0; i < firstKeys.size(); i++)
        {
            byte[] firstKey = firstKeys.get(i);
            long[] blockPosition = blockPositions.get(i);
            VIntCoding.writeUnsignedVInt(firstKey.length, out);
            out.write(firstKey);
            VIntCoding.writeUnsignedVInt(blockPosition[0], out);
            VIntCoding.writeUnsignedVInt(blockPosition[1], out);
        }

        out.writeLong(indexOffset);
        out.writeLong(entryCount);
        out.writeInt(MAGIC);
        out.flush();
        fileOut.getChannel().force(true);
        finished = true;

        logger.debug("Finished {}: {} entries in {} blocks", path, entryCount, firstKeys.size());
        return entryCount;
    }

    /**
     * Releases the file. A table closed before {@link #finish()} is incomplete and is deleted.
     */
    @Override
    public void close() throws IOException
    {
        if (closed)
            return;
        closed = true;

        out.close();
        if (!finished)
        {
            logger.warn("Deleting unfinished table {}", path);
            Files.deleteIfExists(path);
        }
    }
}
