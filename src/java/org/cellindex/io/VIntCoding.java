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

import java.io.DataOutput;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Variable length encoding of unsigned longs, seven bits per byte, least significant group first. The high bit of
 * each byte is set when more bytes follow. A 64 bit value takes between 1 and 10 bytes.
 */
public final class VIntCoding
{
    public static final int MAX_SIZE = 10;

    private VIntCoding()
    {
    }

    public static int computeUnsignedVIntSize(long value)
    {
        int magnitude = 64 - Long.numberOfLeadingZeros(value | 1);
        return (magnitude + 6) / 7;
    }

    public static void writeUnsignedVInt(long value, DataOutput output) throws IOException
    {
        while ((value & ~0x7FL) != 0)
        {
            output.writeByte((int) ((value & 0x7F) | 0x80));
            value >>>= 7;
        }
        output.writeByte((int) value);
    }

    public static void writeUnsignedVInt(long value, ByteBuffer output)
    {
        while ((value & ~0x7FL) != 0)
        {
            output.put((byte) ((value & 0x7F) | 0x80));
            value >>>= 7;
        }
        output.put((byte) value);
    }

    public static byte[] encodeUnsignedVInt(long value)
    {
        ByteBuffer buffer = ByteBuffer.allocate(computeUnsignedVIntSize(value));
        writeUnsignedVInt(value, buffer);
        return buffer.array();
    }

    /**
     * Reads an unsigned vint from the buffer's position, advancing it past the encoded bytes.
     *
     * @throws MalformedVIntException if the buffer ends before the last byte, or the encoding overflows 64 bits
     */
    public static long readUnsignedVInt(ByteBuffer input)
    {
        long result = 0;
        int shift = 0;
        for (int i = 0; i < MAX_SIZE; i++)
        {
            if (!input.hasRemaining())
                throw new MalformedVIntException("Truncated vint after " + i + " bytes");

            int b = input.get() & 0xFF;
            if (b < 0x80)
            {
                if (i == MAX_SIZE - 1 && b > 1)
                    throw new MalformedVIntException("Vint overflows 64 bits");
                return result | ((long) b << shift);
            }
            result |= (long) (b & 0x7F) << shift;
            shift += 7;
        }
        throw new MalformedVIntException("Vint longer than " + MAX_SIZE + " bytes");
    }

    public static class MalformedVIntException extends RuntimeException
    {
        MalformedVIntException(String message)
        {
            super(message);
        }
    }
}
