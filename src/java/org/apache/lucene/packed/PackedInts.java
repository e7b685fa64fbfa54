package org.apache.lucene.packed;

/**
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import java.io.IOException;
import java.util.Arrays;

import org.apache.lucene.packed.store.CorruptDataException;
import org.apache.lucene.packed.store.DataInput;
import org.apache.lucene.packed.store.DataOutput;
import org.apache.lucene.packed.util.Accountable;
import org.apache.lucene.packed.util.CodecUtil;
import org.apache.lucene.packed.util.InfoStream;

/**
 * Simplistic compression for array of unsigned long values.
 * Each value is {@code >= 0} and {@code <=} a specified maximum value.  The
 * values are stored as packed ints, with each value
 * consuming a fixed number of bits.
 *
 * @lucene.internal
 */
public class PackedInts {

  public final static String CODEC_NAME = "PackedInts";
  public final static int VERSION_START = 0;
  public final static int VERSION_CURRENT = VERSION_START;

  /**
   * Default amount of memory to use for bulk operations.
   */
  public static final int DEFAULT_BUFFER_SIZE = 1024; // 1K

  /** Component name used for {@link InfoStream} messages. */
  public static final String INFO_STREAM_COMPONENT = "PI";

  /**
   * Check the validity of a version number.
   */
  public static void checkVersion(int version) {
    if (version < VERSION_START) {
      throw new IllegalArgumentException("Version is too old, should be at least " + VERSION_START + " (got " + version + ")");
    } else if (version > VERSION_CURRENT) {
      throw new IllegalArgumentException("Version is too new, should be at most " + VERSION_CURRENT + " (got " + version + ")");
    }
  }

  /**
   * A format to write packed ints.
   *
   * @lucene.internal
   */
  public enum Format {
    /**
     * A format that potentially wastes space in order to make sure that all
     * values of a block are stored in a single long, so that reading or
     * writing a value never needs to touch two longs.
     */
    PACKED_SINGLE_BLOCK(1);

    /**
     * Get a format according to its ID.
     */
    public static Format byId(int id) {
      for (Format format : Format.values()) {
        if (format.getId() == id) {
          return format;
        }
      }
      throw new IllegalArgumentException("Unknown format id: " + id);
    }

    private Format(int id) {
      this.id = id;
    }

    public final int id;

    /**
     * Returns the ID of the format.
     */
    public int getId() {
      return id;
    }

    /**
     * Computes how many byte blocks are needed to store <code>values</code>
     * values.
     */
    public long byteCount(int packedIntsVersion, int valueCount, int bitsPerValue) {
      return 8L * longCount(packedIntsVersion, valueCount, bitsPerValue);
    }

    /**
     * Computes how many long blocks are needed to store <code>values</code>
     * values.
     */
    public int longCount(int packedIntsVersion, int valueCount, int bitsPerValue) {
      assert bitsPerValue >= 0 && bitsPerValue <= 64 : bitsPerValue;
      checkVersion(packedIntsVersion);
      return Packed64SingleBlock.requiredCapacity(valueCount, 64 / bitsPerValue);
    }

    /**
     * Tests whether the provided number of bits per value is supported by the
     * format.
     */
    public boolean isSupported(int bitsPerValue) {
      return Packed64SingleBlock.isSupported(bitsPerValue);
    }

    /**
     * Returns the overhead per value, in bits.
     */
    public float overheadPerValue(int bitsPerValue) {
      assert isSupported(bitsPerValue);
      final int valuesPerBlock = 64 / bitsPerValue;
      final int overhead = 64 % bitsPerValue;
      return (float) overhead / valuesPerBlock;
    }

    /**
     * Returns the overhead ratio (<code>overhead per value / bits per value</code>).
     */
    public final float overheadRatio(int bitsPerValue) {
      assert isSupported(bitsPerValue);
      return overheadPerValue(bitsPerValue) / bitsPerValue;
    }
  }

  /**
   * A decoder for packed integers.
   */
  public static interface Decoder {

    /**
     * The minimum number of long blocks to encode in a single iteration, when
     * using long encoding.
     */
    int longBlockCount();

    /**
     * The number of values that can be stored in {@link #longBlockCount()} long
     * blocks.
     */
    int longValueCount();

    /**
     * The minimum number of byte blocks to encode in a single iteration, when
     * using byte encoding.
     */
    int byteBlockCount();

    /**
     * The number of values that can be stored in {@link #byteBlockCount()} byte
     * blocks.
     */
    int byteValueCount();

    /**
     * Read <code>iterations * longBlockCount()</code> blocks from <code>blocks</code>,
     * decode them and write <code>iterations * longValueCount()</code> values into
     * <code>values</code>.
     *
     * @param blocks       the long blocks that hold packed integer values
     * @param blocksOffset the offset where to start reading blocks
     * @param values       the values buffer
     * @param valuesOffset the offset where to start writing values
     * @param iterations   controls how much data to decode
     */
    void decode(long[] blocks, int blocksOffset, long[] values, int valuesOffset, int iterations);

    /**
     * Read <code>iterations * byteBlockCount()</code> blocks from <code>blocks</code>,
     * decode them and write <code>iterations * byteValueCount()</code> values into
     * <code>values</code>.
     */
    void decode(byte[] blocks, int blocksOffset, long[] values, int valuesOffset, int iterations);

    /**
     * Same as {@link #decode(long[], int, long[], int, int)} but writes the
     * values into an int[]. Values that need 32 bits come out as negative
     * ints and must be read back with <code>& 0xFFFFFFFFL</code>.
     */
    void decode(long[] blocks, int blocksOffset, int[] values, int valuesOffset, int iterations);

    /**
     * Same as {@link #decode(byte[], int, long[], int, int)} but writes the
     * values into an int[].
     */
    void decode(byte[] blocks, int blocksOffset, int[] values, int valuesOffset, int iterations);

  }

  /**
   * An encoder for packed integers.
   */
  public static interface Encoder {

    /**
     * The minimum number of long blocks to encode in a single iteration, when
     * using long encoding.
     */
    int longBlockCount();

    /**
     * The number of values that can be stored in {@link #longBlockCount()} long
     * blocks.
     */
    int longValueCount();

    /**
     * The minimum number of byte blocks to encode in a single iteration, when
     * using byte encoding.
     */
    int byteBlockCount();

    /**
     * The number of values that can be stored in {@link #byteBlockCount()} byte
     * blocks.
     */
    int byteValueCount();

    /**
     * Read <code>iterations * longValueCount()</code> values from <code>values</code>,
     * encode them and write <code>iterations * longBlockCount()</code> blocks into
     * <code>blocks</code>.
     *
     * @param blocks       the long blocks that hold packed integer values
     * @param blocksOffset the offset where to start writing blocks
     * @param values       the values buffer
     * @param valuesOffset the offset where to start reading values
     * @param iterations   controls how much data to encode
     */
    void encode(long[] values, int valuesOffset, long[] blocks, int blocksOffset, int iterations);

    /**
     * Read <code>iterations * byteValueCount()</code> values from <code>values</code>,
     * encode them and write <code>iterations * byteBlockCount()</code> blocks into
     * <code>blocks</code>.
     */
    void encode(long[] values, int valuesOffset, byte[] blocks, int blocksOffset, int iterations);

    /**
     * Same as {@link #encode(long[], int, long[], int, int)} but reads the
     * values from an int[], interpreted as unsigned.
     */
    void encode(int[] values, int valuesOffset, long[] blocks, int blocksOffset, int iterations);

    /**
     * Same as {@link #encode(long[], int, byte[], int, int)} but reads the
     * values from an int[], interpreted as unsigned.
     */
    void encode(int[] values, int valuesOffset, byte[] blocks, int blocksOffset, int iterations);

  }

  /**
   * A read-only random access array of positive integers.
   * @lucene.internal
   */
  public static abstract class Reader implements Accountable {

    /**
     * @param index the position of the wanted value.
     * @return the value at the stated index.
     */
    public abstract long get(int index);

    /**
     * Bulk get: read at least one and at most <code>len</code> longs starting
     * from <code>index</code> into <code>arr[off:off+len]</code> and return
     * the actual number of values that have been read.
     */
    public abstract int get(int index, long[] arr, int off, int len);

    /**
     * @return the number of bits used to store any given value.
     *         Note: This does not imply that memory usage is
     *         {@code bitsPerValue * #values} as implementations are free to
     *         use non-space-optimal packing of bits.
     */
    public abstract int getBitsPerValue();

    /**
     * @return the number of values.
     */
    public abstract int size();

  }

  /**
   * A packed integer array that can be modified.
   * @lucene.internal
   */
  public static abstract class Mutable extends Reader {

    /**
     * Set the value at the given index in the array.
     * @param index where the value should be positioned.
     * @param value a value conforming to the constraints set by the array.
     */
    public abstract void set(int index, long value);

    /**
     * Bulk set: set at least one and at most <code>len</code> longs starting
     * at <code>off</code> in <code>arr</code> into this mutable, starting at
     * <code>index</code>. Returns the actual number of values that have been
     * set.
     */
    public abstract int set(int index, long[] arr, int off, int len);

    /**
     * Fill the mutable from <code>fromIndex</code> (inclusive) to
     * <code>toIndex</code> (exclusive) with <code>val</code>. Like
     * {@link #set(int, long)}, bits of <code>val</code> above the number of
     * bits per value are dropped.
     */
    public abstract void fill(int fromIndex, int toIndex, long val);

    /**
     * Sets all values to 0.
     */
    public abstract void clear();

    /** The underlying format. */
    public abstract Format getFormat();

    /**
     * Save this mutable into <code>out</code>. Instantiating a mutable from
     * the generated data with {@link PackedInts#getMutable(DataInput)} will
     * return a mutable with the same number of bits per value and the same
     * values.
     */
    public void save(DataOutput out) throws IOException {
      final Format format = getFormat();
      final int bitsPerValue = getBitsPerValue();
      final int valueCount = size();
      final InfoStream infoStream = InfoStream.getDefault();
      if (infoStream.isEnabled(INFO_STREAM_COMPONENT)) {
        infoStream.message(INFO_STREAM_COMPONENT, "save " + this + " format=" + format
            + " longCount=" + format.longCount(VERSION_CURRENT, valueCount, bitsPerValue));
      }
      writeHeader(out, format, valueCount, bitsPerValue);

      final BulkOperation encoder = BulkOperation.of(format, bitsPerValue);
      final int iterations = encoder.computeIterations(valueCount, DEFAULT_BUFFER_SIZE);
      final long[] values = new long[iterations * encoder.longValueCount()];
      final long[] blocks = new long[iterations * encoder.longBlockCount()];
      int index = 0;
      while (index < valueCount) {
        int filled = 0;
        while (filled < values.length && index < valueCount) {
          final int read = get(index, values, filled, values.length - filled);
          assert read > 0;
          index += read;
          filled += read;
        }
        // zero-pad the last, partially filled block
        Arrays.fill(values, filled, values.length, 0L);
        final int blockIterations = (filled + encoder.longValueCount() - 1) / encoder.longValueCount();
        encoder.encode(values, 0, blocks, 0, blockIterations);
        for (int i = 0, end = blockIterations * encoder.longBlockCount(); i < end; ++i) {
          out.writeLong(blocks[i]);
        }
      }
    }

  }

  private static void writeHeader(DataOutput out, Format format, int valueCount, int bitsPerValue) throws IOException {
    CodecUtil.writeHeader(out, CODEC_NAME, VERSION_CURRENT);
    out.writeVInt(bitsPerValue);
    out.writeVInt(valueCount);
    out.writeVInt(format.getId());
  }

  /**
   * Get a {@link Decoder}.
   *
   * @param format         the format used to store packed ints
   * @param version        the compatibility version
   * @param bitsPerValue   the number of bits per value
   * @return a decoder
   */
  public static Decoder getDecoder(Format format, int version, int bitsPerValue) {
    checkVersion(version);
    return BulkOperation.of(format, bitsPerValue);
  }

  /**
   * Get an {@link Encoder}.
   *
   * @param format         the format used to store packed ints
   * @param version        the compatibility version
   * @param bitsPerValue   the number of bits per value
   * @return an encoder
   */
  public static Encoder getEncoder(Format format, int version, int bitsPerValue) {
    checkVersion(version);
    return BulkOperation.of(format, bitsPerValue);
  }

  /**
   * Create a packed integer array with the given amount of values initialized
   * to 0. The <code>bitsPerValue</code> must be one of the widths supported by
   * {@link Format#PACKED_SINGLE_BLOCK}, it is never rounded up. Use
   * {@link #fastestBitsPerValue(int)} to pick a supported width.
   *
   * @param valueCount   the number of elements
   * @param bitsPerValue the number of bits available for any given value
   * @return a mutable packed integer array
   * @throws IllegalArgumentException if <code>bitsPerValue</code> is not supported
   * @lucene.internal
   */
  public static Mutable getMutable(int valueCount, int bitsPerValue) {
    assert valueCount >= 0;
    return Packed64SingleBlock.create(valueCount, bitsPerValue);
  }

  /**
   * Restore a {@link Mutable} from a stream, as written by
   * {@link Mutable#save(DataOutput)}.
   *
   * @param in the stream to read data from, positioned at the beginning of the header
   * @return a mutable holding the saved values
   * @throws CorruptDataException if the header is invalid
   * @throws IOException if there is a low-level I/O error
   * @lucene.internal
   */
  public static Mutable getMutable(DataInput in) throws IOException {
    final int version = CodecUtil.checkHeader(in, CODEC_NAME, VERSION_START, VERSION_CURRENT);
    final int bitsPerValue = in.readVInt();
    final int valueCount = in.readVInt();
    if (valueCount < 0) {
      throw new CorruptDataException("Invalid valueCount=" + valueCount + " (resource: " + in + ")");
    }
    final int formatId = in.readVInt();
    final Format format;
    try {
      format = Format.byId(formatId);
    } catch (IllegalArgumentException e) {
      throw new CorruptDataException("Unknown format id " + formatId + " (resource: " + in + ")", e);
    }
    if (!format.isSupported(bitsPerValue)) {
      throw new CorruptDataException("bitsPerValue=" + bitsPerValue + " is not supported by " + format
          + " (resource: " + in + ")");
    }
    final InfoStream infoStream = InfoStream.getDefault();
    if (infoStream.isEnabled(INFO_STREAM_COMPONENT)) {
      infoStream.message(INFO_STREAM_COMPONENT, "load format=" + format + " version=" + version
          + " bitsPerValue=" + bitsPerValue + " valueCount=" + valueCount);
    }
    return getMutableNoHeader(in, format, version, valueCount, bitsPerValue);
  }

  /**
   * Expert: Restore a {@link Mutable} from a stream without reading metadata
   * at the beginning of the stream. This method is useful to restore data
   * when metadata has been previously read, or when the caller knows
   * <code>valueCount</code> and <code>bitsPerValue</code> out of band.
   *
   * @param in           the stream to read data from, positioned at the first block
   * @param format       the format used to serialize
   * @param version      the version used to serialize the data
   * @param valueCount   how many values the stream holds
   * @param bitsPerValue the number of bits per value
   * @return a mutable holding the values read from <code>in</code>
   * @throws IOException if there is a low-level I/O error
   * @lucene.internal
   */
  public static Mutable getMutableNoHeader(DataInput in, Format format, int version,
      int valueCount, int bitsPerValue) throws IOException {
    checkVersion(version);
    switch (format) {
      case PACKED_SINGLE_BLOCK:
        return Packed64SingleBlock.create(in, valueCount, bitsPerValue);
      default:
        throw new AssertionError("Unknown Writer format: " + format);
    }
  }

  /**
   * Returns the smallest number of bits per value that is
   * {@code >= bitsPerValue} and supported by
   * {@link Format#PACKED_SINGLE_BLOCK}.
   *
   * @throws IllegalArgumentException if <code>bitsPerValue</code> is not in
   *         <code>[1, {@value Packed64SingleBlock#MAX_SUPPORTED_BITS_PER_VALUE}]</code>
   * @lucene.internal
   */
  public static int fastestBitsPerValue(int bitsPerValue) {
    if (bitsPerValue < 1 || bitsPerValue > Packed64SingleBlock.MAX_SUPPORTED_BITS_PER_VALUE) {
      throw new IllegalArgumentException("bitsPerValue must be >= 1 and <= "
          + Packed64SingleBlock.MAX_SUPPORTED_BITS_PER_VALUE + " (got " + bitsPerValue + ")");
    }
    int bpv = bitsPerValue;
    while (!Packed64SingleBlock.isSupported(bpv)) {
      ++bpv;
    }
    return bpv;
  }

  /** Returns how many bits are required to hold values up
   *  to and including maxValue
   *  NOTE: This method returns at least 1.
   * @param maxValue the maximum value that should be representable.
   * @return the amount of bits needed to represent values from 0 to maxValue.
   * @lucene.internal
   */
  public static int bitsRequired(long maxValue) {
    if (maxValue < 0) {
      throw new IllegalArgumentException("maxValue must be non-negative (got: " + maxValue + ")");
    }
    return unsignedBitsRequired(maxValue);
  }

  /** Returns how many bits are required to store <code>bits</code>,
   * interpreted as an unsigned value.
   * NOTE: This method returns at least 1.
   * @lucene.internal
   */
  public static int unsignedBitsRequired(long bits) {
    return Math.max(1, 64 - Long.numberOfLeadingZeros(bits));
  }

  /**
   * Calculates the maximum unsigned long that can be expressed with the given
   * number of bits.
   * @param bitsPerValue the number of bits available for any given value.
   * @return the maximum value for the given bits.
   * @lucene.internal
   */
  public static long maxValue(int bitsPerValue) {
    return bitsPerValue == 64 ? Long.MAX_VALUE : ~(~0L << bitsPerValue);
  }

  /**
   * Copy <code>src[srcPos:srcPos+len]</code> into
   * <code>dest[destPos:destPos+len]</code> using at most <code>mem</code>
   * bytes.
   */
  public static void copy(Reader src, int srcPos, Mutable dest, int destPos, int len, int mem) {
    assert srcPos + len <= src.size();
    assert destPos + len <= dest.size();
    final InfoStream infoStream = InfoStream.getDefault();
    if (infoStream.isEnabled(INFO_STREAM_COMPONENT)) {
      infoStream.message(INFO_STREAM_COMPONENT, "copy len=" + len + " from " + src + "@" + srcPos
          + " to " + dest + "@" + destPos + " mem=" + mem);
    }
    final int capacity = mem >>> 3;
    if (capacity == 0) {
      for (int i = 0; i < len; ++i) {
        dest.set(destPos++, src.get(srcPos++));
      }
    } else if (len > 0) {
      // use bulk operations
      final long[] buf = new long[Math.min(capacity, len)];
      copy(src, srcPos, dest, destPos, len, buf);
    }
  }

  /** Same as {@link #copy(Reader, int, Mutable, int, int, int)} but using a pre-allocated buffer. */
  static void copy(Reader src, int srcPos, Mutable dest, int destPos, int len, long[] buf) {
    assert buf.length > 0;
    int remaining = 0;
    while (len > 0) {
      final int read = src.get(srcPos, buf, remaining, Math.min(len, buf.length - remaining));
      assert read > 0;
      srcPos += read;
      len -= read;
      remaining += read;
      final int written = dest.set(destPos, buf, 0, remaining);
      assert written > 0;
      destPos += written;
      if (written < remaining) {
        System.arraycopy(buf, written, buf, 0, remaining - written);
      }
      remaining -= written;
    }
    while (remaining > 0) {
      final int written = dest.set(destPos, buf, 0, remaining);
      destPos += written;
      remaining -= written;
      System.arraycopy(buf, written, buf, 0, remaining);
    }
  }

}
