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

import java.util.Arrays;

import org.apache.lucene.packed.util.LuceneTestCase;
import org.apache.lucene.packed.util._TestUtil;

/**
 * Bulk get/set and fill against their single-value counterparts.
 */
public class TestPacked64SingleBlockBulk extends LuceneTestCase {

  /** How many values one bulk call is expected to transfer. */
  private static int expectedBulkCount(int valueCount, int bitsPerValue, int index, int len) {
    final int valuesPerBlock = 64 / bitsPerValue;
    final int remaining = Math.min(len, valueCount - index);
    final int offsetInBlock = index % valuesPerBlock;
    if (offsetInBlock != 0) {
      final int head = Math.min(valuesPerBlock - offsetInBlock, remaining);
      return head + (remaining - head) / valuesPerBlock * valuesPerBlock;
    }
    final int whole = remaining / valuesPerBlock * valuesPerBlock;
    // no full block: the element-wise path takes everything
    return whole == 0 ? remaining : whole;
  }

  private static Packed64SingleBlock randomValues(int valueCount, int bitsPerValue, long[] expected) {
    final Packed64SingleBlock values = Packed64SingleBlock.create(valueCount, bitsPerValue);
    for (int i = 0; i < valueCount; ++i) {
      expected[i] = _TestUtil.nextUnsigned(random, bitsPerValue);
      values.set(i, expected[i]);
    }
    return values;
  }

  public void testBulkGetEveryBoundary() {
    for (int bpv : Packed64SingleBlock.SUPPORTED_BITS_PER_VALUE) {
      final int valuesPerBlock = 64 / bpv;
      final int valueCount = 3 * valuesPerBlock + valuesPerBlock / 2 + 1;
      final long[] expected = new long[valueCount];
      final Packed64SingleBlock values = randomValues(valueCount, bpv, expected);
      for (int index = 0; index < valueCount; ++index) {
        for (int len = 1; len <= valueCount - index + 2; ++len) {
          final int off = random.nextInt(3);
          final long[] arr = new long[off + len];
          Arrays.fill(arr, -1L);
          final int got = values.get(index, arr, off, len);
          final String msg = "bpv=" + bpv + " index=" + index + " len=" + len;
          assertEquals(msg, expectedBulkCount(valueCount, bpv, index, len), got);
          for (int i = 0; i < got; ++i) {
            assertEquals(msg, expected[index + i], arr[off + i]);
          }
          for (int i = 0; i < off; ++i) {
            assertEquals(msg, -1L, arr[i]);
          }
          for (int i = off + got; i < arr.length; ++i) {
            assertEquals(msg, -1L, arr[i]);
          }
        }
      }
    }
  }

  public void testBulkSetEveryBoundary() {
    for (int bpv : Packed64SingleBlock.SUPPORTED_BITS_PER_VALUE) {
      final int valuesPerBlock = 64 / bpv;
      final int valueCount = 2 * valuesPerBlock + valuesPerBlock / 2 + 1;
      final long[] expected = new long[valueCount];
      final Packed64SingleBlock values = randomValues(valueCount, bpv, expected);
      for (int index = 0; index < valueCount; ++index) {
        for (int len = 1; len <= valueCount - index + 2; ++len) {
          final int off = random.nextInt(3);
          final long[] arr = new long[off + len];
          for (int i = 0; i < arr.length; ++i) {
            arr[i] = _TestUtil.nextUnsigned(random, bpv);
          }
          final int set = values.set(index, arr, off, len);
          final String msg = "bpv=" + bpv + " index=" + index + " len=" + len;
          assertEquals(msg, expectedBulkCount(valueCount, bpv, index, len), set);
          System.arraycopy(arr, off, expected, index, set);
          for (int i = 0; i < valueCount; ++i) {
            assertEquals(msg + " i=" + i, expected[i], values.get(i));
          }
        }
      }
    }
  }

  public void testBulkSetTruncates() {
    for (int bpv : Packed64SingleBlock.SUPPORTED_BITS_PER_VALUE) {
      final int valuesPerBlock = 64 / bpv;
      final Packed64SingleBlock values = Packed64SingleBlock.create(2 * valuesPerBlock, bpv);
      final long[] arr = new long[values.size()];
      for (int i = 0; i < arr.length; ++i) {
        arr[i] = random.nextLong();
      }
      int index = 0;
      while (index < values.size()) {
        index += values.set(index, arr, index, arr.length - index);
      }
      for (int i = 0; i < arr.length; ++i) {
        assertEquals(arr[i] & PackedInts.maxValue(bpv), values.get(i));
      }
    }
  }

  public void testResumableBulkGet() {
    for (int bpv : Packed64SingleBlock.SUPPORTED_BITS_PER_VALUE) {
      final int valueCount = _TestUtil.nextInt(random, 1, 2000);
      final long[] expected = new long[valueCount];
      final Packed64SingleBlock values = randomValues(valueCount, bpv, expected);
      final long[] arr = new long[valueCount];
      int index = 0;
      while (index < valueCount) {
        final int len = _TestUtil.nextInt(random, 1, valueCount - index);
        final int got = values.get(index, arr, index, len);
        assertTrue(got >= 1 && got <= len);
        index += got;
      }
      assertArrayEquals(expected, arr);
    }
  }

  public void testResumableBulkSet() {
    for (int bpv : Packed64SingleBlock.SUPPORTED_BITS_PER_VALUE) {
      final int valueCount = _TestUtil.nextInt(random, 1, 2000);
      final Packed64SingleBlock values = Packed64SingleBlock.create(valueCount, bpv);
      final long[] expected = new long[valueCount];
      for (int i = 0; i < valueCount; ++i) {
        expected[i] = _TestUtil.nextUnsigned(random, bpv);
      }
      int index = 0;
      while (index < valueCount) {
        final int len = _TestUtil.nextInt(random, 1, valueCount - index);
        final int set = values.set(index, expected, index, len);
        assertTrue(set >= 1 && set <= len);
        index += set;
      }
      for (int i = 0; i < valueCount; ++i) {
        assertEquals(expected[i], values.get(i));
      }
    }
  }

  public void testFill() {
    for (int bpv : Packed64SingleBlock.SUPPORTED_BITS_PER_VALUE) {
      final int valuesPerBlock = 64 / bpv;
      final int valueCount = _TestUtil.nextInt(random, 1, valuesPerBlock * 10);
      final long[] expected = new long[valueCount];
      final Packed64SingleBlock values = randomValues(valueCount, bpv, expected);
      final int iters = atLeast(20);
      for (int iter = 0; iter < iters; ++iter) {
        final int from = random.nextInt(valueCount + 1);
        final int to = _TestUtil.nextInt(random, from, valueCount);
        final long val = _TestUtil.nextUnsigned(random, bpv);
        values.fill(from, to, val);
        Arrays.fill(expected, from, to, val);
        for (int i = 0; i < valueCount; ++i) {
          assertEquals("bpv=" + bpv + " from=" + from + " to=" + to + " i=" + i, expected[i], values.get(i));
        }
      }
    }
  }

  public void testFillWholeBlocksWithRaggedEnds() {
    for (int bpv : Packed64SingleBlock.SUPPORTED_BITS_PER_VALUE) {
      final int valuesPerBlock = 64 / bpv;
      final int valueCount = 5 * valuesPerBlock;
      final Packed64SingleBlock values = Packed64SingleBlock.create(valueCount, bpv);
      final long maxValue = PackedInts.maxValue(bpv);
      final int from = valuesPerBlock / 2 + 1;
      final int to = valueCount - valuesPerBlock / 2 - 1;
      values.fill(from, to, maxValue);
      for (int i = 0; i < valueCount; ++i) {
        assertEquals("bpv=" + bpv + " i=" + i, i >= from && i < to ? maxValue : 0L, values.get(i));
      }
      // inner blocks hold the replicated value
      long blockValue = 0L;
      for (int i = 0; i < valuesPerBlock; ++i) {
        blockValue |= maxValue << (i * bpv);
      }
      assertEquals(blockValue, values.blocks[2]);
    }
  }

  public void testFillClampsToSize() {
    for (int bpv : Packed64SingleBlock.SUPPORTED_BITS_PER_VALUE) {
      final int valuesPerBlock = 64 / bpv;
      final int valueCount = 3 * valuesPerBlock + 1;
      final Packed64SingleBlock values = Packed64SingleBlock.create(valueCount, bpv);
      values.fill(1, valueCount + 2 * valuesPerBlock, 1L);
      assertEquals(0L, values.get(0));
      for (int i = 1; i < valueCount; ++i) {
        assertEquals(1L, values.get(i));
      }
      if (valueCount % valuesPerBlock != 0) {
        // padding of the last block stays clear
        final long last = values.blocks[values.blocks.length - 1];
        assertEquals(0L, last >>> ((valueCount % valuesPerBlock) * bpv));
      }
    }
  }

  public void testFillTruncates() {
    for (int bpv : Packed64SingleBlock.SUPPORTED_BITS_PER_VALUE) {
      final int valuesPerBlock = 64 / bpv;
      final int valueCount = 4 * valuesPerBlock + 3;
      // short ranges go element by element, long ones write whole blocks
      final int[] lengths = new int[] {3, valueCount};
      for (int len : lengths) {
        final long val = (random.nextLong() << bpv) | (1L << bpv) | _TestUtil.nextUnsigned(random, bpv);
        final Packed64SingleBlock filled = Packed64SingleBlock.create(valueCount, bpv);
        final Packed64SingleBlock set = Packed64SingleBlock.create(valueCount, bpv);
        filled.fill(0, len, val);
        for (int i = 0; i < len; ++i) {
          set.set(i, val);
        }
        final String msg = "bpv=" + bpv + " len=" + len + " val=" + val;
        for (int i = 0; i < valueCount; ++i) {
          assertEquals(msg + " i=" + i, set.get(i), filled.get(i));
          assertEquals(msg + " i=" + i, i < len ? val & PackedInts.maxValue(bpv) : 0L, filled.get(i));
        }
        assertArrayEquals(msg, set.blocks, filled.blocks);
      }
    }
  }

  public void testFallbackMatchesBulk() {
    for (int bpv : Packed64SingleBlock.SUPPORTED_BITS_PER_VALUE) {
      final int valueCount = _TestUtil.nextInt(random, 1, 500);
      final long[] expected = new long[valueCount];
      final Packed64SingleBlock values = randomValues(valueCount, bpv, expected);
      final ElementwiseFallback fallback = new ElementwiseFallback(values);
      final int index = random.nextInt(valueCount);
      final long[] arr = new long[valueCount - index];
      assertEquals(arr.length, fallback.get(index, arr, 0, arr.length));
      for (int i = 0; i < arr.length; ++i) {
        assertEquals(expected[index + i], arr[i]);
      }
      fallback.fill(index, valueCount + 3, 0L);
      for (int i = 0; i < valueCount; ++i) {
        assertEquals(i < index ? expected[i] : 0L, values.get(i));
      }
      assertEquals(arr.length, fallback.set(index, arr, 0, arr.length));
      for (int i = 0; i < valueCount; ++i) {
        assertEquals(expected[i], values.get(i));
      }
    }
  }
}
