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

import org.apache.lucene.packed.store.ByteArrayDataOutput;
import org.apache.lucene.packed.util.LuceneTestCase;
import org.apache.lucene.packed.util._TestUtil;

public class TestBulkOperation extends LuceneTestCase {

  public void testOf() {
    for (int bpv : Packed64SingleBlock.SUPPORTED_BITS_PER_VALUE) {
      final BulkOperation op = BulkOperation.of(PackedInts.Format.PACKED_SINGLE_BLOCK, bpv);
      assertSame(op, BulkOperation.of(PackedInts.Format.PACKED_SINGLE_BLOCK, bpv));
      assertEquals(1, op.longBlockCount());
      assertEquals(8, op.byteBlockCount());
      assertEquals(64 / bpv, op.longValueCount());
      assertEquals(64 / bpv, op.byteValueCount());
    }
    for (int bpv : new int[] {0, 11, 33, 64}) {
      try {
        BulkOperation.of(PackedInts.Format.PACKED_SINGLE_BLOCK, bpv);
        fail("bpv=" + bpv);
      } catch (IllegalArgumentException e) {
        // expected
      }
    }
  }

  public void testEncodeDecode() throws IOException {
    for (int bpv : Packed64SingleBlock.SUPPORTED_BITS_PER_VALUE) {
      final BulkOperation op = BulkOperation.of(PackedInts.Format.PACKED_SINGLE_BLOCK, bpv);
      final int iterations = _TestUtil.nextInt(random, 1, 20);
      final int valueCount = iterations * op.longValueCount();
      final int blocksOffset = random.nextInt(5);
      final int valuesOffset = random.nextInt(5);

      final long[] values = new long[valuesOffset + valueCount];
      final Packed64SingleBlock reference = Packed64SingleBlock.create(valueCount, bpv);
      for (int i = 0; i < valueCount; ++i) {
        values[valuesOffset + i] = _TestUtil.nextUnsigned(random, bpv);
        reference.set(i, values[valuesOffset + i]);
      }
      final String msg = "bpv=" + bpv + " iterations=" + iterations;

      // long blocks must match what per-value sets produce
      final long[] blocks = new long[blocksOffset + iterations];
      op.encode(values, valuesOffset, blocks, blocksOffset, iterations);
      for (int i = 0; i < iterations; ++i) {
        assertEquals(msg, reference.blocks[i], blocks[blocksOffset + i]);
      }

      // byte blocks are the big-endian serialization of the long blocks
      final byte[] byteBlocks = new byte[blocksOffset + 8 * iterations];
      op.encode(values, valuesOffset, byteBlocks, blocksOffset, iterations);
      final byte[] expectedBytes = new byte[8 * iterations];
      reference.writeBlocks(new ByteArrayDataOutput(expectedBytes));
      for (int i = 0; i < expectedBytes.length; ++i) {
        assertEquals(msg, expectedBytes[i], byteBlocks[blocksOffset + i]);
      }

      final int[] intValues = new int[valuesOffset + valueCount];
      for (int i = 0; i < intValues.length; ++i) {
        intValues[i] = (int) values[i];
      }
      final long[] blocksFromInts = new long[blocksOffset + iterations];
      op.encode(intValues, valuesOffset, blocksFromInts, blocksOffset, iterations);
      assertArrayEquals(msg, blocks, blocksFromInts);
      final byte[] byteBlocksFromInts = new byte[blocksOffset + 8 * iterations];
      op.encode(intValues, valuesOffset, byteBlocksFromInts, blocksOffset, iterations);
      assertArrayEquals(msg, byteBlocks, byteBlocksFromInts);

      // and back
      final long[] decoded = new long[valuesOffset + valueCount];
      op.decode(blocks, blocksOffset, decoded, valuesOffset, iterations);
      assertArrayEquals(msg, values, decoded);
      final long[] decodedFromBytes = new long[valuesOffset + valueCount];
      op.decode(byteBlocks, blocksOffset, decodedFromBytes, valuesOffset, iterations);
      assertArrayEquals(msg, values, decodedFromBytes);

      final int[] decodedInts = new int[valuesOffset + valueCount];
      op.decode(blocks, blocksOffset, decodedInts, valuesOffset, iterations);
      assertArrayEquals(msg, intValues, decodedInts);
      final int[] decodedIntsFromBytes = new int[valuesOffset + valueCount];
      op.decode(byteBlocks, blocksOffset, decodedIntsFromBytes, valuesOffset, iterations);
      assertArrayEquals(msg, intValues, decodedIntsFromBytes);
    }
  }

  public void testEncodeMasksValues() {
    final BulkOperation op = BulkOperation.of(PackedInts.Format.PACKED_SINGLE_BLOCK, 4);
    final long[] values = new long[16];
    values[0] = 0x1FL;
    values[15] = -1L;
    final long[] blocks = new long[1];
    op.encode(values, 0, blocks, 0, 1);
    assertEquals(0xF00000000000000FL, blocks[0]);
  }

  public void testComputeIterations() {
    for (int bpv : Packed64SingleBlock.SUPPORTED_BITS_PER_VALUE) {
      final BulkOperation op = BulkOperation.of(PackedInts.Format.PACKED_SINGLE_BLOCK, bpv);
      final int valuesPerBlock = op.byteValueCount();
      // tiny budget still moves one block at a time
      assertEquals(1, op.computeIterations(1000, 1));
      // never more blocks than needed to hold every value
      assertEquals(1, op.computeIterations(1, PackedInts.DEFAULT_BUFFER_SIZE));
      final int valueCount = _TestUtil.nextInt(random, 1, 100000);
      final int iterations = op.computeIterations(valueCount, PackedInts.DEFAULT_BUFFER_SIZE);
      assertTrue(iterations >= 1);
      assertTrue(iterations == 1
          || iterations * (op.byteBlockCount() + 8 * valuesPerBlock) <= PackedInts.DEFAULT_BUFFER_SIZE);
      assertTrue((long) (iterations - 1) * valuesPerBlock < valueCount);
    }
  }
}
