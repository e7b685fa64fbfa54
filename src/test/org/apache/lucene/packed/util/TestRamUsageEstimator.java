package org.apache.lucene.packed.util;

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

public class TestRamUsageEstimator extends LuceneTestCase {

  public void testAlignment() {
    final int alignment = RamUsageEstimator.NUM_BYTES_OBJECT_ALIGNMENT;
    assertTrue(alignment >= 8);
    assertEquals(0, Integer.bitCount(alignment) - 1);
    for (int i = 0; i < 100; ++i) {
      final long size = random.nextInt(100000);
      final long aligned = RamUsageEstimator.alignObjectSize(size);
      assertTrue(aligned >= size);
      assertTrue(aligned - size < alignment);
      assertEquals(0, aligned % alignment);
    }
  }

  public void testReferenceSize() {
    if (!Constants.JRE_IS_64BIT) {
      assertEquals(4, RamUsageEstimator.NUM_BYTES_OBJECT_REF);
    }
    assertTrue(RamUsageEstimator.NUM_BYTES_OBJECT_REF == 4 || RamUsageEstimator.NUM_BYTES_OBJECT_REF == 8);
    assertEquals(RamUsageEstimator.COMPRESSED_REFS_ENABLED || !Constants.JRE_IS_64BIT,
        RamUsageEstimator.NUM_BYTES_OBJECT_REF == 4);
    assertTrue(RamUsageEstimator.NUM_BYTES_ARRAY_HEADER >= RamUsageEstimator.NUM_BYTES_OBJECT_HEADER + RamUsageEstimator.NUM_BYTES_INT);
  }

  public void testSizeOfArrays() {
    final int length = random.nextInt(1000);
    assertEquals(RamUsageEstimator.alignObjectSize(RamUsageEstimator.NUM_BYTES_ARRAY_HEADER + 8L * length),
        RamUsageEstimator.sizeOf(new long[length]));
    assertTrue(RamUsageEstimator.sizeOf(new long[length + 1]) > RamUsageEstimator.sizeOf(new long[length]));
  }
}
