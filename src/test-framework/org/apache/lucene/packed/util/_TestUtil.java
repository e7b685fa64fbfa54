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

import java.util.Random;

import org.apache.lucene.packed.PackedInts;

public class _TestUtil {

  /** start and end are BOTH inclusive */
  public static int nextInt(Random r, int start, int end) {
    return start + r.nextInt(end-start+1);
  }

  /** start and end are BOTH inclusive */
  public static long nextLong(Random r, long start, long end) {
    assert end >= start;
    final long range = end - start + 1;
    if (range <= 0) {
      // overflow: the range spans more than Long.MAX_VALUE values
      long v;
      do {
        v = r.nextLong();
      } while (v < start || v > end);
      return v;
    }
    // bias is negligible for the ranges used in tests
    return start + ((r.nextLong() & Long.MAX_VALUE) % range);
  }

  /** Returns a random value in <code>[0, maxValue(bitsPerValue)]</code>. */
  public static long nextUnsigned(Random r, int bitsPerValue) {
    return nextLong(r, 0, PackedInts.maxValue(bitsPerValue));
  }
}
