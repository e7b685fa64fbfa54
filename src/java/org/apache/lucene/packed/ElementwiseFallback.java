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

import org.apache.lucene.packed.util.RamUsageEstimator;

/**
 * Element-by-element implementation of the bulk operations of a
 * {@link PackedInts.Mutable}, expressed only in terms of its single-value
 * {@link PackedInts.Mutable#get(int) get} and
 * {@link PackedInts.Mutable#set(int, long) set}. Implementations that work a
 * whole block at a time call it for the ranges they cannot handle themselves.
 *
 * @lucene.internal
 */
public final class ElementwiseFallback {

  /** Shallow size of an instance: object header plus the reference to the wrapped values. */
  static final long BASE_RAM_BYTES_USED = RamUsageEstimator.alignObjectSize(
      RamUsageEstimator.NUM_BYTES_OBJECT_HEADER + RamUsageEstimator.NUM_BYTES_OBJECT_REF);

  private final PackedInts.Mutable values;

  public ElementwiseFallback(PackedInts.Mutable values) {
    this.values = values;
  }

  /**
   * Read <code>min(len, size() - index)</code> values starting at
   * <code>index</code> into <code>arr[off:]</code>.
   */
  public int get(int index, long[] arr, int off, int len) {
    assert len > 0 : "len must be > 0 (got " + len + ")";
    assert index >= 0 && index < values.size();
    assert off + len <= arr.length;

    final int gets = Math.min(values.size() - index, len);
    for (int i = index, o = off, end = index + gets; i < end; ++i, ++o) {
      arr[o] = values.get(i);
    }
    return gets;
  }

  /**
   * Write <code>min(len, size() - index)</code> values from
   * <code>arr[off:]</code> starting at <code>index</code>.
   */
  public int set(int index, long[] arr, int off, int len) {
    assert len > 0 : "len must be > 0 (got " + len + ")";
    assert index >= 0 && index < values.size();
    assert off + len <= arr.length;

    len = Math.min(len, values.size() - index);
    for (int i = index, o = off, end = index + len; i < end; ++i, ++o) {
      values.set(i, arr[o]);
    }
    return len;
  }

  /** Set every value in <code>[fromIndex, min(toIndex, size()))</code> to <code>val</code>. */
  public void fill(int fromIndex, int toIndex, long val) {
    assert fromIndex >= 0;
    assert fromIndex <= toIndex;
    toIndex = Math.min(toIndex, values.size());
    for (int i = fromIndex; i < toIndex; ++i) {
      values.set(i, val);
    }
  }

}
