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

import java.lang.management.ManagementFactory;
import java.lang.reflect.Method;

/**
 * Estimates the size (memory representation) of Java objects.
 * <p>
 * The sizes are derived from the running JVM where possible (HotSpot
 * diagnostic MXBean for compressed references and object alignment),
 * otherwise conservative 64-bit defaults are used.
 *
 * @see #sizeOf(long[])
 * @see #alignObjectSize(long)
 * @lucene.internal
 */
public final class RamUsageEstimator {

  private RamUsageEstimator() {} // no instance

  public final static int NUM_BYTES_INT = 4;
  public final static int NUM_BYTES_LONG = 8;

  /** True, iff compressed references (oops) are enabled by this JVM. */
  public final static boolean COMPRESSED_REFS_ENABLED;

  /** Number of bytes this JVM uses to represent an object reference. */
  public final static int NUM_BYTES_OBJECT_REF;

  /** Number of bytes to represent an object header (no fields, no alignments). */
  public final static int NUM_BYTES_OBJECT_HEADER;

  /** Number of bytes to represent an array header (no content, but with alignments). */
  public final static int NUM_BYTES_ARRAY_HEADER;

  /**
   * A constant specifying the object alignment boundary inside the JVM. Objects will
   * always take a full multiple of this constant, possibly wasting some space.
   */
  public final static int NUM_BYTES_OBJECT_ALIGNMENT;

  /** Name of the JVM option reporting whether compressed oops are in use. */
  static final String COMPRESSED_OOPS_OPTION = "UseCompressedOops";

  /** Name of the JVM option reporting the object alignment. */
  static final String OBJECT_ALIGNMENT_OPTION = "ObjectAlignmentInBytes";

  static {
    boolean compressedOops = false;
    int objectAlignment = 8;
    if (Constants.JRE_IS_64BIT && Constants.JVM_IS_HOTSPOT) {
      try {
        final Class<?> beanClazz = Class.forName("com.sun.management.HotSpotDiagnosticMXBean");
        final Object hotSpotBean = ManagementFactory.getPlatformMXBean(
            beanClazz.asSubclass(java.lang.management.PlatformManagedObject.class));
        if (hotSpotBean != null) {
          final Method getVMOptionMethod = beanClazz.getMethod("getVMOption", String.class);
          try {
            final Object vmOption = getVMOptionMethod.invoke(hotSpotBean, COMPRESSED_OOPS_OPTION);
            compressedOops = Boolean.parseBoolean(
                vmOption.getClass().getMethod("getValue").invoke(vmOption).toString());
          } catch (ReflectiveOperationException | RuntimeException e) {
            // option not available on this VM, keep the default
            compressedOops = false;
          }
          try {
            final Object vmOption = getVMOptionMethod.invoke(hotSpotBean, OBJECT_ALIGNMENT_OPTION);
            objectAlignment = Integer.parseInt(
                vmOption.getClass().getMethod("getValue").invoke(vmOption).toString());
          } catch (ReflectiveOperationException | RuntimeException e) {
            // option not available on this VM, keep the default
            objectAlignment = 8;
          }
        }
      } catch (ReflectiveOperationException | RuntimeException e) {
        // not a HotSpot VM after all or no access to the bean: use defaults
        compressedOops = false;
        objectAlignment = 8;
      }
    }

    if (Constants.JRE_IS_64BIT) {
      COMPRESSED_REFS_ENABLED = compressedOops;
      NUM_BYTES_OBJECT_REF = compressedOops ? 4 : 8;
      // "mark" word + klass pointer
      NUM_BYTES_OBJECT_HEADER = 8 + NUM_BYTES_OBJECT_REF;
      // header + length, rounded up to the reference size
      NUM_BYTES_ARRAY_HEADER = (int) alignTo(NUM_BYTES_OBJECT_HEADER + NUM_BYTES_INT, 8);
    } else {
      COMPRESSED_REFS_ENABLED = false;
      NUM_BYTES_OBJECT_REF = 4;
      NUM_BYTES_OBJECT_HEADER = 8;
      NUM_BYTES_ARRAY_HEADER = NUM_BYTES_OBJECT_HEADER + NUM_BYTES_INT;
    }
    NUM_BYTES_OBJECT_ALIGNMENT = objectAlignment;
  }

  private static long alignTo(long size, int alignment) {
    size += (long) alignment - 1L;
    return size - (size % alignment);
  }

  /**
   * Aligns an object size to be the next multiple of {@link #NUM_BYTES_OBJECT_ALIGNMENT}.
   */
  public static long alignObjectSize(long size) {
    return alignTo(size, NUM_BYTES_OBJECT_ALIGNMENT);
  }

  /** Returns the size in bytes of the long[] object. */
  public static long sizeOf(long[] arr) {
    return alignObjectSize((long) NUM_BYTES_ARRAY_HEADER + (long) NUM_BYTES_LONG * arr.length);
  }
}
