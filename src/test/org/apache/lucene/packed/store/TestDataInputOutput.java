package org.apache.lucene.packed.store;

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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.util.Random;

import org.apache.lucene.packed.util.LuceneTestCase;
import org.apache.lucene.packed.util._TestUtil;

public class TestDataInputOutput extends LuceneTestCase {

  private static void writeRandom(DataOutput out, long seed, int count) throws IOException {
    final Random r = new Random(seed);
    for (int i = 0; i < count; ++i) {
      switch (r.nextInt(6)) {
        case 0: out.writeByte((byte) r.nextInt()); break;
        case 1: out.writeShort((short) r.nextInt()); break;
        case 2: out.writeInt(r.nextInt()); break;
        case 3: out.writeVInt(r.nextInt() & Integer.MAX_VALUE); break;
        case 4: out.writeLong(r.nextLong()); break;
        default: out.writeVLong(r.nextLong() & Long.MAX_VALUE); break;
      }
    }
  }

  private static void checkRandom(DataInput in, long seed, int count) throws IOException {
    final Random r = new Random(seed);
    for (int i = 0; i < count; ++i) {
      switch (r.nextInt(6)) {
        case 0: assertEquals((byte) r.nextInt(), in.readByte()); break;
        case 1: assertEquals((short) r.nextInt(), in.readShort()); break;
        case 2: assertEquals(r.nextInt(), in.readInt()); break;
        case 3: assertEquals(r.nextInt() & Integer.MAX_VALUE, in.readVInt()); break;
        case 4: assertEquals(r.nextLong(), in.readLong()); break;
        default: assertEquals(r.nextLong() & Long.MAX_VALUE, in.readVLong()); break;
      }
    }
  }

  public void testStreams() throws IOException {
    final long seed = random.nextLong();
    final int count = atLeast(1000);
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    final OutputStreamDataOutput out = new OutputStreamDataOutput(bytes);
    writeRandom(out, seed, count);
    out.close();

    final InputStreamDataInput in = new InputStreamDataInput(new ByteArrayInputStream(bytes.toByteArray()));
    checkRandom(in, seed, count);
    try {
      in.readByte();
      fail("should have hit EOF");
    } catch (EOFException e) {
      // expected
    }
    in.close();
  }

  public void testByteArrays() throws IOException {
    final long seed = random.nextLong();
    final int count = atLeast(1000);
    // each value takes at most 10 bytes
    final byte[] bytes = new byte[10 * count];
    final ByteArrayDataOutput out = new ByteArrayDataOutput(bytes);
    writeRandom(out, seed, count);
    final int length = out.getPosition();

    final ByteArrayDataInput in = new ByteArrayDataInput(bytes, 0, length);
    checkRandom(in, seed, count);
    assertTrue(in.eof());
    assertEquals(length, in.getPosition());

    in.setPosition(0);
    checkRandom(in.clone(), seed, count);
    assertEquals(0, in.getPosition());
  }

  public void testVInt() throws IOException {
    final byte[] bytes = new byte[5];
    final ByteArrayDataOutput out = new ByteArrayDataOutput(bytes);
    out.writeVInt(Integer.MAX_VALUE);
    assertEquals(5, out.getPosition());
    assertEquals(Integer.MAX_VALUE, new ByteArrayDataInput(bytes).readVInt());

    out.reset(bytes);
    out.writeVInt(127);
    assertEquals(1, out.getPosition());
    out.writeVInt(128);
    assertEquals(3, out.getPosition());

    final byte[] corrupt = new byte[] {(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0x1F};
    try {
      new ByteArrayDataInput(corrupt).readVInt();
      fail();
    } catch (CorruptDataException e) {
      // expected
    }
  }

  public void testVLong() throws IOException {
    final byte[] bytes = new byte[9];
    final ByteArrayDataOutput out = new ByteArrayDataOutput(bytes);
    out.writeVLong(Long.MAX_VALUE);
    assertEquals(9, out.getPosition());
    assertEquals(Long.MAX_VALUE, new ByteArrayDataInput(bytes).readVLong());
    try {
      out.writeVLong(-1L);
      fail();
    } catch (IllegalArgumentException e) {
      // expected
    }
  }

  public void testStrings() throws IOException {
    final String[] strings = new String[] {"", "PackedInts", "été", "漢字", "😀"};
    final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    final OutputStreamDataOutput out = new OutputStreamDataOutput(bytes);
    for (String s : strings) {
      out.writeString(s);
    }
    final InputStreamDataInput in = new InputStreamDataInput(new ByteArrayInputStream(bytes.toByteArray()));
    for (String s : strings) {
      assertEquals(s, in.readString());
    }
  }

  public void testBigEndian() throws IOException {
    final byte[] bytes = new byte[14];
    final ByteArrayDataOutput out = new ByteArrayDataOutput(bytes);
    out.writeShort((short) 0x0102);
    out.writeInt(0x03040506);
    out.writeLong(0x0708090A0B0C0D0EL);
    for (int i = 0; i < bytes.length; ++i) {
      assertEquals(i + 1, bytes[i]);
    }
  }

  public void testSkipBytes() throws IOException {
    final byte[] bytes = new byte[_TestUtil.nextInt(random, 10, 100)];
    for (int i = 0; i < bytes.length; ++i) {
      bytes[i] = (byte) i;
    }
    final ByteArrayDataInput in = new ByteArrayDataInput(bytes);
    final int skip = random.nextInt(bytes.length);
    in.skipBytes(skip);
    assertEquals(skip, in.getPosition());
    assertEquals((byte) skip, in.readByte());
    assertEquals(bytes.length, in.length());
  }
}
