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

/**
 * Arrays of unsigned integers packed into <code>long</code> blocks.
 * <p>
 * {@link org.apache.lucene.packed.Packed64SingleBlock} never lets a value
 * straddle two blocks, so every read or write touches exactly one
 * <code>long</code>. Use {@link org.apache.lucene.packed.PackedInts} to
 * create, save and restore instances.
 */
package org.apache.lucene.packed;
