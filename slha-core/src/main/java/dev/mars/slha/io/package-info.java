/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
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
 * Reading and writing SLHA text.
 * <p>
 * This package converts between SLHA files and the in-memory model:
 * <ul>
 *   <li>{@link dev.mars.slha.io.SlhaReader} - Single-pass parser</li>
 *   <li>{@link dev.mars.slha.io.SlhaWriter} - Fixed-column serializer</li>
 *   <li>{@link dev.mars.slha.io.OutputTarget} - File or standard stream destination</li>
 *   <li>{@link dev.mars.slha.io.SlhaConfig} - Charset and reader limits</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Keep first:</b> duplicate records are logged and dropped, never fatal</li>
 *   <li><b>Fail fast on headers:</b> a malformed DECAY header aborts the read</li>
 *   <li><b>Stable output:</b> writing what was read, then reading and writing again, gives the same text</li>
 * </ul>
 *
 * @see dev.mars.slha.model.SlhaDocument
 */
package dev.mars.slha.io;
