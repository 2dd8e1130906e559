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
 * In-memory SLHA data model.
 * <p>
 * An {@link dev.mars.slha.model.SlhaDocument} holds named
 * {@link dev.mars.slha.model.Block}s of {@link dev.mars.slha.model.BlockEntry}s
 * and per-particle {@link dev.mars.slha.model.DecayTable}s of
 * {@link dev.mars.slha.model.DecayMode}s. All containers keep insertion order
 * and reject duplicate keys with {@link dev.mars.slha.model.InsertOutcome}.
 */
package dev.mars.slha.model;
