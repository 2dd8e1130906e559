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
package dev.mars.slha.model;

import dev.mars.slha.io.SlhaConfig;
import dev.mars.slha.io.SlhaReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SlhaDocument} accessors.
 * <p>
 * These tests verify:
 * <ul>
 *   <li>Block and value lookup, including exact key shapes</li>
 *   <li>Value updates and their status codes</li>
 *   <li>Decay lookup by particle ID and by name</li>
 *   <li>Branching ratio defaults</li>
 * </ul>
 */
class SlhaDocumentTest {

    private static final String TEXT = String.join("\n",
            "# test document",
            "BLOCK MINPAR  # Input parameters",
            "  1  7.0E+01  # m0",
            "  3  10       # tanb",
            "BLOCK NMIX",
            "  1  1  9.86E-01",
            "  1  3  1.46E-01",
            "BLOCK SPHENOINPUT",
            "  1  0  3  -1.0",
            "  flag",
            "BLOCK YU Q= 4.67E+02",
            "  3  3  8.9E-01",
            "DECAY 1000021 5.5 # gluino",
            "  0.6  2  -5  1000005",
            "  0.4  2  5  -1000005",
            "DECAY 25 4.1E-03",
            "  1.0  2  5  -5",
            "");

    private SlhaDocument slha;

    @BeforeEach
    void setUp() {
        slha = new SlhaReader(SlhaConfig.builder().build()).parse(TEXT);
    }

    // ========================================================================
    // Structure
    // ========================================================================

    @Test
    void testBlocks_InsertionOrder() {
        assertEquals(List.of("MINPAR", "NMIX", "SPHENOINPUT", "YU Q= 4.67E+02"), List.copyOf(slha.blocks()));
    }

    @Test
    void testDecays_InsertionOrder() {
        assertEquals(List.of(1000021, 25), List.copyOf(slha.decays()));
    }

    @Test
    void testEmptyDocument() {
        SlhaDocument empty = new SlhaDocument();

        assertTrue(empty.blocks().isEmpty());
        assertTrue(empty.decays().isEmpty());
        assertEquals("", empty.preamble());
    }

    @Test
    void testAddBlock_DuplicateIgnored() {
        Block second = new Block("MINPAR", "other");

        assertEquals(InsertOutcome.DUPLICATE_IGNORED, slha.addBlock(second));
        assertEquals("Input parameters", slha.block("MINPAR").orElseThrow().description());
    }

    @Test
    void testAddDecay_DuplicateIgnored() {
        assertEquals(InsertOutcome.DUPLICATE_IGNORED, slha.addDecay(new DecayTable(25, 1.0, "")));
        assertEquals(0.0041, slha.getWidth(25).getAsDouble(), 1e-12);
    }

    @Test
    void testToString() {
        assertEquals("SlhaDocument{blocks=4, decays=2}", slha.toString());
    }

    @Test
    void testBlocksView_IsUnmodifiable() {
        assertThrows(UnsupportedOperationException.class, () -> slha.blocks().remove("MINPAR"));
    }

    // ========================================================================
    // Block lookups
    // ========================================================================

    @Nested
    @DisplayName("Block lookups")
    class BlockLookups {

        @Test
        @DisplayName("findBlock matches by prefix in insertion order")
        void testFindBlock() {
            assertEquals(Optional.of("YU Q= 4.67E+02"), slha.findBlock("YU"));
            assertEquals(Optional.of("MINPAR"), slha.findBlock("M"));
            assertTrue(slha.findBlock("YD").isEmpty());
        }

        @Test
        void testGetBlock_ReturnsEntriesInOrder() {
            Map<EntryKey, BlockEntry> entries = slha.getBlock("MINPAR").orElseThrow();

            assertEquals(List.of(EntryKey.of(1), EntryKey.of(3)), List.copyOf(entries.keySet()));
        }

        @Test
        void testGetBlock_Missing() {
            assertTrue(slha.getBlock("NOSUCH").isEmpty());
        }

        @Test
        void testGetBlockText_Missing() {
            assertTrue(slha.getBlockText("NOSUCH").isEmpty());
        }

        @Test
        void testGetBlockText_StartsWithHeader() {
            String text = slha.getBlockText("MINPAR").orElseThrow();

            assertTrue(text.startsWith("BLOCK MINPAR    # Input parameters\n"), text);
        }
    }

    // ========================================================================
    // Values
    // ========================================================================

    @Nested
    @DisplayName("Get and set values")
    class Values {

        @Test
        void testGetValue_Scalar() {
            assertEquals(Optional.of("10"), slha.getValue("MINPAR", 3));
        }

        @Test
        void testGetValue_KeepsOriginalToken() {
            assertEquals(Optional.of("7.0E+01"), slha.getValue("MINPAR", 1));
        }

        @Test
        void testGetValue_MatrixKey() {
            assertEquals(Optional.of("1.46E-01"), slha.getValue("NMIX", EntryKey.tuple(1, 3)));
        }

        @Test
        @DisplayName("Four-column keys are string tuples")
        void testGetValue_StringTupleKey() {
            assertEquals(Optional.of("-1.0"), slha.getValue("SPHENOINPUT", EntryKey.tuple("1", "0", "3")));
            assertTrue(slha.getValue("SPHENOINPUT", EntryKey.tuple(1, 0, 3)).isEmpty());
        }

        @Test
        void testGetValue_StringKey() {
            assertEquals(Optional.of("flag"), slha.getValue("SPHENOINPUT", EntryKey.of("flag")));
        }

        @Test
        @DisplayName("Missing key returns empty without throwing")
        void testGetValue_MissingKey() {
            assertTrue(slha.getValue("MINPAR", 999).isEmpty());
        }

        @Test
        void testGetValue_MissingBlock() {
            assertTrue(slha.getValue("NOSUCH", 1).isEmpty());
        }

        @Test
        @DisplayName("Lookups do not coerce key shapes")
        void testGetValue_NoCoercion() {
            assertTrue(slha.getValue("MINPAR", EntryKey.of("3")).isEmpty());
            assertTrue(slha.getValue("NMIX", EntryKey.of(1)).isEmpty());
        }

        @Test
        void testSetValue_Updates() {
            assertEquals(SetResult.UPDATED, slha.setValue("MINPAR", 3, 20));
            assertEquals(Optional.of("20"), slha.getValue("MINPAR", 3));
        }

        @Test
        void testSetValue_MatrixKeyWithDouble() {
            assertEquals(SetResult.UPDATED, slha.setValue("NMIX", EntryKey.tuple(1, 3), 0.5));
            assertEquals(Optional.of("0.5"), slha.getValue("NMIX", EntryKey.tuple(1, 3)));
        }

        @Test
        void testSetValue_StringValue() {
            assertEquals(SetResult.UPDATED, slha.setValue("MINPAR", 1, "1.25E+02"));
            assertEquals(Optional.of("1.25E+02"), slha.getValue("MINPAR", 1));
        }

        @Test
        @DisplayName("Setting a missing key reports NOT_FOUND and creates nothing")
        void testSetValue_MissingKey() {
            assertEquals(SetResult.NOT_FOUND, slha.setValue("MINPAR", 999, 1));
            assertEquals(2, slha.block("MINPAR").orElseThrow().size());
        }

        @Test
        void testSetValue_MissingBlock() {
            assertEquals(SetResult.NOT_FOUND, slha.setValue("NOSUCH", 1, 1));
            assertFalse(slha.blocks().contains("NOSUCH"));
        }

        @Test
        @DisplayName("A failed set does not stop later sets")
        void testSetValue_BatchContinuesAfterFailure() {
            SetResult first = slha.setValue("MINPAR", 42, 1);
            SetResult second = slha.setValue("MINPAR", 1, 80);

            assertEquals(SetResult.NOT_FOUND, first);
            assertEquals(SetResult.UPDATED, second);
            assertEquals(Optional.of("80"), slha.getValue("MINPAR", 1));
        }

        @Test
        void testSetValue_KeepsPosition() {
            slha.setValue("MINPAR", 1, 99);

            assertEquals(List.of(EntryKey.of(1), EntryKey.of(3)),
                    List.copyOf(slha.getBlock("MINPAR").orElseThrow().keySet()));
        }

        @Test
        void testSetValue_RejectsNull() {
            assertThrows(NullPointerException.class, () -> slha.setValue("MINPAR", 3, null));
        }
    }

    // ========================================================================
    // Decays
    // ========================================================================

    @Nested
    @DisplayName("Decay lookups")
    class Decays {

        @Test
        void testGetWidth_ById() {
            assertEquals(5.5, slha.getWidth(1000021).getAsDouble());
        }

        @Test
        @DisplayName("Width by name equals width by ID")
        void testGetWidth_ByName() {
            assertEquals(slha.getWidth(1000021), slha.getWidth("~g"));
            assertEquals(slha.getWidth(25), slha.getWidth("h"));
        }

        @Test
        void testGetWidth_UnknownId() {
            assertEquals(OptionalDouble.empty(), slha.getWidth(1000022));
        }

        @Test
        void testGetWidth_UnknownName() {
            assertEquals(OptionalDouble.empty(), slha.getWidth("~gluino"));
        }

        @Test
        void testGetDecay_ModesInOrder() {
            Map<List<Integer>, DecayMode> modes = slha.getDecay(1000021).orElseThrow();

            assertEquals(List.of(List.of(-5, 1000005), List.of(5, -1000005)), List.copyOf(modes.keySet()));
            assertEquals(2, modes.get(List.of(-5, 1000005)).nBody());
        }

        @Test
        void testGetDecay_ByName() {
            assertEquals(slha.getDecay(1000021), slha.getDecay("~g"));
            assertTrue(slha.getDecay("~N1").isEmpty());
        }

        @Test
        void testGetDecayText() {
            assertTrue(slha.getDecayText("~g").orElseThrow().startsWith("DECAY   1000021 "));
            assertTrue(slha.getDecayText(35).isEmpty());
        }

        @Test
        void testGetBranchingRatio() {
            assertEquals(0.6, slha.getBranchingRatio(1000021, -5, 1000005));
            assertEquals(0.6, slha.getBranchingRatio("~g", List.of(-5, 1000005)));
        }

        @Test
        @DisplayName("Daughter order is part of the key")
        void testGetBranchingRatio_OrderSensitive() {
            assertEquals(0.0, slha.getBranchingRatio(1000021, 1000005, -5));
        }

        @Test
        @DisplayName("Unlisted channel returns 0.0")
        void testGetBranchingRatio_MissingMode() {
            assertEquals(0.0, slha.getBranchingRatio(1000021, 21, 21));
        }

        @Test
        @DisplayName("Unknown particle also returns 0.0")
        void testGetBranchingRatio_MissingParticle() {
            assertEquals(0.0, slha.getBranchingRatio(1000022, 5, -5));
            assertEquals(0.0, slha.getBranchingRatio("~gluino", 5, -5));
        }
    }

    @Test
    @DisplayName("A custom resolver is used for name lookups")
    void testCustomResolver() {
        SlhaDocument custom = new SlhaDocument(name -> name.equals("gluino") ? OptionalInt.of(1000021) : OptionalInt.empty());
        custom.addDecay(new DecayTable(1000021, 2.0, ""));

        assertEquals(2.0, custom.getWidth("gluino").getAsDouble());
        assertTrue(custom.getWidth("~g").isEmpty());
    }
}
