/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.colmerge.merge;

import org.apache.colmerge.data.Column;
import org.apache.colmerge.data.categorical.Dictionary;
import org.apache.colmerge.data.categorical.GlobalDictionary;
import org.apache.colmerge.data.categorical.LocalDictionary;
import org.apache.colmerge.data.categorical.StringInterner;
import org.apache.colmerge.types.DataType;
import org.apache.colmerge.types.DataTypes;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link DictionaryReconciler}. */
public class DictionaryReconcilerTest {

    @Test
    public void testIdenticalLocalDictionariesAreShared() {
        LocalDictionary left = LocalDictionary.of("a", "b");
        LocalDictionary right = LocalDictionary.of("a", "b");

        assertThat(DictionaryReconciler.reconcile(left, right, "c")).isSameAs(left);
    }

    @Test
    public void testDifferentLocalDictionariesAreIncompatible() {
        LocalDictionary left = LocalDictionary.of("a", "b");
        LocalDictionary right = LocalDictionary.of("b", "a");

        assertThatThrownBy(() -> DictionaryReconciler.reconcile(left, right, "c"))
                .isInstanceOf(IncompatibleCategoricalsException.class)
                .hasMessageContaining("'c'")
                .hasMessageContaining("local dictionaries differ");
    }

    @Test
    public void testGlobalDictionariesOfOneNamespaceAreMerged() {
        StringInterner interner = new StringInterner();
        GlobalDictionary left = build(interner, "a", "b");
        GlobalDictionary right = build(interner, "c", "a");

        Dictionary merged = DictionaryReconciler.reconcile(left, right, "c");

        assertThat(merged).isNotSameAs(left).isNotSameAs(right);
        assertThat(merged.size()).isEqualTo(3);
        assertThat(merged.decodeToString(interner.intern("c"))).isEqualTo("c");
        assertThat(left.contains(interner.intern("c"))).isFalse();
    }

    @Test
    public void testGlobalSubsetKeepsLeftDictionary() {
        StringInterner interner = new StringInterner();
        GlobalDictionary left = build(interner, "a", "b");
        GlobalDictionary right = build(interner, "b");

        assertThat(DictionaryReconciler.reconcile(left, right, "c")).isSameAs(left);
    }

    @Test
    public void testGlobalDictionariesOfDifferentNamespacesAreIncompatible() {
        GlobalDictionary left = build(new StringInterner(), "a");
        GlobalDictionary right = build(new StringInterner(), "a");

        assertThatThrownBy(() -> DictionaryReconciler.checkCompatible(left, right, "c"))
                .isInstanceOf(IncompatibleCategoricalsException.class)
                .hasMessageContaining("different string interners");
    }

    @Test
    public void testLocalGlobalPairingIsAnInternalFault() {
        LocalDictionary local = LocalDictionary.of("a");
        GlobalDictionary global = build(new StringInterner(), "a");

        assertThatThrownBy(() -> DictionaryReconciler.reconcile(local, global, "c"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Column 'c' pairs a local dictionary with a global dictionary.");
    }

    @Test
    public void testColumnCheckDescendsIntoLists() {
        DataType type = DataTypes.ARRAY(DataTypes.CATEGORICAL());
        Column left = Column.of("tags", type, Collections.singletonList(Arrays.asList("x", "y")));
        Column sameSource =
                Column.of("tags", type, Collections.singletonList(Arrays.asList("x", "y")));
        Column otherSource = Column.of("tags", type, Collections.singletonList(Arrays.asList("y")));

        DictionaryReconciler.checkCompatible(left, sameSource);
        assertThatThrownBy(() -> DictionaryReconciler.checkCompatible(left, otherSource))
                .isInstanceOf(IncompatibleCategoricalsException.class)
                .hasMessageContaining("'tags'");
        // columns without categoricals always pass
        DictionaryReconciler.checkCompatible(
                Column.of("n", DataTypes.INT(), Arrays.asList(1, 2)),
                Column.of("n", DataTypes.INT(), Collections.singletonList(3)));
    }

    private static GlobalDictionary build(StringInterner interner, String... values) {
        GlobalDictionary.Builder builder = interner.newDictionaryBuilder();
        for (String value : values) {
            builder.encode(value);
        }
        return builder.build();
    }
}
