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

package org.apache.colmerge.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link DataTypes}. */
public class DataTypesTest {

    @Test
    public void testSqlStrings() {
        assertThat(DataTypes.INT().asSQLString()).isEqualTo("INT");
        assertThat(DataTypes.INT().copy(false).asSQLString()).isEqualTo("INT NOT NULL");
        assertThat(DataTypes.ARRAY(DataTypes.STRING()).asSQLString()).isEqualTo("ARRAY<STRING>");
        assertThat(DataTypes.CATEGORICAL(CategoricalOrdering.LEXICAL).asSQLString())
                .isEqualTo("CATEGORICAL(LEXICAL)");
        assertThat(DataTypes.TIMESTAMP().asSQLString()).isEqualTo("TIMESTAMP(6)");
    }

    @Test
    public void testEqualsIgnoreNullable() {
        assertThat(DataTypes.INT().equalsIgnoreNullable(DataTypes.INT().copy(false))).isTrue();
        assertThat(DataTypes.INT().equals(DataTypes.INT().copy(false))).isFalse();
        assertThat(DataTypes.INT().equalsIgnoreNullable(DataTypes.BIGINT())).isFalse();

        ArrayType nullableElements = DataTypes.ARRAY(DataTypes.INT());
        ArrayType requiredElements = new ArrayType(false, DataTypes.INT().copy(false));
        assertThat(nullableElements.equalsIgnoreNullable(requiredElements)).isTrue();

        RowType left = RowType.builder().field("a", DataTypes.INT()).build();
        RowType right = RowType.builder().field("a", DataTypes.INT().copy(false)).build();
        RowType renamed = RowType.builder().field("b", DataTypes.INT()).build();
        assertThat(left.equalsIgnoreNullable(right)).isTrue();
        assertThat(left.equalsIgnoreNullable(renamed)).isFalse();
    }

    @Test
    public void testCategoricalOrderingIsPartOfTheType() {
        assertThat(DataTypes.CATEGORICAL())
                .isEqualTo(DataTypes.CATEGORICAL(CategoricalOrdering.PHYSICAL));
        assertThat(
                        DataTypes.CATEGORICAL(CategoricalOrdering.LEXICAL)
                                .equalsIgnoreNullable(DataTypes.CATEGORICAL()))
                .isFalse();
    }

    @Test
    public void testToPhysical() {
        assertThat(DataTypes.toPhysical(DataTypes.DATE())).isEqualTo(DataTypes.INT());
        assertThat(DataTypes.toPhysical(DataTypes.TIMESTAMP())).isEqualTo(DataTypes.BIGINT());
        assertThat(DataTypes.toPhysical(DataTypes.STRING())).isEqualTo(DataTypes.BYTES());
        assertThat(DataTypes.toPhysical(DataTypes.CATEGORICAL())).isEqualTo(DataTypes.INT());
        assertThat(DataTypes.toPhysical(DataTypes.STRING().copy(false)).isNullable()).isFalse();

        RowType nested =
                RowType.builder()
                        .field("day", DataTypes.DATE())
                        .field("tags", DataTypes.ARRAY(DataTypes.STRING()))
                        .build();
        RowType physical = (RowType) DataTypes.toPhysical(nested);
        assertThat(physical.getFieldNames()).containsExactly("day", "tags");
        assertThat(physical.getTypeAt(0)).isEqualTo(DataTypes.INT());
        assertThat(physical.getTypeAt(1)).isEqualTo(DataTypes.ARRAY(DataTypes.BYTES()));

        assertThat(DataTypes.isPhysical(DataTypes.DOUBLE())).isTrue();
        assertThat(DataTypes.isPhysical(nested)).isFalse();
    }

    @Test
    public void testRowTypeFieldLookup() {
        RowType rowType = RowType.of(DataTypes.INT(), DataTypes.STRING());
        assertThat(rowType.getFieldNames()).containsExactly("f0", "f1");
        assertThat(rowType.getFieldIndex("f1")).isEqualTo(1);
        assertThat(rowType.getFieldIndex("missing")).isEqualTo(-1);
        assertThat(rowType.containsField("f0")).isTrue();
    }

    @Test
    public void testDuplicateFieldNamesAreRejected() {
        assertThatThrownBy(
                        () ->
                                RowType.builder()
                                        .field("a", DataTypes.INT())
                                        .field("a", DataTypes.STRING())
                                        .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("a");
    }
}
