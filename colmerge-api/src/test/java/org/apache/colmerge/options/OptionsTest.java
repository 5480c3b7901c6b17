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

package org.apache.colmerge.options;

import org.apache.colmerge.types.CategoricalOrdering;

import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.apache.colmerge.options.ConfigOptions.key;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link Options}. */
public class OptionsTest {

    private static final ConfigOption<Integer> WORKERS =
            key("test.workers").intType().defaultValue(1).withDescription("workers");

    private static final ConfigOption<Boolean> STRICT =
            key("test.strict").booleanType().defaultValue(true);

    private static final ConfigOption<CategoricalOrdering> ORDERING =
            key("test.ordering")
                    .enumType(CategoricalOrdering.class)
                    .defaultValue(CategoricalOrdering.PHYSICAL);

    private static final ConfigOption<String> NAME = key("test.name").stringType().noDefaultValue();

    @Test
    public void testDefaults() {
        Options options = new Options();
        assertThat(options.get(WORKERS)).isEqualTo(1);
        assertThat(options.get(STRICT)).isTrue();
        assertThat(options.get(ORDERING)).isEqualTo(CategoricalOrdering.PHYSICAL);
        assertThat(options.get(NAME)).isNull();
        assertThat(options.getOptional(NAME)).isEmpty();
        assertThat(options.contains(WORKERS)).isFalse();
    }

    @Test
    public void testSetAndParse() {
        Options options =
                Options.fromMap(Collections.singletonMap("test.ordering", " lexical "));
        options.set(WORKERS, 4);
        options.setString("test.strict", "false");

        assertThat(options.get(WORKERS)).isEqualTo(4);
        assertThat(options.get(STRICT)).isFalse();
        assertThat(options.get(ORDERING)).isEqualTo(CategoricalOrdering.LEXICAL);
        assertThat(options.get("test.workers")).isEqualTo("4");
        assertThat(options.toMap()).containsEntry("test.strict", "false");
    }

    @Test
    public void testUnparsableValue() {
        Options options = new Options();
        options.setString("test.workers", "many");
        assertThatThrownBy(() -> options.get(WORKERS))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Could not parse value 'many' for key 'test.workers'.");
    }

    @Test
    public void testSetNullValue() {
        assertThatThrownBy(() -> new Options().set(WORKERS, null))
                .isInstanceOf(NullPointerException.class);
    }
}
