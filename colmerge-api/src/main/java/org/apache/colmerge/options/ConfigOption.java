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

import org.apache.colmerge.annotation.Public;

import static org.apache.colmerge.utils.Preconditions.checkNotNull;

/**
 * 配置项,描述一个配置键、值类型、默认值和说明。
 *
 * <p>配置项通过 {@link ConfigOptions#key(String)} 构建,是不可变对象;
 * {@link #withDescription(String)} 返回新实例。
 *
 * @param <T> 配置值类型
 */
@Public
public class ConfigOption<T> {

    private final String key;

    private final T defaultValue;

    private final String description;

    private final Class<?> clazz;

    Class<?> getClazz() {
        return clazz;
    }

    ConfigOption(String key, Class<?> clazz, String description, T defaultValue) {
        this.key = checkNotNull(key);
        this.description = checkNotNull(description);
        this.defaultValue = defaultValue;
        this.clazz = checkNotNull(clazz);
    }

    public ConfigOption<T> withDescription(final String description) {
        return new ConfigOption<>(key, clazz, description, defaultValue);
    }

    public String key() {
        return key;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }

    public T defaultValue() {
        return defaultValue;
    }

    public String description() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (o != null && o.getClass() == ConfigOption.class) {
            ConfigOption<?> that = (ConfigOption<?>) o;
            return this.key.equals(that.key)
                    && (this.defaultValue == null
                            ? that.defaultValue == null
                            : this.defaultValue.equals(that.defaultValue));
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return 31 * key.hashCode() + (defaultValue != null ? defaultValue.hashCode() : 0);
    }

    @Override
    public String toString() {
        return String.format("Key: '%s' , default: %s", key, defaultValue);
    }
}
