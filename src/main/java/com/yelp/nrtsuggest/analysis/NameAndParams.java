/*
 * Copyright 2020 Yelp Inc.
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
package com.yelp.nrtsuggest.analysis;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Name and parameters of a Lucene analysis factory, as given in a custom analyzer config. A
 * config entry is either a bare name string, or a hash with a {@code name} key and an optional
 * {@code params} hash.
 */
public class NameAndParams {
  /** Reader function for {@link com.yelp.nrtsuggest.config.YamlConfigReader} list entries. */
  static final Function<Object, NameAndParams> READER =
      (node) -> {
        if (node instanceof String) {
          return new NameAndParams((String) node, Collections.emptyMap());
        }
        if (node instanceof Map) {
          Map<?, ?> map = (Map<?, ?>) node;
          Object name = map.get("name");
          if (name == null) {
            return null;
          }
          Map<String, String> params = new HashMap<>();
          Object paramsNode = map.get("params");
          if (paramsNode instanceof Map) {
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) paramsNode).entrySet()) {
              params.put(entry.getKey().toString(), entry.getValue().toString());
            }
          } else if (paramsNode != null) {
            return null;
          }
          return new NameAndParams(name.toString(), params);
        }
        return null;
      };

  private final String name;
  private final Map<String, String> params;

  public NameAndParams(String name, Map<String, String> params) {
    this.name = name;
    this.params = params;
  }

  public String getName() {
    return name;
  }

  /** Get a mutable copy of the params, since Lucene factories consume the map they are given. */
  public Map<String, String> getParams() {
    return new HashMap<>(params);
  }

  @Override
  public String toString() {
    return name + params;
  }
}
