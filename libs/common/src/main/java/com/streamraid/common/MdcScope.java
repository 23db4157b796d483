/*
 * どこで: 共通ユーティリティ
 * 何を: ブロックの間だけ MDC にキーを積み、終了時に元の値へ戻す
 * なぜ: ワーカースレッドを再利用してもログ文脈が漏れないようにするため
 */
package com.streamraid.common;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.MDC;

public final class MdcScope implements AutoCloseable {

  private final Map<String, String> previous;

  private MdcScope(Map<String, String> previous) {
    this.previous = previous;
  }

  public static MdcScope open(Map<String, String> values) {
    final Map<String, String> previous = new HashMap<>();
    for (Map.Entry<String, String> entry : values.entrySet()) {
      previous.put(entry.getKey(), MDC.get(entry.getKey()));
      if (entry.getValue() == null) {
        MDC.remove(entry.getKey());
      } else {
        MDC.put(entry.getKey(), entry.getValue());
      }
    }
    return new MdcScope(previous);
  }

  public static MdcScope open(String key, String value) {
    final Map<String, String> values = new LinkedHashMap<>();
    values.put(key, value);
    return open(values);
  }

  @Override
  public void close() {
    for (Map.Entry<String, String> entry : previous.entrySet()) {
      if (entry.getValue() == null) {
        MDC.remove(entry.getKey());
      } else {
        MDC.put(entry.getKey(), entry.getValue());
      }
    }
  }
}
