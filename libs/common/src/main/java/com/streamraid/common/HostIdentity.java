/*
 * どこで: 共通ユーティリティ
 * 何を: リース所有者として記録するインスタンス識別子を解決する
 * なぜ: 複数インスタンスが同じテーブルをリースするときに所有者を区別するため
 */
package com.streamraid.common;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

public final class HostIdentity {
  private HostIdentity() {}

  public static String resolve() {
    return resolve(System.getenv("HOSTNAME"));
  }

  static String resolve(String hostnameEnv) {
    if (hostnameEnv != null && !hostnameEnv.isBlank()) {
      return hostnameEnv;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      return "unknown-host";
    }
  }

  /** 同一ホスト内でも衝突しないリーストークンを発行する。 */
  public static String newLeaseToken() {
    return resolve() + "/" + UUID.randomUUID();
  }
}
