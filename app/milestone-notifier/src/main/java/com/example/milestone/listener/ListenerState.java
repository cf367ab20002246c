package com.example.milestone.listener;

/** マイルストーンリスナーの接続状態。 */
public enum ListenerState {
  DISCONNECTED,
  CONNECTING,
  LISTENING
}
