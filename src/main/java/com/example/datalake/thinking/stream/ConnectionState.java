package com.example.datalake.thinking.stream;

public enum ConnectionState {
  CONNECTING,
  ESTABLISHED,
  CLOSING,
  CLOSED
}
