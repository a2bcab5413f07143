package com.example.datalake.thinking.stream;

/** A frame could not be written to a connection's outbound channel. */
public class TransportWriteException extends RuntimeException {

  public TransportWriteException(String message) {
    super(message);
  }
}
