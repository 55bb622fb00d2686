package com.polydoc.converter;

import java.nio.charset.StandardCharsets;

/** Outcome of a finished subprocess. */
public record ProcessResult(int exitCode, byte[] stdout, String stderr) {

  public boolean isSuccess() {
    return exitCode == 0;
  }

  public String stdoutAsString() {
    return new String(stdout, StandardCharsets.UTF_8);
  }
}
