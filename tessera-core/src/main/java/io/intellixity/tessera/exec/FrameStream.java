package io.intellixity.tessera.exec;

import io.intellixity.tessera.dataframe.DataFrame;

import java.util.Iterator;

/** Lazy sequence of result blocks. Close it to give the connection back early. */
public interface FrameStream extends Iterator<DataFrame>, AutoCloseable {
  @Override
  void close();
}
